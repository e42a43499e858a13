package com.example.eventsub.store;

import java.time.Duration;
import java.util.Optional;

/**
 * 跨进程共享的键值存储（生产环境为 Redis）。
 * 各组件通过注入使用，不持有全局状态。
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value);

    /**
     * 写入带过期时间的键。
     *
     * @param key   键
     * @param value 值
     * @param ttl   过期时间
     */
    void set(String key, String value, Duration ttl);

    /**
     * 键不存在时写入（Redis SET NX）。
     *
     * @param key   键
     * @param value 值
     * @param ttl   过期时间，null 表示永不过期
     * @return true 表示本次写入成功
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    boolean exists(String key);

    void delete(String key);
}
