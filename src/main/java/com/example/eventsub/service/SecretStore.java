package com.example.eventsub.service;

import com.example.eventsub.store.KeyValueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

/**
 * 管理 webhook 签名密钥：只生成一次，持久化到 Redis，之后从进程内缓存读取。
 * 密钥与已注册的 shard transport 绑定，conduit 存续期间不能变化。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SecretStore {

    public static final String SECRET_KEY = "eventsub:conduit:secret";

    private static final SecureRandom RANDOM = new SecureRandom();

    private final KeyValueStore store;

    private volatile String secret;

    /**
     * 获取签名密钥，不存在时生成。
     * 多个进程同时生成时以先写入 Redis 的值为准，所有进程读到同一个值。
     *
     * @return 签名密钥
     */
    public String getSecret() {
        String cached = secret;
        if (cached != null) {
            return cached;
        }

        String persisted = store.get(SECRET_KEY).orElse(null);
        if (persisted != null) {
            secret = persisted;
            return persisted;
        }

        String generated = generateSecret();
        if (store.setIfAbsent(SECRET_KEY, generated, null)) {
            log.info("Generated new webhook secret");
            secret = generated;
            return generated;
        }

        // Another process won the race; adopt its value
        String winner = store.get(SECRET_KEY).orElse(generated);
        secret = winner;
        return winner;
    }

    /**
     * 从 Redis 重新读取密钥。其他进程创建新 conduit 后会替换密钥，本进程的缓存随之失效。
     *
     * @return 与缓存不同的新密钥；未变化或不存在时为空
     */
    public Optional<String> reload() {
        String persisted = store.get(SECRET_KEY).orElse(null);
        if (persisted == null || persisted.equals(secret)) {
            return Optional.empty();
        }
        log.info("Webhook secret was replaced by another process, reloading");
        secret = persisted;
        return Optional.of(persisted);
    }

    /**
     * 替换密钥。仅在创建新 conduit 时调用：新的 shard transport 使用新的密钥。
     *
     * @param newSecret 新密钥
     */
    public void replace(String newSecret) {
        store.set(SECRET_KEY, newSecret);
        secret = newSecret;
    }

    /**
     * 生成随机密钥：24 字节 -> Base64 后 32 字符，满足 Helix 10~100 字符的要求。
     *
     * @return 新密钥
     */
    public static String generateSecret() {
        byte[] bytes = new byte[24];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
