package com.example.eventsub.service;

import com.example.eventsub.model.EventSubType;
import com.example.eventsub.store.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 订阅冷却：同一用户、同一类型在冷却时间内只尝试一次。
 * 只是尽力而为的限流，键存在即视为冷却中，写入失败不影响订阅结果。
 */
@Service
@Slf4j
public class CooldownGate {

    private final KeyValueStore store;
    private final Executor taskExecutor;

    public CooldownGate(KeyValueStore store, @Qualifier("taskExecutor") Executor taskExecutor) {
        this.store = store;
        this.taskExecutor = taskExecutor;
    }

    static String cooldownKey(String userId, EventSubType type) {
        return "eventsub:cooldown:" + userId + ":" + type.name();
    }

    /**
     * 是否处于冷却中。
     *
     * @param userId 用户 ID
     * @param type   订阅类型
     * @return true 表示最近已尝试过，调用方应跳过
     */
    public boolean isOnCooldown(String userId, EventSubType type) {
        return store.exists(cooldownKey(userId, type));
    }

    /**
     * 异步写入冷却键，TTL 为类型的冷却时间。调用方不需要等待返回的 future。
     *
     * @param userId 用户 ID
     * @param type   订阅类型
     * @return 写入任务，失败只记录日志，不会异常完成
     */
    public CompletableFuture<Void> arm(String userId, EventSubType type) {
        String key = cooldownKey(userId, type);
        if (type.successCooldown().isZero() || type.successCooldown().isNegative()) {
            log.warn("Skipping cooldown for {}: non-positive duration {}", key, type.successCooldown());
            return CompletableFuture.completedFuture(null);
        }

        try {
            return CompletableFuture
                    .runAsync(() -> store.set(key, "1", type.successCooldown()), taskExecutor)
                    .exceptionally(e -> {
                        log.warn("Failed to set cooldown {}: {}", key, e.getMessage());
                        return null;
                    });
        } catch (RuntimeException e) {
            // Executor rejected the task (queue full or shutting down)
            log.warn("Failed to schedule cooldown {}: {}", key, e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
    }
}
