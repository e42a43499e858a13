package com.example.eventsub.helix;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Helix 请求的超时与重试参数，与 {@link HelixRequestExecutor} 上的 @Retryable 使用同一组配置。
 */
@Component
@Getter
public class HelixRetrySettings {

    private final Duration requestTimeout;
    private final int maxAttempts;
    private final long delayMs;
    private final double multiplier;

    public HelixRetrySettings(@Value("${app.helix.request-timeout:10s}") Duration requestTimeout,
                              @Value("${app.helix.retry.max-attempts:3}") int maxAttempts,
                              @Value("${app.helix.retry.delay-ms:500}") long delayMs,
                              @Value("${app.helix.retry.multiplier:2.0}") double multiplier) {
        this.requestTimeout = requestTimeout;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.delayMs = delayMs;
        this.multiplier = multiplier;
    }

    /**
     * 单次调用的最长耗时：所有尝试都超时，再加上各次退避。
     *
     * @param retried 是否会重试（非幂等请求只发送一次）
     * @return 最长耗时
     */
    public Duration worstCase(boolean retried) {
        int attempts = retried ? maxAttempts : 1;
        Duration total = requestTimeout.multipliedBy(attempts);
        double backoff = delayMs;
        for (int i = 1; i < attempts; i++) {
            total = total.plusMillis((long) Math.ceil(backoff));
            backoff *= multiplier;
        }
        return total;
    }
}
