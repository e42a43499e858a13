package com.example.eventsub.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时任务：Redis 中没有 conduit 时创建；已有但不可用时告警，由运维通过接口重新创建。
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.eventsub.conduit.auto-create", havingValue = "true", matchIfMissing = true)
public class ConduitMaintenanceTask {

    private final ConduitResolver conduitResolver;

    @Scheduled(initialDelayString = "${app.eventsub.conduit.initial-delay-ms:10000}",
            fixedDelayString = "${app.eventsub.conduit.check-interval-ms:300000}")
    public void checkConduit() {
        try {
            if (!conduitResolver.isConfigured()) {
                log.info("No conduit cached, creating one");
                conduitResolver.createConduit();
                return;
            }

            if (conduitResolver.getConduitId().isEmpty()) {
                log.warn("Cached conduit is not usable, callback {} may need re-verification or re-creation",
                        conduitResolver.getCallbackUrl());
            }
        } catch (Exception e) {
            log.error("Error during conduit check: {}", e.getMessage(), e);
        }
    }
}
