package com.example.eventsub.service;

import com.example.eventsub.helix.HelixClient;
import com.example.eventsub.helix.HelixResponse;
import com.example.eventsub.helix.Pagination;
import com.example.eventsub.model.CreateSubscriptionRequest;
import com.example.eventsub.model.EventSubSubscription;
import com.example.eventsub.model.EventSubType;
import com.example.eventsub.model.SubscriptionRequest;
import com.example.eventsub.model.SubscriptionTransport;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * 通过 conduit 创建 EventSub 订阅，并查询已有订阅。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    private static final int HTTP_CONFLICT = 409;

    private final HelixClient helixClient;
    private final ConduitResolver conduitResolver;
    private final CooldownGate cooldownGate;
    private final MeterRegistry meterRegistry;

    /**
     * 创建订阅。失败不重试，重试由调用方结合冷却控制。
     *
     * @param request 订阅请求
     * @return true 表示 Helix 已接受订阅
     */
    public boolean subscribe(SubscriptionRequest request) {
        EventSubType type = request.type();
        String userId = request.userId();

        try {
            log.info("Subscribing to {} for {}", type.name(), userId);

            Optional<String> conduitId = conduitResolver.getConduitId();
            if (conduitId.isEmpty()) {
                log.error("Failed to get conduit ID, cannot subscribe to {} for {}", type.name(), userId);
                countAttempt(type, "no_conduit");
                return false;
            }

            CreateSubscriptionRequest helixRequest = type.toRequest(
                    SubscriptionTransport.conduit(conduitId.get()), request.condition());

            HelixResponse<EventSubSubscription> response = helixClient.createEventSubSubscription(helixRequest);
            if (!response.isSuccess()) {
                if (response.getStatusCode() == HTTP_CONFLICT) {
                    log.warn("Subscription to {} for {} already exists: {}", type.name(), userId, response.getMessage());
                } else {
                    log.error("Failed to subscribe to {} for {}: {}", type.name(), userId, response.getMessage());
                }
                countAttempt(type, "rejected");
                return false;
            }

            log.info("Successfully subscribed to {} for {}", type.name(), userId);
            countAttempt(type, "success");

            if (type.shouldSetCooldown()) {
                cooldownGate.arm(userId, type);
            }

            return true;
        } catch (Exception e) {
            log.error("Failed to subscribe to {} for {}", type.name(), userId, e);
            countAttempt(type, "error");
            return false;
        }
    }

    private void countAttempt(EventSubType type, String result) {
        meterRegistry.counter("eventsub.subscribe", "type", type.name(), "result", result).increment();
    }

    /**
     * 是否存在该类型的已启用订阅（任意用户）。
     *
     * @param type 订阅类型
     * @return 在成功读取的页中找到匹配返回 true；false 表示未知，按不存在处理
     */
    public boolean isSubscribed(EventSubType type) {
        List<EventSubSubscription> subscriptions = Pagination.collect(
                helixClient.getEventSubSubscriptions(EventSubSubscription.STATUS_ENABLED, type.name(), null),
                error -> log.error("Failed to get '{}' subscriptions: {}", type.name(), error.getMessage()));

        return subscriptions.stream()
                .anyMatch(s -> s.isEnabled() && type.name().equals(s.type()));
    }

    /**
     * 用户是否存在该类型的已启用订阅。按用户查询，类型在本地匹配。
     *
     * @param type   订阅类型
     * @param userId 用户 ID
     * @return 在成功读取的页中找到匹配返回 true；false 表示未知，按不存在处理
     */
    public boolean isSubscribed(EventSubType type, String userId) {
        if (userId == null) {
            return isSubscribed(type);
        }

        List<EventSubSubscription> subscriptions = Pagination.collect(
                helixClient.getEventSubSubscriptions(EventSubSubscription.STATUS_ENABLED, null, userId),
                error -> log.error("Failed to get '{}' subscriptions for {}: {}", type.name(), userId, error.getMessage()));

        return subscriptions.stream()
                .anyMatch(s -> s.isEnabled() && type.name().equals(s.type()));
    }
}
