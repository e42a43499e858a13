package com.example.eventsub.model;

import java.util.Map;
import java.util.Objects;

/**
 * 为某个用户创建订阅的请求。
 *
 * @param userId    用户 ID（subject）
 * @param type      订阅类型
 * @param condition 订阅条件，例如 broadcaster_user_id
 */
public record SubscriptionRequest(String userId, EventSubType type, Map<String, String> condition) {

    public SubscriptionRequest {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(type, "type");
        condition = condition == null ? Map.of() : Map.copyOf(condition);
    }
}
