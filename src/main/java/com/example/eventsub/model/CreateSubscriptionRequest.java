package com.example.eventsub.model;

import java.util.Map;

/**
 * 提交给 Helix 的订阅请求体。
 */
public record CreateSubscriptionRequest(String type,
                                        String version,
                                        Map<String, String> condition,
                                        SubscriptionTransport transport) {

    public CreateSubscriptionRequest {
        condition = condition == null ? Map.of() : Map.copyOf(condition);
    }
}
