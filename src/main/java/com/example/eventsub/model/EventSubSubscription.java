package com.example.eventsub.model;

import java.util.Map;

/**
 * Helix 上已存在的订阅。
 */
public record EventSubSubscription(String id,
                                   String type,
                                   String version,
                                   String status,
                                   Map<String, String> condition,
                                   String conduitId) {

    public static final String STATUS_ENABLED = "enabled";

    public EventSubSubscription {
        condition = condition == null ? Map.of() : Map.copyOf(condition);
    }

    public boolean isEnabled() {
        return STATUS_ENABLED.equals(status);
    }
}
