package com.example.eventsub.model;

import java.util.Set;

/**
 * Conduit shard 状态。
 */
public enum ShardStatus {
    ENABLED,
    WEBHOOK_VERIFICATION_PENDING,
    DISABLED,
    UNKNOWN;

    // Helix reports these when a shard has stopped receiving notifications
    private static final Set<String> DISABLED_VALUES = Set.of(
            "webhook_callback_verification_failed",
            "notification_failures_exceeded",
            "websocket_disconnected",
            "websocket_failed_ping_pong",
            "websocket_received_inbound_traffic",
            "websocket_connection_unused",
            "websocket_internal_error",
            "websocket_network_timeout",
            "websocket_network_error",
            "websocket_failed_to_reconnect");

    /**
     * 将 Helix 返回的状态字符串映射为枚举。
     *
     * @param value Helix 状态值
     * @return 状态
     */
    public static ShardStatus fromHelix(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        if ("enabled".equals(value)) {
            return ENABLED;
        }
        if ("webhook_callback_verification_pending".equals(value)) {
            return WEBHOOK_VERIFICATION_PENDING;
        }
        if (DISABLED_VALUES.contains(value)) {
            return DISABLED;
        }
        return UNKNOWN;
    }

    /**
     * 创建 shard 之后可以接受的状态（回调验证可能异步完成）。
     *
     * @return true 表示状态正常
     */
    public boolean isExpectedAfterCreation() {
        return this == ENABLED || this == WEBHOOK_VERIFICATION_PENDING;
    }
}
