package com.example.eventsub.model;

/**
 * 订阅的投递方式，本服务只使用 conduit。
 */
public record SubscriptionTransport(String method, String conduitId) {

    public static final String CONDUIT = "conduit";

    public static SubscriptionTransport conduit(String conduitId) {
        return new SubscriptionTransport(CONDUIT, conduitId);
    }
}
