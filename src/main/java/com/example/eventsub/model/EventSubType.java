package com.example.eventsub.model;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * EventSub 订阅类型描述。
 * 新类型通过构造新的描述实例添加（见 {@link EventSubTypes}），不通过继承。
 *
 * @param name              Helix 订阅类型名，例如 channel.chat.message
 * @param version           订阅版本
 * @param requiredScopes    订阅前用户必须授予的 scope
 * @param successCooldown   订阅成功后的冷却时间
 * @param shouldSetCooldown 订阅成功后是否设置冷却
 * @param requestBuilder    构造 Helix 请求体的函数
 */
public record EventSubType(String name,
                           String version,
                           Set<String> requiredScopes,
                           Duration successCooldown,
                           boolean shouldSetCooldown,
                           RequestBuilder requestBuilder) {

    /**
     * 根据类型、投递方式与条件构造请求体。
     */
    @FunctionalInterface
    public interface RequestBuilder {
        CreateSubscriptionRequest build(EventSubType type, SubscriptionTransport transport, Map<String, String> condition);
    }

    public static final RequestBuilder DEFAULT_REQUEST_BUILDER =
            (type, transport, condition) -> new CreateSubscriptionRequest(type.name(), type.version(), condition, transport);

    public EventSubType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        requiredScopes = requiredScopes == null ? Set.of() : Set.copyOf(requiredScopes);
        successCooldown = successCooldown == null ? Duration.ZERO : successCooldown;
        requestBuilder = requestBuilder == null ? DEFAULT_REQUEST_BUILDER : requestBuilder;
    }

    public static EventSubType of(String name, String version, Set<String> requiredScopes,
                                  Duration successCooldown, boolean shouldSetCooldown) {
        return new EventSubType(name, version, requiredScopes, successCooldown, shouldSetCooldown, DEFAULT_REQUEST_BUILDER);
    }

    public CreateSubscriptionRequest toRequest(SubscriptionTransport transport, Map<String, String> condition) {
        return requestBuilder.build(this, transport, condition);
    }
}
