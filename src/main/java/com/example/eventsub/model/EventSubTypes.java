package com.example.eventsub.model;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 已知的订阅类型。
 */
public final class EventSubTypes {

    // Chat through EventSub needs the broadcaster to grant channel:bot
    public static final EventSubType CHANNEL_CHAT_MESSAGE = EventSubType.of(
            "channel.chat.message", "1", Set.of("channel:bot"), Duration.ofHours(1), true);

    public static final EventSubType CHANNEL_BAN = EventSubType.of(
            "channel.ban", "1", Set.of("channel:moderate"), Duration.ofHours(1), true);

    public static final EventSubType STREAM_ONLINE = EventSubType.of(
            "stream.online", "1", Set.of(), Duration.ofMinutes(10), false);

    public static final EventSubType STREAM_OFFLINE = EventSubType.of(
            "stream.offline", "1", Set.of(), Duration.ofMinutes(10), false);

    private static final List<EventSubType> ALL = List.of(
            CHANNEL_CHAT_MESSAGE, CHANNEL_BAN, STREAM_ONLINE, STREAM_OFFLINE);

    private EventSubTypes() {
    }

    /**
     * 按名称查找订阅类型。
     *
     * @param name 类型名
     * @return 类型描述
     */
    public static Optional<EventSubType> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return ALL.stream().filter(t -> t.name().equals(name)).findFirst();
    }
}
