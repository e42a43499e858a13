package com.example.eventsub.model;

/**
 * 为 conduit 中的某个 shard 指定投递方式。
 */
public record ShardAssignment(String id, ShardTransport transport) {
}
