package com.example.eventsub.model;

/**
 * Helix 管理的投递通道。
 *
 * @param id         conduit ID
 * @param shardCount shard 数量
 */
public record Conduit(String id, int shardCount) {
}
