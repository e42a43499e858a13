package com.example.eventsub.model;

/**
 * 更新 shard 时 Helix 返回的单条错误。
 */
public record ShardError(String id, String message, String code) {
}
