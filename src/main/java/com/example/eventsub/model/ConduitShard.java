package com.example.eventsub.model;

/**
 * Conduit 中的一个 shard。
 *
 * @param id        shard ID（conduit 内唯一）
 * @param status    状态
 * @param transport 投递方式
 */
public record ConduitShard(String id, ShardStatus status, ShardTransport transport) {

    public boolean hasWebhookTransport() {
        return transport != null && transport.isWebhook();
    }
}
