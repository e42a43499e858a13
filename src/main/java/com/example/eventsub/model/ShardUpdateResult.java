package com.example.eventsub.model;

import java.util.List;
import java.util.Optional;

/**
 * Update conduit shards 的返回：成功的 shard 与失败的明细。
 */
public record ShardUpdateResult(List<ConduitShard> shards, List<ShardError> errors) {

    public ShardUpdateResult {
        shards = shards == null ? List.of() : List.copyOf(shards);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public Optional<ConduitShard> findShard(String shardId) {
        return shards.stream().filter(s -> s.id().equals(shardId)).findFirst();
    }
}
