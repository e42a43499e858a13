package com.example.eventsub.service;

import com.example.eventsub.helix.HelixClient;
import com.example.eventsub.helix.HelixResponse;
import com.example.eventsub.helix.HelixRetrySettings;
import com.example.eventsub.helix.HelixTransportException;
import com.example.eventsub.helix.Pagination;
import com.example.eventsub.model.Conduit;
import com.example.eventsub.model.ConduitShard;
import com.example.eventsub.model.ShardAssignment;
import com.example.eventsub.model.ShardError;
import com.example.eventsub.model.ShardStatus;
import com.example.eventsub.model.ShardTransport;
import com.example.eventsub.model.ShardUpdateResult;
import com.example.eventsub.store.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * 解析本服务使用的 conduit 及其 shard，必要时由调用方显式创建。
 * conduit ID、shard ID 与签名密钥分别缓存在 Redis 中。
 */
@Service
@Slf4j
public class ConduitResolver {

    public static final String CONDUIT_KEY = "eventsub:conduit";
    public static final String SHARD_KEY = "eventsub:conduit:shard";
    public static final String CREATION_LOCK_KEY = "eventsub:conduit:lock";

    static final String SHARD_ID = "0";

    private static final Duration LOCK_TTL_MARGIN = Duration.ofSeconds(5);

    private final HelixClient helixClient;
    private final KeyValueStore store;
    private final SecretStore secretStore;
    private final URI callbackUrl;
    private final boolean creationLockEnabled;
    private final Duration creationLockTtl;

    public ConduitResolver(HelixClient helixClient,
                           KeyValueStore store,
                           SecretStore secretStore,
                           @Value("${app.eventsub.public-url}") String publicUrl,
                           @Value("${app.eventsub.callback-path:/api/eventsub/callback}") String callbackPath,
                           @Value("${app.eventsub.conduit.creation-lock-enabled:true}") boolean creationLockEnabled,
                           @Value("${app.eventsub.conduit.creation-lock-ttl:2m}") Duration creationLockTtl,
                           HelixRetrySettings retrySettings) {
        this.helixClient = helixClient;
        this.store = store;
        this.secretStore = secretStore;
        this.callbackUrl = URI.create(publicUrl).resolve(callbackPath);
        this.creationLockEnabled = creationLockEnabled;
        this.creationLockTtl = boundLockTtl(creationLockTtl, retrySettings);
    }

    /**
     * 锁必须比一次创建的最长耗时更久：POST 创建 conduit（不重试）加 PATCH 更新 shard（重试）。
     */
    static Duration boundLockTtl(Duration configured, HelixRetrySettings retrySettings) {
        Duration minimum = retrySettings.worstCase(false).plus(retrySettings.worstCase(true)).plus(LOCK_TTL_MARGIN);
        if (configured.compareTo(minimum) < 0) {
            log.warn("Conduit creation lock TTL {} is shorter than the worst-case creation time, using {}",
                    configured, minimum);
            return minimum;
        }
        return configured;
    }

    Duration getCreationLockTtl() {
        return creationLockTtl;
    }

    /**
     * 回调地址，必须与接收投递的 HTTP 接口一致。
     *
     * @return 回调地址
     */
    public URI getCallbackUrl() {
        return callbackUrl;
    }

    /**
     * Redis 中是否已有 conduit ID（不检查其状态）。
     *
     * @return true 表示已创建过
     */
    public boolean isConfigured() {
        return store.exists(CONDUIT_KEY);
    }

    /**
     * 获取可用的 conduit ID。
     * 只有缓存的 shard 在 Helix 上存在、使用 webhook 且状态为 enabled 时才返回，
     * 否则返回空，不做自动修复。
     *
     * @return conduit ID
     */
    public Optional<String> getConduitId() {
        String conduitId = store.get(CONDUIT_KEY).orElse(null);
        if (conduitId == null) {
            return Optional.empty();
        }

        String shardId = store.get(SHARD_KEY).orElse(null);
        if (shardId == null) {
            log.warn("Conduit {} is cached without a shard id", conduitId);
            return Optional.empty();
        }

        try {
            return verifyConduit(conduitId, shardId);
        } catch (HelixTransportException e) {
            log.error("Failed to verify conduit {}: {}", conduitId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    private Optional<String> verifyConduit(String conduitId, String shardId) {
        HelixResponse<List<Conduit>> conduits = helixClient.getConduits();
        if (!conduits.isSuccess()) {
            log.error("Failed to get conduits: {}", conduits.getMessage());
            return Optional.empty();
        }

        boolean listed = conduits.getValue().stream().anyMatch(c -> c.id().equals(conduitId));
        if (!listed) {
            log.warn("Cached conduit {} no longer exists", conduitId);
            return Optional.empty();
        }

        AtomicBoolean pageFailed = new AtomicBoolean(false);
        List<ConduitShard> shards = Pagination.collect(helixClient.getConduitShards(conduitId), error -> {
            pageFailed.set(true);
            log.error("Failed to get shards for conduit {}: {}", conduitId, error.getMessage());
        });
        if (pageFailed.get() || Thread.currentThread().isInterrupted()) {
            return Optional.empty();
        }

        ConduitShard shard = shards.stream()
                .filter(s -> s.id().equals(shardId) && s.hasWebhookTransport())
                .findFirst()
                .orElse(null);
        if (shard == null) {
            log.warn("Shard {} with webhook transport not found on conduit {}", shardId, conduitId);
            return Optional.empty();
        }

        if (shard.status() != ShardStatus.ENABLED) {
            log.error("Shard {} assigned to conduit {} is not enabled: {}", shard.id(), conduitId, shard.status());
            return Optional.empty();
        }

        return Optional.of(conduitId);
    }

    /**
     * 创建新的 conduit（1 个 shard），生成新密钥，并将 shard 0 指向本服务的回调地址。
     * 三个缓存键分别写入，中途失败留下的部分状态会被 {@link #getConduitId()} 识别为不可用。
     *
     * @return true 表示创建完成
     */
    public boolean createConduit() {
        String lockToken = UUID.randomUUID().toString();
        if (creationLockEnabled && !store.setIfAbsent(CREATION_LOCK_KEY, lockToken, creationLockTtl)) {
            log.info("Conduit creation already in progress elsewhere, skipping");
            return false;
        }

        try {
            return doCreateConduit();
        } catch (HelixTransportException e) {
            log.error("Failed to create conduit: {}", e.getMessage(), e);
            return false;
        } finally {
            if (creationLockEnabled) {
                releaseLock(lockToken);
            }
        }
    }

    private boolean doCreateConduit() {
        HelixResponse<List<Conduit>> created = helixClient.createConduits(1);
        if (!created.isSuccess() || created.getValue().isEmpty()) {
            log.error("Failed to create conduit: {}", created.getMessage());
            return false;
        }

        Conduit conduit = created.getValue().get(0);
        String secret = SecretStore.generateSecret();
        ShardTransport transport = ShardTransport.webhook(callbackUrl.toString(), secret);

        HelixResponse<ShardUpdateResult> update = helixClient.updateConduitShards(
                conduit.id(), List.of(new ShardAssignment(SHARD_ID, transport)));
        if (!update.isSuccess()) {
            log.error("Failed to update shard for conduit {}: {}", conduit.id(), update.getMessage());
            return false;
        }
        if (update.getValue().hasErrors()) {
            String errors = update.getValue().errors().stream()
                    .map(ShardError::message)
                    .collect(Collectors.joining(", "));
            log.error("Failed to update shard for conduit {}: {}", conduit.id(), errors);
            return false;
        }

        ConduitShard shard = update.getValue().findShard(SHARD_ID).orElse(null);
        if (shard == null) {
            log.error("Shard {} missing from update response for conduit {}", SHARD_ID, conduit.id());
            return false;
        }
        if (!shard.status().isExpectedAfterCreation()) {
            log.warn("Shard {} is in an unexpected state {}", shard.id(), shard.status());
        }

        store.set(CONDUIT_KEY, conduit.id());
        secretStore.replace(secret);
        store.set(SHARD_KEY, shard.id());

        log.info("Conduit {} has been created with shard {} ({}), callback {}",
                conduit.id(), shard.id(), shard.status(), callbackUrl);
        return true;
    }

    private void releaseLock(String lockToken) {
        try {
            // Only remove our own lock; it may have expired and been taken over
            if (store.get(CREATION_LOCK_KEY).map(lockToken::equals).orElse(false)) {
                store.delete(CREATION_LOCK_KEY);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to release conduit creation lock: {}", e.getMessage());
        }
    }
}
