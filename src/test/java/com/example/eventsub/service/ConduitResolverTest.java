package com.example.eventsub.service;

import com.example.eventsub.helix.FakePager;
import com.example.eventsub.helix.HelixClient;
import com.example.eventsub.helix.HelixResponse;
import com.example.eventsub.helix.HelixRetrySettings;
import com.example.eventsub.helix.HelixTransportException;
import com.example.eventsub.model.Conduit;
import com.example.eventsub.model.ConduitShard;
import com.example.eventsub.model.ShardAssignment;
import com.example.eventsub.model.ShardError;
import com.example.eventsub.model.ShardStatus;
import com.example.eventsub.model.ShardTransport;
import com.example.eventsub.model.ShardUpdateResult;
import com.example.eventsub.store.InMemoryKeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConduitResolverTest {

    private static final String CALLBACK = "https://bot.example.com/api/eventsub/callback";
    private static final HelixRetrySettings RETRY = new HelixRetrySettings(Duration.ofSeconds(10), 3, 500, 2.0);

    @Mock
    private HelixClient helix;

    private InMemoryKeyValueStore store;
    private SecretStore secretStore;
    private ConduitResolver resolver;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        secretStore = new SecretStore(store);
        resolver = new ConduitResolver(helix, store, secretStore,
                "https://bot.example.com", "/api/eventsub/callback", true, Duration.ofSeconds(30), RETRY);
    }

    private void cacheConduit(String conduitId, String shardId) {
        store.set(ConduitResolver.CONDUIT_KEY, conduitId);
        store.set(ConduitResolver.SHARD_KEY, shardId);
    }

    private static ConduitShard webhookShard(String id, ShardStatus status) {
        return new ConduitShard(id, status, new ShardTransport("webhook", CALLBACK, null));
    }

    @Test
    void callbackUrlJoinsPublicUrlAndPath() {
        assertEquals(CALLBACK, resolver.getCallbackUrl().toString());
    }

    @Test
    void nothingCachedReturnsEmptyWithoutRemoteCalls() {
        assertTrue(resolver.getConduitId().isEmpty());
        assertFalse(resolver.isConfigured());
        verifyNoInteractions(helix);
    }

    @Test
    void conduitWithoutShardIdIsTreatedAsPartialState() {
        store.set(ConduitResolver.CONDUIT_KEY, "c-1");

        assertTrue(resolver.getConduitId().isEmpty());
        assertTrue(resolver.isConfigured());
        verifyNoInteractions(helix);
    }

    @Test
    void enabledWebhookShardResolvesCachedConduit() {
        cacheConduit("c-1", "0");
        when(helix.getConduits()).thenReturn(HelixResponse.ok(200, List.of(new Conduit("c-1", 1))));
        when(helix.getConduitShards("c-1")).thenReturn(FakePager.of(List.of(webhookShard("0", ShardStatus.ENABLED))));

        assertEquals(Optional.of("c-1"), resolver.getConduitId());
    }

    @Test
    void shardNotEnabledReturnsEmptyEvenWhenConduitCached() {
        cacheConduit("c-1", "0");
        when(helix.getConduits()).thenReturn(HelixResponse.ok(200, List.of(new Conduit("c-1", 1))));
        when(helix.getConduitShards("c-1")).thenReturn(FakePager.of(List.of(webhookShard("0", ShardStatus.DISABLED))));

        assertTrue(resolver.getConduitId().isEmpty());
    }

    @Test
    void shardOnAnotherTransportIsIgnored() {
        cacheConduit("c-1", "0");
        when(helix.getConduits()).thenReturn(HelixResponse.ok(200, List.of(new Conduit("c-1", 1))));
        when(helix.getConduitShards("c-1")).thenReturn(FakePager.of(List.of(
                new ConduitShard("0", ShardStatus.ENABLED, new ShardTransport("websocket", null, null)))));

        assertTrue(resolver.getConduitId().isEmpty());
    }

    @Test
    void conduitMissingRemotelyReturnsEmpty() {
        cacheConduit("c-1", "0");
        when(helix.getConduits()).thenReturn(HelixResponse.ok(200, List.of(new Conduit("someone-else", 1))));

        assertTrue(resolver.getConduitId().isEmpty());
        verify(helix, never()).getConduitShards(anyString());
    }

    @Test
    void remoteFailureReturnsEmpty() {
        cacheConduit("c-1", "0");
        when(helix.getConduits()).thenReturn(HelixResponse.failure(401, "Invalid OAuth token"));

        assertTrue(resolver.getConduitId().isEmpty());
    }

    @Test
    void transportFaultReturnsEmpty() {
        cacheConduit("c-1", "0");
        when(helix.getConduits()).thenThrow(new HelixTransportException("connection refused", null));

        assertTrue(resolver.getConduitId().isEmpty());
    }

    @Test
    void failedShardPageReturnsEmpty() {
        cacheConduit("c-1", "0");
        when(helix.getConduits()).thenReturn(HelixResponse.ok(200, List.of(new Conduit("c-1", 1))));
        when(helix.getConduitShards("c-1")).thenReturn(new FakePager<ConduitShard>(FakePager.<ConduitShard>failedPage("Too Many Requests")));

        assertTrue(resolver.getConduitId().isEmpty());
    }

    @Test
    void createdConduitPendingVerificationIsNotReturnedUntilEnabled() {
        when(helix.createConduits(1)).thenReturn(HelixResponse.ok(200, List.of(new Conduit("c-new", 1))));
        when(helix.updateConduitShards(eq("c-new"), anyList())).thenReturn(HelixResponse.ok(202, new ShardUpdateResult(
                List.of(webhookShard("0", ShardStatus.WEBHOOK_VERIFICATION_PENDING)), List.of())));

        assertTrue(resolver.createConduit());

        assertEquals("c-new", store.get(ConduitResolver.CONDUIT_KEY).orElseThrow());
        assertEquals("0", store.get(ConduitResolver.SHARD_KEY).orElseThrow());
        assertFalse(store.exists(ConduitResolver.CREATION_LOCK_KEY));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ShardAssignment>> assignments = ArgumentCaptor.forClass(List.class);
        verify(helix).updateConduitShards(eq("c-new"), assignments.capture());
        ShardAssignment assignment = assignments.getValue().get(0);
        assertEquals("0", assignment.id());
        assertEquals(CALLBACK, assignment.transport().callback());
        assertEquals(assignment.transport().secret(), store.get(SecretStore.SECRET_KEY).orElseThrow());
        assertEquals(assignment.transport().secret(), secretStore.getSecret());

        when(helix.getConduits()).thenReturn(HelixResponse.ok(200, List.of(new Conduit("c-new", 1))));
        when(helix.getConduitShards("c-new")).thenReturn(
                FakePager.of(List.of(webhookShard("0", ShardStatus.WEBHOOK_VERIFICATION_PENDING))),
                FakePager.of(List.of(webhookShard("0", ShardStatus.ENABLED))));

        assertTrue(resolver.getConduitId().isEmpty());
        assertEquals(Optional.of("c-new"), resolver.getConduitId());
    }

    @Test
    void unexpectedShardStatusStillPersists() {
        when(helix.createConduits(1)).thenReturn(HelixResponse.ok(200, List.of(new Conduit("c-new", 1))));
        when(helix.updateConduitShards(eq("c-new"), anyList())).thenReturn(HelixResponse.ok(202, new ShardUpdateResult(
                List.of(webhookShard("0", ShardStatus.UNKNOWN)), List.of())));

        assertTrue(resolver.createConduit());
        assertEquals("c-new", store.get(ConduitResolver.CONDUIT_KEY).orElseThrow());
    }

    @Test
    void shardErrorsLeaveCacheUntouched() {
        when(helix.createConduits(1)).thenReturn(HelixResponse.ok(200, List.of(new Conduit("c-new", 1))));
        when(helix.updateConduitShards(eq("c-new"), anyList())).thenReturn(HelixResponse.ok(202, new ShardUpdateResult(
                List.of(), List.of(new ShardError("0", "The callback URL is invalid", "invalid_parameter")))));

        assertFalse(resolver.createConduit());
        assertTrue(store.get(ConduitResolver.CONDUIT_KEY).isEmpty());
        assertTrue(store.get(SecretStore.SECRET_KEY).isEmpty());
        assertTrue(store.get(ConduitResolver.SHARD_KEY).isEmpty());
    }

    @Test
    void failedConduitCreationStopsEarly() {
        when(helix.createConduits(1)).thenReturn(HelixResponse.failure(429, "Too Many Requests"));

        assertFalse(resolver.createConduit());
        verify(helix, never()).updateConduitShards(anyString(), anyList());
        assertFalse(store.exists(ConduitResolver.CREATION_LOCK_KEY));
    }

    @Test
    void heldCreationLockSkipsCreation() {
        store.set(ConduitResolver.CREATION_LOCK_KEY, "other-process", Duration.ofSeconds(30));

        assertFalse(resolver.createConduit());
        verifyNoInteractions(helix);
        assertEquals("other-process", store.get(ConduitResolver.CREATION_LOCK_KEY).orElseThrow());
    }

    @Test
    void transportFaultDuringCreationReleasesLock() {
        when(helix.createConduits(1)).thenThrow(new HelixTransportException("timeout", null));

        assertFalse(resolver.createConduit());
        assertFalse(store.exists(ConduitResolver.CREATION_LOCK_KEY));
    }

    @Test
    void shortLockTtlIsRaisedToWorstCaseCreationTime() {
        // POST once (10s) + PATCH three times (30s) + backoff 0.5s and 1s + 5s margin
        assertEquals(Duration.ofMillis(46_500), resolver.getCreationLockTtl());
    }

    @Test
    void longerLockTtlIsKept() {
        assertEquals(Duration.ofMinutes(2), ConduitResolver.boundLockTtl(Duration.ofMinutes(2), RETRY));
    }

    @Test
    void lockOutlivesSlowCreation() {
        when(helix.createConduits(1)).thenAnswer(invocation -> {
            assertEquals(Duration.ofMillis(46_500), store.ttl(ConduitResolver.CREATION_LOCK_KEY));
            // Every call times out and is retried
            store.advance(RETRY.worstCase(false).plus(RETRY.worstCase(true)));
            assertTrue(store.exists(ConduitResolver.CREATION_LOCK_KEY));
            return HelixResponse.failure(500, "Internal Server Error");
        });

        assertFalse(resolver.createConduit());
        assertFalse(store.exists(ConduitResolver.CREATION_LOCK_KEY));
    }
}
