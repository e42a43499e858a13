package com.example.eventsub.security;

import com.example.eventsub.service.SecretStore;
import com.example.eventsub.store.InMemoryKeyValueStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class DeliverySignatureVerifierTest {

    private static final String SECRET = "s3cr3t-webhook-value";

    private InMemoryKeyValueStore store;
    private DeliverySignatureVerifier verifier;

    @BeforeEach
    public void setup() {
        store = new InMemoryKeyValueStore();
        SecretStore secretStore = new SecretStore(store);
        secretStore.replace(SECRET);
        verifier = new DeliverySignatureVerifier(secretStore);
    }

    @Test
    public void testVerifySuccess() throws Exception {
        String messageId = "e76c6bd4-55c9-4987-8304-da1588d8988b";
        String timestamp = "2024-01-01T00:00:00.000Z";
        String body = "{\"subscription\":{\"type\":\"channel.chat.message\"}}";

        String signature = "sha256=" + DeliverySignatureVerifier.calculateHmac(messageId + timestamp + body, SECRET);

        Assertions.assertTrue(verifier.verify(messageId, timestamp, body, signature));
    }

    @Test
    public void testKnownVector() throws Exception {
        // HMAC-SHA256("key", "The quick brown fox jumps over the lazy dog")
        Assertions.assertEquals("f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8",
                DeliverySignatureVerifier.calculateHmac("The quick brown fox jumps over the lazy dog", "key"));
    }

    @Test
    public void testTamperedBodyFails() throws Exception {
        String signature = "sha256=" + DeliverySignatureVerifier.calculateHmac("id" + "ts" + "{\"a\":1}", SECRET);

        Assertions.assertFalse(verifier.verify("id", "ts", "{\"a\":2}", signature));
    }

    @Test
    public void testWrongSecretFails() throws Exception {
        String signature = "sha256=" + DeliverySignatureVerifier.calculateHmac("id" + "ts" + "{}", "another-secret");

        Assertions.assertFalse(verifier.verify("id", "ts", "{}", signature));
    }

    @Test
    public void testMissingPrefixFails() throws Exception {
        String hex = DeliverySignatureVerifier.calculateHmac("id" + "ts" + "{}", SECRET);

        Assertions.assertFalse(verifier.verify("id", "ts", "{}", hex));
    }

    @Test
    public void testMissingHeadersFail() {
        Assertions.assertFalse(verifier.verify(null, "ts", "{}", "sha256=00"));
        Assertions.assertFalse(verifier.verify("id", "ts", "{}", null));
    }

    @Test
    public void testSecretReplacedByAnotherProcess() throws Exception {
        // Another instance created a new conduit and stored a new secret
        new SecretStore(store).replace("rotated-webhook-secret");
        String signature = "sha256=" + DeliverySignatureVerifier.calculateHmac("id" + "ts" + "{}", "rotated-webhook-secret");

        Assertions.assertTrue(verifier.verify("id", "ts", "{}", signature));

        String stale = "sha256=" + DeliverySignatureVerifier.calculateHmac("id" + "ts" + "{}", SECRET);
        Assertions.assertFalse(verifier.verify("id", "ts", "{}", stale));
    }
}
