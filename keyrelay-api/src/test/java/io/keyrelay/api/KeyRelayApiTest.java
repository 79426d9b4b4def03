/*
 * Copyright 2024 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.keyrelay.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Set;

import com.grack.nanojson.JsonArray;
import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonWriter;

import org.assertj.core.api.SoftAssertions;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import io.keyrelay.RelayNotifier;
import io.keyrelay.config.KeyRelayConfig;
import io.keyrelay.crypto.CryptoUtils;
import io.keyrelay.crypto.X25519;
import io.keyrelay.exchange.ExchangeRepository;
import io.keyrelay.exchange.KeyExchangeCoordinator;
import io.keyrelay.exchange.PublicKeyBundle;
import io.keyrelay.negotiation.AlgorithmCapabilities;
import io.keyrelay.negotiation.EncryptionAlgorithm;
import io.keyrelay.negotiation.KeyExchangeAlgorithm;
import io.keyrelay.negotiation.MessageStatisticsSource;
import io.keyrelay.negotiation.SignatureAlgorithm;
import io.keyrelay.store.HealthReport;
import io.keyrelay.store.KeyMaterialStore;
import io.keyrelay.store.RepositoryException;
import io.keyrelay.store.StateEncryptionKeyProvider;

public class KeyRelayApiTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);

    private KeyRelay relay;
    private KeyRelayApi api;

    @BeforeMethod
    public void setup() {
        relay = new KeyRelay(KeyRelayConfig.defaults(), StateEncryptionKeyProvider.of(CryptoUtils.randomBytes(32)),
                CLOCK, RelayNotifier.LOGGING, MessageStatisticsSource.NONE);
        api = new KeyRelayApi(relay, Set.of("admin"));
    }

    @Test
    public void healthCheckShouldNotRequireAuthentication() {
        var response = api.handle("GET", "/ratchet/health", null, null);

        assertThat(response.status()).isEqualTo(200);
        assertThat(response.body().getString("status")).isEqualTo("healthy");
        assertThat(response.body().getBoolean("success")).isTrue();
    }

    @Test
    public void shouldRejectAnonymousRequests() {
        var response = api.handle("GET", "/ratchet/state/conv/alice", null, null);

        assertError(response, 401, "UNAUTHENTICATED");
    }

    @Test
    public void shouldReturnNotFoundForUnknownRoutes() {
        assertError(api.handle("GET", "/nowhere", "alice", null), 404, "NOT_FOUND");
        assertError(api.handle("PATCH", "/ratchet/state", "alice", null), 404, "NOT_FOUND");
        assertError(api.handle(null, "/ratchet/health", "alice", null), 400, "BAD_REQUEST");
    }

    @Test
    public void shouldStoreAndReturnRatchetState() {
        var put = api.handle("PUT", "/ratchet/state", "alice", ratchetStateRequest("conv-1", "alice", null));
        assertThat(put.status()).isEqualTo(200);
        assertThat(put.body().getString("ratchetStateId")).isNotBlank();
        assertThat(put.body().getLong("version")).isEqualTo(1L);

        var get = api.handle("GET", "/ratchet/state/conv-1/alice", "alice", null);
        assertThat(get.status()).isEqualTo(200);
        var state = (JsonObject) get.body().get("ratchetState");
        var softly = new SoftAssertions();
        softly.assertThat(state.getString("id")).isEqualTo(put.body().getString("ratchetStateId"));
        softly.assertThat(state.getString("conversationId")).isEqualTo("conv-1");
        softly.assertThat(state.getString("userId")).isEqualTo("alice");
        softly.assertThat(state.getInt("sendingMessageNumber")).isEqualTo(4);
        softly.assertThat(state.getInt("sendingChainLength")).isEqualTo(1);
        softly.assertThat(state.getInt("securityLevel")).isEqualTo(3);
        softly.assertThat(Base64.getDecoder().decode(state.getString("rootKey"))).hasSize(32);
        softly.assertThat(state.get("receivingChainKey")).isNull();
        softly.assertAll();
    }

    @Test
    public void shouldDetectConcurrentWritesWithExpectedVersion() {
        api.handle("PUT", "/ratchet/state", "alice", ratchetStateRequest("conv-1", "alice", null));

        var second = api.handle("PUT", "/ratchet/state", "alice", ratchetStateRequest("conv-1", "alice", 1L));
        assertThat(second.status()).isEqualTo(200);
        assertThat(second.body().getLong("version")).isEqualTo(2L);

        var stale = api.handle("PUT", "/ratchet/state", "alice", ratchetStateRequest("conv-1", "alice", 1L));
        assertError(stale, 409, "STATE_CONFLICT");

        var create = api.handle("PUT", "/ratchet/state", "alice", ratchetStateRequest("conv-2", "alice", 0L));
        assertThat(create.status()).isEqualTo(200);
    }

    @Test
    public void shouldDeleteRatchetState() {
        api.handle("PUT", "/ratchet/state", "alice", ratchetStateRequest("conv-1", "alice", null));

        assertThat(api.handle("DELETE", "/ratchet/state/conv-1/alice", "alice", null).status()).isEqualTo(200);
        assertError(api.handle("GET", "/ratchet/state/conv-1/alice", "alice", null), 404, "RATCHET_NOT_INITIALIZED");
        assertError(api.handle("DELETE", "/ratchet/state/conv-1/alice", "alice", null), 404,
                "RATCHET_NOT_INITIALIZED");
    }

    @Test
    public void shouldOnlyAllowOwnerOrAdministratorToAccessRatchetState() {
        api.handle("PUT", "/ratchet/state", "alice", ratchetStateRequest("conv-1", "alice", null));

        assertError(api.handle("GET", "/ratchet/state/conv-1/alice", "mallory", null), 403, "FORBIDDEN");
        assertError(api.handle("PUT", "/ratchet/state", "mallory", ratchetStateRequest("conv-1", "alice", null)),
                403, "FORBIDDEN");
        assertError(api.handle("GET", "/ratchet/stats/conv-1/alice", "mallory", null), 403, "FORBIDDEN");
        assertThat(api.handle("GET", "/ratchet/state/conv-1/alice", "admin", null).status()).isEqualTo(200);
    }

    @Test
    public void shouldStoreAndFetchSkippedKeys() {
        api.handle("PUT", "/ratchet/state", "alice", ratchetStateRequest("conv-1", "alice", null));
        var messageKey = CryptoUtils.randomBytes(32);
        var body = JsonWriter.string(JsonObject.builder()
                .value("conversationId", "conv-1")
                .value("userId", "alice")
                .value("messageKeyId", "2:7")
                .value("messageKey", Base64.getEncoder().encodeToString(messageKey))
                .value("chainLength", 2)
                .value("messageNumber", 7)
                .done());

        var put = api.handle("POST", "/ratchet/skipped-keys", "alice", body);
        assertThat(put.status()).isEqualTo(200);
        assertThat(Instant.parse(put.body().getString("expiresAt")))
                .isEqualTo(CLOCK.instant().plus(relay.config().skippedKeyTtl()));

        var get = api.handle("GET", "/ratchet/skipped-keys/conv-1/alice/2:7", "alice", null);
        assertThat(get.status()).isEqualTo(200);
        var skipped = (JsonObject) get.body().get("skippedKey");
        assertThat(Base64.getDecoder().decode(skipped.getString("messageKey"))).isEqualTo(messageKey);
        assertThat(skipped.getInt("messageNumber")).isEqualTo(7);

        var stats = (JsonObject) api.handle("GET", "/ratchet/stats/conv-1/alice", "alice", null).body().get("stats");
        assertThat(stats.getLong("skippedKeysCount")).isEqualTo(1L);

        assertThat(api.handle("DELETE", "/ratchet/skipped-keys/conv-1/alice/2:7", "alice", null).status())
                .isEqualTo(200);
        assertError(api.handle("GET", "/ratchet/skipped-keys/conv-1/alice/2:7", "alice", null), 404, "NOT_FOUND");
        assertError(api.handle("DELETE", "/ratchet/skipped-keys/conv-1/alice/2:7", "alice", null), 404,
                "NOT_FOUND");
    }

    @Test
    public void shouldRejectSkippedKeyWithoutRatchetState() {
        var body = JsonWriter.string(JsonObject.builder()
                .value("conversationId", "conv-1")
                .value("userId", "alice")
                .value("messageKeyId", "1:0")
                .value("messageKey", Base64.getEncoder().encodeToString(new byte[32]))
                .value("chainLength", 1)
                .value("messageNumber", 0)
                .done());

        assertError(api.handle("POST", "/ratchet/skipped-keys", "alice", body), 404, "RATCHET_NOT_INITIALIZED");
    }

    @Test
    public void shouldRestrictConversationListingAndCleanupToAdministrators() {
        api.handle("PUT", "/ratchet/state", "alice", ratchetStateRequest("conv-1", "alice", null));
        api.handle("PUT", "/ratchet/state", "bob", ratchetStateRequest("conv-1", "bob", null));

        assertError(api.handle("GET", "/ratchet/conversation/conv-1", "alice", null), 403, "FORBIDDEN");
        assertError(api.handle("POST", "/ratchet/cleanup", "alice", null), 403, "FORBIDDEN");

        var listing = api.handle("GET", "/ratchet/conversation/conv-1", "admin", null);
        assertThat(listing.status()).isEqualTo(200);
        assertThat((JsonArray) listing.body().get("ratchetStates")).hasSize(2);

        var cleanup = api.handle("POST", "/ratchet/cleanup", "admin", null);
        assertThat(cleanup.status()).isEqualTo(200);
        assertThat(cleanup.body().getInt("deletedSkippedKeys")).isZero();
        assertThat(cleanup.body().getInt("deletedExchanges")).isZero();
        assertThat(cleanup.body().getInt("expiredSyncPackages")).isZero();
    }

    @Test
    public void shouldRunKeyExchangeOverJson() {
        var initiate = api.handle("POST", "/key-exchange/initiate", "alice", JsonWriter.string(JsonObject.builder()
                .value("recipientId", "bob")
                .value("conversationId", "conv-1")
                .value("exchangeType", "initial_setup")
                .value("publicKeyBundle", classicalBundle().toJson())
                .value("encryptedKeyData", Base64.getEncoder().encodeToString("for bob".getBytes()))
                .done()));
        assertThat(initiate.status()).isEqualTo(200);
        assertThat(initiate.body().getString("status")).isEqualTo("pending");
        var exchangeId = initiate.body().getString("exchangeId");

        var pending = api.handle("GET", "/key-exchange/pending?limit=5", "bob", null);
        var exchanges = (JsonArray) pending.body().get("exchanges");
        assertThat(exchanges).hasSize(1);
        assertThat(exchanges.getObject(0).getString("otherPartyId")).isEqualTo("alice");
        assertThat(exchanges.getObject(0).getBoolean("isInitiator")).isFalse();

        var forBob = (JsonObject) api.handle("GET", "/key-exchange/" + exchangeId, "bob", null).body().get("exchange");
        assertThat(Base64.getDecoder().decode(forBob.getString("encryptedKeyData"))).isEqualTo("for bob".getBytes());

        var respond = api.handle("POST", "/key-exchange/respond", "bob", JsonWriter.string(JsonObject.builder()
                .value("exchangeId", exchangeId)
                .value("responseData", Base64.getEncoder().encodeToString("for alice".getBytes()))
                .value("publicKeyBundle", classicalBundle().toJson())
                .done()));
        assertThat(respond.body().getString("status")).isEqualTo("responded");

        var forAlice = (JsonObject) api.handle("GET", "/key-exchange/" + exchangeId, "alice", null).body()
                .get("exchange");
        assertThat(Base64.getDecoder().decode(forAlice.getString("responseData")))
                .isEqualTo("for alice".getBytes());

        var complete = api.handle("POST", "/key-exchange/complete", "alice", JsonWriter.string(JsonObject.builder()
                .value("exchangeId", exchangeId)
                .done()));
        assertThat(complete.body().getString("status")).isEqualTo("completed");

        var stats = (JsonObject) api.handle("GET", "/key-exchange/stats?timeframe=24h", "alice", null).body()
                .get("stats");
        assertThat(stats.getLong("total")).isEqualTo(1L);
    }

    @Test
    public void shouldMapExchangeErrors() {
        var initiate = api.handle("POST", "/key-exchange/initiate", "alice", JsonWriter.string(JsonObject.builder()
                .value("recipientId", "bob")
                .value("exchangeType", "ratchet_update")
                .value("publicKeyBundle", classicalBundle().toJson())
                .done()));
        var exchangeId = initiate.body().getString("exchangeId");

        assertError(api.handle("GET", "/key-exchange/" + exchangeId, "carol", null), 403, "EXCHANGE_UNAUTHORIZED");
        assertError(api.handle("GET", "/key-exchange/missing", "alice", null), 404, "EXCHANGE_NOT_FOUND");
        assertError(api.handle("POST", "/key-exchange/complete", "alice",
                "{\"exchangeId\":\"" + exchangeId + "\"}"), 409, "EXCHANGE_INVALID_STATE");
        assertError(api.handle("POST", "/key-exchange/initiate", "alice", JsonWriter.string(JsonObject.builder()
                .value("recipientId", "bob")
                .value("exchangeType", "teleport")
                .value("publicKeyBundle", classicalBundle().toJson())
                .done())), 400, "VALIDATION_ERROR");
        assertError(api.handle("GET", "/key-exchange/pending?limit=lots", "bob", null), 400, "VALIDATION_ERROR");
    }

    @Test
    public void shouldDeliverSyncPackagesBetweenOwnDevices() {
        api.handle("POST", "/multi-device/device", "alice", "{\"deviceId\":\"laptop\",\"platform\":\"linux\"}");
        api.handle("POST", "/multi-device/device", "alice", "{\"deviceId\":\"phone\",\"deviceType\":\"mobile\"}");

        var create = api.handle("POST", "/multi-device/sync", "alice", syncRequest("laptop", "phone"));
        assertThat(create.status()).isEqualTo(200);
        assertThat(create.body().getString("status")).isEqualTo("pending");
        var packageId = create.body().getString("packageId");

        var pending = (JsonArray) api.handle("GET", "/multi-device/pending/phone", "alice", null).body()
                .get("packages");
        assertThat(pending).hasSize(1);
        var syncPackage = pending.getObject(0);
        assertThat(syncPackage.getString("packageId")).isEqualTo(packageId);
        assertThat(syncPackage.getString("keyType")).isEqualTo("ratchet_state");
        assertThat(syncPackage.getString("syncPriority")).isEqualTo("high");

        assertError(api.handle("GET", "/multi-device/pending/phone", "bob", null), 403, "EXCHANGE_UNAUTHORIZED");

        var processed = api.handle("POST", "/multi-device/processed/" + packageId, "alice", "{\"success\":true}");
        assertThat(processed.body().getString("status")).isEqualTo("processed");
        assertThat((JsonArray) api.handle("GET", "/multi-device/pending/phone", "alice", null).body()
                .get("packages")).isEmpty();
    }

    @Test
    public void shouldRejectSyncToDevicesOfAnotherUser() {
        api.handle("POST", "/multi-device/device", "alice", "{\"deviceId\":\"laptop\"}");
        api.handle("POST", "/multi-device/device", "bob", "{\"deviceId\":\"tablet\"}");

        assertError(api.handle("POST", "/multi-device/sync", "alice", syncRequest("laptop", "tablet")), 403,
                "DEVICE_OWNERSHIP_MISMATCH");
        assertError(api.handle("POST", "/multi-device/processed/unknown", "alice", "{}"), 400,
                "VALIDATION_ERROR");
    }

    @Test
    public void shouldRecordNegotiationAndReportEncryptionStatus() {
        var record = api.handle("POST", "/algorithm-negotiation", "alice", JsonWriter.string(JsonObject.builder()
                .value("conversationId", "conv-1")
                .value("responderId", "bob")
                .value("keyExchange", "hybrid")
                .value("securityLevel", 3)
                .value("quantumResistant", true)
                .done()));
        assertThat(record.status()).isEqualTo(200);
        var negotiation = (JsonObject) record.body().get("negotiation");
        assertThat(negotiation.getBoolean("hybridMode")).isTrue();
        assertThat(negotiation.getString("signature")).isEqualTo("dilithium3");

        var status = (JsonObject) api.handle("GET", "/conversation/conv-1/encryption-status", "bob", null).body()
                .get("status");
        assertThat(status.getBoolean("hasNegotiation")).isTrue();
        assertThat(status.getInt("securityLevel")).isEqualTo(3);
        assertThat(status.getBoolean("quantumResistant")).isTrue();

        var unknown = (JsonObject) api.handle("GET", "/conversation/other/encryption-status", "bob", null).body()
                .get("status");
        assertThat(unknown.getBoolean("hasNegotiation")).isFalse();
        assertThat(unknown.getString("algorithm")).isEqualTo("none");

        var stats = (JsonObject) api.handle("GET", "/encryption/stats?timeframe=7d", "alice", null).body()
                .get("stats");
        assertThat(stats.getLong("negotiations")).isEqualTo(1L);
        assertThat(stats.getLong("quantumResistantNegotiations")).isEqualTo(1L);
    }

    @Test
    public void shouldRejectMalformedRequests() {
        assertError(api.handle("PUT", "/ratchet/state", "alice", "{not json"), 400, "VALIDATION_ERROR");
        assertError(api.handle("PUT", "/ratchet/state", "alice", "{\"conversationId\":\"c\",\"userId\":\"alice\"}"),
                400, "VALIDATION_ERROR");
        assertError(api.handle("POST", "/algorithm-negotiation", "alice",
                "{\"conversationId\":\"c\",\"keyExchange\":\"x25519\",\"quantumResistant\":true}"),
                400, "VALIDATION_ERROR");
        assertError(api.handle("GET", "/encryption/stats?timeframe=fortnight", "alice", null), 400,
                "VALIDATION_ERROR");
    }

    @Test
    public void shouldRejectRatchetStateWithMalformedKeysWithoutStoringIt() {
        var encoder = Base64.getEncoder();
        var shortPrivateKey = JsonObject.builder()
                .value("rootKey", encoder.encodeToString(CryptoUtils.randomBytes(32)))
                .value("sendingRatchetPrivateKey", encoder.encodeToString(CryptoUtils.randomBytes(16)))
                .value("sendingRatchetPublicKey", encoder.encodeToString(CryptoUtils.randomBytes(32)))
                .value("securityLevel", 3)
                .done();
        var badSecurityLevel = JsonObject.builder()
                .value("rootKey", encoder.encodeToString(CryptoUtils.randomBytes(32)))
                .value("sendingRatchetPrivateKey", encoder.encodeToString(CryptoUtils.randomBytes(32)))
                .value("sendingRatchetPublicKey", encoder.encodeToString(CryptoUtils.randomBytes(32)))
                .value("securityLevel", 42)
                .done();
        var shortChainKey = JsonObject.builder()
                .value("rootKey", encoder.encodeToString(CryptoUtils.randomBytes(32)))
                .value("receivingChainKey", encoder.encodeToString(CryptoUtils.randomBytes(8)))
                .value("sendingRatchetPrivateKey", encoder.encodeToString(CryptoUtils.randomBytes(32)))
                .value("sendingRatchetPublicKey", encoder.encodeToString(CryptoUtils.randomBytes(32)))
                .done();

        for (var state : new JsonObject[] { shortPrivateKey, badSecurityLevel, shortChainKey }) {
            assertError(api.handle("PUT", "/ratchet/state", "alice", putStateRequest("conv-1", "alice", state)),
                    400, "VALIDATION_ERROR");
        }

        assertError(api.handle("GET", "/ratchet/state/conv-1/alice", "alice", null), 404, "RATCHET_NOT_INITIALIZED");
        assertThat(relay.engine().hasState("conv-1", "alice")).isFalse();
    }

    @Test
    public void shouldReportExchangeStorageOutageAsRetryable() {
        var failing = mock(ExchangeRepository.class);
        when(failing.find(anyString())).thenThrow(new RepositoryException("connection refused"));
        when(failing.findOpenFor(anyString())).thenThrow(new RepositoryException("connection refused"));
        var exchanges = new KeyExchangeCoordinator(failing, relay.ledger(), RelayNotifier.LOGGING, CLOCK,
                KeyRelayConfig.defaults().exchangeTtl());
        var outageApi = new KeyRelayApi(new KeyRelay(relay.config(), CLOCK, relay.store(), relay.engine(),
                relay.ledger(), exchanges, relay.sync()), Set.of());

        var data = outageApi.handle("GET", "/key-exchange/exchange-1", "alice", null);
        var pending = outageApi.handle("GET", "/key-exchange/pending", "alice", null);

        assertError(data, 503, "STORAGE_UNAVAILABLE");
        assertError(pending, 503, "STORAGE_UNAVAILABLE");
        assertThat(data.bodyAsString()).doesNotContain("connection refused");
    }

    @Test
    public void shouldReportUnhealthyStore() {
        var store = mock(KeyMaterialStore.class);
        when(store.health()).thenReturn(new HealthReport(HealthReport.Status.UNHEALTHY, 0, 0, 0, "unreachable"));
        var mockRelay = mock(KeyRelay.class);
        when(mockRelay.store()).thenReturn(store);
        var mockApi = new KeyRelayApi(mockRelay, Set.of());

        var response = mockApi.handle("GET", "/ratchet/health", null, null);

        assertThat(response.status()).isEqualTo(503);
        assertThat(response.body().getString("status")).isEqualTo("unhealthy");
        assertThat(response.body().getString("message")).isEqualTo("unreachable");
        assertThat(response.isSuccess()).isFalse();
    }

    @Test
    public void shouldHideUnexpectedFailures() {
        var mockRelay = mock(KeyRelay.class);
        when(mockRelay.store()).thenThrow(new IllegalStateException("database password is hunter2"));
        var mockApi = new KeyRelayApi(mockRelay, Set.of());

        var response = mockApi.handle("GET", "/ratchet/state/conv-1/alice", "alice", null);

        assertError(response, 500, "INTERNAL_ERROR");
        assertThat(response.bodyAsString()).doesNotContain("hunter2");
    }

    private static String ratchetStateRequest(String conversationId, String userId, Long expectedVersion) {
        var encoder = Base64.getEncoder();
        var state = JsonObject.builder()
                .value("rootKey", encoder.encodeToString(CryptoUtils.randomBytes(32)))
                .value("sendingChainKey", encoder.encodeToString(CryptoUtils.randomBytes(32)))
                .value("sendingMessageNumber", 4)
                .value("sendingChainLength", 1)
                .value("sendingRatchetPrivateKey", encoder.encodeToString(CryptoUtils.randomBytes(32)))
                .value("sendingRatchetPublicKey", encoder.encodeToString(CryptoUtils.randomBytes(32)))
                .value("securityLevel", 3)
                .done();
        var request = JsonObject.builder()
                .value("conversationId", conversationId)
                .value("userId", userId)
                .value("ratchetState", state);
        if (expectedVersion != null) {
            request.value("expectedVersion", expectedVersion);
        }
        return JsonWriter.string(request.done());
    }

    private static String putStateRequest(String conversationId, String userId, JsonObject state) {
        return JsonWriter.string(JsonObject.builder()
                .value("conversationId", conversationId)
                .value("userId", userId)
                .value("ratchetState", state)
                .done());
    }

    private static String syncRequest(String from, String to) {
        return JsonWriter.string(JsonObject.builder()
                .value("fromDeviceId", from)
                .value("toDeviceId", to)
                .object("encryptedKeyPackage")
                    .value("encryptedData", Base64.getEncoder().encodeToString(CryptoUtils.randomBytes(64)))
                    .value("integrityHash", "sha256:abcdef")
                    .value("encryptionMethod", "x25519-chacha20poly1305")
                .end()
                .object("packageMetadata")
                    .value("keyType", "ratchet_state")
                    .value("conversationId", "conv-1")
                    .value("priority", "high")
                .end()
                .done());
    }

    private static PublicKeyBundle classicalBundle() {
        var publicKey = X25519.serializePublicKey(X25519.generateKeyPair().getPublic());
        return new PublicKeyBundle(publicKey, null, KeyExchangeAlgorithm.X25519, SignatureAlgorithm.ED25519,
                EncryptionAlgorithm.CHACHA20_POLY1305, 1, false, null, AlgorithmCapabilities.CLASSICAL);
    }

    private static void assertError(ApiResponse response, int status, String code) {
        assertThat(response.status()).isEqualTo(status);
        assertThat(response.isSuccess()).isFalse();
        var error = (JsonObject) response.body().get("error");
        assertThat(error.getString("code")).isEqualTo(code);
    }
}
