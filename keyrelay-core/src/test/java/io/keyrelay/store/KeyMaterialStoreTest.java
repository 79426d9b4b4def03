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

package io.keyrelay.store;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.mockito.ArgumentCaptor;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import io.keyrelay.ErrorCode;
import io.keyrelay.KeyRelayException;
import io.keyrelay.MutableClock;
import io.keyrelay.RatchetEngine;
import io.keyrelay.config.KeyRelayConfig;
import io.keyrelay.crypto.CryptoUtils;

public class KeyMaterialStoreTest {
    private static final Duration TTL = Duration.ofDays(7);

    private MutableClock clock;
    private InMemoryRatchetStateRepository repository;
    private KeyMaterialStore store;
    private RatchetEngine engine;
    private byte[] sharedSecret;

    @BeforeMethod
    public void setup() {
        clock = new MutableClock();
        repository = new InMemoryRatchetStateRepository();
        store = new KeyMaterialStore(repository, StateEncryptionKeyProvider.of(CryptoUtils.randomBytes(32)), clock,
                TTL);
        engine = new RatchetEngine(KeyRelayConfig.defaults(), clock);
        sharedSecret = CryptoUtils.randomBytes(32);
    }

    @Test
    public void shouldStoreAndLoadState() {
        var alice = engine.createState("conversation-1", "alice", sharedSecret, true, 2);
        var id = store.put(alice);

        assertThat(id).isEqualTo(alice.id());
        assertThat(alice.version()).isEqualTo(1L);

        var loaded = store.get("conversation-1", "alice").orElseThrow();
        assertThat(loaded.id()).isEqualTo(alice.id());
        assertThat(loaded.rootKey()).isEqualTo(alice.rootKey());
        assertThat(loaded.sendingChainKey().orElseThrow()).isEqualTo(alice.sendingChainKey().orElseThrow());
        assertThat(loaded.receivingChainKey()).isEmpty();
        assertThat(loaded.sendingRatchetPrivateKey()).isEqualTo(alice.sendingRatchetPrivateKey());
        assertThat(loaded.sendingRatchetPublicKey()).isEqualTo(alice.sendingRatchetPublicKey());
        assertThat(loaded.sendingChainLength()).isEqualTo(1);
        assertThat(loaded.securityLevel()).isEqualTo(2);
        assertThat(loaded.version()).isEqualTo(1L);
        assertThat(store.ratchetStateId("conversation-1", "alice")).contains(alice.id());
        assertThat(store.get("conversation-1", "bob")).isEmpty();
    }

    @Test
    public void shouldEncryptSecretsAtRest() {
        var alice = engine.createState("conversation-1", "alice", sharedSecret, true, 1);
        store.put(alice);

        var record = repository.find("conversation-1", "alice").orElseThrow();
        assertThat(record.rootKey().ciphertext()).isNotEqualTo(alice.rootKey());
        assertThat(record.sendingChainKey().ciphertext()).isNotEqualTo(alice.sendingChainKey().orElseThrow());
        assertThat(containsSequence(record.sendingRatchetKeyPair().ciphertext(), alice.sendingRatchetPrivateKey()))
                .isFalse();
        assertThat(record.receivingChainKey()).isNull();
        assertThat(record.receivingRatchetPublicKey()).isEqualTo(alice.receivingRatchetPublicKey().orElseThrow());
    }

    @Test
    public void shouldFailClosedWithWrongKey() {
        store.put(engine.createState("conversation-1", "alice", sharedSecret, true, 1));
        var other = new KeyMaterialStore(repository, StateEncryptionKeyProvider.of(CryptoUtils.randomBytes(32)),
                clock, TTL);

        assertFails(() -> other.get("conversation-1", "alice"), ErrorCode.CORRUPTED_STATE);
    }

    @Test
    public void shouldDetectTamperedOrSwappedFields() {
        store.put(engine.createState("conversation-1", "alice", sharedSecret, true, 1));
        var record = repository.find("conversation-1", "alice").orElseThrow();

        var flipped = record.rootKey().ciphertext().clone();
        flipped[0] ^= 1;
        repository.save(withRootKey(record, new SealedBox(flipped, record.rootKey().nonce(),
                record.rootKey().authTag())), RatchetStateRepository.ANY_VERSION);
        assertFails(() -> store.get("conversation-1", "alice"), ErrorCode.CORRUPTED_STATE);

        repository.save(withRootKey(record, record.sendingChainKey()), RatchetStateRepository.ANY_VERSION);
        assertFails(() -> store.get("conversation-1", "alice"), ErrorCode.CORRUPTED_STATE);
    }

    @Test
    public void shouldDetectConcurrentWrites() {
        var alice = engine.createState("conversation-1", "alice", sharedSecret, true, 1);
        store.put(alice, 0L);
        var first = store.get("conversation-1", "alice").orElseThrow();
        var second = store.get("conversation-1", "alice").orElseThrow();

        engine.encrypt(first, "one".getBytes(UTF_8), null);
        store.put(first, first.version());
        engine.encrypt(second, "two".getBytes(UTF_8), null);

        assertFails(() -> store.put(second, second.version()), ErrorCode.STATE_CONFLICT);
        assertFails(() -> store.put(alice, 0L), ErrorCode.STATE_CONFLICT);
        assertThat(store.get("conversation-1", "alice").orElseThrow().sendingMessageNumber()).isEqualTo(1);
    }

    @Test
    public void shouldPersistSkippedKeysWithState() {
        var alice = engine.createState("conversation-1", "alice", sharedSecret, true, 1);
        var bob = engine.createState("conversation-1", "bob", sharedSecret, false, 1);
        engine.encrypt(alice, "one".getBytes(UTF_8), null);
        var second = engine.encrypt(alice, "two".getBytes(UTF_8), null);
        engine.decrypt(bob, second, null);
        store.put(bob);

        var loaded = store.get("conversation-1", "bob").orElseThrow();
        assertThat(loaded.skippedKeyCount()).isEqualTo(1);
        assertThat(store.getSkippedKey(bob.id(), "1:0")).isPresent();
        assertThat(store.statistics("conversation-1", "bob")).hasValueSatisfying(stats -> {
            assertThat(stats.skippedKeysCount()).isEqualTo(1);
            assertThat(stats.receivingMessageNumber()).isEqualTo(2);
            assertThat(stats.receivingChainLength()).isEqualTo(1);
        });

        assertThat(store.delete("conversation-1", "bob")).isTrue();
        assertThat(repository.findSkippedKeys(bob.id())).isEmpty();
        assertThat(store.delete("conversation-1", "bob")).isFalse();
    }

    @Test
    public void skippedKeysShouldExpire() {
        var stateId = "ratchet-1";
        var messageKey = CryptoUtils.randomBytes(32);
        var expiresAt = store.putSkippedKey(stateId, "3:7", messageKey, 3, 7);

        assertThat(expiresAt).isEqualTo(clock.instant().plus(TTL));
        assertThat(store.getSkippedKey(stateId, "3:7")).hasValueSatisfying(key -> {
            assertThat(key.messageKey()).isEqualTo(messageKey);
            assertThat(key.chainLength()).isEqualTo(3);
            assertThat(key.messageNumber()).isEqualTo(7);
        });

        clock.advance(TTL.plusSeconds(1));
        assertThat(store.getSkippedKey(stateId, "3:7")).isEmpty();
        assertThat(store.health().expiredKeys()).isEqualTo(1L);
        assertThat(store.cleanupExpired()).isEqualTo(1);
        assertThat(store.health().totalSkippedKeys()).isZero();
    }

    @Test
    public void skippedKeysShouldBeBoundToTheirId() {
        store.putSkippedKey("ratchet-1", "1:0", CryptoUtils.randomBytes(32), 1, 0);
        var stored = repository.findSkippedKey("ratchet-1", "1:0").orElseThrow();
        repository.saveSkippedKey(new StoredSkippedKey("ratchet-1", "1:5", stored.encryptedKey(), 1, 5,
                stored.createdAt(), stored.expiresAt()));

        assertFails(() -> store.getSkippedKey("ratchet-1", "1:5"), ErrorCode.CORRUPTED_STATE);
        assertThat(store.deleteSkippedKey("ratchet-1", "1:5")).isTrue();
        assertThat(store.deleteSkippedKey("ratchet-1", "1:5")).isFalse();
    }

    @Test
    public void shouldRejectInvalidSkippedKeys() {
        assertFails(() -> store.putSkippedKey("ratchet-1", "1:0", new byte[16], 1, 0), ErrorCode.VALIDATION_ERROR);
        assertFails(() -> store.putSkippedKey("ratchet-1", "1:0", new byte[32], -1, 0), ErrorCode.VALIDATION_ERROR);
        assertFails(() -> store.putSkippedKey(" ", "1:0", new byte[32], 1, 0), ErrorCode.VALIDATION_ERROR);
    }

    @Test
    public void shouldListConversationParticipants() {
        store.put(engine.createState("conversation-1", "alice", sharedSecret, true, 1));
        clock.advance(Duration.ofSeconds(1));
        store.put(engine.createState("conversation-1", "bob", sharedSecret, false, 1));
        store.put(engine.createState("conversation-2", "carol", sharedSecret, true, 1));

        assertThat(store.listConversation("conversation-1"))
                .extracting(RatchetSummary::userId)
                .containsExactly("alice", "bob");
        assertThat(store.health()).satisfies(health -> {
            assertThat(health.isHealthy()).isTrue();
            assertThat(health.totalRatchetStates()).isEqualTo(3L);
        });
    }

    @Test
    public void backendFailuresShouldSurfaceAsStorageUnavailable() {
        var failing = mock(RatchetStateRepository.class);
        when(failing.find(anyString(), anyString())).thenThrow(new RepositoryException("connection refused"));
        when(failing.countStates()).thenThrow(new RepositoryException("connection refused"));
        var broken = new KeyMaterialStore(failing, StateEncryptionKeyProvider.of(CryptoUtils.randomBytes(32)),
                clock, TTL);

        assertFails(() -> broken.get("conversation-1", "alice"), ErrorCode.STORAGE_UNAVAILABLE);
        assertFails(() -> broken.put(engine.createState("conversation-1", "alice", sharedSecret, true, 1)),
                ErrorCode.STORAGE_UNAVAILABLE);

        var health = broken.health();
        assertThat(health.isHealthy()).isFalse();
        assertThat(health.message()).isEqualTo("Storage unavailable");
    }

    @Test
    public void cleanupJobShouldSurviveFailures() {
        var failing = mock(RatchetStateRepository.class);
        when(failing.deleteSkippedKeysExpiredBefore(any(Instant.class)))
                .thenThrow(new RepositoryException("timeout"))
                .thenThrow(new IllegalStateException("driver bug"))
                .thenReturn(2);
        var broken = new KeyMaterialStore(failing, StateEncryptionKeyProvider.of(CryptoUtils.randomBytes(32)),
                clock, TTL);
        var scheduler = mock(ScheduledExecutorService.class);

        broken.startCleanupJob(scheduler, Duration.ofMinutes(5));

        var task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleAtFixedRate(task.capture(), eq(300_000L), eq(300_000L), eq(TimeUnit.MILLISECONDS));
        assertThatCode(() -> task.getValue().run()).doesNotThrowAnyException();
        assertThatCode(() -> task.getValue().run()).doesNotThrowAnyException();
        assertThatCode(() -> task.getValue().run()).doesNotThrowAnyException();
        verify(failing, times(3)).deleteSkippedKeysExpiredBefore(any(Instant.class));
    }

    private static StoredRatchetState withRootKey(StoredRatchetState record, SealedBox rootKey) {
        return new StoredRatchetState(record.id(), record.conversationId(), record.userId(), rootKey,
                record.sendingChainKey(), record.receivingChainKey(), record.sendingRatchetKeyPair(),
                record.receivingRatchetPublicKey(), record.sendingMessageNumber(), record.receivingMessageNumber(),
                record.previousSendingChainLength(), record.sendingChainLength(), record.receivingChainLength(),
                record.securityLevel(), record.version(), record.createdAt(), record.updatedAt());
    }

    private static void assertFails(ThrowingCallable call, ErrorCode expected) {
        assertThatThrownBy(call).isInstanceOfSatisfying(KeyRelayException.class,
                e -> assertThat(e.errorCode()).isEqualTo(expected));
    }

    private static boolean containsSequence(byte[] haystack, byte[] needle) {
        outer:
        for (int i = 0; i + needle.length <= haystack.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return true;
        }
        return false;
    }
}
