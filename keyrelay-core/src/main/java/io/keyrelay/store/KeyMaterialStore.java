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

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;

import io.keyrelay.ErrorCode;
import io.keyrelay.KeyRelayException;
import io.keyrelay.RatchetState;
import io.keyrelay.RedactedLogger;
import io.keyrelay.Require;
import io.keyrelay.SkippedMessageKey;
import io.keyrelay.crypto.CryptoUtils;
import io.keyrelay.crypto.X25519;
import io.keyrelay.io.CborReader;
import io.keyrelay.io.CborWriter;

/**
 * Persists ratchet state and skipped message keys, encrypting every secret field at rest. Records are addressed by
 * conversation and user; skipped keys by the owning ratchet state id and their message key id.
 * <p>
 * Backend failures surface as {@link ErrorCode#STORAGE_UNAVAILABLE}; a record that fails to decrypt or parse
 * surfaces as {@link ErrorCode#CORRUPTED_STATE}. Neither is retried here.
 */
public final class KeyMaterialStore {
    private static final Logger logger = RedactedLogger.getLogger(KeyMaterialStore.class);

    private final RatchetStateRepository repository;
    private final StorageGuard storage = new StorageGuard("Key material");
    private final FieldSealer sealer;
    private final Clock clock;
    private final Duration skippedKeyTtl;

    public KeyMaterialStore(RatchetStateRepository repository, StateEncryptionKeyProvider keyProvider, Clock clock,
            Duration skippedKeyTtl) {
        this.repository = requireNonNull(repository, "repository");
        this.sealer = new FieldSealer(keyProvider);
        this.clock = requireNonNull(clock, "clock");
        this.skippedKeyTtl = requireNonNull(skippedKeyTtl, "skippedKeyTtl");
    }

    /**
     * Stores a ratchet state, replacing whatever is stored for the same conversation and user.
     *
     * @return the ratchet state id.
     */
    public String put(RatchetState state) {
        return write(state, RatchetStateRepository.ANY_VERSION);
    }

    /**
     * Stores a ratchet state only if the stored copy still has the given version. Version 0 means the state must not
     * exist yet. On success the state's version is updated to the stored version.
     *
     * @throws KeyRelayException with {@link ErrorCode#STATE_CONFLICT} if another writer got there first.
     */
    public String put(RatchetState state, long expectedVersion) {
        return write(state, expectedVersion);
    }

    private String write(RatchetState state, long expectedVersion) {
        requireNonNull(state, "state");
        return storage.call(() -> {
            var now = clock.instant();
            var existing = repository.find(state.conversationId(), state.userId());
            var record = seal(state, now);
            var newVersion = repository.save(record, expectedVersion).orElseThrow(() -> new KeyRelayException(
                    ErrorCode.STATE_CONFLICT, "Ratchet state was modified concurrently"));
            existing.filter(old -> !old.id().equals(state.id()))
                    .ifPresent(old -> repository.deleteSkippedKeys(old.id()));
            syncSkippedKeys(state, now);
            state.markPersisted(newVersion, now);
            logger.debug("Stored ratchet state {} version {} for conversation {}", state.id(), newVersion,
                    state.conversationId());
            return state.id();
        });
    }

    public Optional<RatchetState> get(String conversationId, String userId) {
        Require.notBlank(conversationId, "conversationId");
        Require.notBlank(userId, "userId");
        return storage.call(() -> repository.find(conversationId, userId).map(this::unseal));
    }

    /**
     * Returns the id of the stored ratchet state without decrypting it.
     */
    public Optional<String> ratchetStateId(String conversationId, String userId) {
        return storage.call(() -> repository.find(conversationId, userId).map(StoredRatchetState::id));
    }

    public boolean delete(String conversationId, String userId) {
        Require.notBlank(conversationId, "conversationId");
        Require.notBlank(userId, "userId");
        var deleted = storage.call(() -> repository.delete(conversationId, userId));
        if (deleted) {
            logger.info("Deleted ratchet state for conversation {} user {}", conversationId, userId);
        }
        return deleted;
    }

    /**
     * Retains a message key for a message that has not arrived yet.
     *
     * @return when the key expires.
     */
    public Instant putSkippedKey(String ratchetStateId, String messageKeyId, byte[] messageKey, int chainLength,
            int messageNumber) {
        Require.notBlank(ratchetStateId, "ratchetStateId");
        Require.notBlank(messageKeyId, "messageKeyId");
        Require.length(messageKey, 32, "messageKey");
        Require.rejectIf(chainLength < 0 || messageNumber < 0, "chainLength and messageNumber must not be negative");
        var now = clock.instant();
        var expiresAt = now.plus(skippedKeyTtl);
        storage.run(() -> repository.saveSkippedKey(new StoredSkippedKey(ratchetStateId, messageKeyId,
                sealer.seal(messageKey, ratchetStateId, messageKeyId), chainLength, messageNumber, now, expiresAt)));
        return expiresAt;
    }

    public Optional<SkippedMessageKey> getSkippedKey(String ratchetStateId, String messageKeyId) {
        var now = clock.instant();
        return storage.call(() -> repository.findSkippedKey(ratchetStateId, messageKeyId))
                .filter(stored -> !stored.isExpiredAt(now))
                .map(this::unseal);
    }

    public boolean deleteSkippedKey(String ratchetStateId, String messageKeyId) {
        return storage.call(() -> repository.deleteSkippedKey(ratchetStateId, messageKeyId));
    }

    /**
     * Deletes every expired skipped key. Safe to run concurrently with normal traffic.
     *
     * @return the number of keys deleted.
     */
    public int cleanupExpired() {
        int deleted = storage.call(() -> repository.deleteSkippedKeysExpiredBefore(clock.instant()));
        if (deleted > 0) {
            logger.info("Cleaned up {} expired skipped message keys", deleted);
        }
        return deleted;
    }

    /**
     * Schedules {@link #cleanupExpired()} at a fixed rate.
     */
    public ScheduledFuture<?> startCleanupJob(ScheduledExecutorService scheduler, Duration interval) {
        long millis = interval.toMillis();
        logger.info("Scheduling skipped key cleanup every {}", interval);
        return scheduler.scheduleAtFixedRate(() -> {
            try {
                cleanupExpired();
            } catch (RuntimeException e) {
                // A task that throws is never rescheduled.
                logger.error("Skipped key cleanup failed: {}", e.getMessage(), e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
    }

    public Optional<RatchetStatistics> statistics(String conversationId, String userId) {
        var now = clock.instant();
        return storage.call(() -> repository.find(conversationId, userId).map(record -> {
            int skipped = (int) repository.findSkippedKeys(record.id()).stream()
                    .filter(k -> !k.isExpiredAt(now))
                    .count();
            return new RatchetStatistics(record.id(), record.sendingMessageNumber(), record.receivingMessageNumber(),
                    record.sendingChainLength(), record.receivingChainLength(), record.previousSendingChainLength(),
                    skipped, record.securityLevel(), record.createdAt(), record.updatedAt());
        }));
    }

    public List<RatchetSummary> listConversation(String conversationId) {
        Require.notBlank(conversationId, "conversationId");
        return storage.call(() -> repository.findByConversation(conversationId).stream()
                .map(r -> new RatchetSummary(r.id(), r.userId(), r.sendingChainLength(), r.receivingChainLength(),
                        r.securityLevel(), r.version(), r.createdAt(), r.updatedAt()))
                .toList());
    }

    public HealthReport health() {
        try {
            var now = clock.instant();
            return new HealthReport(HealthReport.Status.HEALTHY, repository.countStates(),
                    repository.countSkippedKeys(), repository.countSkippedKeysExpiredBefore(now), null);
        } catch (RepositoryException e) {
            logger.error("Key material store health check failed", e);
            return new HealthReport(HealthReport.Status.UNHEALTHY, 0, 0, 0, "Storage unavailable");
        }
    }

    private StoredRatchetState seal(RatchetState state, Instant now) {
        var id = state.id();
        var conversationId = state.conversationId();
        var userId = state.userId();
        var rootKey = state.rootKey();
        var sendingChainKey = state.sendingChainKey().orElse(null);
        var receivingChainKey = state.receivingChainKey().orElse(null);
        var privateKey = state.sendingRatchetPrivateKey();
        var keyPair = CborWriter.encodeArray(array -> array
                .writeBytes(privateKey)
                .writeBytes(state.sendingRatchetPublicKey()));
        try {
            return new StoredRatchetState(id, conversationId, userId,
                    sealer.seal(rootKey, id, conversationId, userId, "rootKey"),
                    sendingChainKey == null ? null
                            : sealer.seal(sendingChainKey, id, conversationId, userId, "sendingChainKey"),
                    receivingChainKey == null ? null
                            : sealer.seal(receivingChainKey, id, conversationId, userId, "receivingChainKey"),
                    sealer.seal(keyPair, id, conversationId, userId, "sendingRatchetKeyPair"),
                    state.receivingRatchetPublicKey().orElse(null),
                    state.sendingMessageNumber(), state.receivingMessageNumber(),
                    state.previousSendingChainLength(), state.sendingChainLength(), state.receivingChainLength(),
                    state.securityLevel(), state.version(), state.createdAt(), now);
        } finally {
            CryptoUtils.wipe(rootKey, sendingChainKey, receivingChainKey, privateKey, keyPair);
        }
    }

    private RatchetState unseal(StoredRatchetState record) {
        var id = record.id();
        var conversationId = record.conversationId();
        var userId = record.userId();
        var rootKey = sealer.open(record.rootKey(), id, conversationId, userId, "rootKey");
        var sendingChainKey = record.sendingChainKey() == null ? null
                : sealer.open(record.sendingChainKey(), id, conversationId, userId, "sendingChainKey");
        var receivingChainKey = record.receivingChainKey() == null ? null
                : sealer.open(record.receivingChainKey(), id, conversationId, userId, "receivingChainKey");
        var keyPair = sealer.open(record.sendingRatchetKeyPair(), id, conversationId, userId,
                "sendingRatchetKeyPair");
        byte[] privateKey = null;
        try (var array = CborReader.ofArray(keyPair)) {
            privateKey = array.readFixedLengthBytes(X25519.KEY_SIZE);
            var publicKey = array.readFixedLengthBytes(X25519.KEY_SIZE);

            var now = clock.instant();
            var skipped = new ArrayList<SkippedMessageKey>();
            for (var stored : repository.findSkippedKeys(id)) {
                if (!stored.isExpiredAt(now)) {
                    skipped.add(unseal(stored));
                }
            }

            return RatchetState.builder()
                    .id(id)
                    .conversationId(conversationId)
                    .userId(userId)
                    .createdAt(record.createdAt())
                    .updatedAt(record.updatedAt())
                    .version(record.version())
                    .rootKey(rootKey)
                    .sendingChainKey(sendingChainKey)
                    .receivingChainKey(receivingChainKey)
                    .sendingMessageNumber(record.sendingMessageNumber())
                    .receivingMessageNumber(record.receivingMessageNumber())
                    .previousSendingChainLength(record.previousSendingChainLength())
                    .sendingChainLength(record.sendingChainLength())
                    .receivingChainLength(record.receivingChainLength())
                    .sendingRatchetKeyPair(privateKey, publicKey)
                    .receivingRatchetPublicKey(record.receivingRatchetPublicKey())
                    .securityLevel(record.securityLevel())
                    .skippedKeys(skipped)
                    .build();
        } catch (IOException e) {
            throw new KeyRelayException(ErrorCode.CORRUPTED_STATE, "Stored ratchet key pair is malformed", e);
        } catch (KeyRelayException e) {
            if (e.errorCode() == ErrorCode.VALIDATION_ERROR) {
                throw new KeyRelayException(ErrorCode.CORRUPTED_STATE, "Stored ratchet state is invalid", e);
            }
            throw e;
        } finally {
            CryptoUtils.wipe(rootKey, sendingChainKey, receivingChainKey, keyPair, privateKey);
        }
    }

    private SkippedMessageKey unseal(StoredSkippedKey stored) {
        var key = sealer.open(stored.encryptedKey(), stored.ratchetStateId(), stored.messageKeyId());
        try {
            return new SkippedMessageKey(stored.messageKeyId(), key, stored.chainLength(), stored.messageNumber(),
                    stored.expiresAt());
        } finally {
            CryptoUtils.wipe(key);
        }
    }

    private void syncSkippedKeys(RatchetState state, Instant now) {
        var stored = new HashSet<String>();
        for (var key : repository.findSkippedKeys(state.id())) {
            stored.add(key.messageKeyId());
        }
        var wanted = new HashSet<String>();
        for (var key : state.skippedKeys()) {
            wanted.add(key.messageKeyId());
            if (!stored.contains(key.messageKeyId())) {
                var material = key.messageKey();
                try {
                    repository.saveSkippedKey(new StoredSkippedKey(state.id(), key.messageKeyId(),
                            sealer.seal(material, state.id(), key.messageKeyId()), key.chainLength(),
                            key.messageNumber(), now, key.expiresAt()));
                } finally {
                    CryptoUtils.wipe(material);
                }
            }
        }
        for (var id : stored) {
            if (!wanted.contains(id)) {
                repository.deleteSkippedKey(state.id(), id);
            }
        }
    }

}
