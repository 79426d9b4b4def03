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

package io.keyrelay;

import static java.util.Objects.requireNonNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

import io.keyrelay.crypto.CryptoUtils;
import io.keyrelay.crypto.X25519;

/**
 * The ratchet state of one user in one conversation. Mutated in place by {@link RatchetEngine}; every other component
 * treats it as an opaque value that is loaded, stored and deleted.
 * <p>
 * Byte array accessors return copies. Instances are not thread-safe: the engine serializes access per conversation
 * and user.
 */
public final class RatchetState {
    private static final int KEY_SIZE = 32;

    private final String id;
    private final String conversationId;
    private final String userId;
    private final Instant createdAt;
    private Instant updatedAt;
    private long version;

    private byte[] rootKey;
    private byte[] sendingChainKey;
    private byte[] receivingChainKey;
    private int sendingMessageNumber;
    private int receivingMessageNumber;
    private int previousSendingChainLength;
    private int sendingChainLength;
    private int receivingChainLength;
    private byte[] sendingRatchetPrivateKey;
    private byte[] sendingRatchetPublicKey;
    private byte[] receivingRatchetPublicKey;
    private final int securityLevel;

    private final LinkedHashMap<String, SkippedMessageKey> skippedKeys = new LinkedHashMap<>();

    private RatchetState(Builder builder) {
        this.id = requireNonNull(builder.id, "id");
        this.conversationId = Require.notBlank(builder.conversationId, "conversationId");
        this.userId = Require.notBlank(builder.userId, "userId");
        this.createdAt = requireNonNull(builder.createdAt, "createdAt");
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.createdAt;
        this.version = builder.version;
        this.rootKey = Require.length(builder.rootKey, KEY_SIZE, "rootKey").clone();
        this.sendingChainKey = copy(Require.lengthIfPresent(builder.sendingChainKey, KEY_SIZE, "sendingChainKey"));
        this.receivingChainKey = copy(
                Require.lengthIfPresent(builder.receivingChainKey, KEY_SIZE, "receivingChainKey"));
        this.sendingMessageNumber = Require.notNegative(builder.sendingMessageNumber, "sendingMessageNumber");
        this.receivingMessageNumber = Require.notNegative(builder.receivingMessageNumber, "receivingMessageNumber");
        this.previousSendingChainLength = Require.notNegative(builder.previousSendingChainLength,
                "previousSendingChainLength");
        this.sendingChainLength = Require.notNegative(builder.sendingChainLength, "sendingChainLength");
        this.receivingChainLength = Require.notNegative(builder.receivingChainLength, "receivingChainLength");
        this.sendingRatchetPrivateKey = Require.length(builder.sendingRatchetPrivateKey, X25519.KEY_SIZE,
                "sendingRatchetPrivateKey").clone();
        this.sendingRatchetPublicKey = Require.length(builder.sendingRatchetPublicKey, X25519.KEY_SIZE,
                "sendingRatchetPublicKey").clone();
        this.receivingRatchetPublicKey = copy(Require.lengthIfPresent(builder.receivingRatchetPublicKey,
                X25519.KEY_SIZE, "receivingRatchetPublicKey"));
        this.securityLevel = Require.between(builder.securityLevel, 1, 5, "securityLevel");
        builder.skippedKeys.forEach(k -> skippedKeys.put(k.messageKeyId(), k.copy()));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String id() {
        return id;
    }

    public String conversationId() {
        return conversationId;
    }

    public String userId() {
        return userId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /**
     * The optimistic-concurrency version of the stored copy this state was loaded from, or 0 if never stored.
     */
    public long version() {
        return version;
    }

    public byte[] rootKey() {
        return rootKey.clone();
    }

    public Optional<byte[]> sendingChainKey() {
        return Optional.ofNullable(copy(sendingChainKey));
    }

    public Optional<byte[]> receivingChainKey() {
        return Optional.ofNullable(copy(receivingChainKey));
    }

    public int sendingMessageNumber() {
        return sendingMessageNumber;
    }

    public int receivingMessageNumber() {
        return receivingMessageNumber;
    }

    public int previousSendingChainLength() {
        return previousSendingChainLength;
    }

    public int sendingChainLength() {
        return sendingChainLength;
    }

    public int receivingChainLength() {
        return receivingChainLength;
    }

    public byte[] sendingRatchetPrivateKey() {
        return sendingRatchetPrivateKey.clone();
    }

    public byte[] sendingRatchetPublicKey() {
        return sendingRatchetPublicKey.clone();
    }

    public Optional<byte[]> receivingRatchetPublicKey() {
        return Optional.ofNullable(copy(receivingRatchetPublicKey));
    }

    public int securityLevel() {
        return securityLevel;
    }

    public Collection<SkippedMessageKey> skippedKeys() {
        return Collections.unmodifiableCollection(new ArrayList<>(skippedKeys.values()));
    }

    public int skippedKeyCount() {
        return skippedKeys.size();
    }

    /**
     * Records the result of a successful write to storage.
     */
    public void markPersisted(long newVersion, Instant when) {
        this.version = newVersion;
        this.updatedAt = requireNonNull(when, "when");
    }

    public RatchetState copy() {
        return toBuilder().build();
    }

    public Builder toBuilder() {
        return builder()
                .id(id)
                .conversationId(conversationId)
                .userId(userId)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .version(version)
                .rootKey(rootKey)
                .sendingChainKey(sendingChainKey)
                .receivingChainKey(receivingChainKey)
                .sendingMessageNumber(sendingMessageNumber)
                .receivingMessageNumber(receivingMessageNumber)
                .previousSendingChainLength(previousSendingChainLength)
                .sendingChainLength(sendingChainLength)
                .receivingChainLength(receivingChainLength)
                .sendingRatchetKeyPair(sendingRatchetPrivateKey, sendingRatchetPublicKey)
                .receivingRatchetPublicKey(receivingRatchetPublicKey)
                .securityLevel(securityLevel)
                .skippedKeys(skippedKeys.values());
    }

    /**
     * Replaces the contents of this state with those of another state for the same conversation and user. Used to
     * commit a working copy once a decryption has fully succeeded.
     */
    void assign(RatchetState other) {
        if (!id.equals(other.id)) {
            throw new IllegalArgumentException("Cannot assign state from a different ratchet");
        }
        wipeSecrets();
        this.updatedAt = other.updatedAt;
        this.rootKey = other.rootKey.clone();
        this.sendingChainKey = copy(other.sendingChainKey);
        this.receivingChainKey = copy(other.receivingChainKey);
        this.sendingMessageNumber = other.sendingMessageNumber;
        this.receivingMessageNumber = other.receivingMessageNumber;
        this.previousSendingChainLength = other.previousSendingChainLength;
        this.sendingChainLength = other.sendingChainLength;
        this.receivingChainLength = other.receivingChainLength;
        this.sendingRatchetPrivateKey = other.sendingRatchetPrivateKey.clone();
        this.sendingRatchetPublicKey = other.sendingRatchetPublicKey.clone();
        this.receivingRatchetPublicKey = copy(other.receivingRatchetPublicKey);
        this.skippedKeys.values().forEach(SkippedMessageKey::wipe);
        this.skippedKeys.clear();
        other.skippedKeys.values().forEach(k -> skippedKeys.put(k.messageKeyId(), k.copy()));
    }

    // Package-private mutators used by the engine.

    byte[] rawRootKey() {
        return rootKey;
    }

    byte[] rawSendingChainKey() {
        return sendingChainKey;
    }

    byte[] rawReceivingChainKey() {
        return receivingChainKey;
    }

    byte[] rawReceivingRatchetPublicKey() {
        return receivingRatchetPublicKey;
    }

    byte[] rawSendingRatchetPrivateKey() {
        return sendingRatchetPrivateKey;
    }

    byte[] rawSendingRatchetPublicKey() {
        return sendingRatchetPublicKey;
    }

    void rootKey(byte[] newRootKey) {
        CryptoUtils.wipe(rootKey);
        this.rootKey = newRootKey;
    }

    void sendingChainKey(byte[] newChainKey) {
        CryptoUtils.wipe(sendingChainKey);
        this.sendingChainKey = newChainKey;
    }

    void receivingChainKey(byte[] newChainKey) {
        CryptoUtils.wipe(receivingChainKey);
        this.receivingChainKey = newChainKey;
    }

    void sendingMessageNumber(int n) {
        this.sendingMessageNumber = n;
    }

    void receivingMessageNumber(int n) {
        this.receivingMessageNumber = n;
    }

    void previousSendingChainLength(int n) {
        this.previousSendingChainLength = n;
    }

    void sendingChainLength(int n) {
        this.sendingChainLength = n;
    }

    void receivingChainLength(int n) {
        this.receivingChainLength = n;
    }

    void sendingRatchetKeyPair(byte[] privateKey, byte[] publicKey) {
        CryptoUtils.wipe(sendingRatchetPrivateKey);
        this.sendingRatchetPrivateKey = privateKey;
        this.sendingRatchetPublicKey = publicKey;
    }

    void receivingRatchetPublicKey(byte[] publicKey) {
        this.receivingRatchetPublicKey = publicKey;
    }

    void touch(Instant when) {
        this.updatedAt = when;
    }

    Optional<SkippedMessageKey> skippedKey(String messageKeyId) {
        return Optional.ofNullable(skippedKeys.get(messageKeyId));
    }

    void addSkippedKey(SkippedMessageKey key) {
        skippedKeys.put(key.messageKeyId(), key);
    }

    void removeSkippedKey(String messageKeyId) {
        var removed = skippedKeys.remove(messageKeyId);
        if (removed != null) {
            removed.wipe();
        }
    }

    /**
     * Drops the oldest retained keys until at most {@code limit} remain.
     *
     * @return the number of keys evicted.
     */
    int evictSkippedKeysOver(int limit) {
        int evicted = 0;
        var it = skippedKeys.values().iterator();
        while (skippedKeys.size() > limit && it.hasNext()) {
            it.next().wipe();
            it.remove();
            evicted++;
        }
        return evicted;
    }

    int removeExpiredSkippedKeys(Instant now) {
        List<String> expired = new ArrayList<>();
        skippedKeys.forEach((id, key) -> {
            if (key.isExpiredAt(now)) {
                expired.add(id);
            }
        });
        expired.forEach(this::removeSkippedKey);
        return expired.size();
    }

    void wipeSecrets() {
        CryptoUtils.wipe(rootKey, sendingChainKey, receivingChainKey, sendingRatchetPrivateKey);
    }

    private static byte[] copy(byte[] data) {
        return data == null ? null : data.clone();
    }

    @Override
    public String toString() {
        return "RatchetState{" +
                "id='" + id + '\'' +
                ", conversationId='" + conversationId + '\'' +
                ", userId='" + userId + '\'' +
                ", version=" + version +
                ", sendingChainLength=" + sendingChainLength +
                ", sendingMessageNumber=" + sendingMessageNumber +
                ", receivingChainLength=" + receivingChainLength +
                ", receivingMessageNumber=" + receivingMessageNumber +
                ", skippedKeys=" + skippedKeys.size() +
                '}';
    }

    public static final class Builder {
        private String id = CryptoUtils.randomHex(16);
        private String conversationId;
        private String userId;
        private Instant createdAt;
        private Instant updatedAt;
        private long version;
        private byte[] rootKey;
        private byte[] sendingChainKey;
        private byte[] receivingChainKey;
        private int sendingMessageNumber;
        private int receivingMessageNumber;
        private int previousSendingChainLength;
        private int sendingChainLength;
        private int receivingChainLength;
        private byte[] sendingRatchetPrivateKey;
        private byte[] sendingRatchetPublicKey;
        private byte[] receivingRatchetPublicKey;
        private int securityLevel = 1;
        private final List<SkippedMessageKey> skippedKeys = new ArrayList<>();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder conversationId(String conversationId) {
            this.conversationId = conversationId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder rootKey(byte[] rootKey) {
            this.rootKey = rootKey;
            return this;
        }

        public Builder sendingChainKey(byte[] sendingChainKey) {
            this.sendingChainKey = sendingChainKey;
            return this;
        }

        public Builder receivingChainKey(byte[] receivingChainKey) {
            this.receivingChainKey = receivingChainKey;
            return this;
        }

        public Builder sendingMessageNumber(int sendingMessageNumber) {
            this.sendingMessageNumber = sendingMessageNumber;
            return this;
        }

        public Builder receivingMessageNumber(int receivingMessageNumber) {
            this.receivingMessageNumber = receivingMessageNumber;
            return this;
        }

        public Builder previousSendingChainLength(int previousSendingChainLength) {
            this.previousSendingChainLength = previousSendingChainLength;
            return this;
        }

        public Builder sendingChainLength(int sendingChainLength) {
            this.sendingChainLength = sendingChainLength;
            return this;
        }

        public Builder receivingChainLength(int receivingChainLength) {
            this.receivingChainLength = receivingChainLength;
            return this;
        }

        public Builder sendingRatchetKeyPair(byte[] privateKey, byte[] publicKey) {
            this.sendingRatchetPrivateKey = privateKey;
            this.sendingRatchetPublicKey = publicKey;
            return this;
        }

        public Builder receivingRatchetPublicKey(byte[] receivingRatchetPublicKey) {
            this.receivingRatchetPublicKey = receivingRatchetPublicKey;
            return this;
        }

        public Builder securityLevel(int securityLevel) {
            this.securityLevel = securityLevel;
            return this;
        }

        public Builder skippedKeys(Collection<SkippedMessageKey> keys) {
            this.skippedKeys.clear();
            this.skippedKeys.addAll(keys);
            return this;
        }

        public RatchetState build() {
            Require.rejectIf(sendingMessageNumber < 0 || receivingMessageNumber < 0
                    || sendingChainLength < 0 || receivingChainLength < 0 || previousSendingChainLength < 0,
                    "Ratchet counters must not be negative");
            return new RatchetState(this);
        }
    }
}
