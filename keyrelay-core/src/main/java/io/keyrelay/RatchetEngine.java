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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;

import io.keyrelay.config.KeyRelayConfig;
import io.keyrelay.crypto.Aead;
import io.keyrelay.crypto.CryptoUtils;
import io.keyrelay.crypto.X25519;
import io.keyrelay.io.CborWriter;
import io.keyrelay.store.KeyMaterialStore;

/**
 * Forward-secret message ratchet. Each message is encrypted under a fresh key taken from a one-way symmetric chain,
 * and the chains are re-keyed with a new X25519 exchange every time the direction of the conversation changes.
 * <p>
 * The engine has two layers. The state-level operations ({@link #createState}, {@link #encrypt(RatchetState,
 * byte[], byte[])} and {@link #decrypt(RatchetState, EncryptedEnvelope, byte[])}) do no I/O and only mutate the state
 * they are given. The session-level operations address a ratchet by conversation and user, load and save it through
 * a {@link KeyMaterialStore}, and are serialized per conversation and user.
 * <p>
 * A failed decryption never changes the state: all work is done on a copy that is only committed once the message
 * has authenticated.
 */
public final class RatchetEngine {
    private static final Logger logger = RedactedLogger.getLogger(RatchetEngine.class);

    private static final Aead MESSAGE_CIPHER = Aead.CHACHA20_POLY1305;
    private static final int LOCK_STRIPES = 64;

    private final int maxSkip;
    private final int maxRetainedSkippedKeys;
    private final Duration skippedKeyTtl;
    private final Clock clock;
    private final KeyMaterialStore store;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public RatchetEngine(KeyRelayConfig config, Clock clock, KeyMaterialStore store) {
        this.maxSkip = config.maxSkip();
        this.maxRetainedSkippedKeys = config.maxRetainedSkippedKeys();
        this.skippedKeyTtl = config.skippedKeyTtl();
        this.clock = requireNonNull(clock, "clock");
        this.store = store;
        for (int i = 0; i < LOCK_STRIPES; ++i) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * Creates an engine for state-level operations only, with no backing store.
     */
    public RatchetEngine(KeyRelayConfig config, Clock clock) {
        this(config, clock, null);
    }

    public int maxSkip() {
        return maxSkip;
    }

    // State-level operations

    /**
     * Derives the initial ratchet state from a 32-byte shared secret. Both parties derive the same root key and the
     * same bootstrap ratchet key pair from the secret. The responder starts out sending on the bootstrap key but has
     * no sending chain until the initiator's first message arrives; the initiator immediately performs the first
     * ratchet step against the bootstrap public key, so its first message is number 0 on chain 1.
     */
    public RatchetState createState(String conversationId, String userId, byte[] sharedSecret, boolean isInitiator,
            int securityLevel) {
        Require.notBlank(conversationId, "conversationId");
        Require.notBlank(userId, "userId");
        Require.length(sharedSecret, RatchetKdf.KEY_SIZE, "sharedSecret");
        Require.between(securityLevel, 1, 5, "securityLevel");

        var initial = RatchetKdf.initial(sharedSecret);
        var bootstrap = X25519.keyPairFromSeed(initial.bootstrapSeed());
        var bootstrapPrivate = X25519.serializePrivateKey(bootstrap.getPrivate());
        var bootstrapPublic = X25519.serializePublicKey(bootstrap.getPublic());
        CryptoUtils.wipe(initial.bootstrapSeed());

        var now = clock.instant();
        var builder = RatchetState.builder()
                .conversationId(conversationId)
                .userId(userId)
                .createdAt(now)
                .securityLevel(securityLevel);

        if (!isInitiator) {
            var state = builder.rootKey(initial.rootKey())
                    .sendingRatchetKeyPair(bootstrapPrivate, bootstrapPublic)
                    .build();
            CryptoUtils.wipe(initial.rootKey(), bootstrapPrivate);
            return state;
        }

        var ratchetKeyPair = generateRatchetKeyPair();
        var dh = X25519.compute(X25519.deserializePrivateKey(ratchetKeyPair.privateKey()), bootstrap.getPublic());
        var step = RatchetKdf.root(initial.rootKey(), dh);
        var state = builder.rootKey(step.rootKey())
                .sendingChainKey(step.chainKey())
                .sendingChainLength(1)
                .sendingRatchetKeyPair(ratchetKeyPair.privateKey(), ratchetKeyPair.publicKey())
                .receivingRatchetPublicKey(bootstrapPublic)
                .build();
        CryptoUtils.wipe(dh, initial.rootKey(), bootstrapPrivate, step.rootKey(), step.chainKey(),
                ratchetKeyPair.privateKey());
        return state;
    }

    /**
     * Encrypts a message and advances the sending chain. The envelope header and the caller's associated data are
     * both authenticated.
     *
     * @throws KeyRelayException with {@link ErrorCode#SENDING_CHAIN_UNAVAILABLE} if this party is the responder and
     * has not yet received the initiator's first message.
     */
    public EncryptedEnvelope encrypt(RatchetState state, byte[] plaintext, byte[] associatedData) {
        requireNonNull(state, "state");
        requireNonNull(plaintext, "plaintext");
        if (state.rawSendingChainKey() == null) {
            throw new KeyRelayException(ErrorCode.SENDING_CHAIN_UNAVAILABLE,
                    "No sending chain yet: the first message must come from the initiator");
        }

        var step = RatchetKdf.chain(state.rawSendingChainKey());
        var ephemeralPublicKey = state.sendingRatchetPublicKey();
        var keyId = RatchetKdf.keyId(ephemeralPublicKey);
        int messageNumber = state.sendingMessageNumber();
        var nonce = CryptoUtils.randomBytes(MESSAGE_CIPHER.nonceSizeBytes());
        var aad = authenticatedHeader(MESSAGE_CIPHER.identifier(), keyId, ephemeralPublicKey, messageNumber,
                state.sendingChainLength(), state.previousSendingChainLength(), state.securityLevel(),
                associatedData);

        Aead.Sealed sealed;
        try (var messageKey = MESSAGE_CIPHER.importKey(step.messageKey())) {
            sealed = MESSAGE_CIPHER.seal(messageKey, nonce, plaintext, aad);
        } finally {
            CryptoUtils.wipe(step.messageKey());
        }

        state.sendingChainKey(step.nextChainKey());
        state.sendingMessageNumber(messageNumber + 1);
        state.touch(clock.instant());

        logger.debug("Encrypted message {} on sending chain {} of conversation {}", messageNumber,
                state.sendingChainLength(), state.conversationId());

        return new EncryptedEnvelope(sealed.ciphertext(), nonce, sealed.tag(), ephemeralPublicKey, messageNumber,
                state.sendingChainLength(), state.previousSendingChainLength(), keyId, MESSAGE_CIPHER.identifier(),
                state.securityLevel(), null, null);
    }

    /**
     * Decrypts a message, performing a ratchet step if it was sent on a new chain and retaining keys for any messages
     * it skipped over. The state is only updated if the message authenticates.
     *
     * @throws KeyRelayException with {@link ErrorCode#AUTHENTICATION_FAILURE} if the ciphertext, tag, nonce, header
     * or associated data were altered; {@link ErrorCode#SKIP_WINDOW_EXCEEDED} if accepting the message would mean
     * retaining more than the configured number of skipped keys; {@link ErrorCode#MESSAGE_KEY_UNAVAILABLE} if the
     * message belongs to a position whose key was already used, expired or evicted.
     */
    public byte[] decrypt(RatchetState state, EncryptedEnvelope envelope, byte[] associatedData) {
        requireNonNull(state, "state");
        requireNonNull(envelope, "envelope");
        if (!MESSAGE_CIPHER.identifier().equals(envelope.algorithm())) {
            throw KeyRelayException.validation("Unsupported message algorithm: " + envelope.algorithm());
        }
        if (envelope.ephemeralPublicKey().length != X25519.KEY_SIZE) {
            throw KeyRelayException.validation("Invalid ephemeral public key");
        }

        var now = clock.instant();
        var working = state.copy();
        try {
            working.removeExpiredSkippedKeys(now);
            var messageKey = messageKeyFor(working, envelope, now);
            working.evictSkippedKeysOver(maxRetainedSkippedKeys);

            var aad = authenticatedHeader(envelope.algorithm(), envelope.keyId(), envelope.ephemeralPublicKey(),
                    envelope.messageNumber(), envelope.chainLength(), envelope.previousChainLength(),
                    envelope.securityLevel(), associatedData);
            Optional<byte[]> plaintext;
            try (var key = MESSAGE_CIPHER.importKey(messageKey)) {
                plaintext = MESSAGE_CIPHER.open(key, envelope.nonce(), envelope.ciphertext(), envelope.authTag(), aad);
            } finally {
                CryptoUtils.wipe(messageKey);
            }
            if (plaintext.isEmpty()) {
                logger.warn("Message {} on chain {} of conversation {} failed authentication",
                        envelope.messageNumber(), envelope.chainLength(), state.conversationId());
                throw new KeyRelayException(ErrorCode.AUTHENTICATION_FAILURE, "Message authentication failed");
            }

            working.touch(now);
            state.assign(working);
            logger.debug("Decrypted message {} on receiving chain {} of conversation {}", envelope.messageNumber(),
                    envelope.chainLength(), state.conversationId());
            return plaintext.get();
        } finally {
            working.wipeSecrets();
        }
    }

    private byte[] messageKeyFor(RatchetState working, EncryptedEnvelope envelope, Instant now) {
        var skippedId = SkippedMessageKey.idFor(envelope.chainLength(), envelope.messageNumber());
        var skipped = working.skippedKey(skippedId);
        if (skipped.isPresent()) {
            var messageKey = skipped.get().messageKey();
            working.removeSkippedKey(skippedId);
            return messageKey;
        }

        var currentPeerKey = working.rawReceivingRatchetPublicKey();
        boolean sameChain = currentPeerKey != null
                && CryptoUtils.constantTimeEquals(currentPeerKey, envelope.ephemeralPublicKey());
        if (sameChain) {
            if (envelope.chainLength() != working.receivingChainLength()
                    || working.rawReceivingChainKey() == null
                    || envelope.messageNumber() < working.receivingMessageNumber()) {
                throw keyUnavailable(envelope);
            }
        } else {
            if (envelope.chainLength() <= working.receivingChainLength()) {
                throw keyUnavailable(envelope);
            }
            checkSkipWindow(working, envelope.previousChainLength());
            if (envelope.messageNumber() > maxSkip) {
                throw skipWindowExceeded(envelope.messageNumber());
            }
            skipTo(working, envelope.previousChainLength(), now);
            ratchetStep(working, envelope.ephemeralPublicKey());
        }

        checkSkipWindow(working, envelope.messageNumber());
        skipTo(working, envelope.messageNumber(), now);

        var step = RatchetKdf.chain(working.rawReceivingChainKey());
        working.receivingChainKey(step.nextChainKey());
        working.receivingMessageNumber(envelope.messageNumber() + 1);
        return step.messageKey();
    }

    private void checkSkipWindow(RatchetState working, int until) {
        if (working.rawReceivingChainKey() == null) {
            return;
        }
        int toSkip = until - working.receivingMessageNumber();
        if (toSkip > maxSkip) {
            throw skipWindowExceeded(toSkip);
        }
    }

    private void skipTo(RatchetState working, int until, Instant now) {
        if (working.rawReceivingChainKey() == null) {
            return;
        }
        var expiresAt = now.plus(skippedKeyTtl);
        while (working.receivingMessageNumber() < until) {
            int n = working.receivingMessageNumber();
            var step = RatchetKdf.chain(working.rawReceivingChainKey());
            var id = SkippedMessageKey.idFor(working.receivingChainLength(), n);
            working.addSkippedKey(new SkippedMessageKey(id, step.messageKey(), working.receivingChainLength(), n,
                    expiresAt));
            CryptoUtils.wipe(step.messageKey());
            working.receivingChainKey(step.nextChainKey());
            working.receivingMessageNumber(n + 1);
        }
    }

    private void ratchetStep(RatchetState working, byte[] peerRatchetKey) {
        var peerPublic = X25519.deserializePublicKey(peerRatchetKey);

        var receiveDh = X25519.compute(X25519.deserializePrivateKey(working.rawSendingRatchetPrivateKey()),
                peerPublic);
        var receiveStep = RatchetKdf.root(working.rawRootKey(), receiveDh);
        working.rootKey(receiveStep.rootKey());
        working.receivingChainKey(receiveStep.chainKey());
        working.receivingRatchetPublicKey(peerRatchetKey.clone());
        working.receivingMessageNumber(0);
        working.receivingChainLength(working.receivingChainLength() + 1);

        var newKeyPair = generateRatchetKeyPair();
        var sendDh = X25519.compute(X25519.deserializePrivateKey(newKeyPair.privateKey()), peerPublic);
        var sendStep = RatchetKdf.root(working.rawRootKey(), sendDh);
        working.rootKey(sendStep.rootKey());
        working.sendingChainKey(sendStep.chainKey());
        working.sendingRatchetKeyPair(newKeyPair.privateKey(), newKeyPair.publicKey());
        working.previousSendingChainLength(working.sendingMessageNumber());
        working.sendingMessageNumber(0);
        working.sendingChainLength(working.sendingChainLength() + 1);

        CryptoUtils.wipe(receiveDh, sendDh);
    }

    private static RatchetKdf.KeyPairBytes generateRatchetKeyPair() {
        var keyPair = X25519.generateKeyPair();
        return new RatchetKdf.KeyPairBytes(X25519.serializePrivateKey(keyPair.getPrivate()),
                X25519.serializePublicKey(keyPair.getPublic()));
    }

    static byte[] authenticatedHeader(String algorithm, String keyId, byte[] ephemeralPublicKey, int messageNumber,
            int chainLength, int previousChainLength, int securityLevel, byte[] associatedData) {
        var header = CborWriter.encodeArray(array -> array
                .writeString(algorithm)
                .writeString(keyId)
                .writeBytes(ephemeralPublicKey)
                .writeInt(messageNumber)
                .writeInt(chainLength)
                .writeInt(previousChainLength)
                .writeInt(securityLevel));
        return associatedData == null ? header : CryptoUtils.concat(header, associatedData);
    }

    private static KeyRelayException keyUnavailable(EncryptedEnvelope envelope) {
        return new KeyRelayException(ErrorCode.MESSAGE_KEY_UNAVAILABLE, "Key for message " +
                envelope.messageNumber() + " on chain " + envelope.chainLength() + " is no longer available");
    }

    private KeyRelayException skipWindowExceeded(int requested) {
        return new KeyRelayException(ErrorCode.SKIP_WINDOW_EXCEEDED,
                "Message is " + requested + " positions ahead; at most " + maxSkip + " can be skipped");
    }

    // Session-level operations

    public RatchetState initialize(String conversationId, String userId, byte[] sharedSecret, boolean isInitiator) {
        return initialize(conversationId, userId, sharedSecret, isInitiator, 1, false);
    }

    /**
     * Creates and stores the ratchet state for a conversation and user.
     *
     * @param reset whether an existing state may be replaced.
     * @throws KeyRelayException with {@link ErrorCode#ALREADY_INITIALIZED} if a state exists and {@code reset} is
     * false.
     */
    public RatchetState initialize(String conversationId, String userId, byte[] sharedSecret, boolean isInitiator,
            int securityLevel, boolean reset) {
        var store = requireStore();
        return withLock(conversationId, userId, () -> {
            var existing = store.get(conversationId, userId);
            if (existing.isPresent()) {
                if (!reset) {
                    throw new KeyRelayException(ErrorCode.ALREADY_INITIALIZED,
                            "Ratchet already initialized for this conversation and user");
                }
                store.delete(conversationId, userId);
                logger.info("Reset ratchet state for conversation {} user {}", conversationId, userId);
            }
            var state = createState(conversationId, userId, sharedSecret, isInitiator, securityLevel);
            store.put(state, 0L);
            logger.info("Initialized ratchet for conversation {} user {} as {}", conversationId, userId,
                    isInitiator ? "initiator" : "responder");
            return state;
        });
    }

    public EncryptedEnvelope encrypt(String conversationId, String userId, byte[] plaintext, byte[] associatedData) {
        var store = requireStore();
        return withLock(conversationId, userId, () -> {
            var state = load(store, conversationId, userId);
            try {
                var envelope = encrypt(state, plaintext, associatedData);
                store.put(state, state.version());
                return envelope;
            } finally {
                state.wipeSecrets();
            }
        });
    }

    public byte[] decrypt(String conversationId, String userId, EncryptedEnvelope envelope, byte[] associatedData) {
        var store = requireStore();
        return withLock(conversationId, userId, () -> {
            var state = load(store, conversationId, userId);
            try {
                var plaintext = decrypt(state, envelope, associatedData);
                store.put(state, state.version());
                return plaintext;
            } finally {
                state.wipeSecrets();
            }
        });
    }

    public boolean hasState(String conversationId, String userId) {
        return requireStore().get(conversationId, userId).isPresent();
    }

    /**
     * Deletes the ratchet state, for example on conversation teardown.
     *
     * @return whether a state existed.
     */
    public boolean reset(String conversationId, String userId) {
        var store = requireStore();
        return withLock(conversationId, userId, () -> store.delete(conversationId, userId));
    }

    private RatchetState load(KeyMaterialStore store, String conversationId, String userId) {
        return store.get(conversationId, userId).orElseThrow(() -> new KeyRelayException(
                ErrorCode.RATCHET_NOT_INITIALIZED, "No ratchet state for this conversation and user"));
    }

    private KeyMaterialStore requireStore() {
        if (store == null) {
            throw new IllegalStateException("No key material store configured");
        }
        return store;
    }

    private <T> T withLock(String conversationId, String userId, Supplier<T> action) {
        Require.notBlank(conversationId, "conversationId");
        Require.notBlank(userId, "userId");
        var lock = locks[Math.floorMod(Objects.hash(conversationId, userId), LOCK_STRIPES)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
