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

import java.time.Instant;

/**
 * The persisted form of a ratchet state. Secret fields are sealed; counters, public keys and timestamps are stored in
 * the clear so that statistics and listings never need to decrypt anything.
 *
 * @param sendingChainKey null until the responder has received its first message.
 * @param receivingChainKey null until the initiator has received its first reply.
 * @param sendingRatchetKeyPair CBOR array {@code [privateKey, publicKey]}, sealed as one field.
 * @param version incremented by the repository on every write.
 */
public record StoredRatchetState(
        String id,
        String conversationId,
        String userId,
        SealedBox rootKey,
        SealedBox sendingChainKey,
        SealedBox receivingChainKey,
        SealedBox sendingRatchetKeyPair,
        byte[] receivingRatchetPublicKey,
        int sendingMessageNumber,
        int receivingMessageNumber,
        int previousSendingChainLength,
        int sendingChainLength,
        int receivingChainLength,
        int securityLevel,
        long version,
        Instant createdAt,
        Instant updatedAt) {

    public StoredRatchetState {
        requireNonNull(id, "id");
        requireNonNull(conversationId, "conversationId");
        requireNonNull(userId, "userId");
        requireNonNull(rootKey, "rootKey");
        requireNonNull(sendingRatchetKeyPair, "sendingRatchetKeyPair");
        requireNonNull(createdAt, "createdAt");
        requireNonNull(updatedAt, "updatedAt");
    }

    StoredRatchetState withVersion(long newVersion) {
        return new StoredRatchetState(id, conversationId, userId, rootKey, sendingChainKey, receivingChainKey,
                sendingRatchetKeyPair, receivingRatchetPublicKey, sendingMessageNumber, receivingMessageNumber,
                previousSendingChainLength, sendingChainLength, receivingChainLength, securityLevel, newVersion,
                createdAt, updatedAt);
    }
}
