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

package io.keyrelay.exchange;

import static java.util.Objects.requireNonNull;

import java.time.Instant;

/**
 * A two-party key exchange held by the relay. The relay only stores public bundles and opaque encrypted blobs.
 *
 * @param conversationId may be null except for {@link ExchangeType#INITIAL_SETUP} exchanges.
 * @param recipientBundle null until the recipient responds.
 * @param responseData null until the recipient responds.
 * @param confirmationSignature null until the exchange is completed.
 */
public record KeyExchange(
        String id,
        String initiatorId,
        String recipientId,
        String conversationId,
        ExchangeType type,
        ExchangeStatus status,
        PublicKeyBundle initiatorBundle,
        PublicKeyBundle recipientBundle,
        byte[] encryptedKeyData,
        byte[] responseData,
        byte[] confirmationSignature,
        Instant createdAt,
        Instant respondedAt,
        Instant completedAt,
        Instant expiresAt) {

    public KeyExchange {
        requireNonNull(id, "id");
        requireNonNull(initiatorId, "initiatorId");
        requireNonNull(recipientId, "recipientId");
        requireNonNull(type, "type");
        requireNonNull(status, "status");
        requireNonNull(initiatorBundle, "initiatorBundle");
        requireNonNull(createdAt, "createdAt");
        requireNonNull(expiresAt, "expiresAt");
        encryptedKeyData = copy(encryptedKeyData);
        responseData = copy(responseData);
        confirmationSignature = copy(confirmationSignature);
    }

    /**
     * The status as seen at the given time: open exchanges past their expiry are reported as expired.
     */
    public ExchangeStatus effectiveStatus(Instant now) {
        return status.isOpen() && now.isAfter(expiresAt) ? ExchangeStatus.EXPIRED : status;
    }

    public boolean isParticipant(String userId) {
        return initiatorId.equals(userId) || recipientId.equals(userId);
    }

    public boolean isInitiator(String userId) {
        return initiatorId.equals(userId);
    }

    public String otherParty(String userId) {
        return isInitiator(userId) ? recipientId : initiatorId;
    }

    @Override
    public byte[] encryptedKeyData() {
        return copy(encryptedKeyData);
    }

    @Override
    public byte[] responseData() {
        return copy(responseData);
    }

    @Override
    public byte[] confirmationSignature() {
        return copy(confirmationSignature);
    }

    KeyExchange responded(PublicKeyBundle bundle, byte[] response, Instant when) {
        return new KeyExchange(id, initiatorId, recipientId, conversationId, type, ExchangeStatus.RESPONDED,
                initiatorBundle, bundle, encryptedKeyData, response, null, createdAt, when, null, expiresAt);
    }

    KeyExchange completed(byte[] signature, Instant when) {
        return new KeyExchange(id, initiatorId, recipientId, conversationId, type, ExchangeStatus.COMPLETED,
                initiatorBundle, recipientBundle, encryptedKeyData, responseData, signature, createdAt, respondedAt,
                when, expiresAt);
    }

    KeyExchange expired() {
        return new KeyExchange(id, initiatorId, recipientId, conversationId, type, ExchangeStatus.EXPIRED,
                initiatorBundle, recipientBundle, encryptedKeyData, responseData, confirmationSignature, createdAt,
                respondedAt, completedAt, expiresAt);
    }

    @Override
    public String toString() {
        return "KeyExchange{id=" + id + ", type=" + type.identifier() + ", status=" + status.identifier()
                + ", initiator=" + initiatorId + ", recipient=" + recipientId + "}";
    }

    private static byte[] copy(byte[] data) {
        return data == null ? null : data.clone();
    }
}
