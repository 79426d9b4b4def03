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

import java.time.Instant;

/**
 * What one party of an exchange is allowed to see. The initiator gets the recipient's response data; the recipient
 * gets the initiator's encrypted key data.
 *
 * @param keyData the opaque blob addressed to the caller, or null if none has been sent yet.
 */
public record ExchangeData(
        String exchangeId,
        ExchangeType type,
        ExchangeStatus status,
        String conversationId,
        boolean isInitiator,
        String otherPartyId,
        PublicKeyBundle initiatorBundle,
        PublicKeyBundle recipientBundle,
        byte[] keyData,
        Instant createdAt,
        Instant respondedAt,
        Instant completedAt,
        Instant expiresAt) {

    public ExchangeData {
        keyData = keyData == null ? null : keyData.clone();
    }

    @Override
    public byte[] keyData() {
        return keyData == null ? null : keyData.clone();
    }
}
