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

package io.keyrelay.negotiation;

import static java.util.Objects.requireNonNull;

import java.time.Instant;

/**
 * A durable record of the suite two parties use in a conversation. At most one record per conversation is active.
 *
 * @param remoteCapabilities may be null when the other party's capabilities were not exchanged.
 */
public record AlgorithmNegotiation(
        String negotiationId,
        String conversationId,
        String initiatorId,
        String responderId,
        SelectedAlgorithms selected,
        int achievedSecurityLevel,
        boolean quantumResistant,
        boolean hybridMode,
        String protocolVersion,
        boolean supportsPfs,
        boolean supportsDoubleRatchet,
        AlgorithmCapabilities localCapabilities,
        AlgorithmCapabilities remoteCapabilities,
        Instant createdAt,
        Instant expiresAt,
        boolean active) {

    public static final String PROTOCOL_VERSION = "1.0";

    public AlgorithmNegotiation {
        requireNonNull(negotiationId, "negotiationId");
        requireNonNull(conversationId, "conversationId");
        requireNonNull(initiatorId, "initiatorId");
        requireNonNull(responderId, "responderId");
        requireNonNull(selected, "selected");
        requireNonNull(localCapabilities, "localCapabilities");
        requireNonNull(createdAt, "createdAt");
        requireNonNull(expiresAt, "expiresAt");
    }

    public boolean isActiveAt(Instant now) {
        return active && !expiresAt.isBefore(now);
    }

    AlgorithmNegotiation deactivated() {
        return new AlgorithmNegotiation(negotiationId, conversationId, initiatorId, responderId, selected,
                achievedSecurityLevel, quantumResistant, hybridMode, protocolVersion, supportsPfs,
                supportsDoubleRatchet, localCapabilities, remoteCapabilities, createdAt, expiresAt, false);
    }
}
