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

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.keyrelay.Require;
import io.keyrelay.Timeframe;
import io.keyrelay.crypto.CryptoUtils;
import io.keyrelay.store.StorageGuard;

/**
 * Records which algorithm suite the parties of a conversation agreed on. Recording a new suite supersedes the
 * previous one; records lapse after a fixed lifetime and are then no longer reported as active.
 */
public final class AlgorithmNegotiationLedger {
    private static final Logger logger = LoggerFactory.getLogger(AlgorithmNegotiationLedger.class);

    private final NegotiationRepository repository;
    private final StorageGuard storage = new StorageGuard("Negotiation");
    private final MessageStatisticsSource messageStatistics;
    private final Clock clock;
    private final Duration ttl;

    public AlgorithmNegotiationLedger(NegotiationRepository repository, MessageStatisticsSource messageStatistics,
            Clock clock, Duration ttl) {
        this.repository = requireNonNull(repository, "repository");
        this.messageStatistics = requireNonNull(messageStatistics, "messageStatistics");
        this.clock = requireNonNull(clock, "clock");
        this.ttl = requireNonNull(ttl, "ttl");
    }

    /**
     * Records a negotiated suite for a conversation, replacing any active record.
     *
     * @param remoteCapabilities may be null.
     * @return the stored record.
     */
    public AlgorithmNegotiation record(String conversationId, String initiatorId, String responderId,
            SelectedAlgorithms selected, int securityLevel, boolean quantumResistant,
            AlgorithmCapabilities localCapabilities, AlgorithmCapabilities remoteCapabilities) {
        Require.notBlank(conversationId, "conversationId");
        Require.notBlank(initiatorId, "initiatorId");
        Require.notBlank(responderId, "responderId");
        Require.notNull(selected, "selected algorithms");
        Require.notNull(localCapabilities, "capabilities");
        Require.between(securityLevel, 1, 5, "securityLevel");
        Require.rejectIf(quantumResistant && !selected.keyExchange().isQuantumResistant(),
                "A classical key exchange cannot be recorded as quantum resistant");

        var now = clock.instant();
        var negotiation = new AlgorithmNegotiation(CryptoUtils.randomHex(12), conversationId, initiatorId,
                responderId, selected, securityLevel, quantumResistant, selected.isHybrid(),
                AlgorithmNegotiation.PROTOCOL_VERSION, localCapabilities.supportsPfs(),
                localCapabilities.supportsDoubleRatchet(), localCapabilities, remoteCapabilities, now, now.plus(ttl),
                true);
        storage.run(() -> repository.replaceActive(negotiation));
        logger.info("Recorded negotiation {} for conversation {}: {}/{}/{} level {}", negotiation.negotiationId(),
                conversationId, selected.keyExchange().identifier(), selected.signature().identifier(),
                selected.encryption().identifier(), securityLevel);
        return negotiation;
    }

    public Optional<AlgorithmNegotiation> getActive(String conversationId) {
        Require.notBlank(conversationId, "conversationId");
        var now = clock.instant();
        return storage.call(() -> repository.findActive(conversationId)).filter(n -> n.isActiveAt(now));
    }

    public EncryptionStatus encryptionStatus(String conversationId) {
        var active = getActive(conversationId);
        boolean encryptionEnabled = storage.call(() -> messageStatistics.hasEncryptedMessages(conversationId));
        return active.map(n -> new EncryptionStatus(encryptionEnabled, true, n.achievedSecurityLevel(),
                        n.quantumResistant(), n.selected().keyExchange().identifier()))
                .orElseGet(() -> new EncryptionStatus(encryptionEnabled, false, 1, false, "none"));
    }

    public EncryptionStatistics statistics(Timeframe timeframe) {
        requireNonNull(timeframe, "timeframe");
        var since = timeframe.startingBefore(clock.instant());
        var messages = storage.call(() -> messageStatistics.countSince(since));
        double rate = messages.total() == 0 ? 0.0 : 100.0 * messages.encrypted() / messages.total();

        var negotiations = storage.call(() -> repository.findCreatedSince(since));
        var byKeyExchange = new TreeMap<String, Long>();
        long quantumResistant = 0;
        for (var negotiation : negotiations) {
            byKeyExchange.merge(negotiation.selected().keyExchange().identifier(), 1L, Long::sum);
            if (negotiation.quantumResistant()) {
                quantumResistant++;
            }
        }
        return new EncryptionStatistics(timeframe, messages.total(), messages.encrypted(), messages.byAlgorithm(),
                rate, negotiations.size(), quantumResistant, byKeyExchange);
    }
}
