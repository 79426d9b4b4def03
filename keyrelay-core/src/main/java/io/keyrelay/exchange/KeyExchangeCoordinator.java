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

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeMap;

import org.slf4j.Logger;

import io.keyrelay.ErrorCode;
import io.keyrelay.KeyRelayException;
import io.keyrelay.RedactedLogger;
import io.keyrelay.RelayNotifier;
import io.keyrelay.RelayNotifier.Event;
import io.keyrelay.RelayNotifier.Notification;
import io.keyrelay.Require;
import io.keyrelay.Timeframe;
import io.keyrelay.crypto.CryptoUtils;
import io.keyrelay.negotiation.AlgorithmNegotiationLedger;
import io.keyrelay.store.StorageGuard;

/**
 * Relays public key bundles and encrypted key material between the two parties of a key exchange. The relay never
 * sees private keys or shared secrets: it moves opaque blobs and enforces the exchange lifecycle.
 * <p>
 * Expiry is evaluated lazily. An open exchange read after its expiry time is reported, and stored, as
 * {@link ExchangeStatus#EXPIRED}; {@link #cleanupExpired()} removes such exchanges altogether.
 */
public final class KeyExchangeCoordinator {
    private static final Logger logger = RedactedLogger.getLogger(KeyExchangeCoordinator.class);
    static final int DEFAULT_PENDING_LIMIT = 10;

    private final ExchangeRepository repository;
    private final StorageGuard storage = new StorageGuard("Key exchange");
    private final AlgorithmNegotiationLedger ledger;
    private final RelayNotifier notifier;
    private final Clock clock;
    private final Duration ttl;

    public KeyExchangeCoordinator(ExchangeRepository repository, AlgorithmNegotiationLedger ledger,
            RelayNotifier notifier, Clock clock, Duration ttl) {
        this.repository = requireNonNull(repository, "repository");
        this.ledger = requireNonNull(ledger, "ledger");
        this.notifier = requireNonNull(notifier, "notifier");
        this.clock = requireNonNull(clock, "clock");
        this.ttl = requireNonNull(ttl, "ttl");
    }

    /**
     * Opens a new exchange and notifies the recipient.
     *
     * @param conversationId required for {@link ExchangeType#INITIAL_SETUP}, otherwise optional.
     * @param encryptedKeyData optional key material for the recipient, opaque to the relay.
     */
    public ExchangeReceipt initiate(String initiatorId, String recipientId, String conversationId, ExchangeType type,
            PublicKeyBundle bundle, byte[] encryptedKeyData) {
        Require.notBlank(initiatorId, "initiatorId");
        Require.notBlank(recipientId, "recipientId");
        Require.notNull(type, "exchangeType");
        Require.notNull(bundle, "publicKeyBundle");
        Require.rejectIf(initiatorId.equals(recipientId), "Cannot exchange keys with yourself");
        if (type == ExchangeType.INITIAL_SETUP) {
            Require.notBlank(conversationId, "conversationId");
        }

        var now = clock.instant();
        var exchange = new KeyExchange(CryptoUtils.randomHex(16), initiatorId, recipientId, conversationId, type,
                ExchangeStatus.PENDING, bundle, null, encryptedKeyData, null, null, now, null, null, now.plus(ttl));
        storage.run(() -> repository.insert(exchange));
        logger.info("Initiated {} exchange {} from {} to {}", type.identifier(), exchange.id(), initiatorId,
                recipientId);

        notifyQuietly(new Notification(recipientId, null, Event.KEY_EXCHANGE_REQUEST, exchange.id()));
        return new ExchangeReceipt(exchange.id(), ExchangeStatus.PENDING, exchange.expiresAt());
    }

    /**
     * Records the recipient's response and notifies the initiator.
     */
    public ExchangeReceipt respond(String exchangeId, String recipientId, byte[] responseData,
            PublicKeyBundle bundle) {
        Require.notBlank(recipientId, "recipientId");
        Require.notEmpty(responseData, "responseData");
        Require.notNull(bundle, "publicKeyBundle");

        var exchange = load(exchangeId);
        if (!exchange.recipientId().equals(recipientId)) {
            throw new KeyRelayException(ErrorCode.EXCHANGE_UNAUTHORIZED, "Not the recipient of this exchange");
        }
        checkTransition(exchange, ExchangeStatus.PENDING);

        var updated = exchange.responded(bundle, responseData, clock.instant());
        if (!storage.call(() -> repository.compareAndSet(exchange.id(), ExchangeStatus.PENDING, updated))) {
            throw new KeyRelayException(ErrorCode.EXCHANGE_INVALID_STATE, "Exchange has already been answered");
        }
        logger.info("Exchange {} responded by {}", exchange.id(), recipientId);

        notifyQuietly(new Notification(exchange.initiatorId(), null, Event.KEY_EXCHANGE_RESPONSE, exchange.id()));
        return new ExchangeReceipt(exchange.id(), ExchangeStatus.RESPONDED, null);
    }

    /**
     * Completes a responded exchange. Either party may complete it. Completing an initial setup records the
     * negotiated algorithms for the conversation.
     *
     * @param confirmationSignature optional signature over the exchange transcript, opaque to the relay.
     */
    public ExchangeReceipt complete(String exchangeId, String userId, byte[] confirmationSignature) {
        Require.notBlank(userId, "userId");

        var exchange = load(exchangeId);
        if (!exchange.isParticipant(userId)) {
            throw new KeyRelayException(ErrorCode.EXCHANGE_UNAUTHORIZED, "Not a party to this exchange");
        }
        checkTransition(exchange, ExchangeStatus.RESPONDED);

        var updated = exchange.completed(confirmationSignature, clock.instant());
        if (!storage.call(() -> repository.compareAndSet(exchange.id(), ExchangeStatus.RESPONDED, updated))) {
            throw new KeyRelayException(ErrorCode.EXCHANGE_INVALID_STATE, "Exchange is not ready for completion");
        }
        logger.info("Exchange {} completed by {}", exchange.id(), userId);

        if (updated.type() == ExchangeType.INITIAL_SETUP) {
            recordNegotiation(updated);
        }
        notifyQuietly(new Notification(exchange.otherParty(userId), null, Event.KEY_EXCHANGE_COMPLETED,
                exchange.id()));
        return new ExchangeReceipt(exchange.id(), ExchangeStatus.COMPLETED, null);
    }

    public List<PendingExchange> listPending(String userId) {
        return listPending(userId, DEFAULT_PENDING_LIMIT);
    }

    /**
     * Open, unexpired exchanges in which the user is either party, newest first.
     */
    public List<PendingExchange> listPending(String userId, int limit) {
        Require.notBlank(userId, "userId");
        Require.rejectIf(limit < 1, "limit must be positive");

        var now = clock.instant();
        var open = new ArrayList<KeyExchange>();
        for (var exchange : storage.call(() -> repository.findOpenFor(userId))) {
            if (exchange.effectiveStatus(now) == ExchangeStatus.EXPIRED) {
                markExpired(exchange);
            } else {
                open.add(exchange);
            }
        }
        open.sort(Comparator.comparing(KeyExchange::createdAt).reversed());

        var result = new ArrayList<PendingExchange>();
        for (var exchange : open.subList(0, Math.min(limit, open.size()))) {
            result.add(new PendingExchange(exchange, exchange.isInitiator(userId), exchange.otherParty(userId)));
        }
        return result;
    }

    /**
     * Returns the part of the exchange the caller may see.
     */
    public ExchangeData getData(String exchangeId, String userId) {
        Require.notBlank(userId, "userId");
        var exchange = load(exchangeId);
        if (!exchange.isParticipant(userId)) {
            throw new KeyRelayException(ErrorCode.EXCHANGE_UNAUTHORIZED, "Access denied to exchange data");
        }
        var status = exchange.effectiveStatus(clock.instant());
        if (status != exchange.status()) {
            markExpired(exchange);
        }
        var initiator = exchange.isInitiator(userId);
        return new ExchangeData(exchange.id(), exchange.type(), status, exchange.conversationId(), initiator,
                exchange.otherParty(userId), exchange.initiatorBundle(), exchange.recipientBundle(),
                initiator ? exchange.responseData() : exchange.encryptedKeyData(), exchange.createdAt(),
                exchange.respondedAt(), exchange.completedAt(), exchange.expiresAt());
    }

    /**
     * Deletes exchanges that expired without completing.
     *
     * @return the number of exchanges removed.
     */
    public int cleanupExpired() {
        int deleted = storage.call(() -> repository.deleteExpired(clock.instant()));
        if (deleted > 0) {
            logger.info("Cleaned up {} expired key exchanges", deleted);
        }
        return deleted;
    }

    public ExchangeStatistics statistics(Timeframe timeframe) {
        requireNonNull(timeframe, "timeframe");
        var now = clock.instant();
        var exchanges = storage.call(() -> repository.findCreatedSince(timeframe.startingBefore(now)));

        var byStatus = new TreeMap<String, Long>();
        var byType = new TreeMap<String, Long>();
        long completed = 0;
        for (var exchange : exchanges) {
            var status = exchange.effectiveStatus(now);
            byStatus.merge(status.identifier(), 1L, Long::sum);
            byType.merge(exchange.type().identifier(), 1L, Long::sum);
            if (status == ExchangeStatus.COMPLETED) {
                completed++;
            }
        }
        double successRate = exchanges.isEmpty() ? 0.0 : 100.0 * completed / exchanges.size();
        return new ExchangeStatistics(timeframe, exchanges.size(), byStatus, byType, successRate);
    }

    private KeyExchange load(String exchangeId) {
        Require.notBlank(exchangeId, "exchangeId");
        return storage.call(() -> repository.find(exchangeId)).orElseThrow(() ->
                new KeyRelayException(ErrorCode.EXCHANGE_NOT_FOUND, "Key exchange not found"));
    }

    private void checkTransition(KeyExchange exchange, ExchangeStatus required) {
        var status = exchange.effectiveStatus(clock.instant());
        if (status == ExchangeStatus.EXPIRED) {
            markExpired(exchange);
            throw new KeyRelayException(ErrorCode.EXCHANGE_EXPIRED, "Key exchange has expired");
        }
        if (status != required) {
            throw new KeyRelayException(ErrorCode.EXCHANGE_INVALID_STATE,
                    "Exchange is " + status.identifier() + ", expected " + required.identifier());
        }
    }

    private void markExpired(KeyExchange exchange) {
        if (exchange.status().isOpen() && storage.call(() -> repository.compareAndSet(exchange.id(),
                exchange.status(), exchange.expired()))) {
            logger.debug("Exchange {} expired", exchange.id());
        }
    }

    private void recordNegotiation(KeyExchange exchange) {
        var initiator = exchange.initiatorBundle();
        var recipient = exchange.recipientBundle();
        ledger.record(exchange.conversationId(), exchange.initiatorId(), exchange.recipientId(),
                initiator.proposedAlgorithms(),
                Math.min(initiator.securityLevel(), recipient.securityLevel()),
                initiator.quantumResistant() && recipient.quantumResistant(),
                initiator.capabilities(), recipient.capabilities());
    }

    private void notifyQuietly(Notification notification) {
        try {
            notifier.notify(notification);
        } catch (RuntimeException e) {
            logger.warn("Failed to deliver {} notification for {}: {}", notification.event(),
                    notification.referenceId(), e.getMessage());
        }
    }
}
