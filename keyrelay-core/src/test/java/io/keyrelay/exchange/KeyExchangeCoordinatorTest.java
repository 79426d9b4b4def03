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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import io.keyrelay.ErrorCode;
import io.keyrelay.KeyRelayException;
import io.keyrelay.MutableClock;
import io.keyrelay.RatchetEngine;
import io.keyrelay.RelayNotifier;
import io.keyrelay.RelayNotifier.Event;
import io.keyrelay.RelayNotifier.Notification;
import io.keyrelay.Timeframe;
import io.keyrelay.config.KeyRelayConfig;
import io.keyrelay.crypto.HybridKeyAgreement;
import io.keyrelay.crypto.X25519;
import io.keyrelay.negotiation.AlgorithmCapabilities;
import io.keyrelay.negotiation.AlgorithmNegotiationLedger;
import io.keyrelay.negotiation.EncryptionAlgorithm;
import io.keyrelay.negotiation.InMemoryNegotiationRepository;
import io.keyrelay.negotiation.KeyExchangeAlgorithm;
import io.keyrelay.negotiation.MessageStatisticsSource;
import io.keyrelay.negotiation.SignatureAlgorithm;
import io.keyrelay.store.RepositoryException;

public class KeyExchangeCoordinatorTest {
    private static final Duration TTL = Duration.ofHours(24);
    private static final byte[] RESPONSE = "encapsulated".getBytes(UTF_8);

    private MutableClock clock;
    private RelayNotifier notifier;
    private AlgorithmNegotiationLedger ledger;
    private KeyExchangeCoordinator coordinator;

    @BeforeMethod
    public void setup() {
        clock = new MutableClock();
        notifier = mock(RelayNotifier.class);
        ledger = new AlgorithmNegotiationLedger(new InMemoryNegotiationRepository(), MessageStatisticsSource.NONE,
                clock, Duration.ofDays(30));
        coordinator = new KeyExchangeCoordinator(new InMemoryExchangeRepository(), ledger, notifier, clock, TTL);
    }

    @Test
    public void shouldRunFullLifecycle() {
        var receipt = coordinator.initiate("alice", "bob", "conversation-1", ExchangeType.INITIAL_SETUP,
                hybridBundle(3), "for bob".getBytes(UTF_8));

        assertThat(receipt.status()).isEqualTo(ExchangeStatus.PENDING);
        assertThat(receipt.exchangeId()).hasSize(32);
        assertThat(receipt.expiresAt()).isEqualTo(clock.instant().plus(TTL));
        verify(notifier).notify(new Notification("bob", null, Event.KEY_EXCHANGE_REQUEST, receipt.exchangeId()));

        clock.advance(Duration.ofMinutes(1));
        var responded = coordinator.respond(receipt.exchangeId(), "bob", RESPONSE, hybridBundle(5));
        assertThat(responded.status()).isEqualTo(ExchangeStatus.RESPONDED);
        verify(notifier).notify(new Notification("alice", null, Event.KEY_EXCHANGE_RESPONSE,
                receipt.exchangeId()));

        var completed = coordinator.complete(receipt.exchangeId(), "alice", new byte[64]);
        assertThat(completed.status()).isEqualTo(ExchangeStatus.COMPLETED);
        verify(notifier).notify(new Notification("bob", null, Event.KEY_EXCHANGE_COMPLETED,
                receipt.exchangeId()));

        var data = coordinator.getData(receipt.exchangeId(), "bob");
        assertThat(data.status()).isEqualTo(ExchangeStatus.COMPLETED);
        assertThat(data.respondedAt()).isNotNull();
        assertThat(data.completedAt()).isEqualTo(clock.instant());
    }

    @Test
    public void completingInitialSetupShouldRecordNegotiation() {
        var receipt = coordinator.initiate("alice", "bob", "conversation-1", ExchangeType.INITIAL_SETUP,
                hybridBundle(5), null);
        coordinator.respond(receipt.exchangeId(), "bob", RESPONSE, classicalBundle());
        coordinator.complete(receipt.exchangeId(), "bob", null);

        assertThat(ledger.getActive("conversation-1")).hasValueSatisfying(negotiation -> {
            assertThat(negotiation.initiatorId()).isEqualTo("alice");
            assertThat(negotiation.responderId()).isEqualTo("bob");
            assertThat(negotiation.selected().keyExchange()).isEqualTo(KeyExchangeAlgorithm.HYBRID);
            assertThat(negotiation.achievedSecurityLevel()).isEqualTo(1);
            assertThat(negotiation.quantumResistant()).isFalse();
            assertThat(negotiation.remoteCapabilities()).isEqualTo(AlgorithmCapabilities.CLASSICAL);
        });
    }

    @Test
    public void otherExchangeTypesShouldNotRecordNegotiation() {
        var receipt = coordinator.initiate("alice", "bob", "conversation-1", ExchangeType.RATCHET_UPDATE,
                hybridBundle(3), null);
        coordinator.respond(receipt.exchangeId(), "bob", RESPONSE, hybridBundle(3));
        coordinator.complete(receipt.exchangeId(), "alice", null);

        assertThat(ledger.getActive("conversation-1")).isEmpty();
    }

    @Test
    public void shouldValidateInitiation() {
        assertFails(() -> coordinator.initiate("alice", "alice", "conversation-1", ExchangeType.INITIAL_SETUP,
                classicalBundle(), null), ErrorCode.VALIDATION_ERROR);
        assertFails(() -> coordinator.initiate("alice", "bob", null, ExchangeType.INITIAL_SETUP,
                classicalBundle(), null), ErrorCode.VALIDATION_ERROR);
        assertFails(() -> coordinator.initiate("alice", "bob", null, ExchangeType.PQC_UPGRADE, null, null),
                ErrorCode.VALIDATION_ERROR);

        var receipt = coordinator.initiate("alice", "bob", null, ExchangeType.DEVICE_ADDITION, classicalBundle(),
                null);
        assertThat(coordinator.getData(receipt.exchangeId(), "alice").conversationId()).isNull();
    }

    @Test
    public void onlyTheRecipientMayRespond() {
        var receipt = coordinator.initiate("alice", "bob", "conversation-1", ExchangeType.INITIAL_SETUP,
                classicalBundle(), null);

        assertFails(() -> coordinator.respond(receipt.exchangeId(), "alice", RESPONSE, classicalBundle()),
                ErrorCode.EXCHANGE_UNAUTHORIZED);
        assertFails(() -> coordinator.respond(receipt.exchangeId(), "mallory", RESPONSE, classicalBundle()),
                ErrorCode.EXCHANGE_UNAUTHORIZED);
        assertFails(() -> coordinator.respond("does-not-exist", "bob", RESPONSE, classicalBundle()),
                ErrorCode.EXCHANGE_NOT_FOUND);
        assertFails(() -> coordinator.respond(receipt.exchangeId(), "bob", new byte[0], classicalBundle()),
                ErrorCode.VALIDATION_ERROR);
    }

    @Test
    public void shouldEnforceStateTransitions() {
        var receipt = coordinator.initiate("alice", "bob", "conversation-1", ExchangeType.INITIAL_SETUP,
                classicalBundle(), null);

        assertFails(() -> coordinator.complete(receipt.exchangeId(), "alice", null),
                ErrorCode.EXCHANGE_INVALID_STATE);
        coordinator.respond(receipt.exchangeId(), "bob", RESPONSE, classicalBundle());
        assertFails(() -> coordinator.respond(receipt.exchangeId(), "bob", RESPONSE, classicalBundle()),
                ErrorCode.EXCHANGE_INVALID_STATE);
        assertFails(() -> coordinator.complete(receipt.exchangeId(), "mallory", null),
                ErrorCode.EXCHANGE_UNAUTHORIZED);
        coordinator.complete(receipt.exchangeId(), "bob", null);
        assertFails(() -> coordinator.complete(receipt.exchangeId(), "alice", null),
                ErrorCode.EXCHANGE_INVALID_STATE);
    }

    @Test
    public void expiredExchangesShouldBeRejectedAndReportedAsExpired() {
        var receipt = coordinator.initiate("alice", "bob", "conversation-1", ExchangeType.INITIAL_SETUP,
                classicalBundle(), null);
        clock.advance(TTL.plusSeconds(1));

        assertFails(() -> coordinator.respond(receipt.exchangeId(), "bob", RESPONSE, classicalBundle()),
                ErrorCode.EXCHANGE_EXPIRED);
        assertThat(coordinator.getData(receipt.exchangeId(), "alice").status()).isEqualTo(ExchangeStatus.EXPIRED);
        assertThat(coordinator.listPending("bob")).isEmpty();

        assertThat(coordinator.cleanupExpired()).isEqualTo(1);
        assertFails(() -> coordinator.getData(receipt.exchangeId(), "alice"), ErrorCode.EXCHANGE_NOT_FOUND);
    }

    @Test
    public void completedExchangesShouldSurviveCleanup() {
        var receipt = coordinator.initiate("alice", "bob", "conversation-1", ExchangeType.INITIAL_SETUP,
                classicalBundle(), null);
        coordinator.respond(receipt.exchangeId(), "bob", RESPONSE, classicalBundle());
        coordinator.complete(receipt.exchangeId(), "alice", null);
        clock.advance(TTL.multipliedBy(2));

        assertThat(coordinator.cleanupExpired()).isZero();
        assertThat(coordinator.getData(receipt.exchangeId(), "bob").status()).isEqualTo(ExchangeStatus.COMPLETED);
    }

    @Test
    public void shouldListPendingNewestFirst() {
        var first = coordinator.initiate("alice", "bob", "c1", ExchangeType.INITIAL_SETUP, classicalBundle(), null);
        clock.advance(Duration.ofMinutes(1));
        var second = coordinator.initiate("carol", "bob", "c2", ExchangeType.INITIAL_SETUP, classicalBundle(), null);
        clock.advance(Duration.ofMinutes(1));
        var third = coordinator.initiate("bob", "dave", "c3", ExchangeType.INITIAL_SETUP, classicalBundle(), null);
        coordinator.initiate("alice", "carol", "c4", ExchangeType.INITIAL_SETUP, classicalBundle(), null);

        var pending = coordinator.listPending("bob");
        assertThat(pending).extracting(p -> p.exchange().id())
                .containsExactly(third.exchangeId(), second.exchangeId(), first.exchangeId());
        assertThat(pending.get(0).isInitiator()).isTrue();
        assertThat(pending.get(0).otherPartyId()).isEqualTo("dave");
        assertThat(pending.get(1).isInitiator()).isFalse();
        assertThat(pending.get(1).otherPartyId()).isEqualTo("carol");

        assertThat(coordinator.listPending("bob", 2)).hasSize(2);
        assertFails(() -> coordinator.listPending("bob", 0), ErrorCode.VALIDATION_ERROR);
    }

    @Test
    public void pendingListShouldBeCappedByDefault() {
        for (int i = 0; i < 12; ++i) {
            coordinator.initiate("user-" + i, "bob", "c" + i, ExchangeType.INITIAL_SETUP, classicalBundle(), null);
            clock.advance(Duration.ofSeconds(1));
        }
        assertThat(coordinator.listPending("bob")).hasSize(10);
    }

    @Test
    public void eachPartyShouldSeeOnlyTheDataAddressedToThem() {
        var receipt = coordinator.initiate("alice", "bob", "conversation-1", ExchangeType.INITIAL_SETUP,
                classicalBundle(), "for bob".getBytes(UTF_8));

        assertThat(coordinator.getData(receipt.exchangeId(), "alice").keyData()).isNull();
        assertThat(coordinator.getData(receipt.exchangeId(), "bob").keyData()).isEqualTo("for bob".getBytes(UTF_8));

        coordinator.respond(receipt.exchangeId(), "bob", RESPONSE, classicalBundle());
        var aliceView = coordinator.getData(receipt.exchangeId(), "alice");
        assertThat(aliceView.keyData()).isEqualTo(RESPONSE);
        assertThat(aliceView.isInitiator()).isTrue();
        assertThat(aliceView.otherPartyId()).isEqualTo("bob");
        assertThat(aliceView.recipientBundle()).isNotNull();

        assertFails(() -> coordinator.getData(receipt.exchangeId(), "mallory"), ErrorCode.EXCHANGE_UNAUTHORIZED);
    }

    @Test
    public void notificationFailuresShouldNotFailTheExchange() {
        doThrow(new IllegalStateException("push gateway down")).when(notifier).notify(any());

        var receipt = coordinator.initiate("alice", "bob", "conversation-1", ExchangeType.INITIAL_SETUP,
                classicalBundle(), null);

        assertThat(coordinator.listPending("bob")).hasSize(1);
        assertThat(coordinator.respond(receipt.exchangeId(), "bob", RESPONSE, classicalBundle()).status())
                .isEqualTo(ExchangeStatus.RESPONDED);
    }

    @Test
    public void shouldComputeStatistics() {
        var done = coordinator.initiate("alice", "bob", "c1", ExchangeType.INITIAL_SETUP, classicalBundle(), null);
        coordinator.respond(done.exchangeId(), "bob", RESPONSE, classicalBundle());
        coordinator.complete(done.exchangeId(), "alice", null);
        coordinator.initiate("alice", "carol", "c2", ExchangeType.INITIAL_SETUP, classicalBundle(), null);
        coordinator.initiate("alice", "dave", null, ExchangeType.PQC_UPGRADE, hybridBundle(3), null);
        coordinator.initiate("alice", "erin", null, ExchangeType.RATCHET_UPDATE, classicalBundle(), null);

        var stats = coordinator.statistics(Timeframe.ONE_DAY);
        assertThat(stats.total()).isEqualTo(4);
        assertThat(stats.byStatus()).containsEntry("completed", 1L).containsEntry("pending", 3L);
        assertThat(stats.byType()).containsEntry("initial_setup", 2L).containsEntry("pqc_upgrade", 1L)
                .containsEntry("ratchet_update", 1L);
        assertThat(stats.successRate()).isCloseTo(25.0, within(0.001));

        clock.advance(Duration.ofDays(2));
        var later = coordinator.statistics(Timeframe.ONE_DAY);
        assertThat(later.total()).isZero();
        assertThat(later.successRate()).isZero();
    }

    @Test
    public void hybridExchangeShouldBootstrapRatchet() {
        var aliceKeys = HybridKeyAgreement.generateKeyPair();
        var bobKeys = HybridKeyAgreement.generateKeyPair();

        var receipt = coordinator.initiate("alice", "bob", "conversation-1", ExchangeType.INITIAL_SETUP,
                bundleFor(aliceKeys), null);

        var request = coordinator.getData(receipt.exchangeId(), "bob");
        var encapsulation = HybridKeyAgreement.encapsulate(bobKeys, request.initiatorBundle().classicalPublicKey(),
                request.initiatorBundle().postQuantumPublicKey());
        coordinator.respond(receipt.exchangeId(), "bob", encapsulation.postQuantumCiphertext(), bundleFor(bobKeys));

        var response = coordinator.getData(receipt.exchangeId(), "alice");
        var aliceSecret = HybridKeyAgreement.decapsulate(aliceKeys, response.recipientBundle().classicalPublicKey(),
                response.keyData());
        coordinator.complete(receipt.exchangeId(), "alice", null);
        assertThat(ledger.encryptionStatus("conversation-1").quantumResistant()).isTrue();

        var engine = new RatchetEngine(KeyRelayConfig.defaults(), clock);
        var alice = engine.createState("conversation-1", "alice", aliceSecret, true, 3);
        var bob = engine.createState("conversation-1", "bob", encapsulation.sharedSecret(), false, 3);

        var hello = engine.encrypt(alice, "hello".getBytes(UTF_8), null);
        assertThat(engine.decrypt(bob, hello, null)).isEqualTo("hello".getBytes(UTF_8));
        var reply = engine.encrypt(bob, "hi alice".getBytes(UTF_8), null);
        assertThat(engine.decrypt(alice, reply, null)).isEqualTo("hi alice".getBytes(UTF_8));
    }

    private static PublicKeyBundle classicalBundle() {
        var publicKey = X25519.serializePublicKey(X25519.generateKeyPair().getPublic());
        return new PublicKeyBundle(publicKey, null, KeyExchangeAlgorithm.X25519, SignatureAlgorithm.ED25519,
                EncryptionAlgorithm.CHACHA20_POLY1305, 1, false, null, AlgorithmCapabilities.CLASSICAL);
    }

    private static PublicKeyBundle hybridBundle(int securityLevel) {
        return new PublicKeyBundle(new byte[32], new byte[1184], KeyExchangeAlgorithm.HYBRID,
                SignatureAlgorithm.DILITHIUM3, EncryptionAlgorithm.CHACHA20_POLY1305, securityLevel, true, "1.0",
                AlgorithmCapabilities.HYBRID);
    }

    private static PublicKeyBundle bundleFor(HybridKeyAgreement.HybridKeyPair keys) {
        return new PublicKeyBundle(keys.classicalPublicKey(), keys.postQuantumPublicKey(),
                KeyExchangeAlgorithm.HYBRID, SignatureAlgorithm.DILITHIUM3, EncryptionAlgorithm.CHACHA20_POLY1305,
                3, true, "1.0", AlgorithmCapabilities.HYBRID);
    }

    @Test
    public void backendFailuresShouldSurfaceAsStorageUnavailable() {
        var failing = mock(ExchangeRepository.class);
        var outage = new RepositoryException("connection refused");
        when(failing.find(anyString())).thenThrow(outage);
        when(failing.findOpenFor(anyString())).thenThrow(outage);
        when(failing.findCreatedSince(any(Instant.class))).thenThrow(outage);
        when(failing.deleteExpired(any(Instant.class))).thenThrow(outage);
        doThrow(outage).when(failing).insert(any(KeyExchange.class));
        var broken = new KeyExchangeCoordinator(failing, ledger, notifier, clock, TTL);

        assertFails(() -> broken.initiate("alice", "bob", "conversation-1", ExchangeType.INITIAL_SETUP,
                hybridBundle(3), null), ErrorCode.STORAGE_UNAVAILABLE);
        assertFails(() -> broken.getData("exchange-1", "alice"), ErrorCode.STORAGE_UNAVAILABLE);
        assertFails(() -> broken.respond("exchange-1", "bob", RESPONSE, classicalBundle()),
                ErrorCode.STORAGE_UNAVAILABLE);
        assertFails(() -> broken.complete("exchange-1", "alice", null), ErrorCode.STORAGE_UNAVAILABLE);
        assertFails(() -> broken.listPending("alice"), ErrorCode.STORAGE_UNAVAILABLE);
        assertFails(() -> broken.statistics(Timeframe.ONE_DAY), ErrorCode.STORAGE_UNAVAILABLE);
        assertFails(broken::cleanupExpired, ErrorCode.STORAGE_UNAVAILABLE);
        verify(notifier, never()).notify(any());
    }

    private static void assertFails(ThrowingCallable call, ErrorCode expected) {
        assertThatThrownBy(call).isInstanceOfSatisfying(KeyRelayException.class,
                e -> assertThat(e.errorCode()).isEqualTo(expected));
    }
}
