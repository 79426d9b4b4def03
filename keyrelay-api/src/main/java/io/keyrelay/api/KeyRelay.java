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

package io.keyrelay.api;

import static java.util.Objects.requireNonNull;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.keyrelay.RatchetEngine;
import io.keyrelay.RelayNotifier;
import io.keyrelay.config.KeyRelayConfig;
import io.keyrelay.exchange.InMemoryExchangeRepository;
import io.keyrelay.exchange.KeyExchangeCoordinator;
import io.keyrelay.negotiation.AlgorithmNegotiationLedger;
import io.keyrelay.negotiation.InMemoryNegotiationRepository;
import io.keyrelay.negotiation.MessageStatisticsSource;
import io.keyrelay.store.EnvironmentKeyProvider;
import io.keyrelay.store.InMemoryRatchetStateRepository;
import io.keyrelay.store.KeyMaterialStore;
import io.keyrelay.store.StateEncryptionKeyProvider;
import io.keyrelay.sync.InMemoryDeviceDirectory;
import io.keyrelay.sync.InMemorySyncPackageRepository;
import io.keyrelay.sync.MultiDeviceSyncCoordinator;

/**
 * Wires every KeyRelay component from a {@link KeyRelayConfig}, backed by in-memory repositories.
 */
public final class KeyRelay {
    private static final Logger logger = LoggerFactory.getLogger(KeyRelay.class);

    private final KeyRelayConfig config;
    private final Clock clock;
    private final KeyMaterialStore store;
    private final RatchetEngine engine;
    private final AlgorithmNegotiationLedger ledger;
    private final KeyExchangeCoordinator exchanges;
    private final MultiDeviceSyncCoordinator sync;

    public KeyRelay(KeyRelayConfig config, StateEncryptionKeyProvider keyProvider, Clock clock,
            RelayNotifier notifier, MessageStatisticsSource messageStatistics) {
        this.config = requireNonNull(config, "config");
        this.clock = requireNonNull(clock, "clock");
        this.store = new KeyMaterialStore(new InMemoryRatchetStateRepository(), keyProvider, clock,
                config.skippedKeyTtl());
        this.engine = new RatchetEngine(config, clock, store);
        this.ledger = new AlgorithmNegotiationLedger(new InMemoryNegotiationRepository(), messageStatistics, clock,
                config.negotiationTtl());
        this.exchanges = new KeyExchangeCoordinator(new InMemoryExchangeRepository(), ledger, notifier, clock,
                config.exchangeTtl());
        this.sync = new MultiDeviceSyncCoordinator(new InMemoryDeviceDirectory(), new InMemorySyncPackageRepository(),
                notifier, clock, config.syncPackageTtl());
        logger.info("KeyRelay started in {} mode", config.mode());
    }

    KeyRelay(KeyRelayConfig config, Clock clock, KeyMaterialStore store, RatchetEngine engine,
            AlgorithmNegotiationLedger ledger, KeyExchangeCoordinator exchanges, MultiDeviceSyncCoordinator sync) {
        this.config = requireNonNull(config, "config");
        this.clock = requireNonNull(clock, "clock");
        this.store = requireNonNull(store, "store");
        this.engine = requireNonNull(engine, "engine");
        this.ledger = requireNonNull(ledger, "ledger");
        this.exchanges = requireNonNull(exchanges, "exchanges");
        this.sync = requireNonNull(sync, "sync");
    }

    /**
     * Creates a relay with the at-rest key taken from the environment, the system clock and logging notifications.
     *
     * @throws IllegalStateException if running in production mode without a valid at-rest key.
     */
    public static KeyRelay create(KeyRelayConfig config) {
        return new KeyRelay(config, EnvironmentKeyProvider.fromEnvironment(config), Clock.systemUTC(),
                RelayNotifier.LOGGING, MessageStatisticsSource.NONE);
    }

    public KeyRelayConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public KeyMaterialStore store() {
        return store;
    }

    public RatchetEngine engine() {
        return engine;
    }

    public AlgorithmNegotiationLedger ledger() {
        return ledger;
    }

    public KeyExchangeCoordinator exchanges() {
        return exchanges;
    }

    public MultiDeviceSyncCoordinator sync() {
        return sync;
    }

    /**
     * Schedules the periodic sweeps: expired skipped keys, abandoned exchanges and undelivered sync packages.
     */
    public List<ScheduledFuture<?>> startMaintenance(ScheduledExecutorService scheduler) {
        var interval = config.cleanupInterval();
        long millis = interval.toMillis();
        var keys = store.startCleanupJob(scheduler, interval);
        var relay = scheduler.scheduleAtFixedRate(() -> {
            sweep("Key exchange", exchanges::cleanupExpired);
            sweep("Key sync", sync::cleanupExpired);
        }, millis, millis, TimeUnit.MILLISECONDS);
        return List.of(keys, relay);
    }

    // A scheduled task that throws is never run again, so every failure stops here.
    private static void sweep(String name, IntSupplier cleanup) {
        try {
            cleanup.getAsInt();
        } catch (RuntimeException e) {
            logger.error("{} cleanup failed: {}", name, e.getMessage(), e);
        }
    }
}
