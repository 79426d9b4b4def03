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

package io.keyrelay.sync;

import static java.util.Objects.requireNonNull;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.keyrelay.ErrorCode;
import io.keyrelay.KeyRelayException;
import io.keyrelay.RelayNotifier;
import io.keyrelay.RelayNotifier.Event;
import io.keyrelay.RelayNotifier.Notification;
import io.keyrelay.Require;
import io.keyrelay.crypto.CryptoUtils;
import io.keyrelay.store.StorageGuard;

/**
 * Relays encrypted key packages between devices owned by the same user. Packages are encrypted by the source device
 * for the target device; the relay only checks ownership and tracks delivery.
 */
public final class MultiDeviceSyncCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(MultiDeviceSyncCoordinator.class);

    private static final Comparator<KeySyncPackage> DELIVERY_ORDER =
            Comparator.comparing(KeySyncPackage::priority).reversed()
                    .thenComparing(KeySyncPackage::createdAt);

    private final DeviceDirectory devices;
    private final SyncPackageRepository repository;
    private final StorageGuard storage = new StorageGuard("Key sync");
    private final RelayNotifier notifier;
    private final Clock clock;
    private final Duration ttl;

    public MultiDeviceSyncCoordinator(DeviceDirectory devices, SyncPackageRepository repository,
            RelayNotifier notifier, Clock clock, Duration ttl) {
        this.devices = requireNonNull(devices, "devices");
        this.repository = requireNonNull(repository, "repository");
        this.notifier = requireNonNull(notifier, "notifier");
        this.clock = requireNonNull(clock, "clock");
        this.ttl = requireNonNull(ttl, "ttl");
    }

    /**
     * Registers a device for the given user.
     */
    public DeviceIdentity registerDevice(String userId, String deviceId, String deviceName, String deviceType,
            String platform, byte[] publicKey) {
        Require.notBlank(userId, "userId");
        Require.notBlank(deviceId, "deviceId");
        var identity = new DeviceIdentity(deviceId, userId, deviceName, deviceType, platform, publicKey,
                clock.instant());
        var device = storage.call(() -> devices.register(identity));
        logger.info("Registered device {} for user {}", deviceId, userId);
        return device;
    }

    /**
     * Stores a package for the target device and notifies it.
     */
    public KeySyncPackage createPackage(String userId, String fromDeviceId, String toDeviceId,
            EncryptedKeyPackage keyPackage, PackageMetadata metadata) {
        Require.notBlank(userId, "userId");
        Require.notBlank(fromDeviceId, "fromDeviceId");
        Require.notBlank(toDeviceId, "toDeviceId");
        Require.notNull(keyPackage, "encryptedKeyPackage");
        Require.notNull(metadata, "packageMetadata");
        Require.rejectIf(fromDeviceId.equals(toDeviceId), "Source and target device must differ");
        if (!isOwnedBy(fromDeviceId, userId) || !isOwnedBy(toDeviceId, userId)) {
            throw new KeyRelayException(ErrorCode.DEVICE_OWNERSHIP_MISMATCH,
                    "Device ownership verification failed");
        }

        var now = clock.instant();
        var syncPackage = new KeySyncPackage(CryptoUtils.randomHex(16), userId, fromDeviceId, toDeviceId, metadata,
                keyPackage, SyncStatus.PENDING, null, now, null, now.plus(ttl));
        storage.run(() -> repository.insert(syncPackage));
        logger.info("Created {} sync package {} for devices {} -> {}", metadata.keyType().identifier(),
                syncPackage.packageId(), fromDeviceId, toDeviceId);

        try {
            notifier.notify(new Notification(userId, toDeviceId, Event.KEY_SYNC_PACKAGE, syncPackage.packageId()));
        } catch (RuntimeException e) {
            logger.warn("Failed to notify device {} of package {}: {}", toDeviceId, syncPackage.packageId(),
                    e.getMessage());
        }
        return syncPackage;
    }

    /**
     * Pending, unexpired packages for a device, most urgent first and oldest first within a priority.
     */
    public List<KeySyncPackage> listPending(String deviceId, String userId) {
        Require.notBlank(deviceId, "deviceId");
        Require.notBlank(userId, "userId");
        if (!isOwnedBy(deviceId, userId)) {
            throw new KeyRelayException(ErrorCode.EXCHANGE_UNAUTHORIZED, "Device not owned by caller");
        }

        var now = clock.instant();
        var result = new ArrayList<KeySyncPackage>();
        for (var syncPackage : storage.call(() -> repository.findPendingFor(deviceId))) {
            if (syncPackage.isExpiredAt(now)) {
                storage.call(() -> repository.compareAndSet(syncPackage.packageId(), SyncStatus.PENDING,
                        syncPackage.expired()));
            } else {
                result.add(syncPackage);
            }
        }
        result.sort(DELIVERY_ORDER);
        return result;
    }

    /**
     * Records the outcome reported by the target device.
     *
     * @param errorMessage kept only when {@code success} is false.
     */
    public KeySyncPackage markProcessed(String packageId, String userId, boolean success, String errorMessage) {
        Require.notBlank(packageId, "packageId");
        Require.notBlank(userId, "userId");

        var syncPackage = storage.call(() -> repository.find(packageId)).orElseThrow(() ->
                new KeyRelayException(ErrorCode.PACKAGE_NOT_FOUND, "Sync package not found"));
        if (!syncPackage.userId().equals(userId) || !isOwnedBy(syncPackage.toDeviceId(), userId)) {
            throw new KeyRelayException(ErrorCode.EXCHANGE_UNAUTHORIZED, "Not the owner of the target device");
        }
        var now = clock.instant();
        if (syncPackage.status() == SyncStatus.PENDING && syncPackage.isExpiredAt(now)) {
            storage.call(() -> repository.compareAndSet(packageId, SyncStatus.PENDING, syncPackage.expired()));
            throw new KeyRelayException(ErrorCode.EXCHANGE_INVALID_STATE, "Sync package has expired");
        }

        var updated = syncPackage.finished(success, errorMessage, now);
        if (syncPackage.status() != SyncStatus.PENDING
                || !storage.call(() -> repository.compareAndSet(packageId, SyncStatus.PENDING, updated))) {
            throw new KeyRelayException(ErrorCode.EXCHANGE_INVALID_STATE, "Sync package is no longer pending");
        }
        logger.info("Sync package {} {}", packageId, updated.status().identifier());
        return updated;
    }

    /**
     * @return the number of pending packages marked expired.
     */
    public int cleanupExpired() {
        int expired = storage.call(() -> repository.expirePendingBefore(clock.instant()));
        if (expired > 0) {
            logger.info("Expired {} undelivered sync packages", expired);
        }
        return expired;
    }

    private boolean isOwnedBy(String deviceId, String userId) {
        return storage.call(() -> devices.isOwnedBy(deviceId, userId));
    }
}
