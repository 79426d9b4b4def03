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

import java.time.Instant;

/**
 * An encrypted key package travelling between two devices of the same user.
 *
 * @param errorMessage set when the target device reported a failure.
 * @param processedAt set once the package is processed or failed.
 */
public record KeySyncPackage(
        String packageId,
        String userId,
        String fromDeviceId,
        String toDeviceId,
        PackageMetadata metadata,
        EncryptedKeyPackage keyPackage,
        SyncStatus status,
        String errorMessage,
        Instant createdAt,
        Instant processedAt,
        Instant expiresAt) {

    public KeySyncPackage {
        requireNonNull(packageId, "packageId");
        requireNonNull(userId, "userId");
        requireNonNull(fromDeviceId, "fromDeviceId");
        requireNonNull(toDeviceId, "toDeviceId");
        requireNonNull(metadata, "metadata");
        requireNonNull(keyPackage, "keyPackage");
        requireNonNull(status, "status");
        requireNonNull(createdAt, "createdAt");
        requireNonNull(expiresAt, "expiresAt");
    }

    public SyncPriority priority() {
        return metadata.priority();
    }

    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    KeySyncPackage finished(boolean success, String error, Instant when) {
        return new KeySyncPackage(packageId, userId, fromDeviceId, toDeviceId, metadata, keyPackage,
                success ? SyncStatus.PROCESSED : SyncStatus.FAILED, success ? null : error, createdAt, when,
                expiresAt);
    }

    KeySyncPackage expired() {
        return new KeySyncPackage(packageId, userId, fromDeviceId, toDeviceId, metadata, keyPackage,
                SyncStatus.EXPIRED, errorMessage, createdAt, processedAt, expiresAt);
    }
}
