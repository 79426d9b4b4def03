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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemorySyncPackageRepository implements SyncPackageRepository {
    private final ConcurrentHashMap<String, KeySyncPackage> packages = new ConcurrentHashMap<>();

    @Override
    public void insert(KeySyncPackage syncPackage) {
        if (packages.putIfAbsent(syncPackage.packageId(), syncPackage) != null) {
            throw new IllegalStateException("Duplicate package id");
        }
    }

    @Override
    public Optional<KeySyncPackage> find(String packageId) {
        return Optional.ofNullable(packages.get(packageId));
    }

    @Override
    public boolean compareAndSet(String packageId, SyncStatus expectedStatus, KeySyncPackage updated) {
        var applied = new boolean[1];
        packages.computeIfPresent(packageId, (id, current) -> {
            if (current.status() != expectedStatus) {
                return current;
            }
            applied[0] = true;
            return updated;
        });
        return applied[0];
    }

    @Override
    public List<KeySyncPackage> findPendingFor(String toDeviceId) {
        var result = new ArrayList<KeySyncPackage>();
        for (var syncPackage : packages.values()) {
            if (syncPackage.status() == SyncStatus.PENDING && syncPackage.toDeviceId().equals(toDeviceId)) {
                result.add(syncPackage);
            }
        }
        return result;
    }

    @Override
    public int expirePendingBefore(Instant now) {
        int count = 0;
        for (var syncPackage : packages.values()) {
            if (syncPackage.status() == SyncStatus.PENDING && syncPackage.expiresAt().isBefore(now)
                    && compareAndSet(syncPackage.packageId(), SyncStatus.PENDING, syncPackage.expired())) {
                count++;
            }
        }
        return count;
    }
}
