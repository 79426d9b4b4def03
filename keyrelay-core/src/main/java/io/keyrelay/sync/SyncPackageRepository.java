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
import java.util.List;
import java.util.Optional;

/**
 * Storage for sync packages.
 */
public interface SyncPackageRepository {

    void insert(KeySyncPackage syncPackage);

    Optional<KeySyncPackage> find(String packageId);

    /**
     * Replaces the stored package only if its current status is {@code expectedStatus}.
     */
    boolean compareAndSet(String packageId, SyncStatus expectedStatus, KeySyncPackage updated);

    List<KeySyncPackage> findPendingFor(String toDeviceId);

    /**
     * Marks every pending package whose expiry time is before {@code now} as expired.
     *
     * @return the number of packages changed.
     */
    int expirePendingBefore(Instant now);
}
