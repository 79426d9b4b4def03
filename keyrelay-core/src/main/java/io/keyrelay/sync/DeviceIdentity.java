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
 * A registered device and the user that owns it. The relay keeps only the device's public key.
 */
public record DeviceIdentity(String deviceId, String userId, String deviceName, String deviceType,
        String platform, byte[] publicKey, Instant registeredAt) {

    public DeviceIdentity {
        requireNonNull(deviceId, "deviceId");
        requireNonNull(userId, "userId");
        requireNonNull(registeredAt, "registeredAt");
        publicKey = publicKey == null ? null : publicKey.clone();
    }

    @Override
    public byte[] publicKey() {
        return publicKey == null ? null : publicKey.clone();
    }

    public boolean isOwnedBy(String userId) {
        return this.userId.equals(userId);
    }
}
