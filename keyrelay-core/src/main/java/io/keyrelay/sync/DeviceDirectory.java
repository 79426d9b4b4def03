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

import java.util.List;
import java.util.Optional;

/**
 * Resolves devices to the users that own them. Device registration and verification belong to the client device
 * management layer; the relay only needs ownership lookups.
 */
public interface DeviceDirectory {

    Optional<DeviceIdentity> find(String deviceId);

    /**
     * Registers a device, or updates it if the same user registered it before.
     *
     * @throws io.keyrelay.KeyRelayException with {@link io.keyrelay.ErrorCode#DEVICE_OWNERSHIP_MISMATCH} if the
     * device id is already registered to another user.
     */
    DeviceIdentity register(DeviceIdentity device);

    List<DeviceIdentity> devicesOf(String userId);

    default boolean isOwnedBy(String deviceId, String userId) {
        return find(deviceId).map(device -> device.isOwnedBy(userId)).orElse(false);
    }
}
