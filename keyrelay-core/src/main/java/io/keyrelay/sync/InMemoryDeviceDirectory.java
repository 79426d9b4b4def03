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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.keyrelay.ErrorCode;
import io.keyrelay.KeyRelayException;

public final class InMemoryDeviceDirectory implements DeviceDirectory {
    private final ConcurrentHashMap<String, DeviceIdentity> devices = new ConcurrentHashMap<>();

    @Override
    public Optional<DeviceIdentity> find(String deviceId) {
        return deviceId == null ? Optional.empty() : Optional.ofNullable(devices.get(deviceId));
    }

    @Override
    public DeviceIdentity register(DeviceIdentity device) {
        return devices.compute(device.deviceId(), (id, existing) -> {
            if (existing != null && !existing.isOwnedBy(device.userId())) {
                throw new KeyRelayException(ErrorCode.DEVICE_OWNERSHIP_MISMATCH,
                        "Device is already registered to another user");
            }
            return device;
        });
    }

    @Override
    public List<DeviceIdentity> devicesOf(String userId) {
        var result = new ArrayList<DeviceIdentity>();
        for (var device : devices.values()) {
            if (device.isOwnedBy(userId)) {
                result.add(device);
            }
        }
        return result;
    }
}
