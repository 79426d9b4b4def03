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

package io.keyrelay.store;

import io.keyrelay.crypto.DestroyableSecretKey;

/**
 * Supplies the operator key used to encrypt ratchet state at rest.
 */
@FunctionalInterface
public interface StateEncryptionKeyProvider {

    /**
     * Returns the 32-byte at-rest key. Callers destroy the returned key after use, so implementations must return a
     * fresh copy each time.
     */
    DestroyableSecretKey stateKey();

    static StateEncryptionKeyProvider of(byte[] keyMaterial) {
        if (keyMaterial == null || keyMaterial.length != 32) {
            throw new IllegalArgumentException("State encryption key must be 32 bytes");
        }
        var copy = keyMaterial.clone();
        return () -> new DestroyableSecretKey(copy, "AES");
    }
}
