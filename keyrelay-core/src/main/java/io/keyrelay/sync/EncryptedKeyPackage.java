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

import io.keyrelay.Require;

/**
 * Key material encrypted by the source device for the target device. Opaque to the relay.
 *
 * @param integrityHash hash the target device checks after decryption.
 * @param signature optional source device signature.
 */
public record EncryptedKeyPackage(byte[] encryptedData, String integrityHash, byte[] signature,
        String encryptionMethod) {

    public EncryptedKeyPackage {
        Require.notEmpty(encryptedData, "encryptedData");
        Require.notBlank(integrityHash, "integrityHash");
        Require.notBlank(encryptionMethod, "encryptionMethod");
        encryptedData = encryptedData.clone();
        signature = signature == null ? null : signature.clone();
    }

    @Override
    public byte[] encryptedData() {
        return encryptedData.clone();
    }

    @Override
    public byte[] signature() {
        return signature == null ? null : signature.clone();
    }
}
