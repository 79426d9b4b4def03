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

package io.keyrelay.negotiation;

/**
 * Symmetric message ciphers. Both are 256-bit, so neither is weakened to below level 3 by a quantum adversary.
 */
public enum EncryptionAlgorithm implements NamedAlgorithm {
    CHACHA20_POLY1305("chacha20poly1305"),
    AES_256_GCM("aes-256-gcm");

    private final String identifier;

    EncryptionAlgorithm(String identifier) {
        this.identifier = identifier;
    }

    @Override
    public String identifier() {
        return identifier;
    }

    @Override
    public int securityLevel() {
        return 5;
    }

    @Override
    public boolean isQuantumResistant() {
        return true;
    }

    public static EncryptionAlgorithm fromIdentifier(String identifier) {
        return NamedAlgorithm.fromIdentifier(EncryptionAlgorithm.class, identifier);
    }
}
