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

import static java.util.Objects.requireNonNull;

/**
 * The algorithm suite two parties settled on.
 */
public record SelectedAlgorithms(KeyExchangeAlgorithm keyExchange, SignatureAlgorithm signature,
        EncryptionAlgorithm encryption) {

    public static final SelectedAlgorithms DEFAULT = new SelectedAlgorithms(KeyExchangeAlgorithm.HYBRID,
            SignatureAlgorithm.DILITHIUM3, EncryptionAlgorithm.CHACHA20_POLY1305);

    public SelectedAlgorithms {
        requireNonNull(keyExchange, "keyExchange");
        requireNonNull(signature, "signature");
        requireNonNull(encryption, "encryption");
    }

    /**
     * The security level of the weakest component.
     */
    public int securityLevel() {
        return Math.min(keyExchange.securityLevel(), Math.min(signature.securityLevel(), encryption.securityLevel()));
    }

    public boolean isQuantumResistant() {
        return keyExchange.isQuantumResistant() && signature.isQuantumResistant();
    }

    public boolean isHybrid() {
        return keyExchange == KeyExchangeAlgorithm.HYBRID;
    }
}
