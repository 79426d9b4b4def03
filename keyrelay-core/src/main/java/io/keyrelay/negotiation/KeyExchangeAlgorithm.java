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

public enum KeyExchangeAlgorithm implements NamedAlgorithm {
    X25519("x25519", 1, false),
    KYBER768("kyber768", 3, true),
    /** X25519 combined with Kyber768. */
    HYBRID("hybrid", 3, true);

    private final String identifier;
    private final int securityLevel;
    private final boolean quantumResistant;

    KeyExchangeAlgorithm(String identifier, int securityLevel, boolean quantumResistant) {
        this.identifier = identifier;
        this.securityLevel = securityLevel;
        this.quantumResistant = quantumResistant;
    }

    @Override
    public String identifier() {
        return identifier;
    }

    @Override
    public int securityLevel() {
        return securityLevel;
    }

    @Override
    public boolean isQuantumResistant() {
        return quantumResistant;
    }

    public static KeyExchangeAlgorithm fromIdentifier(String identifier) {
        return NamedAlgorithm.fromIdentifier(KeyExchangeAlgorithm.class, identifier);
    }
}
