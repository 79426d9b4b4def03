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

public enum SignatureAlgorithm implements NamedAlgorithm {
    ED25519("ed25519", 1, false),
    DILITHIUM3("dilithium3", 3, true);

    private final String identifier;
    private final int securityLevel;
    private final boolean quantumResistant;

    SignatureAlgorithm(String identifier, int securityLevel, boolean quantumResistant) {
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

    public static SignatureAlgorithm fromIdentifier(String identifier) {
        return NamedAlgorithm.fromIdentifier(SignatureAlgorithm.class, identifier);
    }
}
