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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Function;

import com.grack.nanojson.JsonArray;
import com.grack.nanojson.JsonObject;

import io.keyrelay.KeyRelayException;
import io.keyrelay.Require;

/**
 * What one party supports. Used to pick a suite and kept on the negotiation record for audit.
 */
public record AlgorithmCapabilities(
        Set<KeyExchangeAlgorithm> keyExchange,
        Set<SignatureAlgorithm> signature,
        Set<EncryptionAlgorithm> encryption,
        int maxSecurityLevel,
        boolean supportsPfs,
        boolean supportsDoubleRatchet) {

    public static final AlgorithmCapabilities CLASSICAL = new AlgorithmCapabilities(
            EnumSet.of(KeyExchangeAlgorithm.X25519), EnumSet.of(SignatureAlgorithm.ED25519),
            EnumSet.allOf(EncryptionAlgorithm.class), 1, true, true);

    public static final AlgorithmCapabilities HYBRID = new AlgorithmCapabilities(
            EnumSet.allOf(KeyExchangeAlgorithm.class), EnumSet.allOf(SignatureAlgorithm.class),
            EnumSet.allOf(EncryptionAlgorithm.class), 3, true, true);

    public AlgorithmCapabilities {
        Require.notEmpty(keyExchange, "keyExchange capabilities");
        Require.notEmpty(signature, "signature capabilities");
        Require.notEmpty(encryption, "encryption capabilities");
        Require.between(maxSecurityLevel, 1, 5, "maxSecurityLevel");
        keyExchange = Collections.unmodifiableSet(EnumSet.copyOf(keyExchange));
        signature = Collections.unmodifiableSet(EnumSet.copyOf(signature));
        encryption = Collections.unmodifiableSet(EnumSet.copyOf(encryption));
    }

    public boolean supports(SelectedAlgorithms suite) {
        return keyExchange.contains(suite.keyExchange()) && signature.contains(suite.signature())
                && encryption.contains(suite.encryption());
    }

    public JsonObject toJson() {
        return JsonObject.builder()
                .value("keyExchange", identifiers(keyExchange))
                .value("signature", identifiers(signature))
                .value("encryption", identifiers(encryption))
                .value("maxSecurityLevel", maxSecurityLevel)
                .value("supportsPfs", supportsPfs)
                .value("supportsDoubleRatchet", supportsDoubleRatchet)
                .done();
    }

    public static AlgorithmCapabilities fromJson(JsonObject json) {
        if (json == null) {
            throw KeyRelayException.validation("capabilities are required");
        }
        return new AlgorithmCapabilities(
                parse(json.get("keyExchange"), KeyExchangeAlgorithm.class, KeyExchangeAlgorithm::fromIdentifier),
                parse(json.get("signature"), SignatureAlgorithm.class, SignatureAlgorithm::fromIdentifier),
                parse(json.get("encryption"), EncryptionAlgorithm.class, EncryptionAlgorithm::fromIdentifier),
                json.getInt("maxSecurityLevel", 1),
                json.getBoolean("supportsPfs", true),
                json.getBoolean("supportsDoubleRatchet", true));
    }

    private static JsonArray identifiers(Set<? extends NamedAlgorithm> algorithms) {
        var names = new ArrayList<String>();
        algorithms.forEach(a -> names.add(a.identifier()));
        return new JsonArray(names);
    }

    private static <E extends Enum<E>> Set<E> parse(Object names, Class<E> type, Function<String, E> lookup) {
        var result = EnumSet.noneOf(type);
        if (names instanceof JsonArray array) {
            for (var name : array) {
                if (!(name instanceof String s)) {
                    throw KeyRelayException.validation("Algorithm names must be strings");
                }
                result.add(lookup.apply(s));
            }
        }
        return result;
    }
}
