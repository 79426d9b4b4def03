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

import java.util.Locale;

import io.keyrelay.KeyRelayException;

/**
 * An algorithm with a stable wire identifier.
 */
public interface NamedAlgorithm {
    String identifier();

    int securityLevel();

    boolean isQuantumResistant();

    /**
     * Looks up an algorithm by identifier. Matching ignores case and punctuation, so {@code "AES-256-GCM"} and
     * {@code "aes256gcm"} name the same cipher.
     */
    static <E extends Enum<E> & NamedAlgorithm> E fromIdentifier(Class<E> type, String identifier) {
        if (identifier != null) {
            var wanted = normalize(identifier);
            for (var candidate : type.getEnumConstants()) {
                if (normalize(candidate.identifier()).equals(wanted)) {
                    return candidate;
                }
            }
        }
        throw KeyRelayException.validation("Unsupported algorithm: " + identifier);
    }

    private static String normalize(String identifier) {
        return identifier.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
