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

import java.util.Locale;

import io.keyrelay.KeyRelayException;

/**
 * The kind of key material carried by a sync package.
 */
public enum KeyType {
    RATCHET_STATE,
    CONVERSATION_KEY,
    DEVICE_KEY,
    HYBRID_KEY;

    public String identifier() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static KeyType fromIdentifier(String identifier) {
        for (var type : values()) {
            if (type.identifier().equals(identifier)) {
                return type;
            }
        }
        throw KeyRelayException.validation("Unknown key type: " + identifier);
    }
}
