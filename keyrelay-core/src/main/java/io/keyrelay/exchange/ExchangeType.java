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

package io.keyrelay.exchange;

import io.keyrelay.KeyRelayException;

public enum ExchangeType {
    INITIAL_SETUP("initial_setup"),
    RATCHET_UPDATE("ratchet_update"),
    PQC_UPGRADE("pqc_upgrade"),
    DEVICE_ADDITION("device_addition");

    private final String identifier;

    ExchangeType(String identifier) {
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }

    public static ExchangeType fromIdentifier(String identifier) {
        for (var type : values()) {
            if (type.identifier.equals(identifier)) {
                return type;
            }
        }
        throw KeyRelayException.validation("Unknown exchange type: " + identifier);
    }
}
