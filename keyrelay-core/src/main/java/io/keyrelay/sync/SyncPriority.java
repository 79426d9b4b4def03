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
 * Delivery priority of a sync package. Declared in ascending order of urgency.
 */
public enum SyncPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public String identifier() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a priority, defaulting to {@link #MEDIUM} when none is given.
     */
    public static SyncPriority fromIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return MEDIUM;
        }
        for (var priority : values()) {
            if (priority.identifier().equals(identifier)) {
                return priority;
            }
        }
        throw KeyRelayException.validation("Unknown sync priority: " + identifier);
    }
}
