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

package io.keyrelay;

import java.time.Duration;
import java.time.Instant;

/**
 * Reporting windows for statistics endpoints.
 */
public enum Timeframe {
    ONE_HOUR("1h", Duration.ofHours(1)),
    ONE_DAY("24h", Duration.ofHours(24)),
    SEVEN_DAYS("7d", Duration.ofDays(7)),
    THIRTY_DAYS("30d", Duration.ofDays(30));

    private final String identifier;
    private final Duration length;

    Timeframe(String identifier, Duration length) {
        this.identifier = identifier;
        this.length = length;
    }

    public String identifier() {
        return identifier;
    }

    public Instant startingBefore(Instant now) {
        return now.minus(length);
    }

    /**
     * Parses a timeframe identifier, defaulting to 24 hours when none is given.
     */
    public static Timeframe fromIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return ONE_DAY;
        }
        for (var timeframe : values()) {
            if (timeframe.identifier.equals(identifier)) {
                return timeframe;
            }
        }
        throw KeyRelayException.validation("Unknown timeframe: " + identifier);
    }
}
