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

import java.util.Collection;

/**
 * Argument checks for public operations. Unlike plain {@link IllegalArgumentException}s these surface to callers as
 * {@link ErrorCode#VALIDATION_ERROR}.
 */
public final class Require {
    public static String notBlank(String item, String name) {
        if (item == null || item.isBlank()) {
            throw KeyRelayException.validation(name + " is required");
        }
        return item;
    }

    public static <T> T notNull(T item, String name) {
        if (item == null) {
            throw KeyRelayException.validation(name + " is required");
        }
        return item;
    }

    public static byte[] notEmpty(byte[] item, String name) {
        if (item == null || item.length == 0) {
            throw KeyRelayException.validation(name + " is required");
        }
        return item;
    }

    public static <T extends Collection<?>> T notEmpty(T items, String name) {
        if (items == null || items.isEmpty()) {
            throw KeyRelayException.validation(name + " must not be empty");
        }
        return items;
    }

    public static byte[] length(byte[] item, int expected, String name) {
        if (item == null || item.length != expected) {
            throw KeyRelayException.validation(name + " must be " + expected + " bytes");
        }
        return item;
    }

    /**
     * As {@link #length(byte[], int, String)}, but an absent value is allowed.
     */
    public static byte[] lengthIfPresent(byte[] item, int expected, String name) {
        return item == null ? null : length(item, expected, name);
    }

    public static int notNegative(int value, String name) {
        if (value < 0) {
            throw KeyRelayException.validation(name + " must not be negative");
        }
        return value;
    }

    public static int between(int value, int lowerBound, int upperBound, String name) {
        if (value < lowerBound || value > upperBound) {
            throw KeyRelayException.validation(name + " must be between " + lowerBound + " and " + upperBound);
        }
        return value;
    }

    public static void rejectIf(boolean condition, String msg) {
        if (condition) {
            throw KeyRelayException.validation(msg);
        }
    }

    private Require() {}
}
