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

package io.keyrelay.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runtime settings. Values come from {@code keyrelay.properties} on the classpath and can be overridden by
 * environment variables named after the property: {@code keyrelay.ratchet.max-skip} becomes
 * {@code KEYRELAY_RATCHET_MAX_SKIP}.
 */
public record KeyRelayConfig(
        Mode mode,
        String stateKeyEnvironmentVariable,
        int maxSkip,
        int maxRetainedSkippedKeys,
        Duration skippedKeyTtl,
        Duration exchangeTtl,
        Duration syncPackageTtl,
        Duration negotiationTtl,
        Duration cleanupInterval) {

    private static final Logger logger = LoggerFactory.getLogger(KeyRelayConfig.class);

    public static final String RESOURCE_NAME = "keyrelay.properties";

    public enum Mode {
        PRODUCTION,
        DEVELOPMENT
    }

    public KeyRelayConfig {
        if (maxSkip < 1) {
            throw new IllegalArgumentException("keyrelay.ratchet.max-skip must be positive");
        }
        if (maxRetainedSkippedKeys < 1) {
            throw new IllegalArgumentException("keyrelay.ratchet.max-retained-skipped-keys must be positive");
        }
        requirePositive(skippedKeyTtl, "keyrelay.skipped-key.ttl");
        requirePositive(exchangeTtl, "keyrelay.exchange.ttl");
        requirePositive(syncPackageTtl, "keyrelay.sync.ttl");
        requirePositive(negotiationTtl, "keyrelay.negotiation.ttl");
        requirePositive(cleanupInterval, "keyrelay.cleanup.interval");
    }

    public static KeyRelayConfig defaults() {
        return from(new Properties(), Map.of());
    }

    /**
     * Loads configuration from the classpath resource and the process environment.
     */
    public static KeyRelayConfig load() {
        var properties = new Properties();
        try (InputStream in = KeyRelayConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.info("No {} found on classpath, using defaults", RESOURCE_NAME);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + RESOURCE_NAME, e);
        }
        return from(properties, System.getenv());
    }

    public static KeyRelayConfig from(Properties properties, Map<String, String> environment) {
        var source = new Source(properties, environment);
        return new KeyRelayConfig(
                Mode.valueOf(source.get("keyrelay.mode", "production").toUpperCase(Locale.ROOT)),
                source.get("keyrelay.state-key.env", "RATCHET_STATE_ENCRYPTION_KEY"),
                source.getInt("keyrelay.ratchet.max-skip", 1000),
                source.getInt("keyrelay.ratchet.max-retained-skipped-keys", 1000),
                source.getDuration("keyrelay.skipped-key.ttl", "P7D"),
                source.getDuration("keyrelay.exchange.ttl", "PT24H"),
                source.getDuration("keyrelay.sync.ttl", "PT24H"),
                source.getDuration("keyrelay.negotiation.ttl", "P30D"),
                source.getDuration("keyrelay.cleanup.interval", "PT1H"));
    }

    public boolean isProduction() {
        return mode == Mode.PRODUCTION;
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    private record Source(Properties properties, Map<String, String> environment) {
        String get(String key, String defaultValue) {
            var envName = key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
            var value = environment.get(envName);
            if (value == null || value.isBlank()) {
                value = properties.getProperty(key);
            }
            return value == null || value.isBlank() ? defaultValue : value.trim();
        }

        int getInt(String key, int defaultValue) {
            var value = get(key, Integer.toString(defaultValue));
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
            }
        }

        Duration getDuration(String key, String defaultValue) {
            var value = get(key, defaultValue);
            try {
                return Duration.parse(value);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid ISO-8601 duration for " + key + ": " + value, e);
            }
        }
    }
}
