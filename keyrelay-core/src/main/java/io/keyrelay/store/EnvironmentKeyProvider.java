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

package io.keyrelay.store;

import java.util.Base64;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.keyrelay.config.KeyRelayConfig;
import io.keyrelay.crypto.CryptoUtils;

/**
 * Reads the at-rest key from an environment variable holding 32 bytes of standard base64. There is no built-in
 * default key: in production mode a missing or malformed key stops startup, and in development mode a random key is
 * generated for the lifetime of the process, so stored state does not survive a restart.
 */
public final class EnvironmentKeyProvider {
    private static final Logger logger = LoggerFactory.getLogger(EnvironmentKeyProvider.class);

    public static StateEncryptionKeyProvider fromEnvironment(KeyRelayConfig config, Map<String, String> environment) {
        var variable = config.stateKeyEnvironmentVariable();
        var encoded = environment.get(variable);
        if (encoded == null || encoded.isBlank()) {
            if (config.isProduction()) {
                throw new IllegalStateException("At-rest encryption key " + variable + " is not set");
            }
            logger.warn("{} is not set: using an ephemeral random key. Stored ratchet state will be unreadable " +
                    "after restart. Do not use this mode in production.", variable);
            return StateEncryptionKeyProvider.of(CryptoUtils.randomBytes(32));
        }
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(variable + " is not valid base64", e);
        }
        if (decoded.length != 32) {
            CryptoUtils.wipe(decoded);
            throw new IllegalStateException(variable + " must decode to exactly 32 bytes");
        }
        try {
            return StateEncryptionKeyProvider.of(decoded);
        } finally {
            CryptoUtils.wipe(decoded);
        }
    }

    public static StateEncryptionKeyProvider fromEnvironment(KeyRelayConfig config) {
        return fromEnvironment(config, System.getenv());
    }

    private EnvironmentKeyProvider() {}
}
