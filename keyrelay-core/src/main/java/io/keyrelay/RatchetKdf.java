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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.Arrays;
import java.util.HexFormat;

import io.keyrelay.crypto.CryptoUtils;
import io.keyrelay.crypto.DestroyableSecretKey;
import io.keyrelay.crypto.HKDF;
import io.keyrelay.crypto.HashFunction;
import io.keyrelay.crypto.PRF;

/**
 * Key derivation steps of the ratchet. The symmetric chain step is HMAC-SHA-256 with distinct single-byte inputs for
 * the message key and the next chain key; the root step is HKDF keyed by the current root key.
 */
final class RatchetKdf {
    static final int KEY_SIZE = 32;

    private static final PRF CHAIN_PRF = HashFunction.SHA256.hmac();
    private static final byte[] MESSAGE_KEY_INPUT = { 0x01 };
    private static final byte[] CHAIN_KEY_INPUT = { 0x02 };

    private static final byte[] INIT_SALT = "KeyRelay-Ratchet-v1".getBytes(UTF_8);
    private static final byte[] INIT_INFO = "init".getBytes(UTF_8);
    private static final byte[] ROOT_INFO = "KeyRelay-Ratchet-Root".getBytes(UTF_8);

    record KeyPairBytes(byte[] privateKey, byte[] publicKey) {}

    record InitialKeys(byte[] rootKey, byte[] bootstrapSeed) {}

    /**
     * Derived key and the chain key that replaces the input.
     */
    record ChainStep(byte[] messageKey, byte[] nextChainKey) {}

    record RootStep(byte[] rootKey, byte[] chainKey) {}

    static InitialKeys initial(byte[] sharedSecret) {
        var okm = HKDF.derive(INIT_SALT, sharedSecret, INIT_INFO, 2 * KEY_SIZE);
        try {
            return new InitialKeys(Arrays.copyOf(okm, KEY_SIZE), Arrays.copyOfRange(okm, KEY_SIZE, 2 * KEY_SIZE));
        } finally {
            CryptoUtils.wipe(okm);
        }
    }

    static ChainStep chain(byte[] chainKey) {
        try (var key = new DestroyableSecretKey(chainKey, CHAIN_PRF.algorithm())) {
            return new ChainStep(CHAIN_PRF.apply(key, MESSAGE_KEY_INPUT), CHAIN_PRF.apply(key, CHAIN_KEY_INPUT));
        }
    }

    static RootStep root(byte[] rootKey, byte[] dhOutput) {
        var okm = HKDF.derive(rootKey, dhOutput, ROOT_INFO, 2 * KEY_SIZE);
        try {
            return new RootStep(Arrays.copyOf(okm, KEY_SIZE), Arrays.copyOfRange(okm, KEY_SIZE, 2 * KEY_SIZE));
        } finally {
            CryptoUtils.wipe(okm);
        }
    }

    /**
     * Short public identifier of a ratchet public key, carried in envelopes as {@code keyId}.
     */
    static String keyId(byte[] ratchetPublicKey) {
        var digest = HashFunction.SHA256.hash(ratchetPublicKey);
        return HexFormat.of().formatHex(digest, 0, 8);
    }

    private RatchetKdf() {}
}
