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

package io.keyrelay.crypto;

import static io.keyrelay.crypto.HashFunction.SHA256;

/**
 * HKDF (RFC 5869) over HMAC-SHA-256. Used for the initial ratchet root, every root key step and the hybrid key
 * agreement's combined secret.
 */
public final class HKDF {
    private static final PRF HMAC = SHA256.hmac();
    private static final int BLOCK_SIZE = SHA256.outputSizeBytes();
    private static final int MAX_OUTPUT = 255 * BLOCK_SIZE;

    /**
     * The extract step. An absent or empty salt is replaced with a block of zeroes.
     */
    public static DestroyableSecretKey extract(byte[] salt, byte[] inputKeyMaterial) {
        var effectiveSalt = salt == null || salt.length == 0 ? new byte[BLOCK_SIZE] : salt;
        try (var saltKey = new DestroyableSecretKey(effectiveSalt, HMAC.algorithm())) {
            var prk = HMAC.apply(saltKey, inputKeyMaterial);
            try {
                return new DestroyableSecretKey(prk, HMAC.algorithm());
            } finally {
                CryptoUtils.wipe(prk);
            }
        }
    }

    public static byte[] expand(DestroyableSecretKey prk, byte[] info, int length) {
        if (length < 1 || length > MAX_OUTPUT) {
            throw new IllegalArgumentException("HKDF output length must be between 1 and " + MAX_OUTPUT);
        }
        var okm = new byte[length];
        var block = new byte[0];
        for (int i = 1, pos = 0; pos < length; i++, pos += BLOCK_SIZE) {
            var previous = block;
            block = HMAC.apply(prk, CryptoUtils.concat(previous, info, new byte[] { (byte) i }));
            CryptoUtils.wipe(previous);
            System.arraycopy(block, 0, okm, pos, Math.min(BLOCK_SIZE, length - pos));
        }
        CryptoUtils.wipe(block);
        return okm;
    }

    public static byte[] derive(byte[] salt, byte[] inputKeyMaterial, byte[] info, int length) {
        try (var prk = extract(salt, inputKeyMaterial)) {
            return expand(prk, info, length);
        }
    }

    private HKDF() {}
}
