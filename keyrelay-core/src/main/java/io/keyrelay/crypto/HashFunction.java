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

import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import javax.crypto.Mac;
import javax.crypto.SecretKey;

/**
 * The hash used for ratchet key ids and, as HMAC, for chain steps and HKDF. Digest and MAC instances are cached per
 * thread because the ratchet derives two chain outputs for every message.
 */
public enum HashFunction {
    SHA256("SHA-256", "HmacSHA256", 32);

    private final String digestAlgorithm;
    private final int outputSizeBytes;
    private final ThreadLocal<MessageDigest> digests;
    private final PRF hmac;

    HashFunction(String digestAlgorithm, String macAlgorithm, int outputSizeBytes) {
        this.digestAlgorithm = digestAlgorithm;
        this.outputSizeBytes = outputSizeBytes;
        this.digests = ThreadLocal.withInitial(() -> {
            try {
                return MessageDigest.getInstance(digestAlgorithm);
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException(e);
            }
        });
        this.hmac = new Hmac(macAlgorithm, outputSizeBytes);
    }

    public byte[] hash(byte[] data) {
        var digest = digests.get();
        digest.reset();
        return digest.digest(data);
    }

    public int outputSizeBytes() {
        return outputSizeBytes;
    }

    /**
     * HMAC over this hash, with the full-length tag.
     */
    public PRF hmac() {
        return hmac;
    }

    @Override
    public String toString() {
        return digestAlgorithm;
    }

    private static final class Hmac implements PRF {
        private final String macAlgorithm;
        private final int tagSize;
        private final ThreadLocal<Mac> macs;

        Hmac(String macAlgorithm, int tagSize) {
            this.macAlgorithm = macAlgorithm;
            this.tagSize = tagSize;
            this.macs = ThreadLocal.withInitial(() -> {
                try {
                    return Mac.getInstance(macAlgorithm);
                } catch (NoSuchAlgorithmException e) {
                    throw new IllegalStateException(e);
                }
            });
        }

        @Override
        public String algorithm() {
            return macAlgorithm;
        }

        @Override
        public int outputSizeBytes() {
            return tagSize;
        }

        @Override
        public byte[] apply(SecretKey key, byte[] data) {
            var mac = macs.get();
            try {
                mac.init(key);
            } catch (InvalidKeyException e) {
                throw new IllegalArgumentException("Unusable " + macAlgorithm + " key", e);
            }
            return mac.doFinal(data);
        }
    }
}
