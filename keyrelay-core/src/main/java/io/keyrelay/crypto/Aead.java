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

import java.util.Optional;

/**
 * An authenticated encryption cipher with associated data. Tags are returned separately from the ciphertext because
 * both the message envelope and the at-rest record carry them as distinct fields.
 */
public interface Aead {
    Aead CHACHA20_POLY1305 = JdkAead.CHACHA20_POLY1305;
    Aead AES256_GCM = JdkAead.AES256_GCM;

    int TAG_SIZE_BYTES = 16;

    /**
     * The stable identifier of this cipher as it appears in envelopes and negotiation records.
     */
    String identifier();

    int keySizeBytes();

    int nonceSizeBytes();

    Sealed seal(DestroyableSecretKey key, byte[] nonce, byte[] plaintext, byte[] associatedData);

    /**
     * Decrypts and verifies a ciphertext.
     *
     * @return the plaintext, or an empty result if the tag, nonce, key or associated data do not match.
     */
    Optional<byte[]> open(DestroyableSecretKey key, byte[] nonce, byte[] ciphertext, byte[] tag,
            byte[] associatedData);

    /**
     * Imports raw key material for use with this cipher.
     */
    DestroyableSecretKey importKey(byte[] keyMaterial);

    record Sealed(byte[] ciphertext, byte[] tag) {}
}
