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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import io.keyrelay.ErrorCode;
import io.keyrelay.KeyRelayException;
import io.keyrelay.crypto.Aead;
import io.keyrelay.crypto.CryptoUtils;

/**
 * Encrypts individual secret fields under the at-rest key. Each field is bound to its owner and field name through
 * the associated data, so a sealed value copied into another record or another field fails to open.
 */
final class FieldSealer {
    private static final Aead CIPHER = Aead.AES256_GCM;

    private final StateEncryptionKeyProvider keyProvider;

    FieldSealer(StateEncryptionKeyProvider keyProvider) {
        this.keyProvider = requireNonNull(keyProvider, "keyProvider");
    }

    SealedBox seal(byte[] plaintext, String... context) {
        var nonce = CryptoUtils.randomBytes(CIPHER.nonceSizeBytes());
        try (var key = keyProvider.stateKey()) {
            var sealed = CIPHER.seal(key, nonce, plaintext, associatedData(context));
            return new SealedBox(sealed.ciphertext(), nonce, sealed.tag());
        }
    }

    byte[] open(SealedBox box, String... context) {
        try (var key = keyProvider.stateKey()) {
            return CIPHER.open(key, box.nonce(), box.ciphertext(), box.authTag(), associatedData(context))
                    .orElseThrow(() -> new KeyRelayException(ErrorCode.CORRUPTED_STATE,
                            "Stored key material failed integrity check"));
        }
    }

    private static byte[] associatedData(String... context) {
        return String.join("|", context).getBytes(UTF_8);
    }
}
