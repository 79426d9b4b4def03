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

import static java.util.Objects.requireNonNull;

import java.util.Arrays;

/**
 * An AES-256-GCM encrypted field as persisted: ciphertext, 96-bit nonce and 128-bit authentication tag.
 */
public record SealedBox(byte[] ciphertext, byte[] nonce, byte[] authTag) {
    public SealedBox {
        requireNonNull(ciphertext, "ciphertext");
        requireNonNull(nonce, "nonce");
        requireNonNull(authTag, "authTag");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SealedBox that && Arrays.equals(ciphertext, that.ciphertext)
                && Arrays.equals(nonce, that.nonce) && Arrays.equals(authTag, that.authTag);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(nonce);
    }

    @Override
    public String toString() {
        return "SealedBox{" + ciphertext.length + " bytes}";
    }
}
