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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.testng.annotations.Test;

import io.keyrelay.crypto.CryptoUtils;

public class EncryptedEnvelopeTest {

    @Test
    public void shouldCarryOptionalFieldsThroughJson() {
        var envelope = new EncryptedEnvelope(CryptoUtils.randomBytes(20), CryptoUtils.randomBytes(12),
                CryptoUtils.randomBytes(16), CryptoUtils.randomBytes(32), 4, 2, 7, "a1b2c3d4e5f60718",
                "chacha20-poly1305", 3, CryptoUtils.randomBytes(1088), null);

        var json = envelope.toJson();
        assertThat(json).containsKeys("ciphertext", "nonce", "authTag", "ephemeralPublicKey", "pqcCiphertext")
                .doesNotContainKey("signature");
        assertThat(EncryptedEnvelope.fromJsonString(envelope.toJsonString())).isEqualTo(envelope);
    }

    @Test
    public void shouldRejectMalformedJson() {
        assertValidationError("not json");
        assertValidationError("{\"nonce\":\"AAAA\"}");
        assertValidationError("""
                {"ciphertext":"%%%","nonce":"AAAA","authTag":"AAAA","ephemeralPublicKey":"AAAA",
                 "messageNumber":0,"chainLength":1,"previousChainLength":0,"keyId":"k",
                 "algorithm":"chacha20-poly1305","securityLevel":1}""");
        assertValidationError("""
                {"ciphertext":"AAAA","nonce":"AAAA","authTag":"AAAA","ephemeralPublicKey":"AAAA",
                 "messageNumber":-1,"chainLength":1,"previousChainLength":0,"keyId":"k",
                 "algorithm":"chacha20-poly1305","securityLevel":1}""");
    }

    @Test
    public void toStringShouldNotRevealContents() {
        var ciphertext = new byte[] { 0x7f, 0x7f, 0x7f, 0x7f };
        var envelope = new EncryptedEnvelope(ciphertext, new byte[12], new byte[16], new byte[32], 0, 1, 0, "key",
                "chacha20-poly1305", 1, null, null);

        assertThat(envelope.toString()).contains("key").doesNotContain("ciphertext").doesNotContain("127");
    }

    private static void assertValidationError(String json) {
        assertThatThrownBy(() -> EncryptedEnvelope.fromJsonString(json))
                .isInstanceOfSatisfying(KeyRelayException.class,
                        e -> assertThat(e.errorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR));
    }
}
