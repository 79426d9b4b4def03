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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.util.HexFormat;

import org.testng.annotations.Test;

public class X25519Test {
    private static final HexFormat HEX = HexFormat.of();

    // RFC 7748 section 6.1
    private static final byte[] ALICE_PRIVATE =
            HEX.parseHex("77076d0a7318a57d3c16c17251b26645df4c2f87ebc0992ab177fba51db92c2a");
    private static final byte[] ALICE_PUBLIC =
            HEX.parseHex("8520f0098930a754748b7ddcb43ef75a0dbf3a0d26381af4eba4a98eaa9b4e6a");
    private static final byte[] BOB_PUBLIC =
            HEX.parseHex("de9edb7d7b7dc1b4d35b61c2ece435373f8343c85b78674dadfc7e146f882b4f");
    private static final byte[] SHARED =
            HEX.parseHex("4a5d9d5ba4ce2de1728e3bf480350f25e07e21c947d19e3376f09b3c1e161742");

    @Test
    public void shouldDerivePublicKeyFromSeed() {
        var keyPair = X25519.keyPairFromSeed(ALICE_PRIVATE);

        assertThat(X25519.serializePublicKey(keyPair.getPublic())).isEqualTo(ALICE_PUBLIC);
    }

    @Test
    public void shouldComputeSharedSecret() {
        var secret = X25519.compute(X25519.deserializePrivateKey(ALICE_PRIVATE),
                X25519.deserializePublicKey(BOB_PUBLIC));

        assertThat(secret).isEqualTo(SHARED);
    }

    @Test
    public void shouldAgreeWithGeneratedKeys() {
        var alice = X25519.generateKeyPair();
        var bob = X25519.generateKeyPair();

        assertThat(X25519.compute(alice.getPrivate(), bob.getPublic()))
                .isEqualTo(X25519.compute(bob.getPrivate(), alice.getPublic()));
    }

    @Test
    public void shouldRoundTripSerializedKeys() {
        var keyPair = X25519.generateKeyPair();
        var publicKey = X25519.serializePublicKey(keyPair.getPublic());
        var privateKey = X25519.serializePrivateKey(keyPair.getPrivate());

        assertThat(publicKey).hasSize(X25519.KEY_SIZE);
        assertThat(X25519.serializePublicKey(X25519.deserializePublicKey(publicKey))).isEqualTo(publicKey);
        assertThat(X25519.serializePrivateKey(X25519.deserializePrivateKey(privateKey))).isEqualTo(privateKey);
    }

    @Test
    public void shouldRejectWrongLengthKeys() {
        assertThatIllegalArgumentException().isThrownBy(() -> X25519.deserializePublicKey(new byte[31]));
        assertThatIllegalArgumentException().isThrownBy(() -> X25519.deserializePrivateKey(new byte[33]));
    }
}
