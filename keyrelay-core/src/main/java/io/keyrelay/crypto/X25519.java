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

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.XECPrivateKey;
import java.security.interfaces.XECPublicKey;
import java.security.spec.NamedParameterSpec;
import java.security.spec.XECPrivateKeySpec;
import java.security.spec.XECPublicKeySpec;
import java.util.Arrays;

import javax.crypto.KeyAgreement;

/**
 * X25519 Diffie-Hellman using the JDK XDH provider. Keys are exchanged in the RFC 7748 32-byte little-endian
 * encoding.
 */
public final class X25519 {
    public static final int KEY_SIZE = 32;

    private static final BigInteger BASE_POINT = BigInteger.valueOf(9);

    public static KeyPair generateKeyPair() {
        try {
            return KeyPairGenerator.getInstance("X25519").generateKeyPair();
        } catch (NoSuchAlgorithmException e) {
            throw new UnsupportedOperationException(e);
        }
    }

    /**
     * Deterministically derives a key pair from a 32-byte seed. The seed is used directly as the private scalar and
     * is clamped by the provider.
     *
     * @param seed the 32-byte seed.
     * @return the derived key pair.
     */
    public static KeyPair keyPairFromSeed(byte[] seed) {
        var privateKey = deserializePrivateKey(seed);
        try {
            var basePoint = keyFactory().generatePublic(new XECPublicKeySpec(NamedParameterSpec.X25519, BASE_POINT));
            var publicKeyBytes = compute(privateKey, (PublicKey) basePoint);
            return new KeyPair(deserializePublicKey(publicKeyBytes), privateKey);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    public static byte[] compute(PrivateKey privateKey, PublicKey publicKey) {
        try {
            var x25519 = KeyAgreement.getInstance("X25519");
            x25519.init(privateKey);
            x25519.doPhase(publicKey, true);
            return x25519.generateSecret();
        } catch (NoSuchAlgorithmException e) {
            throw new UnsupportedOperationException(e);
        } catch (InvalidKeyException | IllegalStateException e) {
            throw new IllegalArgumentException("Invalid X25519 key agreement input", e);
        }
    }

    public static byte[] serializePublicKey(PublicKey key) {
        if (!(key instanceof XECPublicKey xpk)) {
            throw new IllegalArgumentException("Not an X25519 public key");
        }
        var bigEndian = xpk.getU().toByteArray();
        var littleEndian = CryptoUtils.reverse(bigEndian);
        return Arrays.copyOf(littleEndian, KEY_SIZE);
    }

    public static PublicKey deserializePublicKey(byte[] encoded) {
        if (encoded == null || encoded.length != KEY_SIZE) {
            throw new IllegalArgumentException("X25519 public key must be " + KEY_SIZE + " bytes");
        }
        var bigEndian = CryptoUtils.reverse(encoded);
        bigEndian[0] &= 0x7F;
        try {
            return keyFactory().generatePublic(
                    new XECPublicKeySpec(NamedParameterSpec.X25519, new BigInteger(1, bigEndian)));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException(e);
        }
    }

    public static byte[] serializePrivateKey(PrivateKey key) {
        if (!(key instanceof XECPrivateKey xsk)) {
            throw new IllegalArgumentException("Not an X25519 private key");
        }
        return xsk.getScalar().orElseThrow(() -> new IllegalArgumentException("Private key is not exportable"));
    }

    public static PrivateKey deserializePrivateKey(byte[] scalar) {
        if (scalar == null || scalar.length != KEY_SIZE) {
            throw new IllegalArgumentException("X25519 private key must be " + KEY_SIZE + " bytes");
        }
        try {
            return keyFactory().generatePrivate(new XECPrivateKeySpec(NamedParameterSpec.X25519, scalar));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException(e);
        }
    }

    private static KeyFactory keyFactory() throws NoSuchAlgorithmException {
        return KeyFactory.getInstance("X25519");
    }

    private X25519() {}
}
