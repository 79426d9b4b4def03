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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.security.KeyPair;
import java.security.SecureRandom;

import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.pqc.crypto.crystals.kyber.KyberKEMExtractor;
import org.bouncycastle.pqc.crypto.crystals.kyber.KyberKEMGenerator;
import org.bouncycastle.pqc.crypto.crystals.kyber.KyberKeyGenerationParameters;
import org.bouncycastle.pqc.crypto.crystals.kyber.KyberKeyPairGenerator;
import org.bouncycastle.pqc.crypto.crystals.kyber.KyberParameters;
import org.bouncycastle.pqc.crypto.crystals.kyber.KyberPrivateKeyParameters;
import org.bouncycastle.pqc.crypto.crystals.kyber.KyberPublicKeyParameters;

/**
 * Client-side hybrid key agreement combining X25519 with Kyber768. The relay never runs this code: it only carries the
 * public halves and the Kyber ciphertext between the two parties. Both sides end up with the same 32-byte shared
 * secret, which seeds the message ratchet.
 * <p>
 * The combined secret is {@code HKDF(salt, X25519(a, B) || kyberSecret, senderPk || recipientPk || kyberCt)}, so
 * an attacker has to break both primitives to recover it.
 */
public final class HybridKeyAgreement {
    private static final byte[] SALT = "KeyRelay-Hybrid-v1".getBytes(UTF_8);
    public static final int SHARED_SECRET_SIZE = 32;
    public static final int SECURITY_LEVEL = 3;

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    /**
     * One party's hybrid key pair.
     */
    public record HybridKeyPair(KeyPair classical, AsymmetricCipherKeyPair postQuantum) {
        public HybridKeyPair {
            requireNonNull(classical, "classical");
            requireNonNull(postQuantum, "postQuantum");
        }

        public byte[] classicalPublicKey() {
            return X25519.serializePublicKey(classical.getPublic());
        }

        public byte[] postQuantumPublicKey() {
            return ((KyberPublicKeyParameters) postQuantum.getPublic()).getEncoded();
        }
    }

    /**
     * The encapsulating party's result: the shared secret to keep, and the Kyber ciphertext to send to the party that
     * owns the Kyber key.
     */
    public record Encapsulation(byte[] sharedSecret, byte[] postQuantumCiphertext) {}

    public static HybridKeyPair generateKeyPair() {
        var generator = new KyberKeyPairGenerator();
        generator.init(new KyberKeyGenerationParameters(SECURE_RANDOM, KyberParameters.kyber768));
        return new HybridKeyPair(X25519.generateKeyPair(), generator.generateKeyPair());
    }

    /**
     * Run by the party that received the other side's full public bundle.
     */
    public static Encapsulation encapsulate(HybridKeyPair sender, byte[] recipientClassicalPublicKey,
            byte[] recipientPostQuantumPublicKey) {
        var peerPublic = new KyberPublicKeyParameters(KyberParameters.kyber768, recipientPostQuantumPublicKey);
        var encapsulated = new KyberKEMGenerator(SECURE_RANDOM).generateEncapsulated(peerPublic);
        var kemSecret = encapsulated.getSecret();
        var ciphertext = encapsulated.getEncapsulation();
        var dh = X25519.compute(sender.classical().getPrivate(),
                X25519.deserializePublicKey(recipientClassicalPublicKey));
        try {
            var secret = combine(dh, kemSecret, sender.classicalPublicKey(), recipientClassicalPublicKey,
                    ciphertext);
            return new Encapsulation(secret, ciphertext);
        } finally {
            CryptoUtils.wipe(dh, kemSecret);
        }
    }

    /**
     * Run by the owner of the Kyber key on receipt of the sender's X25519 public key and Kyber ciphertext.
     */
    public static byte[] decapsulate(HybridKeyPair recipient, byte[] senderClassicalPublicKey,
            byte[] postQuantumCiphertext) {
        var extractor = new KyberKEMExtractor((KyberPrivateKeyParameters) recipient.postQuantum().getPrivate());
        var kemSecret = extractor.extractSecret(postQuantumCiphertext);
        var dh = X25519.compute(recipient.classical().getPrivate(),
                X25519.deserializePublicKey(senderClassicalPublicKey));
        try {
            return combine(dh, kemSecret, senderClassicalPublicKey, recipient.classicalPublicKey(),
                    postQuantumCiphertext);
        } finally {
            CryptoUtils.wipe(dh, kemSecret);
        }
    }

    private static byte[] combine(byte[] dh, byte[] kemSecret, byte[] senderPk, byte[] recipientPk, byte[] ct) {
        var ikm = CryptoUtils.concat(dh, kemSecret);
        try {
            return HKDF.derive(SALT, ikm, CryptoUtils.concat(senderPk, recipientPk, ct), SHARED_SECRET_SIZE);
        } finally {
            CryptoUtils.wipe(ikm);
        }
    }

    private HybridKeyAgreement() {}
}
