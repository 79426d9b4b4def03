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

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.spec.AlgorithmParameterSpec;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.IvParameterSpec;

enum JdkAead implements Aead {
    CHACHA20_POLY1305("ChaCha20-Poly1305", "ChaCha20-Poly1305", "ChaCha20", IvParameterSpec::new),
    AES256_GCM("AES-256-GCM", "AES/GCM/NoPadding", "AES", nonce -> new GCMParameterSpec(128, nonce));

    private final String identifier;
    private final String keyAlgorithm;
    private final ThreadLocal<Cipher> cipherThreadLocal;
    private final Function<byte[], AlgorithmParameterSpec> paramSpec;

    JdkAead(String identifier, String transformation, String keyAlgorithm,
            Function<byte[], AlgorithmParameterSpec> paramSpec) {
        this.identifier = identifier;
        this.keyAlgorithm = keyAlgorithm;
        this.cipherThreadLocal = threadLocal(() -> Cipher.getInstance(transformation));
        this.paramSpec = paramSpec;
    }

    @Override
    public String identifier() {
        return identifier;
    }

    @Override
    public int keySizeBytes() {
        return 32;
    }

    @Override
    public int nonceSizeBytes() {
        return 12;
    }

    @Override
    public DestroyableSecretKey importKey(byte[] keyMaterial) {
        if (keyMaterial == null || keyMaterial.length != keySizeBytes()) {
            throw new IllegalArgumentException(identifier + " key must be " + keySizeBytes() + " bytes");
        }
        return new DestroyableSecretKey(keyMaterial, keyAlgorithm);
    }

    @Override
    public Sealed seal(DestroyableSecretKey key, byte[] nonce, byte[] plaintext, byte[] associatedData) {
        checkNonce(nonce);
        var cipher = cipherThreadLocal.get();
        try (var cipherKey = key.withAlgorithm(keyAlgorithm)) {
            cipher.init(Cipher.ENCRYPT_MODE, cipherKey, paramSpec.apply(nonce));
            if (associatedData != null && associatedData.length > 0) {
                cipher.updateAAD(associatedData);
            }
            var output = cipher.doFinal(plaintext);
            int ctLen = output.length - TAG_SIZE_BYTES;
            var sealed = new Sealed(Arrays.copyOf(output, ctLen), Arrays.copyOfRange(output, ctLen, output.length));
            CryptoUtils.wipe(output);
            return sealed;
        } catch (InvalidKeyException e) {
            throw new IllegalArgumentException(e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public Optional<byte[]> open(DestroyableSecretKey key, byte[] nonce, byte[] ciphertext, byte[] tag,
            byte[] associatedData) {
        if (nonce == null || nonce.length != nonceSizeBytes() || tag == null || tag.length != TAG_SIZE_BYTES) {
            return Optional.empty();
        }
        var cipher = cipherThreadLocal.get();
        try (var cipherKey = key.withAlgorithm(keyAlgorithm)) {
            cipher.init(Cipher.DECRYPT_MODE, cipherKey, paramSpec.apply(nonce));
            if (associatedData != null && associatedData.length > 0) {
                cipher.updateAAD(associatedData);
            }
            return Optional.of(cipher.doFinal(CryptoUtils.concat(ciphertext, tag)));
        } catch (AEADBadTagException e) {
            return Optional.empty();
        } catch (InvalidKeyException e) {
            throw new IllegalArgumentException(e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    private void checkNonce(byte[] nonce) {
        if (nonce == null || nonce.length != nonceSizeBytes()) {
            throw new IllegalArgumentException("Nonce must be " + nonceSizeBytes() + " bytes");
        }
    }

    private static <T> ThreadLocal<T> threadLocal(Callable<T> supplier) {
        return ThreadLocal.withInitial(() -> {
            try {
                return supplier.call();
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
    }

    @Override
    public String toString() {
        return identifier;
    }
}
