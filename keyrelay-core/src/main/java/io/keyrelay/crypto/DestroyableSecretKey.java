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

import static java.util.Objects.requireNonNull;

import javax.crypto.SecretKey;

/**
 * Raw key material for root, chain, message and at-rest keys. The bytes are copied in on construction and wiped on
 * {@link #close()}, so a key can be scoped with try-with-resources around the single operation that needs it.
 * Any use after closing fails with {@link IllegalStateException}.
 */
public final class DestroyableSecretKey implements SecretKey, AutoCloseable {

    private final String algorithm;
    private final byte[] material;
    private volatile boolean destroyed;

    public DestroyableSecretKey(byte[] material, String algorithm) {
        this.algorithm = requireNonNull(algorithm, "algorithm");
        this.material = requireNonNull(material, "material").clone();
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    @Override
    public String getFormat() {
        return "RAW";
    }

    @Override
    public byte[] getEncoded() {
        return checkedMaterial().clone();
    }

    /**
     * A second key over the same bytes for a JCA provider that expects another algorithm name, e.g. the AEAD key
     * for an HKDF output. Both keys must be closed.
     */
    public DestroyableSecretKey withAlgorithm(String newAlgorithm) {
        return new DestroyableSecretKey(checkedMaterial(), newAlgorithm);
    }

    private byte[] checkedMaterial() {
        if (destroyed) {
            throw new IllegalStateException(algorithm + " key used after it was destroyed");
        }
        return material;
    }

    @Override
    public void destroy() {
        CryptoUtils.wipe(material);
        destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public void close() {
        destroy();
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof DestroyableSecretKey that) || !algorithm.equals(that.algorithm)) {
            return false;
        }
        return CryptoUtils.constantTimeEquals(checkedMaterial(), that.checkedMaterial());
    }

    @Override
    public int hashCode() {
        // Independent of the key bytes.
        return algorithm.hashCode() * 31 + material.length;
    }

    @Override
    public String toString() {
        return "DestroyableSecretKey{" + algorithm + ", " + material.length * 8 + " bits"
                + (destroyed ? ", destroyed" : "") + "}";
    }
}
