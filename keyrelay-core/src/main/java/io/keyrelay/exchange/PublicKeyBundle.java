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

package io.keyrelay.exchange;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

import com.grack.nanojson.JsonObject;

import io.keyrelay.ErrorCode;
import io.keyrelay.KeyRelayException;
import io.keyrelay.Require;
import io.keyrelay.crypto.X25519;
import io.keyrelay.negotiation.AlgorithmCapabilities;
import io.keyrelay.negotiation.EncryptionAlgorithm;
import io.keyrelay.negotiation.KeyExchangeAlgorithm;
import io.keyrelay.negotiation.SelectedAlgorithms;
import io.keyrelay.negotiation.SignatureAlgorithm;

/**
 * The public half of one party's key exchange material, plus the algorithms it proposes. The relay checks the shape
 * of the bundle but never uses the keys.
 *
 * @param postQuantumPublicKey the Kyber768 encapsulation key; required when the key exchange is post-quantum or
 * hybrid, otherwise null.
 */
public record PublicKeyBundle(
        byte[] classicalPublicKey,
        byte[] postQuantumPublicKey,
        KeyExchangeAlgorithm keyExchange,
        SignatureAlgorithm signature,
        EncryptionAlgorithm encryption,
        int securityLevel,
        boolean quantumResistant,
        String protocolVersion,
        AlgorithmCapabilities capabilities) {

    public PublicKeyBundle {
        Require.length(classicalPublicKey, X25519.KEY_SIZE, "classicalPublicKey");
        Require.notNull(keyExchange, "keyExchange");
        Require.notNull(signature, "signature");
        Require.notNull(encryption, "encryption");
        Require.notNull(capabilities, "capabilities");
        Require.between(securityLevel, 1, 5, "securityLevel");
        Require.rejectIf(keyExchange.isQuantumResistant()
                && (postQuantumPublicKey == null || postQuantumPublicKey.length == 0),
                "postQuantumPublicKey is required for " + keyExchange.identifier());
        Require.rejectIf(quantumResistant && !keyExchange.isQuantumResistant(),
                "A classical key exchange cannot be quantum resistant");
        protocolVersion = protocolVersion == null ? "1.0" : protocolVersion;
        classicalPublicKey = classicalPublicKey.clone();
        postQuantumPublicKey = postQuantumPublicKey == null ? null : postQuantumPublicKey.clone();
    }

    public boolean hybridMode() {
        return keyExchange == KeyExchangeAlgorithm.HYBRID;
    }

    public SelectedAlgorithms proposedAlgorithms() {
        return new SelectedAlgorithms(keyExchange, signature, encryption);
    }

    @Override
    public byte[] classicalPublicKey() {
        return classicalPublicKey.clone();
    }

    @Override
    public byte[] postQuantumPublicKey() {
        return postQuantumPublicKey == null ? null : postQuantumPublicKey.clone();
    }

    public JsonObject toJson() {
        var encoder = Base64.getEncoder();
        var builder = JsonObject.builder()
                .value("classicalPublicKey", encoder.encodeToString(classicalPublicKey))
                .value("keyExchange", keyExchange.identifier())
                .value("signature", signature.identifier())
                .value("encryption", encryption.identifier())
                .value("securityLevel", securityLevel)
                .value("quantumResistant", quantumResistant)
                .value("hybridMode", hybridMode())
                .value("protocolVersion", protocolVersion)
                .value("capabilities", capabilities.toJson());
        if (postQuantumPublicKey != null) {
            builder.value("postQuantumPublicKey", encoder.encodeToString(postQuantumPublicKey));
        }
        return builder.done();
    }

    public static PublicKeyBundle fromJson(JsonObject json) {
        if (json == null) {
            throw KeyRelayException.validation("publicKeyBundle is required");
        }
        try {
            var decoder = Base64.getDecoder();
            var pq = json.getString("postQuantumPublicKey");
            return new PublicKeyBundle(
                    decoder.decode(Require.notBlank(json.getString("classicalPublicKey"), "classicalPublicKey")),
                    pq == null ? null : decoder.decode(pq),
                    KeyExchangeAlgorithm.fromIdentifier(json.getString("keyExchange")),
                    SignatureAlgorithm.fromIdentifier(json.getString("signature")),
                    EncryptionAlgorithm.fromIdentifier(json.getString("encryption")),
                    json.getInt("securityLevel", 1),
                    json.getBoolean("quantumResistant", false),
                    json.getString("protocolVersion"),
                    AlgorithmCapabilities.fromJson(
                            json.get("capabilities") instanceof JsonObject caps ? caps : null));
        } catch (IllegalArgumentException | ClassCastException e) {
            throw new KeyRelayException(ErrorCode.VALIDATION_ERROR, "Malformed public key bundle", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PublicKeyBundle that
                && Arrays.equals(classicalPublicKey, that.classicalPublicKey)
                && Arrays.equals(postQuantumPublicKey, that.postQuantumPublicKey)
                && keyExchange == that.keyExchange && signature == that.signature && encryption == that.encryption
                && securityLevel == that.securityLevel && quantumResistant == that.quantumResistant
                && protocolVersion.equals(that.protocolVersion) && capabilities.equals(that.capabilities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(classicalPublicKey), keyExchange, signature, encryption, securityLevel);
    }

    @Override
    public String toString() {
        return "PublicKeyBundle{" + keyExchange.identifier() + "/" + signature.identifier() + "/"
                + encryption.identifier() + ", level=" + securityLevel + "}";
    }
}
