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

import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;
import com.grack.nanojson.JsonWriter;

/**
 * An encrypted message as it travels between two parties. Byte fields are standard base64 on the wire.
 * {@code pqcCiphertext} and {@code signature} are optional and carried through unchanged.
 */
public record EncryptedEnvelope(
        byte[] ciphertext,
        byte[] nonce,
        byte[] authTag,
        byte[] ephemeralPublicKey,
        int messageNumber,
        int chainLength,
        int previousChainLength,
        String keyId,
        String algorithm,
        int securityLevel,
        byte[] pqcCiphertext,
        byte[] signature) {

    public EncryptedEnvelope {
        requireNonNull(ciphertext, "ciphertext");
        requireNonNull(nonce, "nonce");
        requireNonNull(authTag, "authTag");
        requireNonNull(ephemeralPublicKey, "ephemeralPublicKey");
        requireNonNull(keyId, "keyId");
        requireNonNull(algorithm, "algorithm");
        if (messageNumber < 0 || chainLength < 0 || previousChainLength < 0) {
            throw KeyRelayException.validation("Envelope counters must not be negative");
        }
    }

    public JsonObject toJson() {
        var encoder = Base64.getEncoder();
        var builder = JsonObject.builder()
                .value("ciphertext", encoder.encodeToString(ciphertext))
                .value("nonce", encoder.encodeToString(nonce))
                .value("authTag", encoder.encodeToString(authTag))
                .value("ephemeralPublicKey", encoder.encodeToString(ephemeralPublicKey))
                .value("messageNumber", messageNumber)
                .value("chainLength", chainLength)
                .value("previousChainLength", previousChainLength)
                .value("keyId", keyId)
                .value("algorithm", algorithm)
                .value("securityLevel", securityLevel);
        if (pqcCiphertext != null) {
            builder.value("pqcCiphertext", encoder.encodeToString(pqcCiphertext));
        }
        if (signature != null) {
            builder.value("signature", encoder.encodeToString(signature));
        }
        return builder.done();
    }

    public String toJsonString() {
        return JsonWriter.string(toJson());
    }

    public static EncryptedEnvelope fromJson(JsonObject json) {
        try {
            return new EncryptedEnvelope(
                    requiredBytes(json, "ciphertext"),
                    requiredBytes(json, "nonce"),
                    requiredBytes(json, "authTag"),
                    requiredBytes(json, "ephemeralPublicKey"),
                    requiredInt(json, "messageNumber"),
                    requiredInt(json, "chainLength"),
                    requiredInt(json, "previousChainLength"),
                    requiredString(json, "keyId"),
                    requiredString(json, "algorithm"),
                    requiredInt(json, "securityLevel"),
                    optionalBytes(json, "pqcCiphertext"),
                    optionalBytes(json, "signature"));
        } catch (IllegalArgumentException | ClassCastException e) {
            throw new KeyRelayException(ErrorCode.VALIDATION_ERROR, "Malformed message envelope", e);
        }
    }

    public static EncryptedEnvelope fromJsonString(String json) {
        try {
            return fromJson(JsonParser.object().from(json));
        } catch (JsonParserException e) {
            throw new KeyRelayException(ErrorCode.VALIDATION_ERROR, "Malformed message envelope", e);
        }
    }

    private static byte[] requiredBytes(JsonObject json, String field) {
        return Base64.getDecoder().decode(requiredString(json, field));
    }

    private static byte[] optionalBytes(JsonObject json, String field) {
        if (!json.has(field) || json.isNull(field)) {
            return null;
        }
        return Base64.getDecoder().decode(json.getString(field));
    }

    private static String requiredString(JsonObject json, String field) {
        if (!json.isString(field)) {
            throw KeyRelayException.validation("Envelope field " + field + " is required");
        }
        return json.getString(field);
    }

    private static int requiredInt(JsonObject json, String field) {
        if (!json.isNumber(field)) {
            throw KeyRelayException.validation("Envelope field " + field + " is required");
        }
        return json.getInt(field);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EncryptedEnvelope that
                && messageNumber == that.messageNumber
                && chainLength == that.chainLength
                && previousChainLength == that.previousChainLength
                && securityLevel == that.securityLevel
                && Arrays.equals(ciphertext, that.ciphertext)
                && Arrays.equals(nonce, that.nonce)
                && Arrays.equals(authTag, that.authTag)
                && Arrays.equals(ephemeralPublicKey, that.ephemeralPublicKey)
                && keyId.equals(that.keyId)
                && algorithm.equals(that.algorithm)
                && Arrays.equals(pqcCiphertext, that.pqcCiphertext)
                && Arrays.equals(signature, that.signature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(nonce), keyId, messageNumber, chainLength);
    }

    @Override
    public String toString() {
        return "EncryptedEnvelope{keyId='" + keyId + "', chainLength=" + chainLength
                + ", messageNumber=" + messageNumber + ", algorithm='" + algorithm + "'}";
    }
}
