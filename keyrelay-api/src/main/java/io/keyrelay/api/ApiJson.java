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

package io.keyrelay.api;

import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;

import com.grack.nanojson.JsonArray;
import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;

import io.keyrelay.ErrorCode;
import io.keyrelay.KeyRelayException;
import io.keyrelay.RatchetState;
import io.keyrelay.SkippedMessageKey;
import io.keyrelay.exchange.ExchangeData;
import io.keyrelay.exchange.ExchangeStatistics;
import io.keyrelay.exchange.PendingExchange;
import io.keyrelay.negotiation.AlgorithmNegotiation;
import io.keyrelay.negotiation.EncryptionStatistics;
import io.keyrelay.negotiation.EncryptionStatus;
import io.keyrelay.store.HealthReport;
import io.keyrelay.store.RatchetStatistics;
import io.keyrelay.store.RatchetSummary;
import io.keyrelay.sync.KeySyncPackage;

/**
 * JSON encoding of request and response bodies. Byte fields use standard base64.
 */
final class ApiJson {

    static JsonObject parse(String body) {
        if (body == null || body.isBlank()) {
            return new JsonObject();
        }
        try {
            return JsonParser.object().from(body);
        } catch (JsonParserException e) {
            throw new KeyRelayException(ErrorCode.VALIDATION_ERROR, "Request body is not a JSON object", e);
        }
    }

    static String requiredString(JsonObject json, String field) {
        if (!json.isString(field) || json.getString(field).isBlank()) {
            throw KeyRelayException.validation(field + " is required");
        }
        return json.getString(field);
    }

    static String optionalString(JsonObject json, String field) {
        return json.isString(field) ? json.getString(field) : null;
    }

    static int requiredInt(JsonObject json, String field) {
        if (!json.isNumber(field)) {
            throw KeyRelayException.validation(field + " is required");
        }
        return json.getInt(field);
    }

    static boolean requiredBoolean(JsonObject json, String field) {
        if (!(json.get(field) instanceof Boolean)) {
            throw KeyRelayException.validation(field + " is required");
        }
        return json.getBoolean(field);
    }

    static JsonObject requiredObject(JsonObject json, String field) {
        var value = optionalObject(json, field);
        if (value == null) {
            throw KeyRelayException.validation(field + " is required");
        }
        return value;
    }

    static JsonObject optionalObject(JsonObject json, String field) {
        return json.get(field) instanceof JsonObject value ? value : null;
    }

    static byte[] requiredBytes(JsonObject json, String field) {
        return decode(requiredString(json, field), field);
    }

    static byte[] optionalBytes(JsonObject json, String field) {
        var value = optionalString(json, field);
        return value == null ? null : decode(value, field);
    }

    private static byte[] decode(String value, String field) {
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new KeyRelayException(ErrorCode.VALIDATION_ERROR, field + " is not valid base64", e);
        }
    }

    static String base64(byte[] data) {
        return data == null ? null : Base64.getEncoder().encodeToString(data);
    }

    private static String instant(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    /**
     * Reads a client-supplied ratchet state. Identity and skipped keys not present in the request are carried over
     * from the stored state, if any.
     */
    static RatchetState ratchetState(JsonObject json, String conversationId, String userId,
            Optional<RatchetState> existing, Instant now) {
        var builder = RatchetState.builder()
                .conversationId(conversationId)
                .userId(userId)
                .rootKey(requiredBytes(json, "rootKey"))
                .sendingChainKey(optionalBytes(json, "sendingChainKey"))
                .receivingChainKey(optionalBytes(json, "receivingChainKey"))
                .sendingMessageNumber(json.getInt("sendingMessageNumber", 0))
                .receivingMessageNumber(json.getInt("receivingMessageNumber", 0))
                .previousSendingChainLength(json.getInt("previousSendingChainLength", 0))
                .sendingChainLength(json.getInt("sendingChainLength", 0))
                .receivingChainLength(json.getInt("receivingChainLength", 0))
                .sendingRatchetKeyPair(requiredBytes(json, "sendingRatchetPrivateKey"),
                        requiredBytes(json, "sendingRatchetPublicKey"))
                .receivingRatchetPublicKey(optionalBytes(json, "receivingRatchetPublicKey"))
                .securityLevel(json.getInt("securityLevel", 1));
        if (existing.isPresent()) {
            var stored = existing.get();
            builder.id(stored.id())
                    .createdAt(stored.createdAt())
                    .version(stored.version())
                    .skippedKeys(stored.skippedKeys());
        } else {
            builder.createdAt(now);
        }
        return builder.build();
    }

    static JsonObject ratchetState(RatchetState state) {
        var json = new JsonObject();
        json.put("id", state.id());
        json.put("conversationId", state.conversationId());
        json.put("userId", state.userId());
        json.put("rootKey", base64(state.rootKey()));
        json.put("sendingChainKey", base64(state.sendingChainKey().orElse(null)));
        json.put("receivingChainKey", base64(state.receivingChainKey().orElse(null)));
        json.put("sendingMessageNumber", state.sendingMessageNumber());
        json.put("receivingMessageNumber", state.receivingMessageNumber());
        json.put("previousSendingChainLength", state.previousSendingChainLength());
        json.put("sendingChainLength", state.sendingChainLength());
        json.put("receivingChainLength", state.receivingChainLength());
        json.put("sendingRatchetPrivateKey", base64(state.sendingRatchetPrivateKey()));
        json.put("sendingRatchetPublicKey", base64(state.sendingRatchetPublicKey()));
        json.put("receivingRatchetPublicKey", base64(state.receivingRatchetPublicKey().orElse(null)));
        json.put("securityLevel", state.securityLevel());
        json.put("skippedKeysCount", state.skippedKeyCount());
        json.put("version", state.version());
        json.put("createdAt", instant(state.createdAt()));
        json.put("updatedAt", instant(state.updatedAt()));
        return json;
    }

    static JsonObject skippedKey(SkippedMessageKey key) {
        var json = new JsonObject();
        json.put("messageKeyId", key.messageKeyId());
        json.put("messageKey", base64(key.messageKey()));
        json.put("chainLength", key.chainLength());
        json.put("messageNumber", key.messageNumber());
        json.put("expiresAt", instant(key.expiresAt()));
        return json;
    }

    static JsonObject statistics(RatchetStatistics stats) {
        var json = new JsonObject();
        json.put("ratchetStateId", stats.ratchetStateId());
        json.put("sendingMessageNumber", stats.sendingMessageNumber());
        json.put("receivingMessageNumber", stats.receivingMessageNumber());
        json.put("sendingChainLength", stats.sendingChainLength());
        json.put("receivingChainLength", stats.receivingChainLength());
        json.put("previousSendingChainLength", stats.previousSendingChainLength());
        json.put("skippedKeysCount", stats.skippedKeysCount());
        json.put("securityLevel", stats.securityLevel());
        json.put("createdAt", instant(stats.createdAt()));
        json.put("lastUpdated", instant(stats.lastUpdated()));
        return json;
    }

    static JsonObject summary(RatchetSummary summary) {
        var json = new JsonObject();
        json.put("ratchetStateId", summary.ratchetStateId());
        json.put("userId", summary.userId());
        json.put("sendingChainLength", summary.sendingChainLength());
        json.put("receivingChainLength", summary.receivingChainLength());
        json.put("securityLevel", summary.securityLevel());
        json.put("version", summary.version());
        json.put("createdAt", instant(summary.createdAt()));
        json.put("updatedAt", instant(summary.updatedAt()));
        return json;
    }

    static JsonObject health(HealthReport report) {
        var json = new JsonObject();
        json.put("status", report.isHealthy() ? "healthy" : "unhealthy");
        json.put("totalRatchetStates", report.totalRatchetStates());
        json.put("totalSkippedKeys", report.totalSkippedKeys());
        json.put("expiredKeys", report.expiredKeys());
        if (report.message() != null) {
            json.put("message", report.message());
        }
        return json;
    }

    static JsonObject pending(PendingExchange pending) {
        var exchange = pending.exchange();
        var json = new JsonObject();
        json.put("exchangeId", exchange.id());
        json.put("exchangeType", exchange.type().identifier());
        json.put("status", exchange.status().identifier());
        json.put("conversationId", exchange.conversationId());
        json.put("isInitiator", pending.isInitiator());
        json.put("otherPartyId", pending.otherPartyId());
        json.put("createdAt", instant(exchange.createdAt()));
        json.put("expiresAt", instant(exchange.expiresAt()));
        return json;
    }

    static JsonObject exchangeData(ExchangeData data) {
        var json = new JsonObject();
        json.put("exchangeId", data.exchangeId());
        json.put("exchangeType", data.type().identifier());
        json.put("status", data.status().identifier());
        json.put("conversationId", data.conversationId());
        json.put("isInitiator", data.isInitiator());
        json.put("otherPartyId", data.otherPartyId());
        json.put("publicKeyBundle", data.initiatorBundle().toJson());
        json.put("recipientPublicKeyBundle",
                data.recipientBundle() == null ? null : data.recipientBundle().toJson());
        json.put(data.isInitiator() ? "responseData" : "encryptedKeyData", base64(data.keyData()));
        json.put("createdAt", instant(data.createdAt()));
        json.put("respondedAt", instant(data.respondedAt()));
        json.put("completedAt", instant(data.completedAt()));
        json.put("expiresAt", instant(data.expiresAt()));
        return json;
    }

    static JsonObject exchangeStatistics(ExchangeStatistics stats) {
        var json = new JsonObject();
        json.put("timeframe", stats.timeframe().identifier());
        json.put("total", stats.total());
        json.put("byStatus", counts(stats.byStatus()));
        json.put("byType", counts(stats.byType()));
        json.put("successRate", stats.successRate());
        return json;
    }

    static JsonObject syncPackage(KeySyncPackage syncPackage) {
        var metadata = syncPackage.metadata();
        var keyPackage = syncPackage.keyPackage();
        var json = new JsonObject();
        json.put("packageId", syncPackage.packageId());
        json.put("fromDeviceId", syncPackage.fromDeviceId());
        json.put("toDeviceId", syncPackage.toDeviceId());
        json.put("keyType", metadata.keyType().identifier());
        json.put("conversationId", metadata.conversationId());
        json.put("syncPriority", metadata.priority().identifier());
        json.put("encryptedKeyData", base64(keyPackage.encryptedData()));
        json.put("integrityHash", keyPackage.integrityHash());
        json.put("signature", base64(keyPackage.signature()));
        json.put("encryptionMethod", keyPackage.encryptionMethod());
        json.put("status", syncPackage.status().identifier());
        json.put("errorMessage", syncPackage.errorMessage());
        json.put("createdAt", instant(syncPackage.createdAt()));
        json.put("processedAt", instant(syncPackage.processedAt()));
        json.put("expiresAt", instant(syncPackage.expiresAt()));
        return json;
    }

    static JsonObject negotiation(AlgorithmNegotiation negotiation) {
        var selected = negotiation.selected();
        var json = new JsonObject();
        json.put("negotiationId", negotiation.negotiationId());
        json.put("conversationId", negotiation.conversationId());
        json.put("keyExchange", selected.keyExchange().identifier());
        json.put("signature", selected.signature().identifier());
        json.put("encryption", selected.encryption().identifier());
        json.put("securityLevel", negotiation.achievedSecurityLevel());
        json.put("quantumResistant", negotiation.quantumResistant());
        json.put("hybridMode", negotiation.hybridMode());
        json.put("protocolVersion", negotiation.protocolVersion());
        json.put("expiresAt", instant(negotiation.expiresAt()));
        return json;
    }

    static JsonObject encryptionStatus(String conversationId, EncryptionStatus status) {
        var json = new JsonObject();
        json.put("conversationId", conversationId);
        json.put("encryptionEnabled", status.encryptionEnabled());
        json.put("hasNegotiation", status.hasNegotiation());
        json.put("securityLevel", status.securityLevel());
        json.put("quantumResistant", status.quantumResistant());
        json.put("algorithm", status.algorithm());
        return json;
    }

    static JsonObject encryptionStatistics(EncryptionStatistics stats) {
        var json = new JsonObject();
        json.put("timeframe", stats.timeframe().identifier());
        json.put("totalMessages", stats.totalMessages());
        json.put("encryptedMessages", stats.encryptedMessages());
        json.put("encryptionRate", stats.encryptionRate());
        json.put("byAlgorithm", counts(stats.byAlgorithm()));
        json.put("negotiations", stats.negotiations());
        json.put("quantumResistantNegotiations", stats.quantumResistantNegotiations());
        json.put("negotiationsByKeyExchange", counts(stats.negotiationsByKeyExchange()));
        return json;
    }

    static JsonArray array(Iterable<JsonObject> items) {
        var array = new JsonArray();
        items.forEach(array::add);
        return array;
    }

    private static JsonObject counts(Map<String, Long> counts) {
        return new JsonObject(counts);
    }

    private ApiJson() {}
}
