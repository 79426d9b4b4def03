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

import static java.util.Objects.requireNonNull;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.grack.nanojson.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.keyrelay.ErrorCode;
import io.keyrelay.KeyRelayException;
import io.keyrelay.Timeframe;
import io.keyrelay.exchange.ExchangeType;
import io.keyrelay.exchange.PublicKeyBundle;
import io.keyrelay.negotiation.AlgorithmCapabilities;
import io.keyrelay.negotiation.EncryptionAlgorithm;
import io.keyrelay.negotiation.KeyExchangeAlgorithm;
import io.keyrelay.negotiation.SelectedAlgorithms;
import io.keyrelay.negotiation.SignatureAlgorithm;
import io.keyrelay.sync.EncryptedKeyPackage;
import io.keyrelay.sync.KeyType;
import io.keyrelay.sync.PackageMetadata;
import io.keyrelay.sync.SyncPriority;

/**
 * Maps JSON requests onto the relay components. Transport-agnostic: an HTTP server hands over the method, the path
 * (with query string), the authenticated caller id and the raw body, and writes back the {@link ApiResponse}.
 * <p>
 * Every route except the health check requires a caller id. Ratchet state may only be read or written by the user
 * it belongs to; conversation listings and the cleanup sweep are restricted to administrators.
 */
public final class KeyRelayApi {
    private static final Logger logger = LoggerFactory.getLogger(KeyRelayApi.class);

    private static final String SEGMENT = "([^/]+)";

    private final KeyRelay relay;
    private final Set<String> administrators;
    private final List<Route> routes = new ArrayList<>();

    public KeyRelayApi(KeyRelay relay, Set<String> administrators) {
        this.relay = requireNonNull(relay, "relay");
        this.administrators = Set.copyOf(administrators);

        route("PUT", "/ratchet/state", this::putRatchetState);
        route("GET", "/ratchet/state/" + SEGMENT + "/" + SEGMENT, this::getRatchetState);
        route("DELETE", "/ratchet/state/" + SEGMENT + "/" + SEGMENT, this::deleteRatchetState);
        route("POST", "/ratchet/skipped-keys", this::putSkippedKey);
        route("GET", "/ratchet/skipped-keys/" + SEGMENT + "/" + SEGMENT + "/" + SEGMENT, this::getSkippedKey);
        route("DELETE", "/ratchet/skipped-keys/" + SEGMENT + "/" + SEGMENT + "/" + SEGMENT, this::deleteSkippedKey);
        route("GET", "/ratchet/stats/" + SEGMENT + "/" + SEGMENT, this::ratchetStatistics);
        route("GET", "/ratchet/conversation/" + SEGMENT, this::listConversation);
        route("POST", "/ratchet/cleanup", this::cleanup);
        publicRoute("GET", "/ratchet/health", this::health);

        route("POST", "/key-exchange/initiate", this::initiateExchange);
        route("POST", "/key-exchange/respond", this::respondToExchange);
        route("POST", "/key-exchange/complete", this::completeExchange);
        route("GET", "/key-exchange/pending", this::pendingExchanges);
        route("GET", "/key-exchange/stats", this::exchangeStatistics);
        route("GET", "/key-exchange/" + SEGMENT, this::exchangeData);

        route("POST", "/multi-device/device", this::registerDevice);
        route("POST", "/multi-device/sync", this::createSyncPackage);
        route("GET", "/multi-device/pending/" + SEGMENT, this::pendingSyncPackages);
        route("POST", "/multi-device/processed/" + SEGMENT, this::markSyncPackageProcessed);

        route("POST", "/algorithm-negotiation", this::recordNegotiation);
        route("GET", "/conversation/" + SEGMENT + "/encryption-status", this::encryptionStatus);
        route("GET", "/encryption/stats", this::encryptionStatistics);
    }

    /**
     * Handles one request. Never throws: every failure is turned into an error response.
     *
     * @param callerId the authenticated user, or null for anonymous requests.
     * @param body the raw JSON request body; may be null or empty.
     */
    public ApiResponse handle(String method, String path, String callerId, String body) {
        if (method == null || path == null) {
            return ApiResponse.error(400, "BAD_REQUEST", "Method and path are required");
        }
        var queryStart = path.indexOf('?');
        var rawPath = queryStart < 0 ? path : path.substring(0, queryStart);
        var query = queryStart < 0 ? "" : path.substring(queryStart + 1);

        for (var route : routes) {
            var matcher = route.pattern().matcher(rawPath);
            if (!route.method().equals(method.toUpperCase(Locale.ROOT)) || !matcher.matches()) {
                continue;
            }
            if (route.authenticated() && (callerId == null || callerId.isBlank())) {
                return ApiResponse.error(401, "UNAUTHENTICATED", "Authentication required");
            }
            try {
                var params = new ArrayList<String>();
                for (int i = 1; i <= matcher.groupCount(); i++) {
                    params.add(decode(matcher.group(i)));
                }
                return route.handler().handle(new Request(callerId, params, parseQuery(query),
                        ApiJson.parse(body)));
            } catch (ForbiddenException e) {
                return ApiResponse.error(403, "FORBIDDEN", e.getMessage());
            } catch (KeyRelayException e) {
                logger.debug("{} {} failed: {}", method, rawPath, e.errorCode());
                return ApiResponse.error(e.errorCode(), e.getMessage());
            } catch (RuntimeException e) {
                logger.error("Unexpected failure handling {} {}", method, rawPath, e);
                return ApiResponse.error(500, "INTERNAL_ERROR", "Internal server error");
            }
        }
        return ApiResponse.error(404, "NOT_FOUND", "No such endpoint");
    }

    private ApiResponse putRatchetState(Request request) {
        var conversationId = ApiJson.requiredString(request.body(), "conversationId");
        var userId = ApiJson.requiredString(request.body(), "userId");
        requireSelf(request, userId);
        var stateJson = ApiJson.requiredObject(request.body(), "ratchetState");

        var store = relay.store();
        var existing = store.get(conversationId, userId);
        var state = ApiJson.ratchetState(stateJson, conversationId, userId, existing, relay.clock().instant());
        String id;
        if (request.body().isNumber("expectedVersion")) {
            id = store.put(state, request.body().getLong("expectedVersion"));
        } else {
            id = store.put(state);
        }
        var json = new JsonObject();
        json.put("ratchetStateId", id);
        json.put("version", state.version());
        return ApiResponse.ok(json);
    }

    private ApiResponse getRatchetState(Request request) {
        requireSelf(request, request.param(1));
        return relay.store().get(request.param(0), request.param(1))
                .map(state -> {
                    var json = new JsonObject();
                    json.put("ratchetState", ApiJson.ratchetState(state));
                    return ApiResponse.ok(json);
                })
                .orElseGet(() -> ApiResponse.error(ErrorCode.RATCHET_NOT_INITIALIZED, "Ratchet state not found"));
    }

    private ApiResponse deleteRatchetState(Request request) {
        requireSelf(request, request.param(1));
        if (!relay.store().delete(request.param(0), request.param(1))) {
            return ApiResponse.error(ErrorCode.RATCHET_NOT_INITIALIZED, "Ratchet state not found");
        }
        return ApiResponse.ok(new JsonObject());
    }

    private ApiResponse putSkippedKey(Request request) {
        var body = request.body();
        var conversationId = ApiJson.requiredString(body, "conversationId");
        var userId = ApiJson.requiredString(body, "userId");
        requireSelf(request, userId);
        var stateId = relay.store().ratchetStateId(conversationId, userId).orElseThrow(() ->
                new KeyRelayException(ErrorCode.RATCHET_NOT_INITIALIZED, "Ratchet state not found"));
        var messageKeyId = ApiJson.requiredString(body, "messageKeyId");
        var expiresAt = relay.store().putSkippedKey(stateId, messageKeyId, ApiJson.requiredBytes(body, "messageKey"),
                ApiJson.requiredInt(body, "chainLength"), ApiJson.requiredInt(body, "messageNumber"));
        var json = new JsonObject();
        json.put("messageKeyId", messageKeyId);
        json.put("expiresAt", expiresAt.toString());
        return ApiResponse.ok(json);
    }

    private ApiResponse getSkippedKey(Request request) {
        requireSelf(request, request.param(1));
        var stateId = relay.store().ratchetStateId(request.param(0), request.param(1));
        return stateId.flatMap(id -> relay.store().getSkippedKey(id, request.param(2)))
                .map(key -> {
                    var json = new JsonObject();
                    json.put("skippedKey", ApiJson.skippedKey(key));
                    return ApiResponse.ok(json);
                })
                .orElseGet(() -> ApiResponse.error(404, "NOT_FOUND", "Skipped message key not found"));
    }

    private ApiResponse deleteSkippedKey(Request request) {
        requireSelf(request, request.param(1));
        var deleted = relay.store().ratchetStateId(request.param(0), request.param(1))
                .map(id -> relay.store().deleteSkippedKey(id, request.param(2)))
                .orElse(false);
        if (!deleted) {
            return ApiResponse.error(404, "NOT_FOUND", "Skipped message key not found");
        }
        return ApiResponse.ok(new JsonObject());
    }

    private ApiResponse ratchetStatistics(Request request) {
        requireSelf(request, request.param(1));
        return relay.store().statistics(request.param(0), request.param(1))
                .map(stats -> {
                    var json = new JsonObject();
                    json.put("stats", ApiJson.statistics(stats));
                    return ApiResponse.ok(json);
                })
                .orElseGet(() -> ApiResponse.error(ErrorCode.RATCHET_NOT_INITIALIZED, "Ratchet state not found"));
    }

    private ApiResponse listConversation(Request request) {
        requireAdministrator(request);
        var summaries = new ArrayList<JsonObject>();
        relay.store().listConversation(request.param(0)).forEach(s -> summaries.add(ApiJson.summary(s)));
        var json = new JsonObject();
        json.put("ratchetStates", ApiJson.array(summaries));
        return ApiResponse.ok(json);
    }

    private ApiResponse cleanup(Request request) {
        requireAdministrator(request);
        var json = new JsonObject();
        json.put("deletedSkippedKeys", relay.store().cleanupExpired());
        json.put("deletedExchanges", relay.exchanges().cleanupExpired());
        json.put("expiredSyncPackages", relay.sync().cleanupExpired());
        return ApiResponse.ok(json);
    }

    private ApiResponse health(Request request) {
        var report = relay.store().health();
        return ApiResponse.withStatus(report.isHealthy() ? 200 : 503, ApiJson.health(report));
    }

    private ApiResponse initiateExchange(Request request) {
        var body = request.body();
        var receipt = relay.exchanges().initiate(request.callerId(),
                ApiJson.requiredString(body, "recipientId"),
                ApiJson.optionalString(body, "conversationId"),
                ExchangeType.fromIdentifier(ApiJson.requiredString(body, "exchangeType")),
                PublicKeyBundle.fromJson(ApiJson.requiredObject(body, "publicKeyBundle")),
                ApiJson.optionalBytes(body, "encryptedKeyData"));
        var json = new JsonObject();
        json.put("exchangeId", receipt.exchangeId());
        json.put("status", receipt.status().identifier());
        json.put("expiresAt", receipt.expiresAt().toString());
        return ApiResponse.ok(json);
    }

    private ApiResponse respondToExchange(Request request) {
        var body = request.body();
        var receipt = relay.exchanges().respond(ApiJson.requiredString(body, "exchangeId"), request.callerId(),
                ApiJson.requiredBytes(body, "responseData"),
                PublicKeyBundle.fromJson(ApiJson.requiredObject(body, "publicKeyBundle")));
        var json = new JsonObject();
        json.put("exchangeId", receipt.exchangeId());
        json.put("status", receipt.status().identifier());
        return ApiResponse.ok(json);
    }

    private ApiResponse completeExchange(Request request) {
        var body = request.body();
        var receipt = relay.exchanges().complete(ApiJson.requiredString(body, "exchangeId"), request.callerId(),
                ApiJson.optionalBytes(body, "confirmationSignature"));
        var json = new JsonObject();
        json.put("exchangeId", receipt.exchangeId());
        json.put("status", receipt.status().identifier());
        return ApiResponse.ok(json);
    }

    private ApiResponse pendingExchanges(Request request) {
        var limit = request.intQuery("limit", 10);
        var exchanges = new ArrayList<JsonObject>();
        relay.exchanges().listPending(request.callerId(), limit).forEach(p -> exchanges.add(ApiJson.pending(p)));
        var json = new JsonObject();
        json.put("exchanges", ApiJson.array(exchanges));
        return ApiResponse.ok(json);
    }

    private ApiResponse exchangeStatistics(Request request) {
        var stats = relay.exchanges().statistics(Timeframe.fromIdentifier(request.query().get("timeframe")));
        var json = new JsonObject();
        json.put("stats", ApiJson.exchangeStatistics(stats));
        return ApiResponse.ok(json);
    }

    private ApiResponse exchangeData(Request request) {
        var data = relay.exchanges().getData(request.param(0), request.callerId());
        var json = new JsonObject();
        json.put("exchange", ApiJson.exchangeData(data));
        return ApiResponse.ok(json);
    }

    private ApiResponse registerDevice(Request request) {
        var body = request.body();
        var device = relay.sync().registerDevice(request.callerId(), ApiJson.requiredString(body, "deviceId"),
                ApiJson.optionalString(body, "deviceName"), ApiJson.optionalString(body, "deviceType"),
                ApiJson.optionalString(body, "platform"), ApiJson.optionalBytes(body, "publicKey"));
        var json = new JsonObject();
        json.put("deviceId", device.deviceId());
        return ApiResponse.ok(json);
    }

    private ApiResponse createSyncPackage(Request request) {
        var body = request.body();
        var packageJson = ApiJson.requiredObject(body, "encryptedKeyPackage");
        var metadataJson = ApiJson.requiredObject(body, "packageMetadata");
        var keyPackage = new EncryptedKeyPackage(ApiJson.requiredBytes(packageJson, "encryptedData"),
                ApiJson.requiredString(packageJson, "integrityHash"), ApiJson.optionalBytes(packageJson, "signature"),
                ApiJson.requiredString(packageJson, "encryptionMethod"));
        var metadata = new PackageMetadata(KeyType.fromIdentifier(ApiJson.requiredString(metadataJson, "keyType")),
                ApiJson.optionalString(metadataJson, "conversationId"),
                SyncPriority.fromIdentifier(ApiJson.optionalString(metadataJson, "priority")));
        var syncPackage = relay.sync().createPackage(request.callerId(), ApiJson.requiredString(body, "fromDeviceId"),
                ApiJson.requiredString(body, "toDeviceId"), keyPackage, metadata);
        var json = new JsonObject();
        json.put("packageId", syncPackage.packageId());
        json.put("status", syncPackage.status().identifier());
        return ApiResponse.ok(json);
    }

    private ApiResponse pendingSyncPackages(Request request) {
        var packages = new ArrayList<JsonObject>();
        relay.sync().listPending(request.param(0), request.callerId())
                .forEach(p -> packages.add(ApiJson.syncPackage(p)));
        var json = new JsonObject();
        json.put("packages", ApiJson.array(packages));
        return ApiResponse.ok(json);
    }

    private ApiResponse markSyncPackageProcessed(Request request) {
        var body = request.body();
        var syncPackage = relay.sync().markProcessed(request.param(0), request.callerId(),
                ApiJson.requiredBoolean(body, "success"), ApiJson.optionalString(body, "errorMessage"));
        var json = new JsonObject();
        json.put("packageId", syncPackage.packageId());
        json.put("status", syncPackage.status().identifier());
        return ApiResponse.ok(json);
    }

    private ApiResponse recordNegotiation(Request request) {
        var body = request.body();
        var keyExchange = KeyExchangeAlgorithm.fromIdentifier(ApiJson.requiredString(body, "keyExchange"));
        var signature = body.isString("signature")
                ? SignatureAlgorithm.fromIdentifier(body.getString("signature"))
                : SelectedAlgorithms.DEFAULT.signature();
        var encryption = body.isString("encryption")
                ? EncryptionAlgorithm.fromIdentifier(body.getString("encryption"))
                : SelectedAlgorithms.DEFAULT.encryption();
        var selected = new SelectedAlgorithms(keyExchange, signature, encryption);
        var capabilitiesJson = ApiJson.optionalObject(body, "capabilities");
        var capabilities = capabilitiesJson != null
                ? AlgorithmCapabilities.fromJson(capabilitiesJson)
                : keyExchange.isQuantumResistant() ? AlgorithmCapabilities.HYBRID : AlgorithmCapabilities.CLASSICAL;
        var remoteJson = ApiJson.optionalObject(body, "remoteCapabilities");
        var remote = remoteJson != null ? AlgorithmCapabilities.fromJson(remoteJson) : null;
        var responderId = body.isString("responderId") ? body.getString("responderId") : request.callerId();

        var negotiation = relay.ledger().record(ApiJson.requiredString(body, "conversationId"), request.callerId(),
                responderId, selected, body.getInt("securityLevel", selected.securityLevel()),
                body.getBoolean("quantumResistant", selected.isQuantumResistant()), capabilities, remote);
        var json = new JsonObject();
        json.put("negotiation", ApiJson.negotiation(negotiation));
        return ApiResponse.ok(json);
    }

    private ApiResponse encryptionStatus(Request request) {
        var conversationId = request.param(0);
        var json = new JsonObject();
        json.put("status", ApiJson.encryptionStatus(conversationId, relay.ledger().encryptionStatus(conversationId)));
        return ApiResponse.ok(json);
    }

    private ApiResponse encryptionStatistics(Request request) {
        var stats = relay.ledger().statistics(Timeframe.fromIdentifier(request.query().get("timeframe")));
        var json = new JsonObject();
        json.put("stats", ApiJson.encryptionStatistics(stats));
        return ApiResponse.ok(json);
    }

    private void requireSelf(Request request, String userId) {
        if (!request.callerId().equals(userId) && !administrators.contains(request.callerId())) {
            throw new ForbiddenException("Access denied to another user's ratchet state");
        }
    }

    private void requireAdministrator(Request request) {
        if (!administrators.contains(request.callerId())) {
            throw new ForbiddenException("Administrator access required");
        }
    }

    private void route(String method, String pattern, Handler handler) {
        routes.add(new Route(method, Pattern.compile(pattern), true, handler));
    }

    private void publicRoute(String method, String pattern, Handler handler) {
        routes.add(new Route(method, Pattern.compile(pattern), false, handler));
    }

    private static Map<String, String> parseQuery(String query) {
        var result = new HashMap<String, String>();
        for (var pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            var eq = pair.indexOf('=');
            if (eq < 0) {
                result.put(decode(pair), "");
            } else {
                result.put(decode(pair.substring(0, eq)), decode(pair.substring(eq + 1)));
            }
        }
        return result;
    }

    private static String decode(String component) {
        try {
            return URLDecoder.decode(component, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw KeyRelayException.validation("Malformed URL encoding");
        }
    }

    private static final class ForbiddenException extends RuntimeException {
        ForbiddenException(String message) {
            super(message, null, false, false);
        }
    }

    @FunctionalInterface
    private interface Handler {
        ApiResponse handle(Request request);
    }

    private record Route(String method, Pattern pattern, boolean authenticated, Handler handler) {}

    private record Request(String callerId, List<String> params, Map<String, String> query, JsonObject body) {
        String param(int index) {
            return params.get(index);
        }

        int intQuery(String name, int defaultValue) {
            var value = query.get(name);
            if (value == null || value.isBlank()) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw KeyRelayException.validation(name + " must be an integer");
            }
        }
    }
}
