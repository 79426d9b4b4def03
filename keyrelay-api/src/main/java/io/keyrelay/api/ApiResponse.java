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

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonWriter;

import io.keyrelay.ErrorCode;

/**
 * An HTTP-style response: a status code and a JSON body.
 */
public record ApiResponse(int status, JsonObject body) {

    public ApiResponse {
        requireNonNull(body, "body");
    }

    static ApiResponse ok(JsonObject body) {
        return withStatus(200, body);
    }

    static ApiResponse withStatus(int status, JsonObject body) {
        body.put("success", status < 400);
        return new ApiResponse(status, body);
    }

    static ApiResponse error(ErrorCode code, String message) {
        return error(code.httpStatus(), code.code(), message);
    }

    static ApiResponse error(int status, String code, String message) {
        var error = new JsonObject();
        error.put("code", code);
        error.put("message", message);
        var body = new JsonObject();
        body.put("success", false);
        body.put("error", error);
        return new ApiResponse(status, body);
    }

    public boolean isSuccess() {
        return status < 400;
    }

    public String bodyAsString() {
        return JsonWriter.string(body);
    }
}
