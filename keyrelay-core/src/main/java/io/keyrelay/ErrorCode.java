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

/**
 * Stable error codes. The code string is part of the wire contract and must not change once published.
 */
public enum ErrorCode {
    RATCHET_NOT_INITIALIZED(404),
    ALREADY_INITIALIZED(409),
    AUTHENTICATION_FAILURE(400),
    SKIP_WINDOW_EXCEEDED(400),
    MESSAGE_KEY_UNAVAILABLE(400),
    SENDING_CHAIN_UNAVAILABLE(409),
    STATE_CONFLICT(409),
    CORRUPTED_STATE(500),
    EXCHANGE_NOT_FOUND(404),
    EXCHANGE_UNAUTHORIZED(403),
    EXCHANGE_INVALID_STATE(409),
    EXCHANGE_EXPIRED(410),
    DEVICE_OWNERSHIP_MISMATCH(403),
    PACKAGE_NOT_FOUND(404),
    STORAGE_UNAVAILABLE(503),
    VALIDATION_ERROR(400);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public String code() {
        return name();
    }

    public int httpStatus() {
        return httpStatus;
    }
}
