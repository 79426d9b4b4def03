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

/**
 * The single exception type raised by KeyRelay components. Messages are safe to show to callers: they never contain
 * key material, plaintext or ciphertext.
 */
public class KeyRelayException extends RuntimeException {
    private final ErrorCode errorCode;

    public KeyRelayException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = requireNonNull(errorCode, "errorCode");
    }

    public KeyRelayException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = requireNonNull(errorCode, "errorCode");
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    public static KeyRelayException validation(String message) {
        return new KeyRelayException(ErrorCode.VALIDATION_ERROR, message);
    }

    @Override
    public String toString() {
        return "KeyRelayException{" + errorCode + ": " + getMessage() + "}";
    }
}
