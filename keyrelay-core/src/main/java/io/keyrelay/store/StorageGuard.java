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

package io.keyrelay.store;

import static java.util.Objects.requireNonNull;

import java.util.function.Supplier;

import org.slf4j.Logger;

import io.keyrelay.ErrorCode;
import io.keyrelay.KeyRelayException;
import io.keyrelay.RedactedLogger;

/**
 * Runs calls into a pluggable repository and turns a {@link RepositoryException} into
 * {@link ErrorCode#STORAGE_UNAVAILABLE}, so backend failures reach callers as a retryable error and never as a raw
 * runtime exception.
 */
public final class StorageGuard {
    private static final Logger logger = RedactedLogger.getLogger(StorageGuard.class);

    private final String storeName;

    public StorageGuard(String storeName) {
        this.storeName = requireNonNull(storeName, "storeName");
    }

    public <T> T call(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (RepositoryException e) {
            logger.error("{} storage failure: {}", storeName, e.getMessage());
            throw new KeyRelayException(ErrorCode.STORAGE_UNAVAILABLE, storeName + " storage is unavailable", e);
        }
    }

    public void run(Runnable operation) {
        call(() -> {
            operation.run();
            return null;
        });
    }

    @Override
    public String toString() {
        return "StorageGuard{" + storeName + "}";
    }
}
