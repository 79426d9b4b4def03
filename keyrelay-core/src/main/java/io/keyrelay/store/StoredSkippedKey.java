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

import java.time.Instant;

/**
 * The persisted form of a skipped message key. Unique per ({@code ratchetStateId}, {@code messageKeyId}).
 */
public record StoredSkippedKey(
        String ratchetStateId,
        String messageKeyId,
        SealedBox encryptedKey,
        int chainLength,
        int messageNumber,
        Instant createdAt,
        Instant expiresAt) {

    public StoredSkippedKey {
        requireNonNull(ratchetStateId, "ratchetStateId");
        requireNonNull(messageKeyId, "messageKeyId");
        requireNonNull(encryptedKey, "encryptedKey");
        requireNonNull(createdAt, "createdAt");
        requireNonNull(expiresAt, "expiresAt");
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt.isBefore(now);
    }
}
