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

import java.time.Instant;
import java.util.Arrays;

/**
 * A message key retained for a message that has not arrived yet. The key is single-use: it is removed as soon as the
 * matching message decrypts.
 *
 * @param messageKeyId the identifier {@code "<chainLength>:<messageNumber>"}.
 * @param messageKey the 32-byte message key.
 * @param chainLength the receiving chain the key belongs to.
 * @param messageNumber the index of the message within that chain.
 * @param expiresAt when the key is purged even if unused.
 */
public record SkippedMessageKey(String messageKeyId, byte[] messageKey, int chainLength, int messageNumber,
        Instant expiresAt) {

    public SkippedMessageKey {
        requireNonNull(messageKeyId, "messageKeyId");
        requireNonNull(messageKey, "messageKey");
        requireNonNull(expiresAt, "expiresAt");
        messageKey = messageKey.clone();
    }

    public static String idFor(int chainLength, int messageNumber) {
        return chainLength + ":" + messageNumber;
    }

    @Override
    public byte[] messageKey() {
        return messageKey.clone();
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt.isBefore(now);
    }

    SkippedMessageKey copy() {
        return new SkippedMessageKey(messageKeyId, messageKey, chainLength, messageNumber, expiresAt);
    }

    void wipe() {
        Arrays.fill(messageKey, (byte) 0);
    }

    @Override
    public String toString() {
        return "SkippedMessageKey{" + messageKeyId + ", expiresAt=" + expiresAt + "}";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SkippedMessageKey that && messageKeyId.equals(that.messageKeyId)
                && chainLength == that.chainLength && messageNumber == that.messageNumber
                && expiresAt.equals(that.expiresAt) && Arrays.equals(messageKey, that.messageKey);
    }

    @Override
    public int hashCode() {
        return messageKeyId.hashCode();
    }
}
