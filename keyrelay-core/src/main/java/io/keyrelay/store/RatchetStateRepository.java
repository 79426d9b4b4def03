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

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Storage backend for ratchet state and skipped message keys. Implementations only ever see sealed key material.
 * <p>
 * Implementations report backend failures by throwing {@link RepositoryException}.
 */
public interface RatchetStateRepository {
    /**
     * Passed as the expected version to write unconditionally.
     */
    long ANY_VERSION = -1L;

    Optional<StoredRatchetState> find(String conversationId, String userId);

    List<StoredRatchetState> findByConversation(String conversationId);

    /**
     * Inserts or replaces the record for the record's conversation and user, if the currently stored version matches
     * {@code expectedVersion}. An expected version of 0 means no record may exist yet.
     *
     * @return the new version, or empty if the stored version did not match.
     */
    OptionalLong save(StoredRatchetState record, long expectedVersion);

    /**
     * Deletes a ratchet state together with all of its skipped keys.
     */
    boolean delete(String conversationId, String userId);

    long countStates();

    void saveSkippedKey(StoredSkippedKey key);

    Optional<StoredSkippedKey> findSkippedKey(String ratchetStateId, String messageKeyId);

    List<StoredSkippedKey> findSkippedKeys(String ratchetStateId);

    boolean deleteSkippedKey(String ratchetStateId, String messageKeyId);

    int deleteSkippedKeys(String ratchetStateId);

    /**
     * Deletes every skipped key that expired before {@code now}.
     *
     * @return the number of keys deleted.
     */
    int deleteSkippedKeysExpiredBefore(Instant now);

    long countSkippedKeys();

    long countSkippedKeysExpiredBefore(Instant now);
}
