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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps ratchet state in memory. Suitable for tests and single-process deployments.
 */
public final class InMemoryRatchetStateRepository implements RatchetStateRepository {
    private final ConcurrentHashMap<StateKey, StoredRatchetState> states = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<SkippedKeyId, StoredSkippedKey> skippedKeys = new ConcurrentHashMap<>();

    private record StateKey(String conversationId, String userId) {}

    private record SkippedKeyId(String ratchetStateId, String messageKeyId) {}

    @Override
    public Optional<StoredRatchetState> find(String conversationId, String userId) {
        return Optional.ofNullable(states.get(new StateKey(conversationId, userId)));
    }

    @Override
    public List<StoredRatchetState> findByConversation(String conversationId) {
        var result = new ArrayList<StoredRatchetState>();
        for (var state : states.values()) {
            if (state.conversationId().equals(conversationId)) {
                result.add(state);
            }
        }
        result.sort(Comparator.comparing(StoredRatchetState::createdAt));
        return result;
    }

    @Override
    public OptionalLong save(StoredRatchetState record, long expectedVersion) {
        var key = new StateKey(record.conversationId(), record.userId());
        var newVersion = new long[1];
        var conflict = new boolean[1];
        states.compute(key, (k, current) -> {
            long currentVersion = current == null ? 0L : current.version();
            if (expectedVersion != ANY_VERSION && currentVersion != expectedVersion) {
                conflict[0] = true;
                return current;
            }
            newVersion[0] = currentVersion + 1;
            return record.withVersion(newVersion[0]);
        });
        return conflict[0] ? OptionalLong.empty() : OptionalLong.of(newVersion[0]);
    }

    @Override
    public boolean delete(String conversationId, String userId) {
        var removed = states.remove(new StateKey(conversationId, userId));
        if (removed == null) {
            return false;
        }
        deleteSkippedKeys(removed.id());
        return true;
    }

    @Override
    public long countStates() {
        return states.size();
    }

    @Override
    public void saveSkippedKey(StoredSkippedKey key) {
        skippedKeys.put(new SkippedKeyId(key.ratchetStateId(), key.messageKeyId()), key);
    }

    @Override
    public Optional<StoredSkippedKey> findSkippedKey(String ratchetStateId, String messageKeyId) {
        return Optional.ofNullable(skippedKeys.get(new SkippedKeyId(ratchetStateId, messageKeyId)));
    }

    @Override
    public List<StoredSkippedKey> findSkippedKeys(String ratchetStateId) {
        var result = new ArrayList<StoredSkippedKey>();
        for (Map.Entry<SkippedKeyId, StoredSkippedKey> entry : skippedKeys.entrySet()) {
            if (entry.getKey().ratchetStateId().equals(ratchetStateId)) {
                result.add(entry.getValue());
            }
        }
        result.sort(Comparator.comparing(StoredSkippedKey::createdAt)
                .thenComparingInt(StoredSkippedKey::chainLength)
                .thenComparingInt(StoredSkippedKey::messageNumber));
        return result;
    }

    @Override
    public boolean deleteSkippedKey(String ratchetStateId, String messageKeyId) {
        return skippedKeys.remove(new SkippedKeyId(ratchetStateId, messageKeyId)) != null;
    }

    @Override
    public int deleteSkippedKeys(String ratchetStateId) {
        int before = skippedKeys.size();
        skippedKeys.keySet().removeIf(id -> id.ratchetStateId().equals(ratchetStateId));
        return Math.max(0, before - skippedKeys.size());
    }

    @Override
    public int deleteSkippedKeysExpiredBefore(Instant now) {
        int deleted = 0;
        for (var entry : skippedKeys.entrySet()) {
            if (entry.getValue().isExpiredAt(now) && skippedKeys.remove(entry.getKey(), entry.getValue())) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public long countSkippedKeys() {
        return skippedKeys.size();
    }

    @Override
    public long countSkippedKeysExpiredBefore(Instant now) {
        return skippedKeys.values().stream().filter(k -> k.isExpiredAt(now)).count();
    }
}
