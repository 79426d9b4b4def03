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

package io.keyrelay.negotiation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryNegotiationRepository implements NegotiationRepository {
    private final ConcurrentHashMap<String, List<AlgorithmNegotiation>> byConversation = new ConcurrentHashMap<>();

    @Override
    public void replaceActive(AlgorithmNegotiation negotiation) {
        byConversation.compute(negotiation.conversationId(), (id, existing) -> {
            var records = new ArrayList<AlgorithmNegotiation>();
            if (existing != null) {
                for (var record : existing) {
                    records.add(record.active() ? record.deactivated() : record);
                }
            }
            records.add(negotiation);
            return List.copyOf(records);
        });
    }

    @Override
    public Optional<AlgorithmNegotiation> findActive(String conversationId) {
        return byConversation.getOrDefault(conversationId, List.of()).stream()
                .filter(AlgorithmNegotiation::active)
                .findFirst();
    }

    @Override
    public List<AlgorithmNegotiation> findCreatedSince(Instant since) {
        var result = new ArrayList<AlgorithmNegotiation>();
        for (var records : byConversation.values()) {
            for (var record : records) {
                if (!record.createdAt().isBefore(since)) {
                    result.add(record);
                }
            }
        }
        return result;
    }
}
