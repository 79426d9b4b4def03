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

package io.keyrelay.exchange;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryExchangeRepository implements ExchangeRepository {
    private final ConcurrentHashMap<String, KeyExchange> exchanges = new ConcurrentHashMap<>();

    @Override
    public void insert(KeyExchange exchange) {
        if (exchanges.putIfAbsent(exchange.id(), exchange) != null) {
            throw new IllegalStateException("Duplicate exchange id");
        }
    }

    @Override
    public Optional<KeyExchange> find(String exchangeId) {
        return Optional.ofNullable(exchanges.get(exchangeId));
    }

    @Override
    public boolean compareAndSet(String exchangeId, ExchangeStatus expectedStatus, KeyExchange updated) {
        var applied = new boolean[1];
        exchanges.computeIfPresent(exchangeId, (id, current) -> {
            if (current.status() != expectedStatus) {
                return current;
            }
            applied[0] = true;
            return updated;
        });
        return applied[0];
    }

    @Override
    public List<KeyExchange> findOpenFor(String userId) {
        var result = new ArrayList<KeyExchange>();
        for (var exchange : exchanges.values()) {
            if (exchange.status().isOpen() && exchange.isParticipant(userId)) {
                result.add(exchange);
            }
        }
        return result;
    }

    @Override
    public List<KeyExchange> findCreatedSince(Instant since) {
        var result = new ArrayList<KeyExchange>();
        for (var exchange : exchanges.values()) {
            if (!exchange.createdAt().isBefore(since)) {
                result.add(exchange);
            }
        }
        return result;
    }

    @Override
    public int deleteExpired(Instant now) {
        int before = exchanges.size();
        exchanges.values().removeIf(e -> e.status() != ExchangeStatus.COMPLETED && e.expiresAt().isBefore(now));
        return before - exchanges.size();
    }
}
