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
import java.util.List;
import java.util.Optional;

/**
 * Storage for key exchanges. Status changes go through {@link #compareAndSet} so that two concurrent responses to
 * the same exchange cannot both succeed.
 */
public interface ExchangeRepository {

    void insert(KeyExchange exchange);

    Optional<KeyExchange> find(String exchangeId);

    /**
     * Replaces the stored exchange only if its current status is {@code expectedStatus}.
     *
     * @return true if the update was applied.
     */
    boolean compareAndSet(String exchangeId, ExchangeStatus expectedStatus, KeyExchange updated);

    /**
     * Exchanges in which the user is either party and whose stored status is open.
     */
    List<KeyExchange> findOpenFor(String userId);

    List<KeyExchange> findCreatedSince(Instant since);

    /**
     * Deletes exchanges that were never completed and whose expiry time is before {@code now}.
     *
     * @return the number deleted.
     */
    int deleteExpired(Instant now);
}
