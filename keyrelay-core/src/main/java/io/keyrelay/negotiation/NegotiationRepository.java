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
import java.util.List;
import java.util.Optional;

/**
 * Storage for negotiation records.
 */
public interface NegotiationRepository {

    /**
     * Stores a new active record and deactivates any other active record for the same conversation, atomically.
     */
    void replaceActive(AlgorithmNegotiation negotiation);

    Optional<AlgorithmNegotiation> findActive(String conversationId);

    List<AlgorithmNegotiation> findCreatedSince(Instant since);
}
