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
import java.util.Map;

/**
 * Message counts supplied by the messaging layer, which owns message storage.
 */
public interface MessageStatisticsSource {

    MessageStatisticsSource NONE = new MessageStatisticsSource() {
        @Override
        public MessageCounts countSince(Instant since) {
            return new MessageCounts(0, 0, Map.of());
        }

        @Override
        public boolean hasEncryptedMessages(String conversationId) {
            return false;
        }
    };

    MessageCounts countSince(Instant since);

    boolean hasEncryptedMessages(String conversationId);

    /**
     * @param byAlgorithm number of encrypted messages per cipher identifier.
     */
    record MessageCounts(long total, long encrypted, Map<String, Long> byAlgorithm) {
        public MessageCounts {
            byAlgorithm = Map.copyOf(byAlgorithm);
        }
    }
}
