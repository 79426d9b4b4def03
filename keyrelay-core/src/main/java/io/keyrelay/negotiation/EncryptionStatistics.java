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

import java.util.Map;

import io.keyrelay.Timeframe;

/**
 * Aggregate encryption figures for a reporting window.
 *
 * @param encryptionRate percentage of messages that were encrypted, 0 when there were no messages.
 */
public record EncryptionStatistics(
        Timeframe timeframe,
        long totalMessages,
        long encryptedMessages,
        Map<String, Long> byAlgorithm,
        double encryptionRate,
        long negotiations,
        long quantumResistantNegotiations,
        Map<String, Long> negotiationsByKeyExchange) {
}
