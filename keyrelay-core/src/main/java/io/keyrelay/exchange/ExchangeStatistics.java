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

import java.util.Map;

import io.keyrelay.Timeframe;

/**
 * @param successRate percentage of exchanges in the window that completed, 0 when there were none.
 */
public record ExchangeStatistics(Timeframe timeframe, long total, Map<String, Long> byStatus,
        Map<String, Long> byType, double successRate) {
}
