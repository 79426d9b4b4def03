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

import java.util.Locale;

/**
 * Exchange lifecycle: {@code PENDING -> RESPONDED -> COMPLETED}. Any exchange that is not completed by its expiry
 * time becomes {@code EXPIRED}.
 */
public enum ExchangeStatus {
    PENDING,
    RESPONDED,
    COMPLETED,
    EXPIRED;

    public String identifier() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isOpen() {
        return this == PENDING || this == RESPONDED;
    }
}
