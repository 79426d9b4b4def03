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

package io.keyrelay;

import static java.util.Objects.requireNonNull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tells a user (or one of their devices) that something is waiting for them in the relay. Delivery is best effort:
 * recipients can always poll for pending items, so a failed notification never fails the operation that raised it.
 */
@FunctionalInterface
public interface RelayNotifier {

    void notify(Notification notification);

    /**
     * Default notifier that only logs. Real deployments push over their own realtime channel.
     */
    RelayNotifier LOGGING = new RelayNotifier() {
        private final Logger logger = LoggerFactory.getLogger(RelayNotifier.class);

        @Override
        public void notify(Notification notification) {
            logger.info("Notify user {} device {}: {} {}", notification.userId(), notification.deviceId(),
                    notification.event(), notification.referenceId());
        }
    };

    enum Event {
        KEY_EXCHANGE_REQUEST,
        KEY_EXCHANGE_RESPONSE,
        KEY_EXCHANGE_COMPLETED,
        KEY_SYNC_PACKAGE
    }

    /**
     * @param deviceId null when the notification is for all of the user's devices.
     * @param referenceId the exchange id or package id.
     */
    record Notification(String userId, String deviceId, Event event, String referenceId) {
        public Notification {
            requireNonNull(userId, "userId");
            requireNonNull(event, "event");
            requireNonNull(referenceId, "referenceId");
        }
    }
}
