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

package io.keyrelay.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import org.testng.annotations.Test;

public class KeyRelayConfigTest {

    @Test
    public void shouldUseDefaultsWhenNothingIsSet() {
        var config = KeyRelayConfig.defaults();

        assertThat(config.mode()).isEqualTo(KeyRelayConfig.Mode.PRODUCTION);
        assertThat(config.isProduction()).isTrue();
        assertThat(config.stateKeyEnvironmentVariable()).isEqualTo("RATCHET_STATE_ENCRYPTION_KEY");
        assertThat(config.maxSkip()).isEqualTo(1000);
        assertThat(config.maxRetainedSkippedKeys()).isEqualTo(1000);
        assertThat(config.skippedKeyTtl()).isEqualTo(Duration.ofDays(7));
        assertThat(config.exchangeTtl()).isEqualTo(Duration.ofHours(24));
        assertThat(config.syncPackageTtl()).isEqualTo(Duration.ofHours(24));
        assertThat(config.negotiationTtl()).isEqualTo(Duration.ofDays(30));
        assertThat(config.cleanupInterval()).isEqualTo(Duration.ofHours(1));
    }

    @Test
    public void shouldLoadClasspathResource() {
        var config = KeyRelayConfig.load();

        assertThat(config.maxSkip()).isEqualTo(1000);
        assertThat(config.skippedKeyTtl()).isEqualTo(Duration.ofDays(7));
    }

    @Test
    public void environmentShouldOverrideProperties() {
        var properties = new Properties();
        properties.setProperty("keyrelay.ratchet.max-skip", "50");
        properties.setProperty("keyrelay.mode", "development");

        var config = KeyRelayConfig.from(properties, Map.of(
                "KEYRELAY_RATCHET_MAX_SKIP", "25",
                "KEYRELAY_EXCHANGE_TTL", "PT2H"));

        assertThat(config.maxSkip()).isEqualTo(25);
        assertThat(config.mode()).isEqualTo(KeyRelayConfig.Mode.DEVELOPMENT);
        assertThat(config.exchangeTtl()).isEqualTo(Duration.ofHours(2));
    }

    @Test
    public void shouldRejectInvalidValues() {
        var badInt = new Properties();
        badInt.setProperty("keyrelay.ratchet.max-skip", "lots");
        assertThatIllegalArgumentException()
                .isThrownBy(() -> KeyRelayConfig.from(badInt, Map.of()))
                .withMessageContaining("keyrelay.ratchet.max-skip");

        var badDuration = new Properties();
        badDuration.setProperty("keyrelay.sync.ttl", "1 day");
        assertThatIllegalArgumentException()
                .isThrownBy(() -> KeyRelayConfig.from(badDuration, Map.of()))
                .withMessageContaining("keyrelay.sync.ttl");

        var zeroSkip = new Properties();
        zeroSkip.setProperty("keyrelay.ratchet.max-skip", "0");
        assertThatIllegalArgumentException()
                .isThrownBy(() -> KeyRelayConfig.from(zeroSkip, Map.of()));
    }
}
