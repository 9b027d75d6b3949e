package dev.mars.retryflow.core.backoff;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

import dev.mars.retryflow.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class BackoffConfigTest {

    @Test
    @DisplayName("Defaults retry forever with 100ms growing to 1s")
    void testDefaults() {
        BackoffConfig config = BackoffConfig.defaultConfig();

        assertEquals(Duration.ofMillis(100), config.getInitialInterval());
        assertEquals(Duration.ofSeconds(1), config.getMaxInterval());
        assertEquals(Duration.ZERO, config.getMaxElapsedTime());
        assertEquals(0, config.getMaxRetries());
        assertFalse(config.isRetryCountBounded());
        assertFalse(config.isElapsedTimeBounded());
    }

    @Test
    void testFromProperties() {
        BackoffConfig config = BackoffConfig.fromProperties(Map.of(
            "max-retries", "3",
            "backoff.initial-interval", "50ms",
            "backoff.max-interval", "2s",
            "backoff.max-elapsed-time", "30s",
            "backoff.multiplier", "1.5",
            "backoff.randomization-factor", "0.25"));

        assertEquals(3, config.getMaxRetries());
        assertEquals(Duration.ofMillis(50), config.getInitialInterval());
        assertEquals(Duration.ofSeconds(2), config.getMaxInterval());
        assertEquals(Duration.ofSeconds(30), config.getMaxElapsedTime());
        assertEquals(1.5, config.getMultiplier());
        assertEquals(0.25, config.getRandomizationFactor());
        assertTrue(config.isRetryCountBounded());
        assertTrue(config.isElapsedTimeBounded());
    }

    @Test
    void testMissingKeysKeepDefaults() {
        BackoffConfig config = BackoffConfig.fromProperties(Map.of("max-retries", "2"));

        assertEquals(2, config.getMaxRetries());
        assertEquals(Duration.ofMillis(100), config.getInitialInterval());
    }

    @Test
    @DisplayName("Unparseable values name the setting that failed")
    void testParseErrors() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> BackoffConfig.fromProperties(Map.of("backoff.initial-interval", "soon")));
        assertTrue(e.getMessage().startsWith("failed to parse backoff initial interval"));

        e = assertThrows(IllegalArgumentException.class,
            () -> BackoffConfig.fromProperties(Map.of("backoff.max-interval", "never")));
        assertTrue(e.getMessage().startsWith("failed to parse backoff max interval"));

        e = assertThrows(IllegalArgumentException.class,
            () -> BackoffConfig.fromProperties(Map.of("backoff.max-elapsed-time", "1 hour")));
        assertTrue(e.getMessage().startsWith("failed to parse backoff max elapsed time"));

        e = assertThrows(IllegalArgumentException.class,
            () -> BackoffConfig.fromProperties(Map.of("max-retries", "many")));
        assertTrue(e.getMessage().startsWith("failed to parse max retries"));
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> BackoffConfig.builder().initialInterval(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
            () -> BackoffConfig.builder().initialInterval(Duration.ofSeconds(2)).maxInterval(Duration.ofSeconds(1)).build());
        assertThrows(IllegalArgumentException.class,
            () -> BackoffConfig.builder().maxElapsedTime(Duration.ofSeconds(-1)).build());
        assertThrows(IllegalArgumentException.class,
            () -> BackoffConfig.builder().maxRetries(-1).build());
        assertThrows(IllegalArgumentException.class,
            () -> BackoffConfig.builder().multiplier(0.5).build());
        assertThrows(IllegalArgumentException.class,
            () -> BackoffConfig.builder().randomizationFactor(1.0).build());
        assertThrows(NullPointerException.class,
            () -> BackoffConfig.builder().maxInterval(null).build());
    }
}
