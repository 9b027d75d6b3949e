package dev.mars.retryflow.retry;

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

import dev.mars.retryflow.api.output.OutputConfig;
import dev.mars.retryflow.core.backoff.BackoffConfig;
import dev.mars.retryflow.core.config.Durations;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Settings of a retry output.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryOutputConfig config = RetryOutputConfig.builder()
 *     .name("orders-out")
 *     .backoffConfig(BackoffConfig.builder().maxRetries(3).build())
 *     .backpressurePollInterval(Duration.ofMillis(100))
 *     .build();
 * }</pre>
 */
public class RetryOutputConfig {

    public static final String BACKPRESSURE_POLL_INTERVAL = "backpressure-poll-interval";
    public static final String CLOSE_POLL_INTERVAL = "close-poll-interval";
    public static final String CHANNEL_CAPACITY = "channel-capacity";

    private final String name;
    private final BackoffConfig backoffConfig;
    private final Duration backpressurePollInterval;
    private final Duration closePollInterval;
    private final int channelCapacity;

    private RetryOutputConfig(Builder builder) {
        this.name = builder.name;
        this.backoffConfig = builder.backoffConfig;
        this.backpressurePollInterval = builder.backpressurePollInterval;
        this.closePollInterval = builder.closePollInterval;
        this.channelCapacity = builder.channelCapacity;
    }

    public String getName() { return name; }
    public BackoffConfig getBackoffConfig() { return backoffConfig; }
    public Duration getBackpressurePollInterval() { return backpressurePollInterval; }
    public Duration getClosePollInterval() { return closePollInterval; }
    public int getChannelCapacity() { return channelCapacity; }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the retry settings of a declared output.
     *
     * @throws IllegalArgumentException if a setting is malformed or out of range
     */
    public static RetryOutputConfig fromOutputConfig(OutputConfig config) {
        return fromProperties(config.getName(), config.getProperties());
    }

    public static RetryOutputConfig fromProperties(String name, Map<String, String> properties) {
        Builder builder = builder()
            .name(name)
            .backoffConfig(BackoffConfig.fromProperties(properties));

        String value;
        if ((value = properties.get(BACKPRESSURE_POLL_INTERVAL)) != null) {
            builder.backpressurePollInterval(parseDuration("backpressure poll interval", value));
        }
        if ((value = properties.get(CLOSE_POLL_INTERVAL)) != null) {
            builder.closePollInterval(parseDuration("close poll interval", value));
        }
        if ((value = properties.get(CHANNEL_CAPACITY)) != null) {
            try {
                builder.channelCapacity(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("failed to parse channel capacity: " + value, e);
            }
        }
        return builder.build();
    }

    private static Duration parseDuration(String setting, String value) {
        try {
            return Durations.parse(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("failed to parse " + setting + ": " + e.getMessage(), e);
        }
    }

    public static class Builder {
        private String name = "retry";
        private BackoffConfig backoffConfig = BackoffConfig.defaultConfig();
        private Duration backpressurePollInterval = Duration.ofMillis(100);
        private Duration closePollInterval = Duration.ofSeconds(1);
        private int channelCapacity = 1;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder backoffConfig(BackoffConfig backoffConfig) {
            this.backoffConfig = backoffConfig;
            return this;
        }

        public Builder backpressurePollInterval(Duration backpressurePollInterval) {
            this.backpressurePollInterval = backpressurePollInterval;
            return this;
        }

        public Builder closePollInterval(Duration closePollInterval) {
            this.closePollInterval = closePollInterval;
            return this;
        }

        public Builder channelCapacity(int channelCapacity) {
            this.channelCapacity = channelCapacity;
            return this;
        }

        public RetryOutputConfig build() {
            if (name == null || name.trim().isEmpty()) {
                throw new IllegalArgumentException("Output name cannot be null or empty");
            }
            Objects.requireNonNull(backoffConfig, "Backoff config cannot be null");
            if (backpressurePollInterval == null || backpressurePollInterval.isZero() || backpressurePollInterval.isNegative()) {
                throw new IllegalArgumentException("Backpressure poll interval must be positive, got: " + backpressurePollInterval);
            }
            if (closePollInterval == null || closePollInterval.isZero() || closePollInterval.isNegative()) {
                throw new IllegalArgumentException("Close poll interval must be positive, got: " + closePollInterval);
            }
            if (channelCapacity < 1) {
                throw new IllegalArgumentException("Channel capacity must be at least 1, got: " + channelCapacity);
            }
            return new RetryOutputConfig(this);
        }
    }

    @Override
    public String toString() {
        return "RetryOutputConfig{" +
                "name='" + name + '\'' +
                ", backoffConfig=" + backoffConfig +
                ", backpressurePollInterval=" + backpressurePollInterval +
                ", closePollInterval=" + closePollInterval +
                ", channelCapacity=" + channelCapacity +
                '}';
    }
}
