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

import dev.mars.retryflow.core.config.Durations;

import java.time.Duration;
import java.util.Map;

/**
 * Retry budget and backoff timing of a retrying output.
 *
 * <p>A zero {@code maxElapsedTime} or {@code maxRetries} leaves that dimension unbounded; the
 * other dimension still applies when set.</p>
 */
public class BackoffConfig {

    public static final String MAX_RETRIES = "max-retries";
    public static final String INITIAL_INTERVAL = "backoff.initial-interval";
    public static final String MAX_INTERVAL = "backoff.max-interval";
    public static final String MAX_ELAPSED_TIME = "backoff.max-elapsed-time";
    public static final String MULTIPLIER = "backoff.multiplier";
    public static final String RANDOMIZATION_FACTOR = "backoff.randomization-factor";

    private final Duration initialInterval;
    private final Duration maxInterval;
    private final Duration maxElapsedTime;
    private final int maxRetries;
    private final double multiplier;
    private final double randomizationFactor;

    private BackoffConfig(Builder builder) {
        this.initialInterval = builder.initialInterval;
        this.maxInterval = builder.maxInterval;
        this.maxElapsedTime = builder.maxElapsedTime;
        this.maxRetries = builder.maxRetries;
        this.multiplier = builder.multiplier;
        this.randomizationFactor = builder.randomizationFactor;
    }

    public Duration getInitialInterval() { return initialInterval; }
    public Duration getMaxInterval() { return maxInterval; }
    public Duration getMaxElapsedTime() { return maxElapsedTime; }
    public int getMaxRetries() { return maxRetries; }
    public double getMultiplier() { return multiplier; }
    public double getRandomizationFactor() { return randomizationFactor; }

    public boolean isRetryCountBounded() { return maxRetries > 0; }
    public boolean isElapsedTimeBounded() { return !maxElapsedTime.isZero(); }

    public static Builder builder() {
        return new Builder();
    }

    public static BackoffConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Reads the backoff settings of an output from its properties. Missing keys keep their
     * defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static BackoffConfig fromProperties(Map<String, String> properties) {
        Builder builder = builder();
        String value;
        if ((value = properties.get(MAX_RETRIES)) != null) {
            try {
                builder.maxRetries(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("failed to parse max retries: " + value, e);
            }
        }
        if ((value = properties.get(INITIAL_INTERVAL)) != null) {
            builder.initialInterval(parseDuration("backoff initial interval", value));
        }
        if ((value = properties.get(MAX_INTERVAL)) != null) {
            builder.maxInterval(parseDuration("backoff max interval", value));
        }
        if ((value = properties.get(MAX_ELAPSED_TIME)) != null) {
            builder.maxElapsedTime(parseDuration("backoff max elapsed time", value));
        }
        if ((value = properties.get(MULTIPLIER)) != null) {
            builder.multiplier(parseDouble("backoff multiplier", value));
        }
        if ((value = properties.get(RANDOMIZATION_FACTOR)) != null) {
            builder.randomizationFactor(parseDouble("backoff randomization factor", value));
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

    private static double parseDouble(String setting, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("failed to parse " + setting + ": " + value, e);
        }
    }

    public static class Builder {
        private Duration initialInterval = Duration.ofMillis(100);
        private Duration maxInterval = Duration.ofSeconds(1);
        private Duration maxElapsedTime = Duration.ZERO;
        private int maxRetries = 0;
        private double multiplier = 2.0;
        private double randomizationFactor = 0.0;

        public Builder initialInterval(Duration initialInterval) {
            this.initialInterval = initialInterval;
            return this;
        }

        public Builder maxInterval(Duration maxInterval) {
            this.maxInterval = maxInterval;
            return this;
        }

        public Builder maxElapsedTime(Duration maxElapsedTime) {
            this.maxElapsedTime = maxElapsedTime;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder randomizationFactor(double randomizationFactor) {
            this.randomizationFactor = randomizationFactor;
            return this;
        }

        public BackoffConfig build() {
            if (initialInterval == null || maxInterval == null || maxElapsedTime == null) {
                throw new NullPointerException("Backoff intervals cannot be null");
            }
            if (initialInterval.toMillis() < 1) {
                throw new IllegalArgumentException("Initial interval must be at least 1ms, got: " + initialInterval);
            }
            if (maxInterval.compareTo(initialInterval) < 0) {
                throw new IllegalArgumentException("Max interval must not be shorter than the initial interval, got: "
                    + maxInterval + " < " + initialInterval);
            }
            if (maxElapsedTime.isNegative()) {
                throw new IllegalArgumentException("Max elapsed time cannot be negative, got: " + maxElapsedTime);
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("Max retries cannot be negative, got: " + maxRetries);
            }
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0, got: " + multiplier);
            }
            if (randomizationFactor < 0.0 || randomizationFactor >= 1.0) {
                throw new IllegalArgumentException("Randomization factor must be in [0, 1), got: " + randomizationFactor);
            }
            return new BackoffConfig(this);
        }
    }

    @Override
    public String toString() {
        return "BackoffConfig{" +
                "initialInterval=" + initialInterval +
                ", maxInterval=" + maxInterval +
                ", maxElapsedTime=" + maxElapsedTime +
                ", maxRetries=" + maxRetries +
                ", multiplier=" + multiplier +
                ", randomizationFactor=" + randomizationFactor +
                '}';
    }
}
