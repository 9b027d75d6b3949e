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

import dev.mars.retryflow.api.backoff.Backoff;
import dev.mars.retryflow.api.backoff.BackoffPolicy;
import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Exponential backoff bounded by a retry count and an elapsed-time budget.
 *
 * <p>Interval growth and jitter come from Resilience4j's {@link IntervalFunction}; this class
 * adds the per-transaction budget. The elapsed time is measured from the moment the backoff
 * instance is created, which is the first failure of the transaction.</p>
 */
public class ExponentialBackoffPolicy implements BackoffPolicy {

    private final BackoffConfig config;
    private final IntervalFunction intervalFunction;
    private final LongSupplier nanoClock;

    public ExponentialBackoffPolicy(BackoffConfig config) {
        this(config, System::nanoTime);
    }

    ExponentialBackoffPolicy(BackoffConfig config, LongSupplier nanoClock) {
        this.config = Objects.requireNonNull(config, "Backoff config cannot be null");
        this.nanoClock = nanoClock;
        if (config.getRandomizationFactor() > 0.0) {
            this.intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                config.getInitialInterval().toMillis(), config.getMultiplier(),
                config.getRandomizationFactor(), config.getMaxInterval().toMillis());
        } else {
            this.intervalFunction = IntervalFunction.ofExponentialBackoff(
                config.getInitialInterval().toMillis(), config.getMultiplier(),
                config.getMaxInterval().toMillis());
        }
    }

    public BackoffConfig getConfig() {
        return config;
    }

    @Override
    public Backoff newBackoff() {
        return new ExponentialBackoff(nanoClock.getAsLong());
    }

    private final class ExponentialBackoff implements Backoff {
        private final long startNanos;
        private int attempts;

        private ExponentialBackoff(long startNanos) {
            this.startNanos = startNanos;
        }

        @Override
        public Optional<Duration> nextInterval() {
            if (config.isRetryCountBounded() && attempts >= config.getMaxRetries()) {
                return Optional.empty();
            }
            if (config.isElapsedTimeBounded()
                    && nanoClock.getAsLong() - startNanos > config.getMaxElapsedTime().toNanos()) {
                return Optional.empty();
            }
            attempts++;
            // randomized intervals may overshoot the cap by the jitter factor
            long millis = Math.min(intervalFunction.apply(attempts), config.getMaxInterval().toMillis());
            return Optional.of(Duration.ofMillis(millis));
        }
    }

    @Override
    public String toString() {
        return "ExponentialBackoffPolicy{" + config + '}';
    }
}
