package dev.mars.retryflow.api.backoff;

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

import java.time.Duration;
import java.util.Optional;

/**
 * Stateful backoff for a single transaction. Never shared between transactions.
 */
public interface Backoff {

    /**
     * Advances the backoff.
     *
     * @return the time to wait before the next attempt, or empty once the retry budget is
     *         exhausted
     */
    Optional<Duration> nextInterval();
}
