package dev.mars.retryflow.test.categories;

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

/**
 * Test category constants for the retryflow-core module.
 *
 * <p>Used with JUnit 5 {@code @Tag} annotations so subsets of tests can be selected through
 * surefire's {@code groups} / {@code excludedGroups} settings:</p>
 *
 * <pre>{@code
 * mvn test -Dgroups=core
 * mvn test -DexcludedGroups=slow
 * }</pre>
 *
 * <h3>Module Specific Guidelines:</h3>
 * <ul>
 *   <li><strong>CORE</strong>: Configuration loading, duration parsing, backoff policies, output provider</li>
 * </ul>
 *
 * @see org.junit.jupiter.api.Tag
 */
public final class TestCategories {

    /**
     * Core tests - fast unit tests with in-memory collaborators, each under a second.
     */
    public static final String CORE = "core";

    /**
     * Smoke tests - ultra-fast basic verification.
     */
    public static final String SMOKE = "smoke";

    /**
     * Slow tests - timing based scenarios that wait on real backoff intervals.
     */
    public static final String SLOW = "slow";

    private TestCategories() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }
}
