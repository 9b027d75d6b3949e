package dev.mars.retryflow.runtime;

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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.SMOKE)
class RuntimeConfigTest {

    @Test
    void defaults_enableEverything() {
        RuntimeConfig config = RuntimeConfig.defaults();

        assertTrue(config.isDropOutputEnabled());
        assertTrue(config.isRetryOutputEnabled());
        assertTrue(config.isLogOutputConfig());
    }

    @Test
    void builder_disablesSelectedFeatures() {
        RuntimeConfig config = RuntimeConfig.builder()
                .enableDropOutput(false)
                .logOutputConfig(false)
                .build();

        assertFalse(config.isDropOutputEnabled());
        assertTrue(config.isRetryOutputEnabled());
        assertFalse(config.isLogOutputConfig());
        assertTrue(config.toString().contains("enableDropOutput=false"));
    }
}
