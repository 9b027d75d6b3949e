package dev.mars.retryflow.api.output;

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

import io.micrometer.core.instrument.MeterRegistry;

import java.util.Set;

/**
 * Creates outputs from their configuration.
 */
public interface OutputProvider {

    /**
     * Creates an output of the configured type.
     *
     * @throws dev.mars.retryflow.api.error.OutputCreationException if the type is unknown or
     *         the output cannot be constructed
     */
    Output createOutput(OutputConfig config);

    Set<String> getSupportedTypes();

    boolean isTypeSupported(String outputType);

    /**
     * Registry that created outputs bind their meters to.
     */
    MeterRegistry getMeterRegistry();
}
