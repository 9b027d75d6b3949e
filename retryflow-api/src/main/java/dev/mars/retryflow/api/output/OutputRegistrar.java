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

/**
 * Registry of output implementations by type name.
 */
public interface OutputRegistrar {

    /**
     * Registers an output creator with the provider.
     *
     * @param outputType The type name of the output (e.g., "drop", "retry")
     * @param creator The output creator function
     */
    void registerOutput(String outputType, OutputCreator creator);

    /**
     * Unregisters an output creator.
     *
     * @param outputType The type name to unregister
     */
    void unregisterOutput(String outputType);

    /**
     * Functional interface for creating outputs. The provider is passed so that wrapping
     * outputs can build their children.
     */
    @FunctionalInterface
    interface OutputCreator {
        /**
         * Creates an output instance.
         *
         * @param config The configuration of the output to create
         * @param provider The provider creating the output
         * @return A new, not yet consuming, output
         * @throws Exception if the output cannot be created
         */
        Output create(OutputConfig config, OutputProvider provider) throws Exception;
    }
}
