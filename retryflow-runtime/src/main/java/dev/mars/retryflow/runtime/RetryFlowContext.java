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

import dev.mars.retryflow.api.output.Output;
import dev.mars.retryflow.api.output.OutputProvider;
import dev.mars.retryflow.core.config.RetryFlowConfiguration;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Objects;

/**
 * Everything created during runtime bootstrap: the loaded configuration, the output provider
 * with its registered output types and the meter registry outputs report to.
 */
public final class RetryFlowContext {

    private final RetryFlowConfiguration configuration;
    private final OutputProvider outputProvider;
    private final RuntimeConfig config;

    RetryFlowContext(RetryFlowConfiguration configuration, OutputProvider outputProvider, RuntimeConfig config) {
        this.configuration = Objects.requireNonNull(configuration, "RetryFlowConfiguration cannot be null");
        this.outputProvider = Objects.requireNonNull(outputProvider, "OutputProvider cannot be null");
        this.config = Objects.requireNonNull(config, "RuntimeConfig cannot be null");
    }

    public RetryFlowConfiguration getConfiguration() {
        return configuration;
    }

    public OutputProvider getOutputProvider() {
        return outputProvider;
    }

    public RuntimeConfig getConfig() {
        return config;
    }

    public MeterRegistry getMeterRegistry() {
        return outputProvider.getMeterRegistry();
    }

    /**
     * Builds a new, unstarted instance of the configured output pipeline.
     */
    public Output createOutput() {
        return RetryFlowRuntime.createOutput(configuration, outputProvider, config);
    }

    @Override
    public String toString() {
        return "RetryFlowContext{" +
                "profile=" + configuration.getProfile() +
                ", supportedTypes=" + outputProvider.getSupportedTypes() +
                ", config=" + config +
                '}';
    }
}
