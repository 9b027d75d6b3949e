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

import dev.mars.retryflow.api.error.OutputCreationException;
import dev.mars.retryflow.api.output.Output;
import dev.mars.retryflow.api.output.OutputConfig;
import dev.mars.retryflow.api.output.OutputProvider;
import dev.mars.retryflow.core.config.OutputConfigSanitiser;
import dev.mars.retryflow.core.config.RetryFlowConfiguration;
import dev.mars.retryflow.core.output.DropOutputRegistrar;
import dev.mars.retryflow.core.provider.OutputFactoryProvider;
import dev.mars.retryflow.retry.RetryOutputRegistrar;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Single entry point for building RetryFlow outputs. Wires the output modules into one
 * provider and builds the pipeline described by a {@link RetryFlowConfiguration}.
 *
 * <pre>{@code
 * Output output = RetryFlowRuntime.createOutput(new RetryFlowConfiguration(), meterRegistry);
 * output.consume(transactions);
 *
 * // or keep the provider and configuration around
 * RetryFlowContext context = RetryFlowRuntime.bootstrap();
 * Output another = context.createOutput();
 * }</pre>
 */
public final class RetryFlowRuntime {

    private static final Logger logger = LoggerFactory.getLogger(RetryFlowRuntime.class);

    private static final OutputConfigSanitiser SANITISER = new OutputConfigSanitiser(Set.of(RetryOutputRegistrar.TYPE));

    private RetryFlowRuntime() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Creates a provider with every built-in output type registered, reporting to an in-memory
     * meter registry.
     */
    public static OutputProvider createProvider() {
        return createProvider(new SimpleMeterRegistry());
    }

    public static OutputProvider createProvider(MeterRegistry meterRegistry) {
        return createProvider(RuntimeConfig.defaults(), meterRegistry);
    }

    public static OutputProvider createProvider(RuntimeConfig config, MeterRegistry meterRegistry) {
        Objects.requireNonNull(config, "RuntimeConfig cannot be null");
        Objects.requireNonNull(meterRegistry, "MeterRegistry cannot be null");

        OutputFactoryProvider provider = new OutputFactoryProvider(meterRegistry);
        if (config.isDropOutputEnabled()) {
            DropOutputRegistrar.registerWith(provider);
        }
        if (config.isRetryOutputEnabled()) {
            RetryOutputRegistrar.registerWith(provider);
        }
        logger.debug("Output provider created with types: {}", provider.getSupportedTypes());
        return provider;
    }

    /**
     * Builds the output pipeline described by the configuration.
     *
     * @throws OutputCreationException if any output in the pipeline cannot be built
     */
    public static Output createOutput(RetryFlowConfiguration configuration, MeterRegistry meterRegistry) {
        return createOutput(configuration, createProvider(meterRegistry), RuntimeConfig.defaults());
    }

    static Output createOutput(RetryFlowConfiguration configuration, OutputProvider provider, RuntimeConfig config) {
        Objects.requireNonNull(configuration, "RetryFlowConfiguration cannot be null");

        OutputConfig outputConfig = configuration.getOutputConfig();
        if (outputConfig == null) {
            throw new OutputCreationException(null, "No output configured under " + RetryFlowConfiguration.OUTPUT_PREFIX);
        }
        if (config.isLogOutputConfig()) {
            logger.info("Creating output pipeline: {}", SANITISER.toJson(outputConfig));
        }
        return provider.createOutput(outputConfig);
    }

    public static RetryFlowContext bootstrap() {
        return bootstrap(RuntimeConfig.defaults(), new RetryFlowConfiguration(), new SimpleMeterRegistry());
    }

    public static RetryFlowContext bootstrap(RuntimeConfig config, RetryFlowConfiguration configuration,
                                             MeterRegistry meterRegistry) {
        Objects.requireNonNull(config, "RuntimeConfig cannot be null");
        Objects.requireNonNull(configuration, "RetryFlowConfiguration cannot be null");

        logger.info("Bootstrapping RetryFlow runtime with config: {}", config);
        RetryFlowContext context = new RetryFlowContext(configuration, createProvider(config, meterRegistry), config);
        logger.info("RetryFlow runtime bootstrapped: {}", context);
        return context;
    }
}
