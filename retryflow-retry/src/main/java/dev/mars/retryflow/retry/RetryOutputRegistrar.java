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

import dev.mars.retryflow.api.error.OutputCreationException;
import dev.mars.retryflow.api.output.Output;
import dev.mars.retryflow.api.output.OutputConfig;
import dev.mars.retryflow.api.output.OutputProvider;
import dev.mars.retryflow.api.output.OutputRegistrar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers the {@code retry} output type with an output registrar.
 *
 * <p>A retry output always wraps a child output, built through the same provider so that
 * retry outputs can be nested.</p>
 *
 * <pre>{@code
 * OutputFactoryProvider provider = new OutputFactoryProvider(meterRegistry);
 * DropOutputRegistrar.registerWith(provider);
 * RetryOutputRegistrar.registerWith(provider);
 * }</pre>
 */
public class RetryOutputRegistrar {

    private static final Logger logger = LoggerFactory.getLogger(RetryOutputRegistrar.class);

    public static final String TYPE = "retry";

    private RetryOutputRegistrar() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void registerWith(OutputRegistrar registrar) {
        registrar.registerOutput(TYPE, RetryOutputRegistrar::createRetryOutput);
        logger.info("Registered retry output");
    }

    public static void unregisterFrom(OutputRegistrar registrar) {
        registrar.unregisterOutput(TYPE);
        logger.info("Unregistered retry output");
    }

    static Output createRetryOutput(OutputConfig config, OutputProvider provider) {
        if (!config.hasChild()) {
            throw new OutputCreationException(TYPE, "cannot create retry output without a child");
        }
        // settings first so a bad value fails before any child is built
        RetryOutputConfig retryConfig = RetryOutputConfig.fromOutputConfig(config);
        Output child = provider.createOutput(config.getChild());

        logger.debug("Creating retry output '{}' wrapping '{}'", config.getName(), config.getChild().getType());
        return new RetryOutput(retryConfig, child, provider.getMeterRegistry());
    }
}
