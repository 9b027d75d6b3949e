package dev.mars.retryflow.core.provider;

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
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry-backed output factory. Output modules register their creators through
 * {@link OutputRegistrar}; callers build outputs from configuration through
 * {@link OutputProvider}.
 *
 * <p>Every construction failure surfaces as an {@link OutputCreationException} naming the
 * declared type of the output that failed.</p>
 */
public class OutputFactoryProvider implements OutputProvider, OutputRegistrar {

    private static final Logger logger = LoggerFactory.getLogger(OutputFactoryProvider.class);

    private final ConcurrentMap<String, OutputCreator> outputCreators = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public OutputFactoryProvider() {
        this(new SimpleMeterRegistry());
    }

    public OutputFactoryProvider(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "Meter registry cannot be null");
    }

    @Override
    public void registerOutput(String outputType, OutputCreator creator) {
        if (outputType == null || outputType.trim().isEmpty()) {
            throw new IllegalArgumentException("Output type cannot be null or empty");
        }
        Objects.requireNonNull(creator, "Output creator cannot be null");

        OutputCreator previous = outputCreators.put(outputType.toLowerCase(), creator);
        if (previous != null) {
            logger.warn("Replaced existing creator for output type: {}", outputType);
        } else {
            logger.debug("Registered output type: {}", outputType);
        }
    }

    @Override
    public void unregisterOutput(String outputType) {
        if (outputType != null && outputCreators.remove(outputType.toLowerCase()) != null) {
            logger.debug("Unregistered output type: {}", outputType);
        }
    }

    @Override
    public Output createOutput(OutputConfig config) {
        if (config == null) {
            throw new OutputCreationException(null, "Output configuration cannot be null");
        }
        String outputType = config.getType();
        if (outputType == null || outputType.trim().isEmpty()) {
            throw new OutputCreationException(outputType, "Output type cannot be null or empty");
        }

        OutputCreator creator = outputCreators.get(outputType.toLowerCase());
        if (creator == null) {
            throw new OutputCreationException(outputType, "Unsupported output type: " + outputType +
                ". Available types: " + outputCreators.keySet());
        }

        try {
            Output output = creator.create(config, this);
            logger.info("Created output '{}' of type: {}", config.getName(), outputType);
            return output;
        } catch (OutputCreationException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Failed to create output of type: {}", outputType, e);
            throw new OutputCreationException(outputType,
                "failed to create output '" + outputType + "': " + e.getMessage(), e);
        }
    }

    @Override
    public Set<String> getSupportedTypes() {
        return Set.copyOf(outputCreators.keySet());
    }

    @Override
    public boolean isTypeSupported(String outputType) {
        return outputType != null && outputCreators.containsKey(outputType.toLowerCase());
    }

    @Override
    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
