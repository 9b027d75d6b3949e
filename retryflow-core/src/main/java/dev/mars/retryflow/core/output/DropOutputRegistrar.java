package dev.mars.retryflow.core.output;

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

import dev.mars.retryflow.api.output.OutputRegistrar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers the {@code drop} output type.
 */
public class DropOutputRegistrar {

    private static final Logger logger = LoggerFactory.getLogger(DropOutputRegistrar.class);

    public static final String TYPE = "drop";

    private DropOutputRegistrar() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void registerWith(OutputRegistrar registrar) {
        registrar.registerOutput(TYPE, (config, provider) -> new DropOutput(config.getName()));
        logger.info("Registered drop output");
    }

    public static void unregisterFrom(OutputRegistrar registrar) {
        registrar.unregisterOutput(TYPE);
        logger.info("Unregistered drop output");
    }
}
