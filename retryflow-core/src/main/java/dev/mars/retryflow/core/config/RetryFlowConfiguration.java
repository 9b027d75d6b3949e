package dev.mars.retryflow.core.config;

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

import dev.mars.retryflow.api.output.OutputConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Layered configuration for RetryFlow.
 *
 * <p>Sources, lowest precedence first: {@code /retryflow-default.properties},
 * {@code /retryflow-<profile>.properties}, {@code RETRYFLOW_*} environment variables and
 * finally {@code retryflow.*} system properties.</p>
 *
 * <p>The output pipeline is described under {@code retryflow.output}: the output type at
 * {@code <prefix>.type}, its settings under {@code <prefix>.<type>.*} and a wrapped child
 * output under {@code <prefix>.child}.</p>
 */
public class RetryFlowConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(RetryFlowConfiguration.class);

    public static final String OUTPUT_PREFIX = "retryflow.output";
    private static final int MAX_OUTPUT_DEPTH = 16;

    private final Properties properties;
    private final String profile;

    public RetryFlowConfiguration() {
        this(getActiveProfile());
    }

    public RetryFlowConfiguration(String profile) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        validateConfiguration();
        logger.info("Loaded RetryFlow configuration for profile: {}", profile);
    }

    /**
     * Programmatic configuration. The given properties override every other source, which keeps
     * tests and embedded callers independent of the process environment.
     */
    public RetryFlowConfiguration(String profile, Properties overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        overrides.stringPropertyNames().forEach(key -> properties.setProperty(key, overrides.getProperty(key)));
        validateConfiguration();
        logger.info("Loaded RetryFlow configuration for profile: {} with {} explicit overrides",
            profile, overrides.size());
    }

    private static String getActiveProfile() {
        return System.getProperty("retryflow.profile",
               System.getenv("RETRYFLOW_PROFILE") != null ? System.getenv("RETRYFLOW_PROFILE") : "default");
    }

    private Properties loadProperties(String profile) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/retryflow-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/retryflow-" + profile + ".properties");
        }

        // env first, system properties last so -D wins
        System.getenv().forEach((key, value) -> {
            if (key.startsWith("RETRYFLOW_")) {
                String propKey = key.toLowerCase().replace("_", ".");
                props.setProperty(propKey, value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("retryflow.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        validateOutputConfig(OUTPUT_PREFIX, 0, errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateOutputConfig(String prefix, int depth, List<String> errors) {
        if (depth > MAX_OUTPUT_DEPTH) {
            errors.add("Output nesting deeper than " + MAX_OUTPUT_DEPTH + " levels at " + prefix);
            return;
        }
        String type = getString(prefix + ".type", "").trim();
        if (type.isEmpty()) {
            if (depth == 0) {
                errors.add("Output type is required (" + prefix + ".type)");
            }
            return;
        }
        if ("child".equals(type) || "type".equals(type) || "name".equals(type)) {
            errors.add("Output type '" + type + "' is reserved (" + prefix + ".type)");
        }
        validateOutputConfig(prefix + ".child", depth + 1, errors);
    }

    public String getProfile() {
        return profile;
    }

    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public String getString(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Required configuration property not found: " + key);
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Durations.parse(value);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * @return the configured output pipeline
     */
    public OutputConfig getOutputConfig() {
        return getOutputConfig(OUTPUT_PREFIX);
    }

    /**
     * Builds the output described under the given prefix, including its wrapped children.
     *
     * @return the output configuration, or null if no type is set under the prefix
     */
    public OutputConfig getOutputConfig(String prefix) {
        String type = getString(prefix + ".type", "").trim();
        if (type.isEmpty()) {
            return null;
        }

        OutputConfig.Builder builder = OutputConfig.builder(type)
            .name(getString(prefix + ".name", type).trim());

        String typePrefix = prefix + "." + type + ".";
        properties.stringPropertyNames().stream()
            .filter(key -> key.startsWith(typePrefix))
            .sorted()
            .forEach(key -> builder.property(key.substring(typePrefix.length()), properties.getProperty(key).trim()));

        return builder.child(getOutputConfig(prefix + ".child")).build();
    }

    @Override
    public String toString() {
        return "RetryFlowConfiguration{profile='" + profile + "', properties=" + properties.size() + '}';
    }
}
