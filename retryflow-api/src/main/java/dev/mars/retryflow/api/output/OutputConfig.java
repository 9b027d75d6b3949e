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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative description of an output: its type name, its type-specific properties and,
 * for outputs that wrap another output, the configuration of the wrapped child.
 */
public final class OutputConfig {

    private final String type;
    private final String name;
    private final Map<String, String> properties;
    private final OutputConfig child;

    private OutputConfig(Builder builder) {
        this.type = builder.type;
        this.name = builder.name != null ? builder.name : builder.type;
        this.properties = Map.copyOf(builder.properties);
        this.child = builder.child;
    }

    public String getType() { return type; }
    public String getName() { return name; }
    public Map<String, String> getProperties() { return properties; }
    public OutputConfig getChild() { return child; }
    public boolean hasChild() { return child != null; }

    public String getProperty(String key, String defaultValue) {
        return properties.getOrDefault(key, defaultValue);
    }

    public static Builder builder(String type) {
        return new Builder(type);
    }

    public static class Builder {
        private final String type;
        private String name;
        private final Map<String, String> properties = new LinkedHashMap<>();
        private OutputConfig child;

        private Builder(String type) {
            this.type = type;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder property(String key, String value) {
            this.properties.put(Objects.requireNonNull(key, "Property key cannot be null"),
                Objects.requireNonNull(value, "Property value cannot be null"));
            return this;
        }

        public Builder properties(Map<String, String> properties) {
            properties.forEach(this::property);
            return this;
        }

        public Builder child(OutputConfig child) {
            this.child = child;
            return this;
        }

        public OutputConfig build() {
            return new OutputConfig(this);
        }
    }

    @Override
    public String toString() {
        return "OutputConfig{" +
                "type='" + type + '\'' +
                ", name='" + name + '\'' +
                ", properties=" + properties +
                ", child=" + child +
                '}';
    }
}
