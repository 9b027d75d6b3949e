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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.retryflow.api.output.OutputConfig;

import java.util.Map;
import java.util.Set;

/**
 * Renders an output configuration tree as JSON for logging and inspection.
 *
 * <p>Dotted property keys become nested objects. Outputs that wrap a child always carry an
 * {@code output} field, rendered as an empty object when no child is configured.</p>
 *
 * <pre>{@code
 * {"type":"retry","retry":{"backoff":{"initial-interval":"100ms"},"max-retries":2,"output":{"type":"drop","drop":{}}}}
 * }</pre>
 */
public class OutputConfigSanitiser {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private final Set<String> wrapperTypes;

    public OutputConfigSanitiser(Set<String> wrapperTypes) {
        this.wrapperTypes = Set.copyOf(wrapperTypes);
    }

    public ObjectNode sanitise(OutputConfig config) {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        if (config == null) {
            return root;
        }
        root.put("type", config.getType());
        if (!config.getName().equals(config.getType())) {
            root.put("name", config.getName());
        }

        ObjectNode section = root.putObject(config.getType());
        for (Map.Entry<String, String> entry : config.getProperties().entrySet()) {
            putNested(section, entry.getKey(), entry.getValue());
        }
        if (config.hasChild() || wrapperTypes.contains(config.getType())) {
            section.set("output", sanitise(config.getChild()));
        }
        return root;
    }

    public String toJson(OutputConfig config) {
        try {
            return MAPPER.writeValueAsString(MAPPER.treeToValue(sanitise(config), Object.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render output configuration", e);
        }
    }

    private static void putNested(ObjectNode section, String key, String value) {
        String[] path = key.split("\\.");
        ObjectNode target = section;
        for (int i = 0; i < path.length - 1; i++) {
            if (target.get(path[i]) instanceof ObjectNode) {
                target = (ObjectNode) target.get(path[i]);
            } else {
                target = target.putObject(path[i]);
            }
        }
        String leaf = path[path.length - 1];
        if (value.matches("-?\\d{1,18}")) {
            target.put(leaf, Long.parseLong(value));
        } else if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
            target.put(leaf, Boolean.parseBoolean(value));
        } else {
            target.put(leaf, value);
        }
    }
}
