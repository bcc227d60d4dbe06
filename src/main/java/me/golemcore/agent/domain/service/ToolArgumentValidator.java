package me.golemcore.agent.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Checks tool arguments against the subset of JSON Schema used by tool
 * definitions: {@code required}, property {@code type}, {@code enum},
 * {@code minimum}/{@code maximum} and {@code additionalProperties: false}.
 */
final class ToolArgumentValidator {

    private static final String KEY_PROPERTIES = "properties";

    private ToolArgumentValidator() {
    }

    @SuppressWarnings("unchecked")
    static List<String> validate(Map<String, Object> schema, Map<String, Object> arguments) {
        List<String> violations = new ArrayList<>();
        if (schema == null || schema.isEmpty()) {
            return violations;
        }
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        Map<String, Object> properties = schema.get(KEY_PROPERTIES) instanceof Map<?, ?> props
                ? (Map<String, Object>) props
                : Map.of();

        if (schema.get("required") instanceof Collection<?> required) {
            for (Object name : required) {
                if (args.get(String.valueOf(name)) == null) {
                    violations.add("missing required argument '" + name + "'");
                }
            }
        }

        if (Boolean.FALSE.equals(schema.get("additionalProperties"))) {
            for (String name : args.keySet()) {
                if (!properties.containsKey(name)) {
                    violations.add("unexpected argument '" + name + "'");
                }
            }
        }

        for (Map.Entry<String, Object> entry : args.entrySet()) {
            Object value = entry.getValue();
            if (value == null || !(properties.get(entry.getKey()) instanceof Map<?, ?> propertySchema)) {
                continue;
            }
            checkProperty(entry.getKey(), value, (Map<String, Object>) propertySchema, violations);
        }
        return violations;
    }

    private static void checkProperty(String name, Object value, Map<String, Object> propertySchema,
            List<String> violations) {
        Object type = propertySchema.get("type");
        if (type instanceof String expected && !matchesType(expected, value)) {
            violations.add("argument '" + name + "' must be of type " + expected);
            return;
        }

        if (propertySchema.get("enum") instanceof Collection<?> allowed && !allowed.contains(value)) {
            violations.add("argument '" + name + "' must be one of " + allowed);
        }

        if (value instanceof Number number) {
            if (propertySchema.get("minimum") instanceof Number minimum
                    && number.doubleValue() < minimum.doubleValue()) {
                violations.add("argument '" + name + "' must be >= " + minimum);
            }
            if (propertySchema.get("maximum") instanceof Number maximum
                    && number.doubleValue() > maximum.doubleValue()) {
                violations.add("argument '" + name + "' must be <= " + maximum);
            }
        }
    }

    private static boolean matchesType(String expected, Object value) {
        return switch (expected) {
        case "string" -> value instanceof String;
        case "integer" -> value instanceof Integer || value instanceof Long || value instanceof Short
                || (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())
                        && !Double.isInfinite(n.doubleValue()));
        case "number" -> value instanceof Number;
        case "boolean" -> value instanceof Boolean;
        case "array" -> value instanceof Collection<?>;
        case "object" -> value instanceof Map<?, ?>;
        default -> true;
        };
    }
}
