package me.golemcore.pilot.domain.system.toolloop;

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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Checks call arguments against the subset of JSON Schema used by action
 * definitions: {@code type}, {@code properties}, {@code required},
 * {@code items} and {@code enum}. Unknown keywords are ignored.
 */
public class ToolArgumentValidator {

    /**
     * Returns a list of human-readable violations; empty when the arguments are
     * valid.
     */
    public List<String> validate(Map<String, Object> schema, Map<String, Object> args) {
        List<String> errors = new ArrayList<>();
        if (schema == null || schema.isEmpty()) {
            return errors;
        }
        validateValue("arguments", schema, args != null ? args : Map.of(), errors);
        return errors;
    }

    private void validateValue(String path, Map<?, ?> schema, Object value, List<String> errors) {
        Object enumValues = schema.get("enum");
        if (enumValues instanceof Collection<?> allowed && value != null && !containsLoosely(allowed, value)) {
            errors.add(path + " must be one of " + allowed + " but was " + value);
            return;
        }

        Object type = schema.get("type");
        if (!(type instanceof String typeName)) {
            return;
        }
        switch (typeName) {
        case "object" -> validateObject(path, schema, value, errors);
        case "array" -> validateArray(path, schema, value, errors);
        case "string" -> expect(value instanceof CharSequence, path, "a string", value, errors);
        case "integer" -> expect(isInteger(value), path, "an integer", value, errors);
        case "number" -> expect(value instanceof Number, path, "a number", value, errors);
        case "boolean" -> expect(value instanceof Boolean, path, "a boolean", value, errors);
        default -> {
            // other types are not constrained
        }
        }
    }

    private void validateObject(String path, Map<?, ?> schema, Object value, List<String> errors) {
        if (!(value instanceof Map<?, ?> object)) {
            errors.add(path + " must be an object but was " + describe(value));
            return;
        }
        if (schema.get("required") instanceof Collection<?> required) {
            for (Object name : required) {
                if (object.get(name) == null) {
                    errors.add(path + "." + name + " is required");
                }
            }
        }
        if (schema.get("properties") instanceof Map<?, ?> properties) {
            for (Map.Entry<?, ?> property : properties.entrySet()) {
                Object propertyValue = object.get(property.getKey());
                if (propertyValue != null && property.getValue() instanceof Map<?, ?> propertySchema) {
                    validateValue(path + "." + property.getKey(), propertySchema, propertyValue, errors);
                }
            }
        }
    }

    private void validateArray(String path, Map<?, ?> schema, Object value, List<String> errors) {
        if (!(value instanceof List<?> items)) {
            errors.add(path + " must be an array but was " + describe(value));
            return;
        }
        if (schema.get("items") instanceof Map<?, ?> itemSchema) {
            for (int i = 0; i < items.size(); i++) {
                validateValue(path + "[" + i + "]", itemSchema, items.get(i), errors);
            }
        }
    }

    private static void expect(boolean condition, String path, String expected, Object value, List<String> errors) {
        if (!condition) {
            errors.add(path + " must be " + expected + " but was " + describe(value));
        }
    }

    private static boolean isInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            return !Double.isInfinite(number) && number == Math.rint(number);
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        return false;
    }

    private static boolean containsLoosely(Collection<?> allowed, Object value) {
        for (Object candidate : allowed) {
            if (candidate != null && candidate.toString().equals(value.toString())) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        return value.getClass().getSimpleName();
    }
}
