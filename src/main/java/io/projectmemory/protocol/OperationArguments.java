package io.projectmemory.protocol;

import io.projectmemory.error.ValidationException;

import java.util.Collections;
import java.util.Map;

/**
 * Typed access to the raw argument object of one call. Checks shape only: presence and JSON
 * type. Content rules (key syntax, truncation) are applied later by the input validator.
 */
public final class OperationArguments {

    private final Map<String, Object> values;

    public OperationArguments(Map<String, Object> values) {
        this.values = values == null ? Collections.emptyMap() : values;
    }

    public String requiredString(String name) {
        String value = optionalString(name);
        if (value == null) {
            throw new ValidationException("Missing required argument '%s'".formatted(name), Map.of("field", name));
        }
        return value;
    }

    public String optionalString(String name) {
        Object value = values.get(name);
        if (value == null) return null;
        if (value instanceof String s) return s;
        throw typeMismatch(name, "a string");
    }

    public Integer optionalInt(String name) {
        Object value = values.get(name);
        if (value == null) return null;
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long number = ((Number) value).longValue();
            return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, number));
        }
        if (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) {
            return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, n.doubleValue()));
        }
        throw typeMismatch(name, "an integer");
    }

    /** A nested JSON payload given either as an object or as a JSON string. */
    public Object requiredPayload(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new ValidationException("Missing required argument '%s'".formatted(name), Map.of("field", name));
        }
        if (value instanceof String || value instanceof Map<?, ?>) {
            return value;
        }
        throw typeMismatch(name, "a JSON object or a JSON string");
    }

    private static ValidationException typeMismatch(String name, String expected) {
        return new ValidationException("Argument '%s' must be %s".formatted(name, expected), Map.of("field", name));
    }
}
