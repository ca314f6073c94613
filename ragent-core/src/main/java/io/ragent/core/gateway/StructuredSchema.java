package io.ragent.core.gateway;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON schema for structured generation together with the record type the reply binds to.
 */
public record StructuredSchema<T>(String name, Map<String, Object> jsonSchema, Class<T> type) {

    public StructuredSchema {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        jsonSchema = jsonSchema == null ? Map.of() : Map.copyOf(jsonSchema);
    }

    public List<String> requiredFields() {
        Object required = jsonSchema.get("required");
        if (required instanceof List<?> names) {
            return names.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
