package io.ragent.core.tool;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name to tool mapping. Populated at startup and only read afterwards, so concurrent runs can
 * share one instance.
 */
public final class ToolRegistry {
    private final Map<String, Tool> tools = new ConcurrentHashMap<>();

    public void register(Tool tool) {
        Tool previous = tools.putIfAbsent(tool.name(), tool);
        if (previous != null) {
            throw new IllegalArgumentException("Tool already registered: " + tool.name());
        }
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(name == null ? null : tools.get(name));
    }

    public List<ToolSpec> specs() {
        return tools.values().stream()
            .sorted(Comparator.comparing(Tool::name))
            .map(ToolSpec::of)
            .toList();
    }

    /**
     * Checks {@code input} against the tool's JSON schema: required properties present and
     * declared primitive types matching.
     */
    public void validate(Tool tool, Map<String, Object> input) {
        Map<String, Object> schema = tool.schema();
        Map<String, Object> properties = asMap(schema.get("properties"));
        Object required = schema.get("required");
        if (required instanceof Collection<?> names) {
            for (Object name : names) {
                String key = String.valueOf(name);
                if (input.get(key) == null) {
                    throw new ToolArgumentException("Missing required argument '" + key + "' for tool '" + tool.name() + "'");
                }
            }
        }
        for (Map.Entry<String, Object> entry : input.entrySet()) {
            Map<String, Object> property = asMap(properties.get(entry.getKey()));
            Object type = property.get("type");
            if (type == null || entry.getValue() == null) {
                continue;
            }
            if (!matches(String.valueOf(type), entry.getValue())) {
                throw new ToolArgumentException(
                    "Argument '" + entry.getKey() + "' for tool '" + tool.name() + "' must be of type " + type
                );
            }
        }
    }

    private boolean matches(String type, Object value) {
        return switch (type) {
            case "string" -> value instanceof String;
            case "integer" -> value instanceof Integer || value instanceof Long
                || value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue());
            case "number" -> value instanceof Number;
            case "boolean" -> value instanceof Boolean;
            case "object" -> value instanceof Map<?, ?>;
            case "array" -> value instanceof Collection<?>;
            default -> true;
        };
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }
}
