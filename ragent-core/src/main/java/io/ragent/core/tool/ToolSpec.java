package io.ragent.core.tool;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Tool description handed to the model in tool-augmented generation. */
public record ToolSpec(String name, String description, Map<String, Object> parameters) {

    public ToolSpec {
        Objects.requireNonNull(name, "name must not be null");
        description = description == null ? "" : description;
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public static ToolSpec of(Tool tool) {
        return new ToolSpec(tool.name(), tool.description(), tool.schema());
    }

    public Map<String, Object> toFunctionDefinition() {
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", name);
        function.put("description", description);
        function.put("parameters", parameters);
        return Map.of("type", "function", "function", function);
    }
}
