package io.ragent.core.tool;

import java.util.Map;

public interface Tool {
    String name();

    String description();

    default Map<String, Object> schema() {
        return Map.of("type", "object", "properties", Map.of());
    }

    /**
     * Runs the tool. Any runtime exception is reported back to the model as error content for
     * this call only.
     */
    String execute(Map<String, Object> input, ToolContext context);
}
