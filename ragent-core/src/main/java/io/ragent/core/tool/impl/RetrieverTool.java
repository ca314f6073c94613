package io.ragent.core.tool.impl;

import io.ragent.core.retrieval.Passage;
import io.ragent.core.retrieval.Retriever;
import io.ragent.core.tool.Tool;
import io.ragent.core.tool.ToolContext;
import io.ragent.core.tool.ToolInvocationException;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Exposes a {@link Retriever} to the model. Output is the ranked passages' text separated by
 * blank lines.
 */
public final class RetrieverTool implements Tool {
    static final String NO_RESULTS = "No relevant passages found";

    private final String name;
    private final String description;
    private final Retriever retriever;

    public RetrieverTool(String name, String description, Retriever retriever) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.description = description == null ? "" : description;
        this.retriever = Objects.requireNonNull(retriever, "retriever must not be null");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "query", Map.of("type", "string", "description", "Search query to look up")
            ),
            "required", List.of("query")
        );
    }

    @Override
    public String execute(Map<String, Object> input, ToolContext context) {
        String query = String.valueOf(input.getOrDefault("query", "")).trim();
        if (query.isEmpty()) {
            throw new ToolInvocationException("query must not be blank");
        }
        context.cancellation().throwIfCancelled();
        List<Passage> passages;
        try {
            passages = retriever.search(query);
        } catch (IOException e) {
            throw new ToolInvocationException("retrieval failed: " + e.getMessage(), e);
        }
        if (passages.isEmpty()) {
            return NO_RESULTS;
        }
        return passages.stream()
            .map(Passage::text)
            .collect(Collectors.joining("\n\n"));
    }
}
