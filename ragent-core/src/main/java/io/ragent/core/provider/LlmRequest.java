package io.ragent.core.provider;

import io.ragent.core.model.Turn;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record LlmRequest(
    String model,
    List<Turn> messages,
    List<Map<String, Object>> tools,
    Map<String, Object> responseFormat,
    Double temperature,
    Integer maxTokens
) {
    public LlmRequest {
        Objects.requireNonNull(model, "model must not be null");
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
        responseFormat = responseFormat == null ? Map.of() : Map.copyOf(responseFormat);
    }

    public static LlmRequest of(String model, List<Turn> messages) {
        return new LlmRequest(model, messages, List.of(), Map.of(), null, null);
    }
}
