package io.ragent.core.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ragent.core.model.ToolCall;
import io.ragent.core.model.Turn;
import io.ragent.core.provider.LlmProvider;
import io.ragent.core.provider.LlmRequest;
import io.ragent.core.provider.LlmResponse;
import io.ragent.core.tool.ToolSpec;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LlmGateway} over a chat-completion provider bound to one model and sampling setup.
 */
public final class ProviderGateway implements LlmGateway {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderGateway.class);

    private final LlmProvider provider;
    private final String model;
    private final Double temperature;
    private final Integer maxTokens;
    private final ObjectMapper mapper = new ObjectMapper();

    public ProviderGateway(LlmProvider provider, String model, Double temperature, Integer maxTokens) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    @Override
    public Turn generate(List<Turn> turns) {
        LlmResponse response = call(new LlmRequest(model, turns, List.of(), Map.of(), temperature, maxTokens));
        return Turn.assistant(response.content());
    }

    @Override
    public Turn generateWithTools(List<Turn> turns, List<ToolSpec> tools) {
        List<Map<String, Object>> definitions = tools.stream().map(ToolSpec::toFunctionDefinition).toList();
        LlmResponse response = call(new LlmRequest(model, turns, definitions, Map.of(), temperature, maxTokens));
        if (response.toolCalls().isEmpty()) {
            return Turn.assistant(response.content());
        }
        return Turn.assistantWithToolCalls(response.content(), uniqueIds(response.toolCalls()));
    }

    @Override
    public <T> T generateStructured(List<Turn> turns, StructuredSchema<T> schema) {
        List<Turn> prompt = new ArrayList<>(turns.size() + 1);
        prompt.add(Turn.system(schemaInstruction(schema)));
        prompt.addAll(turns);

        Map<String, Object> jsonSchema = new LinkedHashMap<>();
        jsonSchema.put("name", schema.name());
        jsonSchema.put("strict", true);
        jsonSchema.put("schema", schema.jsonSchema());
        Map<String, Object> responseFormat = Map.of("type", "json_schema", "json_schema", jsonSchema);

        LlmResponse response = call(new LlmRequest(model, prompt, List.of(), responseFormat, temperature, maxTokens));
        return bind(response.content(), schema);
    }

    private LlmResponse call(LlmRequest request) {
        long started = System.currentTimeMillis();
        LlmResponse response = provider.chat(request);
        LOG.debug(
            "Provider {} answered in {} ms (tool calls: {})",
            provider.name(),
            System.currentTimeMillis() - started,
            response.toolCalls().size()
        );
        return response;
    }

    <T> T bind(String content, StructuredSchema<T> schema) {
        String json = extractJsonObject(content);
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SchemaViolationException("Structured reply for " + schema.name() + " is not valid JSON: " + content, e);
        }
        if (node == null || !node.isObject()) {
            throw new SchemaViolationException("Structured reply for " + schema.name() + " is not a JSON object: " + content);
        }
        for (String field : schema.requiredFields()) {
            if (!node.hasNonNull(field)) {
                throw new SchemaViolationException("Structured reply for " + schema.name() + " is missing field '" + field + "'");
            }
        }
        try {
            return mapper.treeToValue(node, schema.type());
        } catch (JsonProcessingException e) {
            throw new SchemaViolationException("Structured reply does not match " + schema.type().getSimpleName(), e);
        }
    }

    private String extractJsonObject(String content) {
        String text = content == null ? "" : content.trim();
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end < start) {
            return text;
        }
        return text.substring(start, end + 1);
    }

    private String schemaInstruction(StructuredSchema<?> schema) {
        String rendered;
        try {
            rendered = mapper.writeValueAsString(schema.jsonSchema());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize schema " + schema.name(), e);
        }
        return "Respond only with a JSON object that conforms to this JSON schema: " + rendered;
    }

    private List<ToolCall> uniqueIds(List<ToolCall> calls) {
        Set<String> seen = new HashSet<>();
        List<ToolCall> normalized = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            ToolCall call = calls.get(i);
            String id = call.id();
            if (id.isBlank() || !seen.add(id)) {
                id = "call_" + i;
                while (!seen.add(id)) {
                    id = id + "_";
                }
            }
            normalized.add(new ToolCall(id, call.name(), call.arguments()));
        }
        return normalized;
    }
}
