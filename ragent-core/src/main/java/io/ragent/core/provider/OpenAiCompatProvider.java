package io.ragent.core.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ragent.core.gateway.GatewayException;
import io.ragent.core.model.MessageRole;
import io.ragent.core.model.ToolCall;
import io.ragent.core.model.Turn;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;

/**
 * Chat completions against any OpenAI-compatible endpoint (OpenAI, OpenRouter, LM Studio).
 * Accepts both plain JSON and server-sent-event replies.
 */
public final class OpenAiCompatProvider implements LlmProvider {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Map<String, String> extraHeaders;

    public OpenAiCompatProvider(String name, String apiKey, String apiBase, Map<String, String> extraHeaders) {
        this(name, apiKey, apiBase, extraHeaders, Duration.ofSeconds(90));
    }

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders,
        Duration readTimeout
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(readTimeout)
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(LlmRequest request) {
        Request httpRequest = buildRequest(request);
        try (Response response = client.newCall(httpRequest).execute()) {
            if (!response.isSuccessful()) {
                String errorBody = response.body() == null ? "" : response.body().string();
                throw new GatewayException("Provider " + name + " returned HTTP " + response.code() + " " + errorBody);
            }

            ResponseBody body = response.body();
            if (body == null) {
                return new LlmResponse("", List.of(), Map.of());
            }

            String contentType = response.header("Content-Type", "");
            if (contentType.contains("text/event-stream")) {
                return parseSse(body.source());
            }
            return parseJson(body.string());
        } catch (IOException e) {
            throw new GatewayException("Provider " + name + " call failed: " + e.getMessage(), e);
        }
    }

    private Request buildRequest(LlmRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", request.model());
        payload.put("messages", toWireMessages(request.messages()));
        payload.put("stream", false);
        if (request.temperature() != null) {
            payload.put("temperature", request.temperature());
        }
        if (request.maxTokens() != null && request.maxTokens() > 0) {
            payload.put("max_tokens", request.maxTokens());
        }
        if (!request.tools().isEmpty()) {
            payload.put("tools", request.tools());
            payload.put("tool_choice", "auto");
        }
        if (!request.responseFormat().isEmpty()) {
            payload.put("response_format", request.responseFormat());
        }

        RequestBody body;
        try {
            body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        } catch (IOException e) {
            throw new GatewayException("Failed to encode request for provider " + name, e);
        }

        Request.Builder builder = new Request.Builder()
            .url(completionsUrl())
            .post(body)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json, text/event-stream");
        if (!apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }

        for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private HttpUrl completionsUrl() {
        return apiBase.newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<Turn> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (Turn message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", toRoleValue(message.role()));
            row.put("content", message.content());
            if (message.hasToolCalls()) {
                row.put("tool_calls", toWireToolCalls(message.toolCalls()));
            }
            if (message.role() == MessageRole.TOOL) {
                row.put("tool_call_id", message.toolCallId());
            }
            wire.add(row);
        }
        return wire;
    }

    private List<Map<String, Object>> toWireToolCalls(List<ToolCall> toolCalls) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ToolCall call : toolCalls) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", call.name());
            function.put("arguments", toArgumentsJson(call.arguments()));

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", call.id());
            item.put("type", "function");
            item.put("function", function);
            wire.add(item);
        }
        return wire;
    }

    private String toArgumentsJson(Map<String, Object> arguments) {
        try {
            return mapper.writeValueAsString(arguments);
        } catch (IOException e) {
            throw new GatewayException("Failed to encode tool call arguments", e);
        }
    }

    private String toRoleValue(MessageRole role) {
        return switch (role) {
            case SYSTEM -> "system";
            case USER -> "user";
            case ASSISTANT -> "assistant";
            case TOOL -> "tool";
        };
    }

    private LlmResponse parseJson(String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        if (root.has("error")) {
            throw new GatewayException("Provider " + name + " error: " + root.path("error").path("message").asText(root.path("error").toString()));
        }
        JsonNode message = root.path("choices").path(0).path("message");
        if (message.isMissingNode()) {
            throw new GatewayException("Provider " + name + " returned no choices");
        }
        String content = message.path("content").asText("");
        List<ToolCall> toolCalls = parseToolCalls(message.path("tool_calls"));
        Map<String, Object> usage = usageAsMap(root.path("usage"));
        return new LlmResponse(content, toolCalls, usage);
    }

    private LlmResponse parseSse(BufferedSource source) throws IOException {
        StringBuilder content = new StringBuilder();
        Map<Integer, ToolCallBuffer> toolBuffers = new LinkedHashMap<>();
        Map<String, Object> usage = Map.of();

        while (!source.exhausted()) {
            String line = source.readUtf8Line();
            if (line == null || line.isBlank() || !line.startsWith("data:")) {
                continue;
            }

            String payload = line.substring(5).trim();
            if (payload.isEmpty()) {
                continue;
            }
            if ("[DONE]".equals(payload)) {
                break;
            }

            JsonNode event = mapper.readTree(payload);
            if (event.has("usage") && !event.path("usage").isNull()) {
                usage = usageAsMap(event.path("usage"));
            }

            for (JsonNode choice : event.path("choices")) {
                JsonNode delta = choice.path("delta");
                if (delta.has("content") && !delta.path("content").isNull()) {
                    content.append(delta.path("content").asText(""));
                }
                collectToolCalls(delta.path("tool_calls"), toolBuffers);
            }
        }

        List<ToolCall> toolCalls = new ArrayList<>();
        for (Map.Entry<Integer, ToolCallBuffer> entry : toolBuffers.entrySet()) {
            ToolCallBuffer buffer = entry.getValue();
            String id = buffer.id.isBlank() ? "call_" + entry.getKey() : buffer.id;
            toolCalls.add(new ToolCall(id, buffer.name, parseArguments(buffer.arguments.toString())));
        }

        return new LlmResponse(content.toString(), toolCalls, usage);
    }

    private List<ToolCall> parseToolCalls(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }

        List<ToolCall> toolCalls = new ArrayList<>();
        int index = 0;
        for (JsonNode item : node) {
            String id = item.path("id").asText("");
            JsonNode function = item.path("function");
            String toolName = function.path("name").asText("");
            JsonNode argsNode = function.path("arguments");
            Map<String, Object> args = argsNode.isTextual()
                ? parseArguments(argsNode.asText("{}"))
                : mapper.convertValue(argsNode, MAP_TYPE);
            toolCalls.add(new ToolCall(id.isBlank() ? "call_" + index : id, toolName, args));
            index++;
        }
        return toolCalls;
    }

    private void collectToolCalls(JsonNode toolCallsNode, Map<Integer, ToolCallBuffer> buffers) {
        if (toolCallsNode == null || !toolCallsNode.isArray()) {
            return;
        }
        for (JsonNode toolCall : toolCallsNode) {
            int index = Math.max(toolCall.path("index").asInt(0), 0);
            ToolCallBuffer buffer = buffers.computeIfAbsent(index, ignored -> new ToolCallBuffer());
            String id = toolCall.path("id").asText("");
            if (!id.isBlank()) {
                buffer.id = id;
            }
            JsonNode function = toolCall.path("function");
            String fragmentName = function.path("name").asText("");
            if (!fragmentName.isBlank()) {
                buffer.name = fragmentName;
            }
            String argChunk = function.path("arguments").asText("");
            if (!argChunk.isEmpty()) {
                buffer.arguments.append(argChunk);
            }
        }
    }

    private Map<String, Object> usageAsMap(JsonNode usage) {
        if (usage == null || usage.isMissingNode() || usage.isNull()) {
            return Map.of();
        }
        return mapper.convertValue(usage, MAP_TYPE);
    }

    private Map<String, Object> parseArguments(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(raw, MAP_TYPE);
        } catch (IOException e) {
            throw new GatewayException("Model produced malformed tool arguments: " + raw, e);
        }
    }

    private static final class ToolCallBuffer {
        private String id = "";
        private String name = "";
        private final StringBuilder arguments = new StringBuilder();
    }
}
