package io.ragent.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One entry of the conversation log. Tool calls only appear on assistant turns and
 * {@code toolCallId} only on tool turns.
 */
public record Turn(MessageRole role, String content, String toolCallId, List<ToolCall> toolCalls) {

    public Turn {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        if (role != MessageRole.ASSISTANT && !toolCalls.isEmpty()) {
            throw new IllegalArgumentException("Only assistant turns may carry tool calls");
        }
        if (role == MessageRole.TOOL && (toolCallId == null || toolCallId.isBlank())) {
            throw new IllegalArgumentException("Tool turns require a toolCallId");
        }
        if (role != MessageRole.TOOL) {
            toolCallId = null;
        }
    }

    public static Turn system(String content) {
        return new Turn(MessageRole.SYSTEM, content, null, List.of());
    }

    public static Turn user(String content) {
        return new Turn(MessageRole.USER, content, null, List.of());
    }

    public static Turn assistant(String content) {
        return new Turn(MessageRole.ASSISTANT, content, null, List.of());
    }

    public static Turn assistantWithToolCalls(String content, List<ToolCall> toolCalls) {
        return new Turn(MessageRole.ASSISTANT, content, null, toolCalls);
    }

    public static Turn tool(String content, String toolCallId) {
        return new Turn(MessageRole.TOOL, content, toolCallId, List.of());
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
