package io.ragent.core.model;

import java.util.Objects;

public record ToolResult(String callId, String content, boolean failed) {

    public ToolResult {
        Objects.requireNonNull(callId, "callId must not be null");
        content = content == null ? "" : content;
    }

    public static ToolResult success(String callId, String content) {
        return new ToolResult(callId, content, false);
    }

    public static ToolResult failure(String callId, String content) {
        return new ToolResult(callId, content, true);
    }

    public Turn toTurn() {
        return Turn.tool(content, callId);
    }
}
