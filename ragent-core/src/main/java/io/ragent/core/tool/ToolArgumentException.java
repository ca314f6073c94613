package io.ragent.core.tool;

public final class ToolArgumentException extends ToolInvocationException {

    public ToolArgumentException(String message) {
        super(message);
    }
}
