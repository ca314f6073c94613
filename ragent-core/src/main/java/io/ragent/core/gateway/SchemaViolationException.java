package io.ragent.core.gateway;

public final class SchemaViolationException extends GatewayException {

    public SchemaViolationException(String message) {
        super(message);
    }

    public SchemaViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
