package io.ragent.core.gateway;

/**
 * Failure of a generation, grading or rewrite call: transport error, bad HTTP status or a reply
 * that cannot be interpreted. Never retried by the gateway.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
