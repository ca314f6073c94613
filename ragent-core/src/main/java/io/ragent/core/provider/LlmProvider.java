package io.ragent.core.provider;

/**
 * Wire-level chat completion transport. Throws {@link io.ragent.core.gateway.GatewayException}
 * on any failure.
 */
public interface LlmProvider {
    String name();

    LlmResponse chat(LlmRequest request);
}
