package io.ragent.core.provider;

import io.ragent.core.gateway.GatewayException;

/**
 * Provider placeholder used when a provider is not configured.
 */
public final class DisabledProvider implements LlmProvider {
    private final String name;
    private final String reason;

    public DisabledProvider(String name, String reason) {
        this.name = name;
        this.reason = reason == null || reason.isBlank() ? "provider is disabled" : reason;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(LlmRequest request) {
        throw new GatewayException("Provider " + name + " is not configured (" + reason + ")");
    }
}
