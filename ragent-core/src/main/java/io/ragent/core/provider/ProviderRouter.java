package io.ragent.core.provider;

import java.util.Locale;

public final class ProviderRouter {
    private final ProviderRegistry registry;

    public ProviderRouter(ProviderRegistry registry) {
        this.registry = registry;
    }

    public LlmProvider resolve(String preferredProvider, String model) {
        if (preferredProvider != null && !preferredProvider.isBlank()) {
            return registry.find(preferredProvider)
                .orElseThrow(() -> new IllegalArgumentException(
                    "Unknown provider: " + preferredProvider + " (registered: " + registry.names() + ")"));
        }

        String normalizedModel = model == null ? "" : model.toLowerCase(Locale.ROOT);
        if (normalizedModel.contains("/")) {
            return require("openrouter");
        }
        if (normalizedModel.startsWith("gpt") || normalizedModel.startsWith("o1") || normalizedModel.startsWith("o3")) {
            return require("openai");
        }
        return require("lmstudio");
    }

    private LlmProvider require(String name) {
        return registry.find(name)
            .orElseThrow(() -> new IllegalArgumentException("Provider " + name + " is not registered"));
    }
}
