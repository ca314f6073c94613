package io.ragent.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(
    @JsonProperty("lmstudio")
    @JsonAlias({"lm_studio", "lm-studio"}) ProviderConfig lmstudio,
    ProviderConfig openai,
    ProviderConfig openrouter
) {
    public static final String LMSTUDIO_BASE = "http://127.0.0.1:1234/v1";
    public static final String OPENAI_BASE = "https://api.openai.com/v1";
    public static final String OPENROUTER_BASE = "https://openrouter.ai/api/v1";

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(
            ProviderConfig.local(LMSTUDIO_BASE),
            ProviderConfig.defaults(),
            ProviderConfig.defaults()
        );
    }

    public ProviderConfig byName(String name) {
        String normalized = name == null ? "" : name.toLowerCase().replace('-', '_');
        return switch (normalized) {
            case "lmstudio", "lm_studio" -> lmstudio;
            case "openai" -> openai;
            case "openrouter" -> openrouter;
            default -> throw new IllegalArgumentException("Unknown provider: " + name);
        };
    }

    public static String defaultBase(String name) {
        String normalized = name == null ? "" : name.toLowerCase().replace('-', '_');
        return switch (normalized) {
            case "openai" -> OPENAI_BASE;
            case "openrouter" -> OPENROUTER_BASE;
            default -> LMSTUDIO_BASE;
        };
    }
}
