package io.ragent.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"extra_headers"}) Map<String, String> extraHeaders,
    @JsonAlias({"requires_key"}) boolean requiresKey
) {

    public static ProviderConfig defaults() {
        return new ProviderConfig("", null, Map.of(), true);
    }

    public static ProviderConfig local(String apiBase) {
        return new ProviderConfig("", apiBase, Map.of(), false);
    }

    public boolean configured() {
        return !requiresKey || apiKey != null && !apiKey.isBlank();
    }

    public String apiBaseOr(String fallback) {
        return apiBase == null || apiBase.isBlank() ? fallback : apiBase;
    }
}
