package io.ragent.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RagentConfig(
    AgentDefaults agent,
    ProvidersConfig providers,
    RetrievalConfig retrieval
) {

    public static RagentConfig defaults() {
        return new RagentConfig(
            AgentDefaults.defaults(),
            ProvidersConfig.defaults(),
            RetrievalConfig.defaults()
        );
    }
}
