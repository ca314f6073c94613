package io.ragent.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.ragent.core.agent.AgentSettings;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentDefaults(
    String provider,
    String model,
    double temperature,
    int maxTokens,
    int maxIterations,
    int runTimeoutSeconds,
    int toolParallelism,
    String systemPrompt
) {

    public static AgentDefaults defaults() {
        return new AgentDefaults(
            "lmstudio",
            "granite-4.0-h-tiny",
            0.0,
            500,
            3,
            0,
            4,
            ""
        );
    }

    public AgentSettings toSettings() {
        return new AgentSettings(systemPrompt, maxIterations, Duration.ofSeconds(Math.max(0, runTimeoutSeconds)), toolParallelism);
    }
}
