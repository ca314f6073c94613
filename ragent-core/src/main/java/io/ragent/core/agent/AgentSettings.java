package io.ragent.core.agent;

import java.time.Duration;

/**
 * @param maxIterations cap on query passes per run; exceeding it aborts the run
 * @param runTimeout    deadline for a whole run, zero for none
 */
public record AgentSettings(
    String systemPrompt,
    int maxIterations,
    Duration runTimeout,
    int toolParallelism
) {
    public AgentSettings {
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        maxIterations = Math.max(1, maxIterations);
        runTimeout = runTimeout == null || runTimeout.isNegative() ? Duration.ZERO : runTimeout;
        toolParallelism = Math.max(1, toolParallelism);
    }

    public static AgentSettings defaults() {
        return new AgentSettings("", 3, Duration.ZERO, 4);
    }
}
