package io.ragent.cli;

import io.ragent.core.config.ConfigService;
import java.nio.file.Path;

public record CliContext(
    AgentFactory agentFactory,
    ConfigService configService,
    Path configPath,
    IngestRunner ingestRunner
) {
    public CliContext(AgentFactory agentFactory, ConfigService configService, Path configPath) {
        this(agentFactory, configService, configPath, config -> {
            throw new UnsupportedOperationException("ingestion is not configured");
        });
    }
}
