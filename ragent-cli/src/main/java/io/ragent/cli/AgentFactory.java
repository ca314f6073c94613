package io.ragent.cli;

import io.ragent.core.agent.RagAgent;
import io.ragent.core.config.model.RagentConfig;

/**
 * Builds a ready-to-run agent (providers wired, knowledge source indexed) from configuration.
 */
@FunctionalInterface
public interface AgentFactory {
    RagAgent create(RagentConfig config) throws Exception;
}
