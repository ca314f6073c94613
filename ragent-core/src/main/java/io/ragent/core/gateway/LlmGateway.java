package io.ragent.core.gateway;

import io.ragent.core.model.Turn;
import io.ragent.core.tool.ToolSpec;
import java.util.List;

/**
 * Text and decision generation as seen by the agent's nodes. Implementations must be stateless
 * so that concurrent runs can share them; every method fails with {@link GatewayException}.
 */
public interface LlmGateway {

    /** Free-form generation. Returns an assistant turn without tool calls. */
    Turn generate(List<Turn> turns);

    /** Generation with tools offered; the reply may request zero or more tool calls. */
    Turn generateWithTools(List<Turn> turns, List<ToolSpec> tools);

    /**
     * Schema-constrained generation.
     *
     * @throws SchemaViolationException if the reply does not bind to {@code schema}
     */
    <T> T generateStructured(List<Turn> turns, StructuredSchema<T> schema);
}
