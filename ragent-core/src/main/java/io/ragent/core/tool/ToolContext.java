package io.ragent.core.tool;

import io.ragent.core.agent.CancellationSignal;
import java.util.Objects;

public record ToolContext(String runId, CancellationSignal cancellation) {

    public ToolContext {
        runId = runId == null ? "" : runId;
        Objects.requireNonNull(cancellation, "cancellation must not be null");
    }

    public ToolContext(String runId) {
        this(runId, CancellationSignal.create());
    }
}
