package io.ragent.core.agent;

import io.ragent.core.gateway.GatewayException;
import io.ragent.core.gateway.LlmGateway;
import io.ragent.core.model.ToolCall;
import io.ragent.core.model.ToolResult;
import io.ragent.core.tool.ToolContext;
import io.ragent.core.tool.ToolExecutor;
import io.ragent.core.tool.ToolSpec;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Per-run collaborators handed to nodes. Gateway and tool calls made through it observe the
 * run's cancellation signal.
 */
public final class NodeContext {
    private final String runId;
    private final CancellationSignal cancellation;
    private final LlmGateway gateway;
    private final ToolExecutor toolExecutor;
    private final ExecutorService callExecutor;

    public NodeContext(
        String runId,
        CancellationSignal cancellation,
        LlmGateway gateway,
        ToolExecutor toolExecutor,
        ExecutorService callExecutor
    ) {
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation must not be null");
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.toolExecutor = Objects.requireNonNull(toolExecutor, "toolExecutor must not be null");
        this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor must not be null");
    }

    public String runId() {
        return runId;
    }

    public List<ToolSpec> toolSpecs() {
        return toolExecutor.registry().specs();
    }

    public <T> T invokeGateway(Function<LlmGateway, T> call) {
        cancellation.throwIfCancelled();
        Future<T> future = callExecutor.submit(() -> call.apply(gateway));
        try {
            return cancellation.await(future);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new GatewayException("Gateway call failed: " + (cause == null ? e.getMessage() : cause.getMessage()), cause);
        }
    }

    public List<ToolResult> executeTools(List<ToolCall> calls) {
        return toolExecutor.executeAll(calls, new ToolContext(runId, cancellation));
    }
}
