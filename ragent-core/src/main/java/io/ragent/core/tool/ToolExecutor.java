package io.ragent.core.tool;

import io.ragent.core.agent.CancellationSignal;
import io.ragent.core.model.ToolCall;
import io.ragent.core.model.ToolResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches one batch of tool calls concurrently and waits for all of them. Results come back
 * in call order; a failing call yields error content and never affects its siblings.
 */
public final class ToolExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(ToolExecutor.class);

    private final ToolRegistry registry;
    private final ExecutorService executor;

    public ToolExecutor(ToolRegistry registry, ExecutorService executor) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    public ToolRegistry registry() {
        return registry;
    }

    public List<ToolResult> executeAll(List<ToolCall> calls, ToolContext context) {
        CancellationSignal cancellation = context.cancellation();
        cancellation.throwIfCancelled();

        List<Future<ToolResult>> pending = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            pending.add(executor.submit(() -> execute(call, context)));
        }

        List<ToolResult> results = new ArrayList<>(calls.size());
        try {
            for (int i = 0; i < calls.size(); i++) {
                results.add(awaitResult(calls.get(i), pending.get(i), cancellation));
            }
        } catch (RuntimeException e) {
            pending.forEach(future -> future.cancel(true));
            throw e;
        }
        return results;
    }

    private ToolResult awaitResult(ToolCall call, Future<ToolResult> future, CancellationSignal cancellation) {
        try {
            return cancellation.await(future);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.warn("Tool {} crashed outside its error boundary", call.name(), cause);
            return ToolResult.failure(call.id(), "Error executing tool '" + call.name() + "': " + cause.getMessage());
        }
    }

    private ToolResult execute(ToolCall call, ToolContext context) {
        return registry.find(call.name())
            .map(tool -> safelyExecute(tool, call, context))
            .orElseGet(() -> {
                LOG.warn("Model requested unknown tool {}", call.name());
                return ToolResult.failure(call.id(), "Error: Tool '" + call.name() + "' not found");
            });
    }

    private ToolResult safelyExecute(Tool tool, ToolCall call, ToolContext context) {
        long started = System.currentTimeMillis();
        try {
            registry.validate(tool, call.arguments());
            String output = tool.execute(call.arguments(), context);
            LOG.debug("Tool {} ({}) finished in {} ms", tool.name(), call.id(), System.currentTimeMillis() - started);
            return ToolResult.success(call.id(), output);
        } catch (RuntimeException ex) {
            LOG.warn("Tool {} failed", tool.name(), ex);
            return ToolResult.failure(call.id(), "Error executing tool '" + tool.name() + "': " + ex.getMessage());
        }
    }
}
