package io.ragent.core.agent;

import io.ragent.core.agent.node.GenerateNode;
import io.ragent.core.agent.node.GradeDocumentsNode;
import io.ragent.core.agent.node.QueryOrRespondNode;
import io.ragent.core.agent.node.RewriteNode;
import io.ragent.core.conversation.ConversationLog;
import io.ragent.core.gateway.GatewayException;
import io.ragent.core.gateway.LlmGateway;
import io.ragent.core.model.RunResult;
import io.ragent.core.model.RunStatus;
import io.ragent.core.model.Turn;
import io.ragent.core.tool.ToolExecutor;
import io.ragent.core.tool.ToolRegistry;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the retrieval agent's state machine: query or respond, grade, then generate or rewrite
 * and query again, until the router terminates or the iteration cap is hit.
 *
 * <p>Each call to {@link #run} owns its own conversation log. The gateway, tool registry and
 * thread pools are shared, so one instance can serve concurrent runs.
 */
public final class RagAgent implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RagAgent.class);

    private final LlmGateway gateway;
    private final ToolExecutor toolExecutor;
    private final AgentSettings settings;
    private final Map<NodeName, Node> nodes;
    private final ExecutorService toolPool;
    private final ExecutorService callPool;

    public RagAgent(LlmGateway gateway, ToolRegistry toolRegistry, AgentSettings settings) {
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.settings = settings == null ? AgentSettings.defaults() : settings;
        this.toolPool = Executors.newFixedThreadPool(this.settings.toolParallelism(), daemonThreads("ragent-tool"));
        this.callPool = Executors.newCachedThreadPool(daemonThreads("ragent-gateway"));
        this.toolExecutor = new ToolExecutor(Objects.requireNonNull(toolRegistry, "toolRegistry must not be null"), toolPool);
        this.nodes = defaultNodes();
    }

    public RunResult run(String question) {
        return run(question, CancellationSignal.withTimeout(settings.runTimeout()), RunListener.NONE);
    }

    public RunResult run(String question, RunListener listener) {
        return run(question, CancellationSignal.withTimeout(settings.runTimeout()), listener);
    }

    public RunResult run(String question, CancellationSignal cancellation) {
        return run(question, cancellation, RunListener.NONE);
    }

    public RunResult run(String question, CancellationSignal cancellation, RunListener listener) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question must not be blank");
        }
        RunListener events = listener == null ? RunListener.NONE : listener;
        String runId = UUID.randomUUID().toString().substring(0, 8);

        ConversationLog log = new ConversationLog();
        if (!settings.systemPrompt().isBlank()) {
            log.append(Turn.system(settings.systemPrompt()));
        }
        log.append(Turn.user(question));

        NodeContext context = new NodeContext(runId, cancellation, gateway, toolExecutor, callPool);
        NodeName current = Router.start();
        int iterations = 0;
        RunResult result;
        try {
            while (current != NodeName.TERMINATED) {
                if (current == NodeName.QUERY_OR_RESPOND) {
                    if (iterations >= settings.maxIterations()) {
                        throw new RunAbortedException(iterations, settings.maxIterations());
                    }
                    iterations++;
                }
                cancellation.throwIfCancelled();

                LOG.debug("Run {}: entering {}", runId, current.label());
                NodeResult step = nodes.get(current).execute(log.view(), context);
                log.append(step.turns());
                events.onNodeCompleted(current, step.turns(), step.verdict());
                current = Router.next(current, log.view(), step.verdict());
            }
            result = RunResult.completed(log.latest().content(), log.snapshot(), iterations);
        } catch (GatewayException e) {
            LOG.warn("Run {} failed in {}: {}", runId, current.label(), e.getMessage());
            result = RunResult.stopped(RunStatus.FAILED, log.snapshot(), iterations, current.label(), e.getMessage());
        } catch (RunAbortedException e) {
            LOG.warn("Run {} aborted: {}", runId, e.getMessage());
            result = RunResult.stopped(RunStatus.ABORTED, log.snapshot(), iterations, current.label(), e.getMessage());
        } catch (RunCancelledException e) {
            LOG.warn("Run {} cancelled in {}: {}", runId, current.label(), e.getMessage());
            result = RunResult.stopped(RunStatus.CANCELLED, log.snapshot(), iterations, current.label(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Run {} crashed in {}", runId, current.label(), e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            result = RunResult.stopped(RunStatus.FAILED, log.snapshot(), iterations, current.label(), message);
        }
        events.onRunFinished(result);
        return result;
    }

    @Override
    public void close() {
        toolPool.shutdownNow();
        callPool.shutdownNow();
    }

    private static Map<NodeName, Node> defaultNodes() {
        Map<NodeName, Node> nodes = new EnumMap<>(NodeName.class);
        for (Node node : List.of(new QueryOrRespondNode(), new GradeDocumentsNode(), new RewriteNode(), new GenerateNode())) {
            nodes.put(node.name(), node);
        }
        return nodes;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
