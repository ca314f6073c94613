package io.ragent.core.agent;

import static org.assertj.core.api.Assertions.assertThat;

import io.ragent.core.gateway.GatewayException;
import io.ragent.core.gateway.ProviderGateway;
import io.ragent.core.model.GradeVerdict;
import io.ragent.core.model.MessageRole;
import io.ragent.core.model.RunResult;
import io.ragent.core.model.RunStatus;
import io.ragent.core.model.ToolCall;
import io.ragent.core.model.Turn;
import io.ragent.core.provider.LlmProvider;
import io.ragent.core.provider.LlmRequest;
import io.ragent.core.provider.LlmResponse;
import io.ragent.core.tool.Tool;
import io.ragent.core.tool.ToolContext;
import io.ragent.core.tool.ToolRegistry;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class RagAgentTest {

    private static final String QUESTION = "What does Lilian Weng say about types of reward hacking?";

    @Test
    void shouldAnswerDirectlyWithoutGrading() {
        ScriptedProvider provider = new ScriptedProvider();
        provider.query(textReply("2+2 is 4."));

        try (RagAgent agent = agent(provider, new PassageTool("unused"), AgentSettings.defaults())) {
            RunResult result = agent.run("What is 2+2?");

            assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(result.answer()).isEqualTo("2+2 is 4.");
            assertThat(result.iterations()).isEqualTo(1);
            assertThat(result.transcript()).extracting(Turn::role)
                .containsExactly(MessageRole.USER, MessageRole.ASSISTANT);
            assertThat(provider.graderPrompts).isEmpty();
            assertThat(provider.textPrompts).isEmpty();
        }
    }

    @Test
    void shouldRetrieveGradeAndGenerate() {
        ScriptedProvider provider = new ScriptedProvider();
        provider.query(toolRequest("call_1", "reward hacking"));
        provider.query(textReply("Let me summarize the passage."));
        provider.grade("{\"binaryScore\":\"yes\"}");
        provider.text("Reward hacking includes environment and reward tampering.");
        RecordingListener listener = new RecordingListener();

        try (RagAgent agent = agent(provider, new PassageTool("Reward hacking occurs when an agent exploits flaws."), AgentSettings.defaults())) {
            RunResult result = agent.run(QUESTION, listener);

            assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(result.answer()).isEqualTo("Reward hacking includes environment and reward tampering.");
            assertThat(result.transcript()).extracting(Turn::role).containsExactly(
                MessageRole.USER,
                MessageRole.ASSISTANT,
                MessageRole.TOOL,
                MessageRole.ASSISTANT,
                MessageRole.ASSISTANT
            );
            assertThat(result.transcript().get(2).toolCallId()).isEqualTo("call_1");
            assertThat(provider.graderPrompts.get(0))
                .contains(QUESTION)
                .contains("Reward hacking occurs when an agent exploits flaws.");
            assertThat(provider.textPrompts.get(0)).contains("Reward hacking occurs when an agent exploits flaws.");
            assertThat(listener.nodes).containsExactly(NodeName.QUERY_OR_RESPOND, NodeName.GRADE_DOCUMENTS, NodeName.GENERATE);
            assertThat(listener.verdicts).containsExactly(GradeVerdict.RELEVANT);
            assertThat(listener.finished).isSameAs(result);
        }
    }

    @Test
    void shouldRewriteAndRetryWhenDocumentsAreIrrelevant() {
        ScriptedProvider provider = new ScriptedProvider();
        provider.query(toolRequest("call_1", "reward hacking"));
        provider.query(textReply("That does not look right."));
        provider.grade("{\"binaryScore\":\"no\"}");
        provider.text("Which categories of reward hacking does Lilian Weng describe?");
        provider.query(toolRequest("call_2", "reward hacking categories"));
        provider.query(textReply("Found it."));
        provider.grade("{\"binaryScore\":\"yes\"}");
        provider.text("final answer");

        try (RagAgent agent = agent(provider, new PassageTool("meow"), AgentSettings.defaults())) {
            RunResult result = agent.run(QUESTION);

            assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(result.answer()).isEqualTo("final answer");
            assertThat(result.iterations()).isEqualTo(2);
            assertThat(result.transcript())
                .filteredOn(turn -> turn.role() == MessageRole.USER)
                .extracting(Turn::content)
                .containsExactly(QUESTION, "Which categories of reward hacking does Lilian Weng describe?");
            // rewrite and grading stay anchored to the seed question
            assertThat(provider.textPrompts.get(0)).contains(QUESTION);
            assertThat(provider.graderPrompts.get(1)).contains(QUESTION)
                .doesNotContain("Which categories of reward hacking does Lilian Weng describe?");
            // second query pass sees the rewritten question
            assertThat(provider.queryRequests.get(2).messages()).extracting(Turn::content)
                .contains("Which categories of reward hacking does Lilian Weng describe?");
        }
    }

    @Test
    void shouldAbortWhenIterationCapIsReached() {
        ScriptedProvider provider = new ScriptedProvider();
        for (int i = 0; i < 2; i++) {
            provider.query(toolRequest("call_" + i, "q" + i));
            provider.query(textReply("follow-up " + i));
            provider.grade("{\"binaryScore\":\"no\"}");
            provider.text("rewrite " + i);
        }

        try (RagAgent agent = agent(provider, new PassageTool("meow"), new AgentSettings("", 2, Duration.ZERO, 2))) {
            RunResult result = agent.run(QUESTION);

            assertThat(result.status()).isEqualTo(RunStatus.ABORTED);
            assertThat(result.iterations()).isEqualTo(2);
            assertThat(result.failedNode()).isEqualTo("queryOrRespond");
            assertThat(result.answer()).isEmpty();
            assertThat(result.transcript()).last().extracting(Turn::content).isEqualTo("rewrite 1");
            assertThat(provider.queryRequests).hasSize(4);
        }
    }

    @Test
    void shouldFailWithLogRetainedWhenGraderCallFails() {
        ScriptedProvider provider = new ScriptedProvider();
        provider.query(toolRequest("call_1", "reward hacking"));
        provider.query(textReply("follow-up"));
        provider.failGrader = true;

        try (RagAgent agent = agent(provider, new PassageTool("passage"), AgentSettings.defaults())) {
            RunResult result = agent.run(QUESTION);

            assertThat(result.status()).isEqualTo(RunStatus.FAILED);
            assertThat(result.failedNode()).isEqualTo("gradeDocuments");
            assertThat(result.error()).contains("grader unavailable");
            assertThat(result.transcript()).hasSize(4);
        }
    }

    @Test
    void shouldFailNamingTheNodeWhenGatewayThrowsAnUnexpectedException() {
        ScriptedProvider provider = new ScriptedProvider();
        provider.query(toolRequest("call_1", "reward hacking"));
        provider.query(textReply("follow-up"));
        provider.graderCrash = new IllegalStateException("decoder state corrupted");
        RecordingListener listener = new RecordingListener();

        try (RagAgent agent = agent(provider, new PassageTool("passage"), AgentSettings.defaults())) {
            RunResult result = agent.run(QUESTION, listener);

            assertThat(result.status()).isEqualTo(RunStatus.FAILED);
            assertThat(result.failedNode()).isEqualTo("gradeDocuments");
            assertThat(result.error()).isEqualTo("decoder state corrupted");
            assertThat(result.transcript()).hasSize(4);
            assertThat(listener.finished).isSameAs(result);
        }
    }

    @Test
    void shouldRunToolCallsWhoseArgumentsContainNulls() {
        Map<String, Object> arguments = new HashMap<>();
        arguments.put("query", "reward hacking");
        arguments.put("k", null);
        ScriptedProvider provider = new ScriptedProvider();
        provider.query(toolsReply(List.of(new ToolCall("call_1", "retrieve_blog_posts", arguments))));
        provider.query(textReply("follow-up"));
        provider.grade("{\"binaryScore\":\"yes\"}");
        provider.text("answer");

        try (RagAgent agent = agent(provider, new PassageTool("passage"), AgentSettings.defaults())) {
            RunResult result = agent.run(QUESTION);

            assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(result.transcript().get(1).toolCalls().get(0).arguments())
                .containsEntry("query", "reward hacking")
                .containsEntry("k", null);
        }
    }

    @Test
    void shouldFailOnUnsupportedGraderLabel() {
        ScriptedProvider provider = new ScriptedProvider();
        provider.query(toolRequest("call_1", "reward hacking"));
        provider.query(textReply("follow-up"));
        provider.grade("{\"binaryScore\":\"maybe\"}");

        try (RagAgent agent = agent(provider, new PassageTool("passage"), AgentSettings.defaults())) {
            RunResult result = agent.run(QUESTION);

            assertThat(result.status()).isEqualTo(RunStatus.FAILED);
            assertThat(result.failedNode()).isEqualTo("gradeDocuments");
            assertThat(result.error()).contains("maybe");
        }
    }

    @Test
    void shouldContinueWhenOneOfTwoToolCallsFails() {
        ScriptedProvider provider = new ScriptedProvider();
        provider.query(toolsReply(List.of(
            new ToolCall("call_1", "retrieve_blog_posts", Map.of("query", "reward hacking")),
            new ToolCall("call_2", "broken", Map.of())
        )));
        provider.query(textReply("follow-up"));
        provider.grade("{\"binaryScore\":\"yes\"}");
        provider.text("answer");

        ToolRegistry tools = new ToolRegistry();
        tools.register(new PassageTool("passage"));
        tools.register(new BrokenTool());
        try (RagAgent agent = new RagAgent(new ProviderGateway(provider, "test-model", 0.0, 100), tools, AgentSettings.defaults())) {
            RunResult result = agent.run(QUESTION);

            assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
            List<Turn> toolTurns = result.transcript().stream().filter(turn -> turn.role() == MessageRole.TOOL).toList();
            assertThat(toolTurns).extracting(Turn::toolCallId).containsExactly("call_1", "call_2");
            assertThat(toolTurns.get(0).content()).isEqualTo("passage");
            assertThat(toolTurns.get(1).content()).startsWith("Error executing tool 'broken'").contains("index offline");
        }
    }

    @Test
    void shouldKeepSystemPromptInLogButOutOfQueryRequests() {
        ScriptedProvider provider = new ScriptedProvider();
        provider.query(textReply("hi"));

        try (RagAgent agent = agent(provider, new PassageTool("unused"), new AgentSettings("be brief", 3, Duration.ZERO, 2))) {
            RunResult result = agent.run("hello");

            assertThat(result.transcript().get(0).role()).isEqualTo(MessageRole.SYSTEM);
            assertThat(provider.queryRequests.get(0).messages()).extracting(Turn::role).containsExactly(MessageRole.USER);
        }
    }

    @Test
    void shouldReportCancellationDuringToolExecution() throws Exception {
        ScriptedProvider provider = new ScriptedProvider();
        provider.query(toolRequest("call_1", "reward hacking"));
        BlockingTool tool = new BlockingTool();
        CancellationSignal cancellation = CancellationSignal.create();

        Thread canceller = new Thread(() -> {
            try {
                if (tool.started.await(5, TimeUnit.SECONDS)) {
                    cancellation.cancel("user abort");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        canceller.start();

        try (RagAgent agent = agent(provider, tool, AgentSettings.defaults())) {
            RunResult result = agent.run(QUESTION, cancellation, RunListener.NONE);

            assertThat(result.status()).isEqualTo(RunStatus.CANCELLED);
            assertThat(result.failedNode()).isEqualTo("queryOrRespond");
            assertThat(result.error()).isEqualTo("user abort");
            assertThat(result.transcript()).hasSize(1);
        }
        canceller.join(5_000);
    }

    @Test
    void shouldCancelWhenRunDeadlinePasses() {
        ScriptedProvider provider = new ScriptedProvider();
        provider.queryDelay = Duration.ofSeconds(5);
        provider.query(textReply("too late"));

        try (RagAgent agent = agent(provider, new PassageTool("unused"), new AgentSettings("", 3, Duration.ofMillis(100), 2))) {
            RunResult result = agent.run(QUESTION);

            assertThat(result.status()).isEqualTo(RunStatus.CANCELLED);
            assertThat(result.error()).isEqualTo("run deadline exceeded");
        }
    }

    private static RagAgent agent(LlmProvider provider, Tool tool, AgentSettings settings) {
        ToolRegistry tools = new ToolRegistry();
        tools.register(tool);
        return new RagAgent(new ProviderGateway(provider, "test-model", 0.0, 100), tools, settings);
    }

    private static LlmResponse toolRequest(String id, String query) {
        return toolsReply(List.of(new ToolCall(id, "retrieve_blog_posts", Map.of("query", query))));
    }

    private static LlmResponse textReply(String content) {
        return new LlmResponse(content, List.of(), Map.of());
    }

    private static LlmResponse toolsReply(List<ToolCall> calls) {
        return new LlmResponse("", calls, Map.of());
    }

    /**
     * Answers by request kind: tool-augmented requests from the query queue, schema-constrained
     * ones from the grader queue, everything else from the text queue.
     */
    private static final class ScriptedProvider implements LlmProvider {
        private final Deque<LlmResponse> queryReplies = new ArrayDeque<>();
        private final Deque<String> graderReplies = new ArrayDeque<>();
        private final Deque<String> textReplies = new ArrayDeque<>();
        private final List<LlmRequest> queryRequests = Collections.synchronizedList(new ArrayList<>());
        private final List<String> graderPrompts = Collections.synchronizedList(new ArrayList<>());
        private final List<String> textPrompts = Collections.synchronizedList(new ArrayList<>());
        private volatile boolean failGrader;
        private volatile RuntimeException graderCrash;
        private volatile Duration queryDelay = Duration.ZERO;

        void query(LlmResponse response) {
            queryReplies.add(response);
        }

        void grade(String json) {
            graderReplies.add(json);
        }

        void text(String content) {
            textReplies.add(content);
        }

        @Override
        public String name() {
            return "scripted";
        }

        @Override
        public synchronized LlmResponse chat(LlmRequest request) {
            if (!request.responseFormat().isEmpty()) {
                graderPrompts.add(lastContent(request));
                if (failGrader) {
                    throw new GatewayException("grader unavailable");
                }
                if (graderCrash != null) {
                    throw graderCrash;
                }
                return textReply(next(graderReplies));
            }
            if (!request.tools().isEmpty()) {
                queryRequests.add(request);
                pause();
                return next(queryReplies);
            }
            textPrompts.add(lastContent(request));
            return textReply(next(textReplies));
        }

        private void pause() {
            if (queryDelay.isZero()) {
                return;
            }
            try {
                Thread.sleep(queryDelay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new GatewayException("interrupted");
            }
        }

        private static String lastContent(LlmRequest request) {
            return request.messages().get(request.messages().size() - 1).content();
        }

        private static <T> T next(Deque<T> queue) {
            T value = queue.poll();
            if (value == null) {
                throw new GatewayException("script exhausted");
            }
            return value;
        }
    }

    private static final class PassageTool implements Tool {
        private final String passage;

        PassageTool(String passage) {
            this.passage = passage;
        }

        @Override
        public String name() {
            return "retrieve_blog_posts";
        }

        @Override
        public String description() {
            return "Search blog posts";
        }

        @Override
        public String execute(Map<String, Object> input, ToolContext context) {
            return passage;
        }
    }

    private static final class BrokenTool implements Tool {
        @Override
        public String name() {
            return "broken";
        }

        @Override
        public String description() {
            return "Always fails";
        }

        @Override
        public String execute(Map<String, Object> input, ToolContext context) {
            throw new IllegalStateException("index offline");
        }
    }

    private static final class BlockingTool implements Tool {
        private final CountDownLatch started = new CountDownLatch(1);

        @Override
        public String name() {
            return "retrieve_blog_posts";
        }

        @Override
        public String description() {
            return "Never returns";
        }

        @Override
        public String execute(Map<String, Object> input, ToolContext context) {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        }
    }

    private static final class RecordingListener implements RunListener {
        private final List<NodeName> nodes = new ArrayList<>();
        private final List<GradeVerdict> verdicts = new ArrayList<>();
        private RunResult finished;

        @Override
        public void onNodeCompleted(NodeName node, List<Turn> appended, GradeVerdict verdict) {
            nodes.add(node);
            if (verdict != null) {
                verdicts.add(verdict);
            }
        }

        @Override
        public void onRunFinished(RunResult result) {
            finished = result;
        }
    }
}
