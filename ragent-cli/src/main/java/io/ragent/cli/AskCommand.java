package io.ragent.cli;

import io.ragent.core.agent.NodeName;
import io.ragent.core.agent.RagAgent;
import io.ragent.core.agent.RunListener;
import io.ragent.core.config.model.AgentDefaults;
import io.ragent.core.config.model.RagentConfig;
import io.ragent.core.model.GradeVerdict;
import io.ragent.core.model.RunResult;
import io.ragent.core.model.ToolCall;
import io.ragent.core.model.Turn;
import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "ask", description = "Answer a question, consulting the knowledge source when needed")
public final class AskCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Question to answer")
    String question;

    @Option(names = {"-m", "--model"}, description = "Model override")
    String model;

    @Option(names = {"-p", "--provider"}, description = "Provider override")
    String provider;

    @Option(names = {"--max-iterations"}, description = "Maximum query passes before the run is aborted")
    Integer maxIterations;

    @Option(names = {"-v", "--verbose"}, description = "Print the output of every node as it completes")
    boolean verbose;

    public AskCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        RunResult result;
        try (RagAgent agent = context.agentFactory().create(withOverrides(context.configService().load(context.configPath())))) {
            result = agent.run(question, verbose ? new NodePrinter(System.out) : RunListener.NONE);
        } catch (Exception e) {
            System.err.println("Ask command failed: " + e.getMessage());
            return 1;
        }

        if (!result.succeeded()) {
            System.err.println("Run " + result.status().name().toLowerCase()
                + (result.failedNode() == null ? "" : " in " + result.failedNode())
                + ": " + result.error());
            return 1;
        }
        System.out.println(result.answer());
        return 0;
    }

    private RagentConfig withOverrides(RagentConfig config) {
        AgentDefaults defaults = config.agent();
        AgentDefaults agent = new AgentDefaults(
            provider != null ? provider : defaults.provider(),
            model != null ? model : defaults.model(),
            defaults.temperature(),
            defaults.maxTokens(),
            maxIterations != null ? maxIterations : defaults.maxIterations(),
            defaults.runTimeoutSeconds(),
            defaults.toolParallelism(),
            defaults.systemPrompt()
        );
        return new RagentConfig(agent, config.providers(), config.retrieval());
    }

    static final class NodePrinter implements RunListener {
        private final PrintStream out;

        NodePrinter(PrintStream out) {
            this.out = out;
        }

        @Override
        public void onNodeCompleted(NodeName node, List<Turn> appended, GradeVerdict verdict) {
            out.println("Output from node: '" + node.label() + "'");
            if (verdict != null) {
                out.println("  verdict: " + verdict.name().toLowerCase());
            }
            for (Turn turn : appended) {
                out.println("  [" + turn.role().name().toLowerCase() + "] " + abbreviate(turn.content()));
                for (ToolCall call : turn.toolCalls()) {
                    out.println("    tool call " + call.id() + ": " + call.name() + " " + call.arguments());
                }
            }
            out.println("---");
        }

        private String abbreviate(String content) {
            String flat = content.replace('\n', ' ');
            return flat.length() <= 200 ? flat : flat.substring(0, 200) + "...";
        }
    }
}
