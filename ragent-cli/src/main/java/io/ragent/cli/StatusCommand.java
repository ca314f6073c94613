package io.ragent.cli;

import io.ragent.core.config.model.RagentConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--json"}, description = "Print the effective configuration as JSON")
    boolean json;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RagentConfig config = context.configService().load(context.configPath());
            if (json) {
                System.out.println(context.configService().toPrettyJson(config));
                return 0;
            }
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Default provider: " + config.agent().provider());
            System.out.println("Default model: " + config.agent().model());
            System.out.println("Max iterations: " + config.agent().maxIterations());
            System.out.println("LM Studio configured: " + config.providers().lmstudio().configured());
            System.out.println("OpenAI configured: " + config.providers().openai().configured());
            System.out.println("OpenRouter configured: " + config.providers().openrouter().configured());
            System.out.println("Retrieval tool: " + config.retrieval().toolName());
            System.out.println("Sources: " + config.retrieval().urls().size());
            config.retrieval().urls().forEach(url -> System.out.println("  - " + url));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
