package io.ragent.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Write a default configuration file")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--overwrite"}, description = "Replace an existing config with defaults")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            boolean created = context.configService().onboard(context.configPath(), overwrite);
            System.out.println((created ? "Created " : overwrite ? "Reset " : "Refreshed ") + context.configPath());
            return 0;
        } catch (Exception e) {
            System.err.println("Onboard command failed: " + e.getMessage());
            return 1;
        }
    }
}
