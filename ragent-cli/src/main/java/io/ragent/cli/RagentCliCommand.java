package io.ragent.cli;

import picocli.CommandLine.Command;

@Command(name = "ragent", mixinStandardHelpOptions = true, description = "Agentic retrieval-augmented question answering")
public final class RagentCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
