package io.ragent.cli;

import io.ragent.core.config.model.RagentConfig;
import io.ragent.core.retrieval.IngestionPipeline;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "ingest", description = "Fetch, split and index the configured sources, then report counts")
public final class IngestCommand implements Callable<Integer> {
    private final CliContext context;

    public IngestCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RagentConfig config = context.configService().load(context.configPath());
            IngestionPipeline.Report report = context.ingestRunner().ingest(config);
            System.out.println("Documents loaded: " + report.documents());
            System.out.println("Chunks indexed: " + report.chunks());
            return 0;
        } catch (Exception e) {
            System.err.println("Ingest command failed: " + e.getMessage());
            return 1;
        }
    }
}
