package io.ragent.cli;

import io.ragent.core.config.model.RagentConfig;
import io.ragent.core.retrieval.IngestionPipeline;

@FunctionalInterface
public interface IngestRunner {
    IngestionPipeline.Report ingest(RagentConfig config) throws Exception;
}
