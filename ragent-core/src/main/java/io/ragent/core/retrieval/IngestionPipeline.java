package io.ragent.core.retrieval;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Load, split and index: fills a vector store from a list of source URLs.
 */
public final class IngestionPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(IngestionPipeline.class);

    private final WebDocumentLoader loader;
    private final RecursiveTextSplitter splitter;

    public IngestionPipeline(WebDocumentLoader loader, RecursiveTextSplitter splitter) {
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
        this.splitter = Objects.requireNonNull(splitter, "splitter must not be null");
    }

    public Report ingest(List<String> urls, InMemoryVectorStore store) throws IOException {
        List<SourceDocument> documents = loader.loadAll(urls);
        List<SourceDocument> chunks = splitter.split(documents);
        LOG.info("Split {} document(s) into {} chunk(s)", documents.size(), chunks.size());
        store.addAll(chunks);
        return new Report(documents.size(), chunks.size());
    }

    public record Report(int documents, int chunks) {
    }
}
