package io.ragent.core.retrieval;

import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.document.splitter.DocumentSplitters;
import dev.langchain4j.data.segment.TextSegment;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits documents into chunks of at most {@code chunkSize} characters using langchain4j's
 * recursive splitter: paragraphs first, then lines, sentences, words and finally characters.
 * Consecutive chunks share up to {@code chunkOverlap} characters.
 */
public final class RecursiveTextSplitter {
    private final DocumentSplitter delegate;

    public RecursiveTextSplitter(int chunkSize, int chunkOverlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException("chunkOverlap must be in [0, chunkSize)");
        }
        this.delegate = DocumentSplitters.recursive(chunkSize, chunkOverlap);
    }

    public List<SourceDocument> split(List<SourceDocument> documents) {
        List<SourceDocument> chunks = new ArrayList<>();
        for (SourceDocument document : documents) {
            for (String chunk : split(document.text())) {
                chunks.add(new SourceDocument(document.source(), chunk));
            }
        }
        return chunks;
    }

    public List<String> split(String text) {
        // Document.from rejects blank text
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> chunks = new ArrayList<>();
        for (TextSegment segment : delegate.split(Document.from(text.strip()))) {
            String chunk = segment.text().strip();
            if (!chunk.isEmpty()) {
                chunks.add(chunk);
            }
        }
        return chunks;
    }
}
