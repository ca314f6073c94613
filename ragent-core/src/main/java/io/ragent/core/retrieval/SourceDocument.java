package io.ragent.core.retrieval;

public record SourceDocument(String source, String text) {

    public SourceDocument {
        source = source == null ? "" : source;
        text = text == null ? "" : text;
    }
}
