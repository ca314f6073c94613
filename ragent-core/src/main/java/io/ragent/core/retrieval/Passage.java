package io.ragent.core.retrieval;

public record Passage(String text, String source, double score) {

    public Passage {
        text = text == null ? "" : text;
        source = source == null ? "" : source;
    }
}
