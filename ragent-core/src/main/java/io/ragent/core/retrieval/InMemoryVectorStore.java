package io.ragent.core.retrieval;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Brute-force cosine similarity over chunks held in memory.
 */
public final class InMemoryVectorStore implements Retriever {
    private final EmbeddingClient embeddings;
    private final int topK;
    private final List<Entry> entries = new CopyOnWriteArrayList<>();

    public InMemoryVectorStore(EmbeddingClient embeddings, int topK) {
        this.embeddings = Objects.requireNonNull(embeddings, "embeddings must not be null");
        this.topK = Math.max(1, topK);
    }

    public void addAll(List<SourceDocument> chunks) throws IOException {
        if (chunks.isEmpty()) {
            return;
        }
        List<float[]> vectors = embeddings.embed(chunks.stream().map(SourceDocument::text).toList());
        List<Entry> added = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            added.add(new Entry(chunks.get(i), vectors.get(i)));
        }
        entries.addAll(added);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public List<Passage> search(String query) throws IOException {
        if (query == null || query.isBlank() || entries.isEmpty()) {
            return List.of();
        }
        float[] target = embeddings.embed(query);
        return entries.stream()
            .map(entry -> new Passage(entry.chunk().text(), entry.chunk().source(), cosine(target, entry.vector())))
            .sorted(Comparator.comparingDouble(Passage::score).reversed())
            .limit(topK)
            .toList();
    }

    static double cosine(float[] a, float[] b) {
        int length = Math.min(a.length, b.length);
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private record Entry(SourceDocument chunk, float[] vector) {
    }
}
