package io.ragent.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RetrievalConfig(
    List<String> urls,
    int chunkSize,
    int chunkOverlap,
    int topK,
    String embeddingProvider,
    String embeddingModel,
    String toolName,
    String toolDescription
) {

    public RetrievalConfig {
        urls = urls == null ? List.of() : List.copyOf(urls);
    }

    public static RetrievalConfig defaults() {
        return new RetrievalConfig(
            List.of(
                "https://lilianweng.github.io/posts/2023-06-23-agent/",
                "https://lilianweng.github.io/posts/2023-03-15-prompt-engineering/",
                "https://lilianweng.github.io/posts/2023-10-25-adv-attack-llm/"
            ),
            500,
            50,
            4,
            "lmstudio",
            "text-embedding-nomic-embed-text-v1.5",
            "retrieve_blog_posts",
            "Search and return information about Lilian Weng blog posts on LLM agents, "
                + "prompt engineering, and adversarial attacks on LLMs."
        );
    }
}
