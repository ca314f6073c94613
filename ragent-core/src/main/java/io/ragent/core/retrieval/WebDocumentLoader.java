package io.ragent.core.retrieval;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches web pages and reduces them to readable text.
 */
public final class WebDocumentLoader {
    private static final Logger LOG = LoggerFactory.getLogger(WebDocumentLoader.class);

    private final OkHttpClient client;

    public WebDocumentLoader() {
        this(new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(Duration.ofSeconds(30))
            .build());
    }

    public WebDocumentLoader(OkHttpClient client) {
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    public List<SourceDocument> loadAll(List<String> urls) throws IOException {
        List<SourceDocument> documents = new ArrayList<>();
        for (String url : urls) {
            documents.add(load(url));
        }
        return documents;
    }

    public SourceDocument load(String url) throws IOException {
        Request request = new Request.Builder()
            .url(url)
            .get()
            .header("User-Agent", "ragent/0.1")
            .build();
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Failed to fetch " + url + ": HTTP " + response.code());
            }
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            String contentType = response.header("Content-Type", "");
            String text = contentType.contains("html") ? extractText(raw, url) : raw;
            LOG.debug("Loaded {} ({} chars)", url, text.length());
            return new SourceDocument(url, text);
        }
    }

    private String extractText(String html, String url) {
        Document document = Jsoup.parse(html, url);
        document.select("script, style, nav, header, footer").remove();
        StringBuilder text = new StringBuilder();
        document.body().select("h1, h2, h3, h4, p, li, pre, blockquote, td").forEach(element -> {
            String line = element.text().strip();
            if (!line.isEmpty()) {
                text.append(line).append("\n\n");
            }
        });
        if (text.length() == 0) {
            return document.text();
        }
        return text.toString().strip();
    }
}
