package io.ragent.core.retrieval;

import java.io.IOException;
import java.util.List;

public interface EmbeddingClient {

    /** One vector per input, in input order. */
    List<float[]> embed(List<String> inputs) throws IOException;

    default float[] embed(String input) throws IOException {
        return embed(List.of(input)).get(0);
    }
}
