package io.ragent.core.retrieval;

import java.io.IOException;
import java.util.List;

public interface Retriever {

    /** Passages ranked best first. */
    List<Passage> search(String query) throws IOException;
}
