package com.certprep.rag.client;

import com.certprep.rag.exception.EmbeddingException;

import java.util.List;

/**
 * Turns query text into a vector comparable with the indexed passage embeddings.
 *
 * <p>The model behind it must be the one the corpus was embedded with.
 */
public interface Embedder {

    /**
     * @throws EmbeddingException if the provider fails; the engine does not retry
     */
    List<Float> embed(String text);

    String getModelName();
}
