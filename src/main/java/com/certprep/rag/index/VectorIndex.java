package com.certprep.rag.index;

import com.certprep.rag.core.Passage;
import com.certprep.rag.core.SearchFilter;
import com.certprep.rag.core.SearchResult;
import com.certprep.rag.exception.DimensionMismatchException;
import com.certprep.rag.exception.IndexUnavailableException;

import java.util.List;

/**
 * Nearest-neighbour store of passage embeddings with exact-match metadata filtering.
 *
 * <p>Writes happen in offline batches before the index serves queries. Reads may run
 * concurrently.
 */
public interface VectorIndex {

    /**
     * Inserts or replaces passages by {@code chunkId}.
     *
     * <p>A passage seen for the first time gets a stable internal id, which decides its
     * position among equal-score matches. Re-upserting keeps the id.
     *
     * @throws DimensionMismatchException if an embedding has the wrong length
     * @throws IndexUnavailableException if the backing store cannot be reached
     */
    void upsert(List<Passage> passages);

    /**
     * Returns at most {@code topK} passages matching {@code filter}, by descending cosine
     * similarity, ties in insertion order.
     *
     * @throws DimensionMismatchException if the query vector has the wrong length
     * @throws IndexUnavailableException if the backing store cannot be reached
     */
    List<SearchResult> search(List<Float> queryVector, int topK, SearchFilter filter);

    /**
     * Health and size of the index. Reports {@link IndexStatus#UNAVAILABLE} instead of throwing.
     */
    IndexDescription describe();
}
