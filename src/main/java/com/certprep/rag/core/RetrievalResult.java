package com.certprep.rag.core;

import lombok.Value;

import java.util.List;

/**
 * Ranked results of a retrieval together with the context text assembled from them.
 */
@Value
public class RetrievalResult {

    private static final RetrievalResult EMPTY = new RetrievalResult(List.of(), "");

    List<SearchResult> results;
    String context;

    public static RetrievalResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public int size() {
        return results.size();
    }
}
