package com.certprep.rag.search;

import com.certprep.rag.core.RetrievalResult;
import com.certprep.rag.core.SearchFilter;
import com.certprep.rag.core.SearchResult;

import java.util.List;

/**
 * First-stage retrieval: embed the query, search the index, assemble the context.
 */
public interface BaseRetriever {

    /**
     * @param k number of results wanted, must be positive
     * @param filter metadata constraints, {@link SearchFilter#none()} for none
     * @return at most {@code k} results by descending score and their context text
     * @throws com.certprep.rag.exception.EmbeddingException if the query cannot be embedded
     * @throws com.certprep.rag.exception.IndexUnavailableException if the index cannot be reached
     */
    RetrievalResult retrieve(String queryText, int k, SearchFilter filter);

    /**
     * Unfiltered retrieval keeping only results scoring at least {@code scoreThreshold}.
     */
    List<SearchResult> retrieveWithScores(String queryText, int k, double scoreThreshold);
}
