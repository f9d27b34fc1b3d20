package com.certprep.rag.rerank;

import com.certprep.rag.core.SearchResult;

import java.util.List;

/**
 * Second-stage ranking of an oversized candidate pool.
 */
public interface CandidateReranker {

    /**
     * Picks the best {@code k} of {@code candidates}.
     *
     * <p>Always returns exactly {@code min(k, candidates.size())} results and never throws
     * because the ranking model failed; in that case the first {@code k} candidates are
     * returned as they came.
     *
     * @param candidates results ordered by descending score
     * @param k wanted size, must be positive
     */
    List<SearchResult> rerank(String queryText, List<SearchResult> candidates, int k);
}
