package com.certprep.rag.search.impl;

import com.certprep.rag.client.Embedder;
import com.certprep.rag.core.RetrievalResult;
import com.certprep.rag.core.SearchFilter;
import com.certprep.rag.core.SearchResult;
import com.certprep.rag.index.VectorIndex;
import com.certprep.rag.search.BaseRetriever;
import com.certprep.rag.search.ContextAssembler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class VectorBaseRetriever implements BaseRetriever {

    private final Embedder embedder;
    private final VectorIndex vectorIndex;

    @Override
    public RetrievalResult retrieve(String queryText, int k, SearchFilter filter) {
        List<SearchResult> results = search(queryText, k, filter == null ? SearchFilter.none() : filter);
        if (results.isEmpty()) {
            log.info("🔍 No passages for query (k={}, filter={})", k, filter);
            return RetrievalResult.empty();
        }
        log.info("🔍 Retrieved {} passages (k={}, top score={})", results.size(), k,
                String.format("%.3f", results.get(0).getScore()));
        return new RetrievalResult(List.copyOf(results), ContextAssembler.assemble(results));
    }

    @Override
    public List<SearchResult> retrieveWithScores(String queryText, int k, double scoreThreshold) {
        List<SearchResult> results = search(queryText, k, SearchFilter.none());
        List<SearchResult> kept = results.stream()
                .filter(result -> result.getScore() >= scoreThreshold)
                .toList();
        log.debug("Score threshold {} kept {} of {} passages", scoreThreshold, kept.size(), results.size());
        return kept;
    }

    private List<SearchResult> search(String queryText, int k, SearchFilter filter) {
        if (queryText == null || queryText.isBlank()) {
            throw new IllegalArgumentException("Query text must not be blank");
        }
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }
        List<Float> vector = embedder.embed(queryText);
        return vectorIndex.search(vector, k, filter);
    }
}
