package com.certprep.rag.scenario.impl;

import com.certprep.rag.configuration.AppProperties;
import com.certprep.rag.configuration.RetrievalProperties;
import com.certprep.rag.core.RetrievalResult;
import com.certprep.rag.core.SearchFilter;
import com.certprep.rag.core.SearchResult;
import com.certprep.rag.scenario.ScenarioQueryExpander;
import com.certprep.rag.search.BaseRetriever;
import com.certprep.rag.search.ContextAssembler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs the main query and one query per option, then merges.
 *
 * <p>Sub-queries go to the given executor, the calling thread by default. Merging always
 * walks the results in main-then-options order, so a passage surfaced by several queries
 * keeps the copy (and score) from the earliest one whichever finished first.
 */
@Slf4j
@Service
public class DefaultScenarioQueryExpander implements ScenarioQueryExpander {

    private final BaseRetriever baseRetriever;
    private final RetrievalProperties retrieval;
    private final Executor executor;

    @Autowired
    public DefaultScenarioQueryExpander(BaseRetriever baseRetriever,
                                        AppProperties props,
                                        @Qualifier("retrievalExecutor") ObjectProvider<Executor> retrievalExecutor) {
        this(baseRetriever, props.getRetrieval(), retrievalExecutor.getIfAvailable(() -> Runnable::run));
    }

    public DefaultScenarioQueryExpander(BaseRetriever baseRetriever, RetrievalProperties retrieval, Executor executor) {
        this.baseRetriever = baseRetriever;
        this.retrieval = retrieval;
        this.executor = executor;
    }

    @Override
    public RetrievalResult retrieveForScenario(String scenario, String question, List<String> options,
                                               int k, SearchFilter filter) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question must not be blank");
        }
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }

        String mainQuery = scenario == null || scenario.isBlank() ? question : scenario + " " + question;
        int optionK = Math.max(retrieval.getMinOptionK(), k / 2);

        List<CompletableFuture<RetrievalResult>> pending = new ArrayList<>();
        pending.add(submit(mainQuery, k, filter));
        int optionQueries = 0;
        for (String option : options == null ? List.<String>of() : options) {
            // a blank option still gets its query, on the question alone
            String optionQuery = option == null || option.isBlank() ? question : question + " " + option;
            pending.add(submit(optionQuery, optionK, filter));
            optionQueries++;
        }

        Map<String, SearchResult> merged = new LinkedHashMap<>();
        int surfaced = 0;
        for (CompletableFuture<RetrievalResult> future : pending) {
            for (SearchResult result : await(future).getResults()) {
                surfaced++;
                merged.putIfAbsent(result.getChunkId(), result);
            }
        }

        List<SearchResult> ranked = new ArrayList<>(merged.values());
        ranked.sort(Comparator.comparingDouble(SearchResult::getScore).reversed());
        if (ranked.size() > retrieval.getScenarioResultCap()) {
            ranked = ranked.subList(0, retrieval.getScenarioResultCap());
        }

        log.info("🧩 Scenario retrieval: 1 main + {} option queries surfaced {} passages, {} unique, {} kept",
                optionQueries, surfaced, merged.size(), ranked.size());

        if (ranked.isEmpty()) {
            return RetrievalResult.empty();
        }
        List<SearchResult> results = List.copyOf(ranked);
        return new RetrievalResult(results, ContextAssembler.assemble(results));
    }

    private CompletableFuture<RetrievalResult> submit(String query, int k, SearchFilter filter) {
        return CompletableFuture.supplyAsync(() -> baseRetriever.retrieve(query, k, filter), executor);
    }

    private static RetrievalResult await(CompletableFuture<RetrievalResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
