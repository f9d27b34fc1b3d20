package com.certprep.rag.service.impl;

import com.certprep.rag.configuration.AppProperties;
import com.certprep.rag.core.RetrievalResult;
import com.certprep.rag.core.SearchFilter;
import com.certprep.rag.core.SearchResult;
import com.certprep.rag.index.IndexDescription;
import com.certprep.rag.index.VectorIndex;
import com.certprep.rag.model.metrics.RetrievalUsageStats;
import com.certprep.rag.rerank.CandidateReranker;
import com.certprep.rag.scenario.ExamQuestion;
import com.certprep.rag.scenario.ScenarioQueryExpander;
import com.certprep.rag.search.BaseRetriever;
import com.certprep.rag.search.ContextAssembler;
import com.certprep.rag.service.RetrievalMetricsService;
import com.certprep.rag.service.RetrievalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalServiceImpl implements RetrievalService {

    private final BaseRetriever baseRetriever;
    private final CandidateReranker reranker;
    private final ScenarioQueryExpander scenarioQueryExpander;
    private final VectorIndex vectorIndex;
    private final RetrievalMetricsService metricsService;
    private final AppProperties props;

    @Override
    public RetrievalResult retrieve(String queryText, int k, SearchFilter filter) {
        return baseRetriever.retrieve(queryText, k, filter);
    }

    @Override
    public RetrievalResult retrieve(String queryText, SearchFilter filter) {
        return retrieve(queryText, props.getRetrieval().getDefaultK(), filter);
    }

    @Override
    public RetrievalResult retrieveWithReranking(String queryText, int k, int initialK, SearchFilter filter) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }
        int poolSize = Math.max(initialK, k);
        RetrievalResult candidates = baseRetriever.retrieve(queryText, poolSize, filter);
        if (candidates.isEmpty()) {
            return RetrievalResult.empty();
        }

        List<SearchResult> reranked = reranker.rerank(queryText, candidates.getResults(), k);
        log.debug("Reranked pool of {} down to {}", candidates.size(), reranked.size());
        return new RetrievalResult(List.copyOf(reranked), ContextAssembler.assemble(reranked));
    }

    @Override
    public RetrievalResult retrieveWithReranking(String queryText, int k, SearchFilter filter) {
        return retrieveWithReranking(queryText, k, props.getRetrieval().getInitialK(), filter);
    }

    @Override
    public RetrievalResult retrieveForScenario(String scenario, String question, List<String> options,
                                               int k, SearchFilter filter) {
        return scenarioQueryExpander.retrieveForScenario(scenario, question, options, k, filter);
    }

    @Override
    public RetrievalResult retrieveForExamQuestion(ExamQuestion question, int k, SearchFilter filter) {
        SearchFilter effective = filter == null ? SearchFilter.none() : filter;
        if (effective.getChapterNum() == null && question.getChapter() != null) {
            effective = effective.toBuilder().chapterNum(question.getChapter()).build();
        }
        log.info("📝 Retrieving for exam question {} ({} options)", question.getId(), question.getOptions().size());
        return scenarioQueryExpander.retrieveForScenario(
                question.getScenario(), question.getQuestion(), question.getOptions(), k, effective);
    }

    @Override
    public IndexDescription describeIndex() {
        return vectorIndex.describe();
    }

    @Override
    public RetrievalUsageStats getUsageStats() {
        return metricsService.snapshot();
    }
}
