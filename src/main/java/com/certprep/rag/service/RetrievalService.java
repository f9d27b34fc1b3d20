package com.certprep.rag.service;

import com.certprep.rag.core.RetrievalResult;
import com.certprep.rag.core.SearchFilter;
import com.certprep.rag.index.IndexDescription;
import com.certprep.rag.model.metrics.RetrievalUsageStats;
import com.certprep.rag.scenario.ExamQuestion;

import java.util.List;

/**
 * Entry point for hosts embedding the engine: answer composition, evaluation runs,
 * health checks.
 */
public interface RetrievalService {

    RetrievalResult retrieve(String queryText, int k, SearchFilter filter);

    /**
     * Same as {@link #retrieve(String, int, SearchFilter)} with the configured default k.
     */
    RetrievalResult retrieve(String queryText, SearchFilter filter);

    /**
     * Pulls {@code max(initialK, k)} candidates and reranks them down to {@code k}.
     */
    RetrievalResult retrieveWithReranking(String queryText, int k, int initialK, SearchFilter filter);

    /**
     * Same as {@link #retrieveWithReranking(String, int, int, SearchFilter)} with the configured
     * candidate pool size.
     */
    RetrievalResult retrieveWithReranking(String queryText, int k, SearchFilter filter);

    RetrievalResult retrieveForScenario(String scenario, String question, List<String> options,
                                        int k, SearchFilter filter);

    /**
     * Scenario retrieval for a parsed exam question. Without an explicit chapter filter
     * the question's own chapter, if any, is used.
     */
    RetrievalResult retrieveForExamQuestion(ExamQuestion question, int k, SearchFilter filter);

    IndexDescription describeIndex();

    RetrievalUsageStats getUsageStats();
}
