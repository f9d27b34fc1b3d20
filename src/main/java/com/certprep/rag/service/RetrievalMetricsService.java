package com.certprep.rag.service;

import com.certprep.rag.model.metrics.RetrievalUsageStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.LongAdder;

/**
 * Single place where usage counters are mutated.
 *
 * Counters are updated from whichever thread issued a query; readers get a
 * snapshot through {@link #snapshot()}. Recording never throws.
 */
@Slf4j
@Service
public class RetrievalMetricsService {

    private final LongAdder queryEmbeddings = new LongAdder();
    private final LongAdder embeddingFailures = new LongAdder();
    private final LongAdder judgeCalls = new LongAdder();
    private final LongAdder judgeFailures = new LongAdder();
    private final LongAdder judgeInputTokens = new LongAdder();
    private final LongAdder judgeOutputTokens = new LongAdder();
    private final LongAdder reranks = new LongAdder();
    private final LongAdder rerankingsDegraded = new LongAdder();

    public void recordEmbedding(boolean success) {
        queryEmbeddings.increment();
        if (!success) {
            embeddingFailures.increment();
        }
    }

    public void recordJudgeCall(String provider, int inputTokens, int outputTokens) {
        judgeCalls.increment();
        judgeInputTokens.add(Math.max(0, inputTokens));
        judgeOutputTokens.add(Math.max(0, outputTokens));
        log.debug("Recorded judge usage: provider={}, tokens={} in + {} out", provider, inputTokens, outputTokens);
    }

    public void recordJudgeFailure(String provider) {
        judgeCalls.increment();
        judgeFailures.increment();
        log.debug("Recorded judge failure: provider={}", provider);
    }

    public void recordRerank(boolean degraded) {
        reranks.increment();
        if (degraded) {
            rerankingsDegraded.increment();
        }
    }

    public RetrievalUsageStats snapshot() {
        return RetrievalUsageStats.builder()
                .queryEmbeddings(queryEmbeddings.sum())
                .embeddingFailures(embeddingFailures.sum())
                .judgeCalls(judgeCalls.sum())
                .judgeFailures(judgeFailures.sum())
                .judgeInputTokens(judgeInputTokens.sum())
                .judgeOutputTokens(judgeOutputTokens.sum())
                .reranks(reranks.sum())
                .rerankingsDegraded(rerankingsDegraded.sum())
                .build();
    }

    /**
     * Clears all counters, e.g. between evaluation runs.
     */
    public void reset() {
        queryEmbeddings.reset();
        embeddingFailures.reset();
        judgeCalls.reset();
        judgeFailures.reset();
        judgeInputTokens.reset();
        judgeOutputTokens.reset();
        reranks.reset();
        rerankingsDegraded.reset();
        log.info("Usage counters reset");
    }
}
