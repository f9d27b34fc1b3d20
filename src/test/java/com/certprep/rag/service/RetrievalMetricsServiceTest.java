package com.certprep.rag.service;

import com.certprep.rag.model.metrics.RetrievalUsageStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Usage counters")
class RetrievalMetricsServiceTest {

    @Test
    @DisplayName("Should aggregate judge tokens and degraded reranks")
    void shouldAggregateUsage() {
        RetrievalMetricsService metrics = new RetrievalMetricsService();

        metrics.recordJudgeCall("fake", 420, 6);
        metrics.recordJudgeCall("fake", 380, 4);
        metrics.recordJudgeFailure("fake");
        metrics.recordRerank(false);
        metrics.recordRerank(true);
        metrics.recordEmbedding(true);
        metrics.recordEmbedding(false);

        RetrievalUsageStats stats = metrics.snapshot();
        assertThat(stats.getJudgeCalls()).isEqualTo(3);
        assertThat(stats.getJudgeFailures()).isEqualTo(1);
        assertThat(stats.getJudgeTotalTokens()).isEqualTo(810);
        assertThat(stats.getReranks()).isEqualTo(2);
        assertThat(stats.getRerankingsDegraded()).isEqualTo(1);
        assertThat(stats.getQueryEmbeddings()).isEqualTo(2);
        assertThat(stats.getEmbeddingFailures()).isEqualTo(1);

        metrics.reset();
        assertThat(metrics.snapshot().getJudgeCalls()).isZero();
    }

    @Test
    @DisplayName("Should not lose updates from concurrent queries")
    void shouldCountConcurrently() throws InterruptedException {
        RetrievalMetricsService metrics = new RetrievalMetricsService();
        ExecutorService pool = Executors.newFixedThreadPool(8);

        for (int i = 0; i < 1000; i++) {
            pool.execute(() -> metrics.recordJudgeCall("fake", 10, 1));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(metrics.snapshot().getJudgeInputTokens()).isEqualTo(10_000);
        assertThat(metrics.snapshot().getJudgeCalls()).isEqualTo(1000);
    }
}
