package com.certprep.rag.model.metrics;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time copy of the engine's usage counters.
 */
@Value
@Builder
public class RetrievalUsageStats {

    long queryEmbeddings;
    long embeddingFailures;
    long judgeCalls;
    long judgeFailures;
    long judgeInputTokens;
    long judgeOutputTokens;
    long reranks;
    long rerankingsDegraded;

    public long getJudgeTotalTokens() {
        return judgeInputTokens + judgeOutputTokens;
    }
}
