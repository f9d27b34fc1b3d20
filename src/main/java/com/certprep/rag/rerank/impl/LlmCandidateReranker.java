package com.certprep.rag.rerank.impl;

import com.certprep.rag.client.Judge;
import com.certprep.rag.client.JudgeRequest;
import com.certprep.rag.config.JudgeConfig;
import com.certprep.rag.core.SearchResult;
import com.certprep.rag.rerank.CandidateReranker;
import com.certprep.rag.rerank.RerankPrompt;
import com.certprep.rag.rerank.RerankResponseParser;
import com.certprep.rag.service.RetrievalMetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reranks candidates by asking a {@link Judge} which of them answer the query best.
 *
 * <p>Selected results get synthetic scores {@code 1.0 - 0.05 * rank}; the values carry no
 * meaning beyond being strictly descending.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmCandidateReranker implements CandidateReranker {

    static final double SCORE_STEP = 0.05;
    private static final String PURPOSE = "rerank";

    private final Judge judge;
    private final JudgeConfig judgeConfig;
    private final RetrievalMetricsService metricsService;

    @Override
    public List<SearchResult> rerank(String queryText, List<SearchResult> candidates, int k) {
        if (candidates == null) {
            throw new IllegalArgumentException("Candidates must not be null");
        }
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }
        if (candidates.isEmpty()) {
            return List.of();
        }
        if (candidates.size() <= k) {
            return candidates;
        }

        List<Integer> selected;
        try {
            String response = judge.complete(JudgeRequest.builder()
                    .prompt(RerankPrompt.build(queryText, candidates, k))
                    .purpose(PURPOSE)
                    .maxOutputTokens(judgeConfig.getMaxOutputTokens())
                    .stopSequence(RerankPrompt.CLOSE_MARKER)
                    .build());
            selected = RerankResponseParser.parse(response, candidates.size());
            if (selected.isEmpty()) {
                return degrade(candidates, k, "unparseable judgment: " + response);
            }
        } catch (RuntimeException e) {
            return degrade(candidates, k, e.getMessage());
        }

        List<SearchResult> ordered = new ArrayList<>(k);
        Set<Integer> taken = new HashSet<>();
        for (Integer index : selected) {
            if (ordered.size() == k) {
                break;
            }
            ordered.add(candidates.get(index));
            taken.add(index);
        }
        // too few usable indices: pad with the highest-scoring candidates not yet selected
        if (ordered.size() < k) {
            List<SearchResult> remaining = new ArrayList<>();
            for (int i = 0; i < candidates.size(); i++) {
                if (!taken.contains(i)) {
                    remaining.add(candidates.get(i));
                }
            }
            remaining.sort(Comparator.comparingDouble(SearchResult::getScore).reversed());
            for (SearchResult candidate : remaining) {
                if (ordered.size() == k) {
                    break;
                }
                ordered.add(candidate);
            }
        }

        List<SearchResult> reranked = new ArrayList<>(ordered.size());
        for (int rank = 0; rank < ordered.size(); rank++) {
            reranked.add(ordered.get(rank).withScore(1.0 - rank * SCORE_STEP));
        }

        metricsService.recordRerank(false);
        log.info("🏅 Reranked {} candidates to {} via {} (judge picked {})",
                candidates.size(), reranked.size(), judge.getProviderName(), selected.size());
        return reranked;
    }

    private List<SearchResult> degrade(List<SearchResult> candidates, int k, String reason) {
        metricsService.recordRerank(true);
        log.warn("⚠️ RerankingDegraded: keeping first {} of {} candidates by vector score ({})",
                k, candidates.size(), reason);
        return List.copyOf(candidates.subList(0, k));
    }
}
