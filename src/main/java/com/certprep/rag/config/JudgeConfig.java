package com.certprep.rag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Settings for the language model that judges rerank candidates.
 *
 * <p>Properties are loaded from the {@code app.judge} namespace in application.yml:
 * <pre>
 * app:
 *   judge:
 *     provider: gemini
 *     temperature: 0.0
 *     max-output-tokens: 50
 *     retry:
 *       max-attempts: 2
 *       initial-backoff-seconds: 1
 *       max-backoff-seconds: 4
 *       retryable-status-codes: [429, 500, 502, 503, 504]
 * </pre>
 *
 * <p>Provider endpoints and models live under {@code app.gemini} and {@code app.ollama}.
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "app.judge")
@Data
public class JudgeConfig {

    /**
     * {@code gemini} or {@code ollama}.
     */
    private String provider = "gemini";

    /**
     * Judging is a selection task, so the default is fully deterministic.
     */
    private double temperature = 0.0;

    /**
     * Output budget for the index list; a handful of comma-separated integers.
     */
    private int maxOutputTokens = 50;

    private RetryConfig retry = new RetryConfig();

    /**
     * Exponential backoff for transient judge failures (rate limits, 5xx).
     *
     * <p>Kept short: a slow judge only delays a query that would degrade anyway.
     */
    @Data
    public static class RetryConfig {

        private int maxAttempts = 2;

        private long initialBackoffSeconds = 1;

        private long maxBackoffSeconds = 4;

        /**
         * When null, any 5xx or 429 is retried.
         */
        private List<Integer> retryableStatusCodes;
    }
}
