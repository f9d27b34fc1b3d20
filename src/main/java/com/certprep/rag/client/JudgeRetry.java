package com.certprep.rag.client;

import com.certprep.rag.config.JudgeConfig;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Reactor retry policy shared by the judge clients.
 */
final class JudgeRetry {

    private JudgeRetry() {
    }

    static Retry backoff(JudgeConfig.RetryConfig retry) {
        return Retry.backoff(retry.getMaxAttempts(), Duration.ofSeconds(retry.getInitialBackoffSeconds()))
                .maxBackoff(Duration.ofSeconds(retry.getMaxBackoffSeconds()))
                .filter(ex -> isRetryable(ex, retry))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    static boolean isRetryable(Throwable ex, JudgeConfig.RetryConfig retry) {
        if (!(ex instanceof WebClientResponseException webEx)) {
            return false;
        }
        if (retry.getRetryableStatusCodes() == null) {
            return webEx.getStatusCode().is5xxServerError() || webEx.getStatusCode().value() == 429;
        }
        return retry.getRetryableStatusCodes().contains(webEx.getStatusCode().value());
    }
}
