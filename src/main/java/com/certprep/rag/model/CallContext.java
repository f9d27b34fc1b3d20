package com.certprep.rag.model;

import org.slf4j.Logger;

import java.util.UUID;

/**
 * Timing and log correlation for one remote call.
 *
 * <p>Request and response lines share a short call id so that interleaved calls
 * from concurrent queries can be told apart. Key/value details are logged at DEBUG.
 *
 * @see com.certprep.rag.util.ExternalCallLogger
 */
public class CallContext {
    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final long startNanos;
    private final Logger logger;

    public CallContext(ServiceType service, String operation, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.startNanos = System.nanoTime();
        this.logger = logger;
    }

    public void logRequest(String summary, Object... details) {
        logger.info("{} {} → {} [{}] {}", service.getEmoji(), service.getName(), operation, callId,
                summary == null ? "" : summary);
        logDetails(details);
    }

    public void logResponse(String summary, Object... details) {
        logger.info("{} {} ← {} [{}] ({}ms) {}", service.getEmoji(), service.getName(), operation, callId,
                getElapsedMs(), summary == null ? "" : summary);
        logDetails(details);
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} {} ✖ {} [{}] ({}ms) - {}", service.getEmoji(), service.getName(), operation, callId,
                getElapsedMs(), errorMessage);
        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    private void logDetails(Object... details) {
        if (details == null || !logger.isDebugEnabled()) {
            return;
        }
        // details come in key, value pairs; a trailing odd key is ignored
        for (int i = 0; i + 1 < details.length; i += 2) {
            logger.debug("  {}: {}", details[i], details[i + 1]);
        }
    }

    public String getCallId() {
        return callId;
    }

    public ServiceType getService() {
        return service;
    }

    public long getElapsedMs() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
