package com.certprep.rag.client;

/**
 * Language-model endpoint asked to judge which candidate passages answer a query.
 *
 * <p>Implementations are remote and may fail with any runtime exception; callers
 * are expected to degrade rather than propagate.
 */
public interface Judge {

    String complete(JudgeRequest request);

    String getProviderName();
}
