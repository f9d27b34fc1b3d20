package com.certprep.rag.index;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IndexDescription {

    public static final String COSINE = "Cosine";

    String collectionName;
    long count;
    int dimension;

    @Builder.Default
    String distanceMetric = COSINE;

    IndexStatus status;

    /**
     * Reason the index is unavailable; null otherwise.
     */
    String error;
}
