package com.certprep.rag.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class RetrievalProperties {

    /**
     * Results returned when the caller gives no k.
     */
    @Min(1)
    private int defaultK = 3;

    /**
     * Candidates pulled from the index before reranking.
     */
    @Min(1)
    private int initialK = 20;

    @Min(1)
    private int scenarioResultCap = 12;

    @Min(1)
    private int minOptionK = 3;

    private boolean parallelScenarioQueries = false;
}
