package com.certprep.rag.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class IndexProperties {

    /**
     * Backing store: {@code memory} or {@code pinecone}.
     */
    @NotBlank
    private String provider = "memory";

    @NotBlank
    private String collectionName = "comptia_security_plus";

    @Min(1)
    private int dimension = 1536;

    /**
     * Precomputed corpus (embeddings.json) loaded before serving. Empty means none.
     */
    private String corpusFile;

    private boolean loadOnStartup = true;

    @Min(1)
    private int upsertBatchSize = 100;
}
