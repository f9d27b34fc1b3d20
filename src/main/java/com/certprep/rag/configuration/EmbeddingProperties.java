package com.certprep.rag.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class EmbeddingProperties {

    /**
     * {@code openai} or {@code ollama}.
     */
    @NotBlank
    private String provider = "openai";

    /**
     * Overrides the provider's default embedding model when set.
     */
    private String modelName;

    private String apiKey;

    /**
     * Optional override of the provider endpoint.
     */
    private String baseUrl;

    @Min(1)
    private int timeoutSeconds = 60;

    @Min(0)
    private int maxRetries = 3;

    private boolean logRequests = false;
}
