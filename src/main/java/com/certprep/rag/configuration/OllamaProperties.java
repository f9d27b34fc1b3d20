package com.certprep.rag.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OllamaProperties {

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    @NotBlank
    private String chatModel = "qwen2.5:7b";

    @NotBlank
    private String embeddingModel = "nomic-embed-text";

    @Min(1)
    private int timeoutSeconds = 120;
}
