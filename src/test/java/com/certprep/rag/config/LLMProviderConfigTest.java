package com.certprep.rag.config;

import com.certprep.rag.client.Embedder;
import com.certprep.rag.configuration.AppProperties;
import com.certprep.rag.service.RetrievalMetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Embedding provider selection")
class LLMProviderConfigTest {

    private final LLMProviderConfig config = new LLMProviderConfig();
    private AppProperties props;

    @BeforeEach
    void setUp() {
        props = new AppProperties();
    }

    @Test
    @DisplayName("Should use the Ollama embedding model when no model name is set")
    void embedder_OllamaShouldUseOllamaModel() {
        // Given
        props.getEmbedding().setProvider("ollama");
        props.getOllama().setEmbeddingModel("mxbai-embed-large");

        // When
        Embedder embedder = config.embedder(props, new RetrievalMetricsService());

        // Then
        assertThat(embedder.getModelName()).isEqualTo("mxbai-embed-large");
    }

    @Test
    @DisplayName("Should default to nomic-embed-text for Ollama")
    void embedder_OllamaShouldDefaultToNomic() {
        props.getEmbedding().setProvider("ollama");

        assertThat(config.embedder(props, new RetrievalMetricsService()).getModelName())
                .isEqualTo("nomic-embed-text");
    }

    @Test
    @DisplayName("Should prefer an explicit model name over the provider default")
    void embedder_ShouldHonourExplicitModelName() {
        props.getEmbedding().setProvider("ollama");
        props.getEmbedding().setModelName("all-minilm");

        assertThat(config.embedder(props, new RetrievalMetricsService()).getModelName()).isEqualTo("all-minilm");
    }

    @Test
    @DisplayName("Should default to text-embedding-3-small for OpenAI")
    void embedder_OpenAiShouldDefaultModel() {
        props.getEmbedding().setProvider("openai");
        props.getEmbedding().setApiKey("sk-test");
        props.getEmbedding().setModelName(" ");

        assertThat(config.embedder(props, new RetrievalMetricsService()).getModelName())
                .isEqualTo("text-embedding-3-small");
    }

    @Test
    @DisplayName("Should require an API key for OpenAI")
    void embedder_OpenAiShouldRequireKey() {
        props.getEmbedding().setProvider("openai");

        assertThatThrownBy(() -> config.embedder(props, new RetrievalMetricsService()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("api-key");
    }

    @Test
    @DisplayName("Should refuse an unknown embedding provider")
    void embedder_ShouldRejectUnknownProvider() {
        props.getEmbedding().setProvider("cohere");

        assertThatThrownBy(() -> config.embedder(props, new RetrievalMetricsService()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cohere");
    }
}
