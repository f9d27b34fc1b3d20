package com.certprep.rag.config;

import com.certprep.rag.client.Embedder;
import com.certprep.rag.client.GeminiJudgeClient;
import com.certprep.rag.client.Judge;
import com.certprep.rag.client.LangChain4jEmbedder;
import com.certprep.rag.client.OllamaJudgeClient;
import com.certprep.rag.configuration.AppProperties;
import com.certprep.rag.configuration.EmbeddingProperties;
import com.certprep.rag.model.ServiceType;
import com.certprep.rag.service.RetrievalMetricsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Selects the query embedder and the rerank judge from configuration.
 *
 * <ul>
 *   <li>{@code app.embedding.provider}: {@code openai} | {@code ollama}</li>
 *   <li>{@code app.judge.provider}: {@code gemini} | {@code ollama}</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Slf4j
@Configuration
public class LLMProviderConfig {

    static final String OPENAI_EMBEDDING_MODEL = "text-embedding-3-small";

    @Bean
    public Embedder embedder(AppProperties props, RetrievalMetricsService metricsService) {
        EmbeddingProperties embedding = props.getEmbedding();
        String provider = embedding.getProvider().toLowerCase();
        String modelName = embeddingModelName(provider, props);
        log.info("🚀 Embedding provider: {} ({}, timeout={}s, maxRetries={})", provider,
                modelName, embedding.getTimeoutSeconds(), embedding.getMaxRetries());

        return switch (provider) {
            case "openai" -> new LangChain4jEmbedder(openAiModel(embedding, modelName), modelName,
                    ServiceType.OPENAI, metricsService);
            case "ollama" -> new LangChain4jEmbedder(ollamaModel(embedding, modelName, props), modelName,
                    ServiceType.OLLAMA, metricsService);
            // a wrong fallback here would silently produce vectors from another space
            default -> throw new IllegalStateException("Unknown embedding provider: " + provider);
        };
    }

    @Bean
    public Judge judge(AppProperties props,
                       JudgeConfig judgeConfig,
                       ObjectMapper objectMapper,
                       RetrievalMetricsService metricsService,
                       WebClient.Builder webClientBuilder) {
        String provider = judgeConfig.getProvider().toLowerCase();
        Judge judge = switch (provider) {
            case "gemini" -> new GeminiJudgeClient(props.getGemini(), judgeConfig, objectMapper,
                    metricsService, webClientBuilder.clone());
            case "ollama" -> new OllamaJudgeClient(props.getOllama(), judgeConfig, metricsService,
                    webClientBuilder.clone());
            default -> {
                log.warn("Unknown judge provider: {}, falling back to Ollama", provider);
                yield new OllamaJudgeClient(props.getOllama(), judgeConfig, metricsService, webClientBuilder.clone());
            }
        };
        log.info("🚀 Rerank judge: {}", judge.getProviderName());
        return judge;
    }

    /**
     * {@code app.embedding.model-name} when set, otherwise the provider's own default:
     * {@value #OPENAI_EMBEDDING_MODEL} for OpenAI, {@code app.ollama.embedding-model} for Ollama.
     */
    static String embeddingModelName(String provider, AppProperties props) {
        String configured = props.getEmbedding().getModelName();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return "ollama".equals(provider) ? props.getOllama().getEmbeddingModel() : OPENAI_EMBEDDING_MODEL;
    }

    private static EmbeddingModel openAiModel(EmbeddingProperties embedding, String modelName) {
        if (embedding.getApiKey() == null || embedding.getApiKey().isBlank()) {
            throw new IllegalStateException("app.embedding.api-key is required for the openai provider");
        }
        var builder = OpenAiEmbeddingModel.builder()
                .apiKey(embedding.getApiKey())
                .modelName(modelName)
                .timeout(Duration.ofSeconds(embedding.getTimeoutSeconds()))
                .maxRetries(embedding.getMaxRetries())
                .logRequests(embedding.isLogRequests())
                .logResponses(false);
        if (embedding.getBaseUrl() != null && !embedding.getBaseUrl().isBlank()) {
            builder.baseUrl(embedding.getBaseUrl());
        }
        return builder.build();
    }

    private static EmbeddingModel ollamaModel(EmbeddingProperties embedding, String modelName, AppProperties props) {
        String baseUrl = embedding.getBaseUrl() != null && !embedding.getBaseUrl().isBlank()
                ? embedding.getBaseUrl()
                : props.getOllama().getBaseUrl();
        return OllamaEmbeddingModel.builder()
                .baseUrl(baseUrl)
                .modelName(modelName)
                .timeout(Duration.ofSeconds(embedding.getTimeoutSeconds()))
                .maxRetries(embedding.getMaxRetries())
                .logRequests(embedding.isLogRequests())
                .logResponses(false)
                .build();
    }
}
