package com.certprep.rag.client;

import com.certprep.rag.exception.EmbeddingException;
import com.certprep.rag.model.CallContext;
import com.certprep.rag.model.ServiceType;
import com.certprep.rag.service.RetrievalMetricsService;
import com.certprep.rag.util.ExternalCallLogger;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Query embedder backed by a LangChain4j {@link EmbeddingModel}.
 *
 * <p>Retries and timeouts are configured on the wrapped model (OpenAI or Ollama);
 * whatever still fails surfaces as {@link EmbeddingException}.
 */
@Slf4j
public class LangChain4jEmbedder implements Embedder {

    private final EmbeddingModel embeddingModel;
    private final String modelName;
    private final ServiceType serviceType;
    private final RetrievalMetricsService metricsService;

    public LangChain4jEmbedder(EmbeddingModel embeddingModel,
                               String modelName,
                               ServiceType serviceType,
                               RetrievalMetricsService metricsService) {
        this.embeddingModel = embeddingModel;
        this.modelName = modelName;
        this.serviceType = serviceType;
        this.metricsService = metricsService;
    }

    @Override
    public List<Float> embed(String text) {
        CallContext callCtx = ExternalCallLogger.startCall(serviceType, "embed", log);
        callCtx.logRequest("Embedding query",
                "Model", modelName,
                "Text", ExternalCallLogger.truncate(text, 200));

        try {
            Response<Embedding> response = embeddingModel.embed(text);
            if (response == null || response.content() == null) {
                throw new IllegalStateException("Provider returned no embedding");
            }
            List<Float> vector = response.content().vectorAsList();
            metricsService.recordEmbedding(true);

            callCtx.logResponse(vector.size() + " dims",
                    "Vector", ExternalCallLogger.previewVector(vector));
            return vector;

        } catch (RuntimeException e) {
            metricsService.recordEmbedding(false);
            callCtx.logError(e.getMessage(), e);
            throw new EmbeddingException("Query embedding failed with model " + modelName, modelName, e);
        }
    }

    @Override
    public String getModelName() {
        return modelName;
    }
}
