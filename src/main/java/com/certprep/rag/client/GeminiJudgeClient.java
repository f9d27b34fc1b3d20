package com.certprep.rag.client;

import com.certprep.rag.config.JudgeConfig;
import com.certprep.rag.configuration.GeminiProperties;
import com.certprep.rag.model.CallContext;
import com.certprep.rag.model.ServiceType;
import com.certprep.rag.service.RetrievalMetricsService;
import com.certprep.rag.util.ExternalCallLogger;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Judge backed by the Gemini {@code generateContent} endpoint.
 *
 * <p>The API key travels in the {@code x-goog-api-key} header, never in the URL.
 */
@Slf4j
public class GeminiJudgeClient implements Judge {

    private final GeminiProperties gemini;
    private final JudgeConfig judgeConfig;
    private final ObjectMapper objectMapper;
    private final RetrievalMetricsService metricsService;
    private final WebClient geminiWebClient;

    public GeminiJudgeClient(GeminiProperties gemini,
                             JudgeConfig judgeConfig,
                             ObjectMapper objectMapper,
                             RetrievalMetricsService metricsService,
                             WebClient.Builder webClientBuilder) {
        this.gemini = gemini;
        this.judgeConfig = judgeConfig;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.geminiWebClient = webClientBuilder
                .baseUrl(gemini.getBaseUrl())
                .defaultHeader("x-goog-api-key", gemini.getApiKey() == null ? "" : gemini.getApiKey())
                .build();
    }

    @Override
    public String complete(JudgeRequest request) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GEMINI, "generateContent", log);
        String model = gemini.getChatModel();
        String url = String.format("/%s/models/%s:generateContent", gemini.getApiVersion(), model);

        callCtx.logRequest("Judging candidates",
                "Purpose", request.getPurpose(),
                "Model", model,
                "Prompt Length", request.getPrompt().length() + " chars",
                "Prompt", ExternalCallLogger.truncate(request.getPrompt(), 500));

        Map<String, Object> generationConfig = new HashMap<>();
        generationConfig.put("temperature", judgeConfig.getTemperature());
        generationConfig.put("maxOutputTokens", request.getMaxOutputTokens());
        if (!request.getStopSequences().isEmpty()) {
            generationConfig.put("stopSequences", request.getStopSequences());
        }
        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of("role", "user", "parts", List.of(Map.of("text", request.getPrompt())))),
                "generationConfig", generationConfig);

        try {
            String json = geminiWebClient.post().uri(url).bodyValue(body)
                    .retrieve().bodyToMono(String.class)
                    .retryWhen(JudgeRetry.backoff(judgeConfig.getRetry()))
                    .block();

            JsonNode root = objectMapper.readTree(json);
            JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
            if (!parts.isArray() || parts.isEmpty()) {
                String finishReason = root.path("candidates").path(0).path("finishReason").asText("UNKNOWN");
                throw new IllegalStateException("Gemini returned no text (finishReason=" + finishReason + ")");
            }
            String response = parts.path(0).path("text").asText();

            JsonNode usage = root.path("usageMetadata");
            int inputTokens = usage.path("promptTokenCount").asInt(0);
            int outputTokens = usage.path("candidatesTokenCount").asInt(0);
            metricsService.recordJudgeCall(getProviderName(), inputTokens, outputTokens);

            callCtx.logResponse("Judgment received",
                    "Tokens", String.format("%d in + %d out", inputTokens, outputTokens),
                    "Response", ExternalCallLogger.truncate(response, 200));
            return response;

        } catch (WebClientResponseException e) {
            metricsService.recordJudgeFailure(getProviderName());
            callCtx.logError(e.getStatusCode() + ": " + e.getMessage(), e);
            throw new RuntimeException("Gemini judge call failed for " + request.getPurpose(), e);

        } catch (Exception e) {
            metricsService.recordJudgeFailure(getProviderName());
            callCtx.logError("Unexpected error: " + e.getMessage(), e);
            throw new RuntimeException("Gemini judge call failed for " + request.getPurpose(), e);
        }
    }

    @Override
    public String getProviderName() {
        return "Gemini (" + gemini.getChatModel() + ")";
    }
}
