package com.certprep.rag.client;

import com.certprep.rag.config.JudgeConfig;
import com.certprep.rag.configuration.OllamaProperties;
import com.certprep.rag.model.CallContext;
import com.certprep.rag.model.ServiceType;
import com.certprep.rag.service.RetrievalMetricsService;
import com.certprep.rag.util.ExternalCallLogger;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Judge backed by a local Ollama model through {@code /api/chat}.
 *
 * Useful for offline evaluation runs where cloud quotas or cost matter.
 */
@Slf4j
public class OllamaJudgeClient implements Judge {

    private static final String SYSTEM_PROMPT =
            "You select relevant study passages. Answer only with the requested index list.";

    private final OllamaProperties ollama;
    private final JudgeConfig judgeConfig;
    private final RetrievalMetricsService metricsService;
    private final WebClient ollamaWebClient;

    public OllamaJudgeClient(OllamaProperties ollama,
                             JudgeConfig judgeConfig,
                             RetrievalMetricsService metricsService,
                             WebClient.Builder webClientBuilder) {
        this.ollama = ollama;
        this.judgeConfig = judgeConfig;
        this.metricsService = metricsService;

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10000)
                .responseTimeout(Duration.ofSeconds(ollama.getTimeoutSeconds()))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(ollama.getTimeoutSeconds(), TimeUnit.SECONDS)));

        this.ollamaWebClient = webClientBuilder
                .baseUrl(ollama.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Override
    public String complete(JudgeRequest request) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.OLLAMA, "chat", log);
        String model = ollama.getChatModel();

        callCtx.logRequest("Judging candidates",
                "Purpose", request.getPurpose(),
                "Model", model,
                "Prompt", ExternalCallLogger.truncate(request.getPrompt(), 500));

        Map<String, Object> options = new HashMap<>();
        options.put("temperature", judgeConfig.getTemperature());
        options.put("num_predict", request.getMaxOutputTokens());
        if (!request.getStopSequences().isEmpty()) {
            options.put("stop", request.getStopSequences());
        }
        Map<String, Object> body = Map.of(
                "model", model,
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", request.getPrompt())),
                "stream", false,
                "options", options);

        try {
            JsonNode response = ollamaWebClient.post()
                    .uri("/api/chat")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .retryWhen(JudgeRetry.backoff(judgeConfig.getRetry()))
                    .block();

            if (response == null || response.path("message").isMissingNode()) {
                throw new IllegalStateException("Ollama returned no message");
            }
            String content = response.path("message").path("content").asText();
            int inputTokens = response.path("prompt_eval_count").asInt(0);
            int outputTokens = response.path("eval_count").asInt(0);
            metricsService.recordJudgeCall(getProviderName(), inputTokens, outputTokens);

            callCtx.logResponse("Judgment received",
                    "Tokens", String.format("%d in + %d out", inputTokens, outputTokens),
                    "Response", ExternalCallLogger.truncate(content, 200));
            return content;

        } catch (Exception e) {
            metricsService.recordJudgeFailure(getProviderName());
            callCtx.logError(e.getMessage(), e);
            throw new RuntimeException("Ollama judge call failed. Ensure " + model + " is pulled and Ollama is running.", e);
        }
    }

    @Override
    public String getProviderName() {
        return "Ollama (" + ollama.getChatModel() + ")";
    }
}
