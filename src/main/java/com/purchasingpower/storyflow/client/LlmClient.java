package com.purchasingpower.storyflow.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.storyflow.config.LlmConfig;
import com.purchasingpower.storyflow.exception.GenerationException;
import com.purchasingpower.storyflow.model.CallContext;
import com.purchasingpower.storyflow.model.ServiceType;
import com.purchasingpower.storyflow.util.ExternalCallLogger;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Client for an OpenAI-compatible {@code /chat/completions} endpoint.
 *
 * <p>Transient HTTP failures (configured status codes) are retried here with exponential
 * backoff. Anything else is reported as {@link GenerationException}; client errors such as
 * 401 are marked non-retryable so the workflow does not retry them either.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmClient {

    private final LlmConfig llmConfig;
    private final ObjectMapper objectMapper;

    private WebClient webClient;

    @PostConstruct
    public void init() {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(llmConfig.getBaseUrl())
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build());
        if (llmConfig.getApiKey() != null && !llmConfig.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + llmConfig.getApiKey());
        }
        this.webClient = builder.build();
    }

    /**
     * Send a single-message chat completion and return the assistant text.
     *
     * @param prompt      full prompt text
     * @param temperature sampling temperature
     * @param service     call category for logging
     * @param operation   short name of the caller, e.g. "enhance" or "score-pacing_quality"
     */
    public String chat(String prompt, double temperature, ServiceType service, String operation) {
        CallContext callCtx = ExternalCallLogger.startCall(service, operation, log);
        callCtx.logRequest("Chat completion",
                "Model", llmConfig.getChatModel(),
                "Temperature", temperature,
                "Prompt Length", prompt.length() + " chars",
                "Prompt", ExternalCallLogger.truncate(prompt, 500));

        Map<String, Object> body = Map.of(
                "model", llmConfig.getChatModel(),
                "temperature", temperature,
                "max_tokens", llmConfig.getMaxTokens(),
                "messages", List.of(Map.of("role", "user", "content", prompt)));

        try {
            String json = webClient.post().uri("/chat/completions").bodyValue(body)
                    .retrieve().bodyToMono(String.class)
                    .timeout(llmConfig.getRequestTimeout())
                    .retryWhen(buildRetrySpec())
                    .block();

            String text = extractText(json);

            JsonNode usage = objectMapper.readTree(json).path("usage");
            callCtx.logResponse("Completion received",
                    "Tokens", String.format("%d in + %d out",
                            usage.path("prompt_tokens").asInt(0), usage.path("completion_tokens").asInt(0)),
                    "Response Length", text.length() + " chars",
                    "Response", ExternalCallLogger.truncate(text, 500));
            return text;

        } catch (WebClientResponseException e) {
            callCtx.logError(e.getStatusCode() + ": " + e.getMessage(), e);
            boolean retryable = e.getStatusCode().is5xxServerError() || e.getStatusCode().value() == 429;
            throw new GenerationException("LLM call failed for " + operation + " with HTTP "
                    + e.getStatusCode().value(), e, retryable);

        } catch (IOException e) {
            callCtx.logError("Unreadable response", e);
            throw new GenerationException("LLM returned an unreadable response for " + operation, e);

        } catch (GenerationException e) {
            callCtx.logError(e.getMessage(), e);
            throw e;

        } catch (RuntimeException e) {
            callCtx.logError("Unexpected error", e);
            throw new GenerationException("LLM call failed for " + operation + ": " + e.getMessage(), e);
        }
    }

    String extractText(String rawJson) throws IOException {
        if (rawJson == null || rawJson.isBlank()) {
            throw new GenerationException("LLM returned an empty body");
        }
        JsonNode choices = objectMapper.readTree(rawJson).path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new GenerationException("LLM response has no choices");
        }
        String text = choices.get(0).path("message").path("content").asText("");
        if (text.isBlank()) {
            throw new GenerationException("LLM response has empty content");
        }
        return text;
    }

    private Retry buildRetrySpec() {
        LlmConfig.RetryConfig retry = llmConfig.getRetry();
        return Retry.backoff(retry.getMaxAttempts(), Duration.ofSeconds(retry.getInitialBackoffSeconds()))
                .maxBackoff(Duration.ofSeconds(retry.getMaxBackoffSeconds()))
                .filter(this::isRetryable)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    private boolean isRetryable(Throwable ex) {
        if (!(ex instanceof WebClientResponseException webEx)) {
            return false;
        }
        List<Integer> codes = llmConfig.getRetry().getRetryableStatusCodes();
        if (codes == null) {
            return webEx.getStatusCode().is5xxServerError() || webEx.getStatusCode().value() == 429;
        }
        return codes.contains(webEx.getStatusCode().value());
    }
}
