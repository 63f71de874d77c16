package com.purchasingpower.storyflow.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Configuration for the OpenAI-compatible chat completion endpoint that writes and scores
 * stories.
 *
 * <p>Properties are loaded from the {@code app.llm} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   llm:
 *     base-url: https://api.openai.com/v1
 *     api-key: ${OPENAI_API_KEY}
 *     chat-model: gpt-4o-mini
 *     temperature: 0.8
 *     scoring-temperature: 0.1
 *     retry:
 *       max-attempts: 3
 *       initial-backoff-seconds: 2
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.llm")
public class LlmConfig {

    @NotBlank
    private String baseUrl = "https://api.openai.com/v1";

    /**
     * Should be set via the OPENAI_API_KEY environment variable.
     */
    private String apiKey;

    @NotBlank
    private String chatModel = "gpt-4o-mini";

    /**
     * Temperature for story writing. Higher is more creative.
     */
    private double temperature = 0.8;

    /**
     * Temperature for dimension scoring. Low values give more consistent scores.
     */
    private double scoringTemperature = 0.1;

    private int maxTokens = 4000;

    /**
     * Timeout for a single HTTP call, not counting retries.
     */
    private Duration requestTimeout = Duration.ofSeconds(90);

    @Valid
    private RetryConfig retry = new RetryConfig();

    /**
     * Transport-level retry for transient HTTP failures (rate limits, server errors).
     * Step-level retry is configured separately in {@link WorkflowConfig}.
     */
    @Data
    public static class RetryConfig {

        private int maxAttempts = 3;

        private long initialBackoffSeconds = 2;

        private long maxBackoffSeconds = 10;

        /**
         * HTTP status codes that should trigger a retry.
         */
        private List<Integer> retryableStatusCodes = List.of(429, 500, 502, 503, 504);
    }
}
