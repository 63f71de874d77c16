package com.purchasingpower.storyflow.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Backoff settings applied between attempts of a workflow step.
 *
 * <p>Properties are loaded from the {@code app.retry} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   retry:
 *     backoff-ms: 1000
 *     max-backoff-ms: 10000
 *     multiplier: 2.0
 * </pre>
 *
 * <p><b>Exponential Backoff Calculation:</b>
 * For retry N (starting at 0), the delay is:
 * <pre>
 *   delay = min(backoff-ms * (multiplier ^ N), max-backoff-ms)
 * </pre>
 * Example with defaults: 1s, 2s, 4s, 8s, then capped at 10s.
 *
 * <p>How many retries a step gets is configured per step in {@link WorkflowConfig}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.retry")
public class GlobalRetryConfig {

    /**
     * Delay in milliseconds before the first retry.
     * Default: 1000 (1 second)
     */
    @Min(0)
    private long backoffMs = 1000;

    /**
     * Upper bound in milliseconds for any single backoff.
     * Default: 10000 (10 seconds)
     */
    @Min(0)
    private long maxBackoffMs = 10_000;

    /**
     * Exponential multiplier applied per retry.
     * Default: 2.0
     */
    @DecimalMin("1.0")
    private double multiplier = 2.0;

    /**
     * Backoff to wait before retry number {@code retry} (0-based).
     */
    public Duration backoffFor(int retry) {
        double delay = backoffMs * Math.pow(multiplier, retry);
        return Duration.ofMillis((long) Math.min(delay, maxBackoffMs));
    }
}
