package com.purchasingpower.storyflow.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for the story workflow runner.
 *
 * <p>Properties are loaded from the {@code app.workflow} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   workflow:
 *     max-workflow-time: 300s
 *     optional-step-failure-policy: continue
 *     steps:
 *       content_generation:
 *         timeout: 120s
 *         retry-count: 2
 *         required: true
 * </pre>
 *
 * <p>Steps that have no entry under {@code steps} run with {@link StepSettings} defaults
 * (60s timeout, 2 retries, required).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.workflow")
public class WorkflowConfig {

    /**
     * Wall-clock budget for a whole run, across all steps, retries and backoffs.
     */
    @NotNull
    private Duration maxWorkflowTime = Duration.ofSeconds(300);

    /**
     * What to do when a step registered as optional exhausts its retries.
     */
    @NotNull
    private OptionalStepFailurePolicy optionalStepFailurePolicy = OptionalStepFailurePolicy.CONTINUE;

    /**
     * When false the enhancement step keeps the first draft as is.
     */
    private boolean enableQualityEnhancement = true;

    /**
     * Per-step settings keyed by step name.
     */
    @Valid
    private Map<String, StepSettings> steps = new LinkedHashMap<>();

    public StepSettings settingsFor(String stepName) {
        StepSettings settings = steps.get(stepName);
        return settings != null ? settings : new StepSettings();
    }

    public enum OptionalStepFailurePolicy {
        /**
         * Record the failure and move on to the next step.
         */
        CONTINUE,

        /**
         * Treat the optional step like a required one and abort the run.
         */
        ABORT
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StepSettings {

        @NotNull
        private Duration timeout = Duration.ofSeconds(60);

        /**
         * Retries after the first attempt. 0 means a single attempt.
         */
        @Min(0)
        private int retryCount = 2;

        private boolean required = true;
    }
}
