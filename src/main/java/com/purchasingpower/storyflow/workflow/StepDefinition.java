package com.purchasingpower.storyflow.workflow;

import com.purchasingpower.storyflow.config.WorkflowConfig;
import com.purchasingpower.storyflow.model.WorkflowStage;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable registration of a step with its execution policy. Created once when the runner is
 * built.
 */
@Value
@Builder
public class StepDefinition {

    @NonNull
    WorkflowStep<?> step;

    @NonNull
    Duration timeout;

    /**
     * Retries after the first attempt.
     */
    int retryCount;

    boolean required;

    public String getName() {
        return step.name();
    }

    public WorkflowStage getStage() {
        return step.stage();
    }

    public int getMaxAttempts() {
        return retryCount + 1;
    }

    public static StepDefinition of(WorkflowStep<?> step, WorkflowConfig.StepSettings settings) {
        if (settings.getTimeout().isNegative() || settings.getTimeout().isZero()) {
            throw new IllegalArgumentException("Step '" + step.name() + "' needs a positive timeout");
        }
        if (settings.getRetryCount() < 0) {
            throw new IllegalArgumentException("Step '" + step.name() + "' has a negative retry count");
        }
        return StepDefinition.builder()
                .step(step)
                .timeout(settings.getTimeout())
                .retryCount(settings.getRetryCount())
                .required(settings.isRequired())
                .build();
    }
}
