package com.purchasingpower.storyflow.exception;

import lombok.Getter;

/**
 * A required step exhausted its retries. Always aborts the run.
 *
 * <p>The cause is either a {@link StepTimeoutException} or a {@link StepExecutionException}.
 */
@Getter
public class RequiredStepFailureException extends StoryFlowException {

    private final String stepName;
    private final int attempts;

    public RequiredStepFailureException(String stepName, int attempts, StoryFlowException cause) {
        super(String.format("Required step '%s' failed: %s", stepName, cause.getMessage()), cause, false);
        this.stepName = stepName;
        this.attempts = attempts;
    }
}
