package com.purchasingpower.storyflow.exception;

import lombok.Getter;

/**
 * A step raised an error on its last attempt.
 */
@Getter
public class StepExecutionException extends StoryFlowException {

    private final String stepName;
    private final int attempts;

    public StepExecutionException(String stepName, int attempts, Throwable cause) {
        super(String.format("Step '%s' failed after %d attempt(s): %s",
                stepName, attempts, cause.getMessage()), cause, false);
        this.stepName = stepName;
        this.attempts = attempts;
    }
}
