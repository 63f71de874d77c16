package com.purchasingpower.storyflow.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * A step did not finish within its timeout on any attempt.
 */
@Getter
public class StepTimeoutException extends StoryFlowException {

    private final String stepName;
    private final int attempts;
    private final Duration timeout;

    public StepTimeoutException(String stepName, int attempts, Duration timeout) {
        super(String.format("Step '%s' timed out after %d attempt(s) (timeout %ss)",
                stepName, attempts, timeout.toMillis() / 1000.0), true);
        this.stepName = stepName;
        this.attempts = attempts;
        this.timeout = timeout;
    }
}
