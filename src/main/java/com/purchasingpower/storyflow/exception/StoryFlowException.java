package com.purchasingpower.storyflow.exception;

import lombok.Getter;

/**
 * Base class for every failure the story workflow reports to its caller.
 *
 * <p>{@code retryable} tells the workflow runner whether another attempt of the same step can
 * succeed. Failures that can never succeed on retry (bad configuration, contract violations)
 * are created non-retryable so the runner stops early.
 */
@Getter
public class StoryFlowException extends RuntimeException {

    private final boolean retryable;

    public StoryFlowException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public StoryFlowException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }
}
