package com.purchasingpower.storyflow.exception;

/**
 * The generation service could not produce content.
 */
public class GenerationException extends StoryFlowException {

    public GenerationException(String message) {
        super(message, true);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause, true);
    }

    public GenerationException(String message, Throwable cause, boolean retryable) {
        super(message, cause, retryable);
    }
}
