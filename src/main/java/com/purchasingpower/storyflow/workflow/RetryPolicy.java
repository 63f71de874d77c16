package com.purchasingpower.storyflow.workflow;

import com.purchasingpower.storyflow.config.GlobalRetryConfig;
import com.purchasingpower.storyflow.exception.StoryFlowException;
import lombok.RequiredArgsConstructor;

import java.time.Duration;

/**
 * Decides whether a failed step attempt is worth repeating and how long to wait first.
 *
 * <p>JVM errors and {@link StoryFlowException}s flagged non-retryable are fatal. Timeouts and
 * every other exception are retryable while the step's retry budget lasts.
 */
@RequiredArgsConstructor
public class RetryPolicy {

    private final GlobalRetryConfig config;

    public <T> StepOutcome<T> classify(Throwable error) {
        if (error instanceof Error) {
            return StepOutcome.fatal(error);
        }
        if (error instanceof StoryFlowException sfe && !sfe.isRetryable()) {
            return StepOutcome.fatal(error);
        }
        return StepOutcome.retryable(error);
    }

    /**
     * @param attemptsMade attempts already executed, including the failed one
     */
    public boolean shouldRetry(StepOutcome<?> outcome, int attemptsMade, StepDefinition definition) {
        return outcome.getKind() == StepOutcome.Kind.RETRYABLE && attemptsMade < definition.getMaxAttempts();
    }

    /**
     * Backoff before retry number {@code retry} (0-based): {@code min(base * multiplier^retry, max)}.
     */
    public Duration backoff(int retry) {
        return config.backoffFor(retry);
    }
}
