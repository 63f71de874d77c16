package com.purchasingpower.storyflow.exception;

import com.purchasingpower.storyflow.model.EnhancementResult;
import com.purchasingpower.storyflow.model.EnhancementStrategy;
import lombok.Getter;

/**
 * A generation or scoring call failed in the middle of the enhancement loop.
 *
 * <p>{@link #getBestKnown()} holds the content and quality from before the failing pass
 * (including all passes completed so far) so the caller can decide what to do with it.
 */
@Getter
public class EnhancementPassException extends StoryFlowException {

    private final int passNumber;
    private final EnhancementStrategy strategy;
    private final EnhancementResult bestKnown;

    public EnhancementPassException(int passNumber, EnhancementStrategy strategy,
                                    EnhancementResult bestKnown, Throwable cause) {
        super(String.format("Enhancement pass %d (%s) failed: %s", passNumber, strategy, cause.getMessage()),
                cause, true);
        this.passNumber = passNumber;
        this.strategy = strategy;
        this.bestKnown = bestKnown;
    }
}
