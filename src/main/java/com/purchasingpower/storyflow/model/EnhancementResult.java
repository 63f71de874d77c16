package com.purchasingpower.storyflow.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of the enhancement loop.
 */
@Value
@Builder(toBuilder = true)
public class EnhancementResult {

    String content;

    String title;

    /**
     * Executed passes in order. Never longer than the pass budget.
     */
    @Singular("pass")
    List<EnhancementPass> passes;

    QualityVector initialQuality;

    QualityVector finalQuality;

    ConvergenceState convergence;

    StopReason stopReason;

    QualityFeedback feedback;

    long totalTokens;

    Duration elapsed;

    public int getPassCount() {
        return passes.size();
    }

    public double getTotalImprovement() {
        return finalQuality.getOverall() - initialQuality.getOverall();
    }
}
