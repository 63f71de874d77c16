package com.purchasingpower.storyflow.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Human-readable summary of the final quality and of how the enhancement passes went.
 */
@Value
@Builder
public class QualityFeedback {

    QualityTier tier;

    String overallAssessment;

    @Singular
    List<String> strengths;

    @Singular
    List<QualityImprovement> improvements;

    Trend trend;

    /**
     * Strategy of the pass with the largest gain; null when no pass improved the story.
     */
    EnhancementStrategy mostEffectiveStrategy;

    public enum Trend {
        NO_PASSES, IMPROVING, STABLE, DECLINING
    }
}
