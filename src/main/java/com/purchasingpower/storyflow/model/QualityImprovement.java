package com.purchasingpower.storyflow.model;

import lombok.Builder;
import lombok.Value;

/**
 * Suggested improvement for a dimension that scored below the weak-dimension threshold.
 */
@Value
@Builder
public class QualityImprovement {

    QualityDimension dimension;

    double currentScore;

    /**
     * 1 (most urgent) to 5.
     */
    int priority;

    Effort effort;

    String suggestion;

    public enum Effort {
        LOW, MEDIUM, HIGH
    }
}
