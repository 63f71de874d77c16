package com.purchasingpower.storyflow.exception;

import com.purchasingpower.storyflow.model.QualityDimension;
import lombok.Getter;

/**
 * Scoring failed or returned an out-of-range value. No partial quality vector is ever
 * returned alongside this error.
 */
@Getter
public class QualityAssessmentException extends StoryFlowException {

    /**
     * Dimension that failed, or null when the failure was not dimension-specific.
     */
    private final QualityDimension dimension;

    public QualityAssessmentException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public QualityAssessmentException(String message, QualityDimension dimension, Throwable cause) {
        super(message, cause, true);
        this.dimension = dimension;
    }
}
