package com.purchasingpower.storyflow.service;

import com.purchasingpower.storyflow.model.QualityVector;
import com.purchasingpower.storyflow.model.StoryRequirements;

/**
 * Scores a story on every {@link com.purchasingpower.storyflow.model.QualityDimension}.
 *
 * <p>Implementations must raise rather than clamp when a dimension score falls outside [0, 10],
 * and must never return a vector with dimensions missing.
 */
public interface QualityScoringService {

    QualityVector score(String content, StoryRequirements requirements);
}
