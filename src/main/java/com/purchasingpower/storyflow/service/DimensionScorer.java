package com.purchasingpower.storyflow.service;

import com.purchasingpower.storyflow.model.QualityDimension;
import com.purchasingpower.storyflow.model.StoryRequirements;

/**
 * Scores a story on a single dimension. Calls for different dimensions are independent and
 * may run concurrently.
 */
@FunctionalInterface
public interface DimensionScorer {

    double score(QualityDimension dimension, String content, StoryRequirements requirements);
}
