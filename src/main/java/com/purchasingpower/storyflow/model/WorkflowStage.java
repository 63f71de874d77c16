package com.purchasingpower.storyflow.model;

/**
 * Stages of the story workflow, in pipeline order.
 */
public enum WorkflowStage {
    ANALYSIS,
    STRATEGY_SELECTION,
    OUTLINE_GENERATION,
    CONTENT_GENERATION,
    QUALITY_ASSESSMENT,
    ENHANCEMENT,
    FINALIZATION
}
