package com.purchasingpower.storyflow.workflow;

import com.purchasingpower.storyflow.model.EnhancementResult;
import com.purchasingpower.storyflow.model.GenerationStrategy;
import com.purchasingpower.storyflow.model.QualityVector;
import com.purchasingpower.storyflow.model.RequirementAnalysis;
import com.purchasingpower.storyflow.model.StoryRequirements;
import com.purchasingpower.storyflow.model.StrategyRecommendation;
import lombok.Getter;
import lombok.Setter;

/**
 * Intermediate results of one run. Owned by a single run and never shared.
 *
 * <p>Written only from {@link WorkflowStep#applyResult} on the runner thread.
 */
@Getter
@Setter
public class WorkflowContext {

    private final String runId;
    private final StoryRequirements requirements;

    /**
     * Strategy forced by the caller; null to let the selector decide.
     */
    private final GenerationStrategy requestedStrategy;

    private RequirementAnalysis analysis;
    private StrategyRecommendation recommendation;
    private GenerationStrategy strategy;
    private String outline;
    private String content;
    private String title;
    private QualityVector initialQuality;
    private QualityVector finalQuality;
    private EnhancementResult enhancement;

    public WorkflowContext(String runId, StoryRequirements requirements, GenerationStrategy requestedStrategy) {
        this.runId = runId;
        this.requirements = requirements;
        this.requestedStrategy = requestedStrategy;
    }

    public boolean hasOutline() {
        return outline != null && !outline.isBlank();
    }

    /**
     * Latest known quality of {@link #getContent()}.
     */
    public QualityVector currentQuality() {
        return finalQuality != null ? finalQuality : initialQuality;
    }
}
