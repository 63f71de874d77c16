package com.purchasingpower.storyflow.workflow.steps;

import com.purchasingpower.storyflow.config.WorkflowConfig;
import com.purchasingpower.storyflow.exception.EnhancementPassException;
import com.purchasingpower.storyflow.model.EnhancementResult;
import com.purchasingpower.storyflow.model.WorkflowStage;
import com.purchasingpower.storyflow.workflow.WorkflowContext;
import com.purchasingpower.storyflow.workflow.WorkflowStep;
import com.purchasingpower.storyflow.workflow.enhancement.EnhancementLoop;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Runs the {@link EnhancementLoop} on the first draft. Returns null when enhancement is
 * disabled, which keeps the draft as the final story.
 *
 * <p>When every attempt fails and the run continues, the passes completed before the failing
 * one are kept from the last {@link EnhancementPassException}.
 */
@Slf4j
@Component
@Order(6)
@RequiredArgsConstructor
public class EnhancementStep implements WorkflowStep<EnhancementResult> {

    public static final String NAME = "enhancement";

    private final EnhancementLoop enhancementLoop;
    private final WorkflowConfig workflowConfig;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public WorkflowStage stage() {
        return WorkflowStage.ENHANCEMENT;
    }

    @Override
    public EnhancementResult execute(WorkflowContext context) {
        if (!workflowConfig.isEnableQualityEnhancement()) {
            log.info("⏭️ Quality enhancement disabled");
            return null;
        }
        return enhancementLoop.enhance(context.getContent(), context.getTitle(),
                context.getRequirements(), context.getInitialQuality());
    }

    @Override
    public void applyResult(WorkflowContext context, EnhancementResult result) {
        if (result == null) {
            return;
        }
        context.setEnhancement(result);
        context.setContent(result.getContent());
        context.setTitle(result.getTitle());
        context.setFinalQuality(result.getFinalQuality());
    }

    @Override
    public void applyFailure(WorkflowContext context, Throwable error) {
        if (error instanceof EnhancementPassException passFailure && passFailure.getBestKnown() != null) {
            EnhancementResult bestKnown = passFailure.getBestKnown();
            log.info("💾 Keeping {} completed enhancement pass(es) after pass {} failed (overall {})",
                    bestKnown.getPassCount(), passFailure.getPassNumber(), bestKnown.getFinalQuality().getOverall());
            applyResult(context, bestKnown);
        }
    }
}
