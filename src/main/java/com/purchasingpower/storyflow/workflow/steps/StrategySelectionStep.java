package com.purchasingpower.storyflow.workflow.steps;

import com.purchasingpower.storyflow.model.StrategyRecommendation;
import com.purchasingpower.storyflow.model.WorkflowStage;
import com.purchasingpower.storyflow.workflow.WorkflowContext;
import com.purchasingpower.storyflow.workflow.WorkflowStep;
import com.purchasingpower.storyflow.workflow.strategy.StrategySelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Scores the generation strategies. A strategy requested by the caller overrides the
 * recommendation, which is still kept for reporting.
 */
@Slf4j
@Component
@Order(2)
@RequiredArgsConstructor
public class StrategySelectionStep implements WorkflowStep<StrategyRecommendation> {

    public static final String NAME = "strategy_selection";

    private final StrategySelector strategySelector;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public WorkflowStage stage() {
        return WorkflowStage.STRATEGY_SELECTION;
    }

    @Override
    public StrategyRecommendation execute(WorkflowContext context) {
        if (context.getAnalysis() != null) {
            return strategySelector.selectStrategy(context.getRequirements(), context.getAnalysis());
        }
        return strategySelector.selectStrategy(context.getRequirements());
    }

    @Override
    public void applyResult(WorkflowContext context, StrategyRecommendation result) {
        context.setRecommendation(result);
        if (context.getRequestedStrategy() != null) {
            log.info("🧭 Using requested strategy {} (recommended {})",
                    context.getRequestedStrategy(), result.getStrategy());
            context.setStrategy(context.getRequestedStrategy());
        } else {
            context.setStrategy(result.getStrategy());
        }
    }
}
