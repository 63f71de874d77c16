package com.purchasingpower.storyflow.workflow.steps;

import com.purchasingpower.storyflow.model.RequirementAnalysis;
import com.purchasingpower.storyflow.model.WorkflowStage;
import com.purchasingpower.storyflow.workflow.WorkflowContext;
import com.purchasingpower.storyflow.workflow.WorkflowStep;
import com.purchasingpower.storyflow.workflow.strategy.RequirementsAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class RequirementsAnalysisStep implements WorkflowStep<RequirementAnalysis> {

    public static final String NAME = "requirements_analysis";

    private final RequirementsAnalyzer analyzer;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public WorkflowStage stage() {
        return WorkflowStage.ANALYSIS;
    }

    @Override
    public RequirementAnalysis execute(WorkflowContext context) {
        RequirementAnalysis analysis = analyzer.analyze(context.getRequirements());
        log.info("📋 Requirements: complexity={}, feasibility={}, difficulty={}",
                String.format("%.2f", analysis.getComplexity()),
                String.format("%.2f", analysis.getFeasibility()),
                analysis.getDifficulty());
        return analysis;
    }

    @Override
    public void applyResult(WorkflowContext context, RequirementAnalysis result) {
        context.setAnalysis(result);
    }
}
