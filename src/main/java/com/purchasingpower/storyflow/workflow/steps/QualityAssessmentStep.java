package com.purchasingpower.storyflow.workflow.steps;

import com.purchasingpower.storyflow.model.QualityVector;
import com.purchasingpower.storyflow.model.WorkflowStage;
import com.purchasingpower.storyflow.service.QualityAssessmentService;
import com.purchasingpower.storyflow.workflow.WorkflowContext;
import com.purchasingpower.storyflow.workflow.WorkflowStep;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(5)
@RequiredArgsConstructor
public class QualityAssessmentStep implements WorkflowStep<QualityVector> {

    public static final String NAME = "quality_assessment";

    private final QualityAssessmentService qualityAssessment;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public WorkflowStage stage() {
        return WorkflowStage.QUALITY_ASSESSMENT;
    }

    @Override
    public QualityVector execute(WorkflowContext context) {
        return qualityAssessment.assess(context.getContent(), context.getRequirements());
    }

    @Override
    public void applyResult(WorkflowContext context, QualityVector result) {
        context.setInitialQuality(result);
    }
}
