package com.purchasingpower.storyflow.workflow.steps;

import com.purchasingpower.storyflow.model.GeneratedContent;
import com.purchasingpower.storyflow.model.GenerationStrategy;
import com.purchasingpower.storyflow.model.WorkflowStage;
import com.purchasingpower.storyflow.service.GenerationService;
import com.purchasingpower.storyflow.service.StoryInstructionService;
import com.purchasingpower.storyflow.workflow.WorkflowContext;
import com.purchasingpower.storyflow.workflow.WorkflowStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Produces a story outline. Direct generation does not use one, so the step returns null and
 * leaves the context untouched.
 */
@Slf4j
@Component
@Order(3)
@RequiredArgsConstructor
public class OutlineGenerationStep implements WorkflowStep<String> {

    public static final String NAME = "outline_generation";

    private final GenerationService generationService;
    private final StoryInstructionService instructions;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public WorkflowStage stage() {
        return WorkflowStage.OUTLINE_GENERATION;
    }

    @Override
    public String execute(WorkflowContext context) {
        if (context.getStrategy() == GenerationStrategy.DIRECT) {
            log.info("⏭️ Skipping outline for direct generation");
            return null;
        }
        String instruction = instructions.outlineInstruction(context.getRequirements());
        GeneratedContent outline = generationService.generate("", instruction, context.getRequirements());
        log.info("🗺️ Outline generated ({} chars)", outline.content().length());
        return outline.content();
    }

    @Override
    public void applyResult(WorkflowContext context, String result) {
        if (result != null) {
            context.setOutline(result);
        }
    }
}
