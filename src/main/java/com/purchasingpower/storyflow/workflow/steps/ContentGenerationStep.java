package com.purchasingpower.storyflow.workflow.steps;

import com.purchasingpower.storyflow.model.GeneratedContent;
import com.purchasingpower.storyflow.model.WorkflowStage;
import com.purchasingpower.storyflow.service.GenerationService;
import com.purchasingpower.storyflow.service.StoryInstructionService;
import com.purchasingpower.storyflow.util.ExternalCallLogger;
import com.purchasingpower.storyflow.workflow.WorkflowContext;
import com.purchasingpower.storyflow.workflow.WorkflowStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Writes the first draft, from the outline when one exists.
 */
@Slf4j
@Component
@Order(4)
@RequiredArgsConstructor
public class ContentGenerationStep implements WorkflowStep<GeneratedContent> {

    public static final String NAME = "content_generation";
    static final String DEFAULT_TITLE = "Untitled";

    private final GenerationService generationService;
    private final StoryInstructionService instructions;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public WorkflowStage stage() {
        return WorkflowStage.CONTENT_GENERATION;
    }

    @Override
    public GeneratedContent execute(WorkflowContext context) {
        String outline = context.hasOutline() ? context.getOutline() : null;
        String instruction = instructions.draftInstruction(context.getRequirements(), outline);
        GeneratedContent draft = generationService.generate("", instruction, context.getRequirements());
        log.info("📝 Draft generated: \"{}\" ({} words, target {})", draft.title(),
                ExternalCallLogger.countWords(draft.content()), context.getRequirements().getTargetWordCount());
        return draft;
    }

    @Override
    public void applyResult(WorkflowContext context, GeneratedContent result) {
        context.setContent(result.content());
        context.setTitle(result.hasTitle() ? result.title() : DEFAULT_TITLE);
    }
}
