package com.purchasingpower.storyflow.workflow.steps;

import com.purchasingpower.storyflow.StoryFixtures;
import com.purchasingpower.storyflow.model.GenerationStrategy;
import com.purchasingpower.storyflow.service.StoryInstructionService;
import com.purchasingpower.storyflow.workflow.WorkflowContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Outline Generation Step Tests")
class OutlineGenerationStepTest {

    private StoryFixtures.ScriptedGenerationService generation;
    private OutlineGenerationStep step;
    private WorkflowContext context;

    @BeforeEach
    void setUp() {
        generation = new StoryFixtures.ScriptedGenerationService();
        step = new OutlineGenerationStep(generation,
                new StoryInstructionService(StoryFixtures.loadedPromptLibrary()));
        context = new WorkflowContext("run-outline", StoryFixtures.mysteryRequirements(), null);
    }

    @Test
    @DisplayName("Direct generation should skip the outline")
    void testDirectStrategy_ShouldSkipOutline() {
        // Given
        context.setStrategy(GenerationStrategy.DIRECT);

        // When
        String outline = step.execute(context);
        step.applyResult(context, outline);

        // Then
        assertNull(outline);
        assertFalse(context.hasOutline());
        assertEquals(0, generation.getCalls());
    }

    @Test
    @DisplayName("Other strategies should generate an outline from scratch")
    void testOutlineStrategy_ShouldGenerateOutline() {
        context.setStrategy(GenerationStrategy.OUTLINE);
        generation.thenReturn("1. The keeper lies.\n2. The storm hides the truth.", null);

        String outline = step.execute(context);
        step.applyResult(context, outline);

        assertEquals("1. The keeper lies.\n2. The storm hides the truth.", context.getOutline());
        assertEquals("", generation.getInputs().get(0));
        assertFalse(generation.getInstructions().get(0).isBlank());
    }
}
