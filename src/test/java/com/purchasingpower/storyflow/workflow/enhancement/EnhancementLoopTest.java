package com.purchasingpower.storyflow.workflow.enhancement;

import com.purchasingpower.storyflow.StoryFixtures;
import com.purchasingpower.storyflow.StoryFixtures.ScriptedGenerationService;
import com.purchasingpower.storyflow.StoryFixtures.ScriptedScoringService;
import com.purchasingpower.storyflow.config.EnhancementConfig;
import com.purchasingpower.storyflow.exception.EnhancementPassException;
import com.purchasingpower.storyflow.exception.GenerationException;
import com.purchasingpower.storyflow.exception.QualityAssessmentException;
import com.purchasingpower.storyflow.model.EnhancementPass;
import com.purchasingpower.storyflow.model.EnhancementResult;
import com.purchasingpower.storyflow.model.EnhancementStrategy;
import com.purchasingpower.storyflow.model.QualityVector;
import com.purchasingpower.storyflow.model.StopReason;
import com.purchasingpower.storyflow.model.StoryRequirements;
import com.purchasingpower.storyflow.service.QualityAssessmentService;
import com.purchasingpower.storyflow.service.StoryInstructionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Enhancement Loop Tests")
class EnhancementLoopTest {

    private static final String ORIGINAL = "The keeper counted the steps twice.";

    private final StoryRequirements requirements = StoryFixtures.mysteryRequirements();

    private EnhancementConfig config;
    private ScriptedGenerationService generation;
    private ScriptedScoringService scoring;
    private EnhancementLoop loop;

    @BeforeEach
    void setUp() {
        config = new EnhancementConfig();
        generation = new ScriptedGenerationService();
        scoring = new ScriptedScoringService();
        loop = new EnhancementLoop(
                generation,
                new QualityAssessmentService(scoring),
                new EnhancementStrategySelector(config),
                new StoryInstructionService(StoryFixtures.loadedPromptLibrary()),
                new QualityFeedbackAnalyzer(config),
                config);
    }

    @Test
    @DisplayName("Should execute zero passes when the story already meets the target")
    void testAlreadyGood_ShouldReturnUnchanged() {
        // When
        EnhancementResult result = loop.enhance(ORIGINAL, "Original", requirements, QualityVector.uniform(8.5));

        // Then
        assertEquals(StopReason.TARGET_ACHIEVED, result.getStopReason());
        assertEquals(0, result.getPassCount());
        assertEquals(ORIGINAL, result.getContent());
        assertEquals("Original", result.getTitle());
        assertEquals(0, generation.getCalls());
        assertEquals(0, scoring.getCalls());
        assertEquals(0.0, result.getTotalImprovement(), 1e-9);
    }

    @Test
    @DisplayName("Should assess the content first when no quality is known")
    void testUnknownQuality_ShouldAssessFirst() {
        // Given
        scoring.thenUniform(9.0);

        // When
        EnhancementResult result = loop.enhance(ORIGINAL, "Original", requirements, null);

        // Then
        assertEquals(1, scoring.getCalls());
        assertEquals(StopReason.TARGET_ACHIEVED, result.getStopReason());
        assertEquals(9.0, result.getFinalQuality().getOverall(), 1e-9);
    }

    @Test
    @DisplayName("Should stop at the pass budget and never exceed it")
    void testSteadyGains_ShouldExhaustPassBudget() {
        // Given: deltas 0.5, 0.6, 0.5 never converge
        scoring.thenUniform(6.5, 7.1, 7.6);

        // When
        EnhancementResult result = loop.enhance(ORIGINAL, "Original", requirements, QualityVector.uniform(6.0));

        // Then
        assertEquals(StopReason.PASS_BUDGET_EXHAUSTED, result.getStopReason());
        assertEquals(3, result.getPassCount());
        assertEquals("revision 3", result.getContent());
        assertEquals("Title 3", result.getTitle());
        assertEquals(7.6, result.getFinalQuality().getOverall(), 1e-9);
        assertEquals(6.0, result.getInitialQuality().getOverall(), 1e-9);

        // And each pass worked on the previous revision
        assertEquals(ORIGINAL, generation.getInputs().get(0));
        assertEquals("revision 1", generation.getInputs().get(1));
        assertEquals("revision 2", generation.getInputs().get(2));
    }

    @Test
    @DisplayName("Should respect an explicit pass budget of zero")
    void testZeroPassBudget_ShouldNotGenerate() {
        EnhancementResult result = loop.enhance(ORIGINAL, "Original", requirements,
                QualityVector.uniform(5.0), 8.0, 0);

        assertEquals(StopReason.PASS_BUDGET_EXHAUSTED, result.getStopReason());
        assertEquals(0, result.getPassCount());
        assertEquals(0, generation.getCalls());
    }

    @Test
    @DisplayName("Should reject a negative pass budget")
    void testNegativePassBudget_ShouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> loop.enhance(ORIGINAL, "Original", requirements, QualityVector.uniform(5.0), 8.0, -1));
    }

    @Test
    @DisplayName("Should pick focused strategies for weak stories and comprehensive once nothing is weak")
    void testStrategySelection_ShouldFollowQuality() {
        // Given
        scoring.thenUniform(6.5, 7.1, 7.6);

        // When
        EnhancementResult result = loop.enhance(ORIGINAL, "Original", requirements, QualityVector.uniform(6.0));

        // Then: with every dimension equal, the highest weight (emotional impact 1.3) wins
        assertEquals(EnhancementStrategy.EMOTIONAL_FOCUS, result.getPasses().get(0).getStrategy());
        assertEquals(EnhancementStrategy.COMPREHENSIVE, result.getPasses().get(2).getStrategy());
        assertTrue(generation.getInstructions().get(0).contains("emotional impact"));
        assertTrue(generation.getInstructions().get(2).contains("Comprehensive enhancement"));
    }

    @Test
    @DisplayName("Should stop on diminishing returns without adopting the converging revision")
    void testDiminishingReturns_ShouldConvergeAfterSecondPass() {
        // Given: deltas 1.0 then 0.3
        scoring.thenUniform(6.0, 6.3, 9.9);

        // When
        EnhancementResult result = loop.enhance(ORIGINAL, "Original", requirements, QualityVector.uniform(5.0));

        // Then
        assertEquals(StopReason.CONVERGED, result.getStopReason());
        assertEquals(2, result.getPassCount());
        assertTrue(result.getConvergence().isDiminishingReturnsDetected());
        assertFalse(result.getConvergence().isPlateauDetected());
        assertEquals("revision 1", result.getContent());
        assertEquals("Title 1", result.getTitle());
        assertEquals(6.0, result.getFinalQuality().getOverall(), 1e-9);
        assertEquals(6.3, result.getPasses().get(1).getAfter().getOverall(), 1e-9);
        assertEquals(2, generation.getCalls());
    }

    @Test
    @DisplayName("Should stop on plateau when two passes gain less than the threshold")
    void testPlateau_ShouldConverge() {
        // Given: deltas 0.05 then 0.08
        scoring.thenUniform(6.05, 6.13);

        // When
        EnhancementResult result = loop.enhance(ORIGINAL, "Original", requirements, QualityVector.uniform(6.0));

        // Then
        assertEquals(StopReason.CONVERGED, result.getStopReason());
        assertEquals(2, result.getPassCount());
        assertTrue(result.getConvergence().isPlateauDetected());
        assertEquals("revision 1", result.getContent());
        assertEquals(6.05, result.getFinalQuality().getOverall(), 1e-9);
    }

    @Test
    @DisplayName("Should keep the previous story when the converging pass made it worse")
    void testConvergingRegression_ShouldKeepPreviousStory() {
        // Given: +1.0 then -0.2
        scoring.thenUniform(7.0, 6.8);

        // When
        EnhancementResult result = loop.enhance(ORIGINAL, "Original", requirements, QualityVector.uniform(6.0));

        // Then
        assertEquals(StopReason.CONVERGED, result.getStopReason());
        assertEquals(2, result.getPassCount());
        assertEquals("revision 1", result.getContent());
        assertEquals("Title 1", result.getTitle());
        assertEquals(7.0, result.getFinalQuality().getOverall(), 1e-9);
        assertFalse(result.getPasses().get(1).isImprovement());
    }

    @Test
    @DisplayName("Should stop as soon as a pass reaches the target")
    void testTargetReachedMidLoop_ShouldStop() {
        scoring.thenUniform(8.2);

        EnhancementResult result = loop.enhance(ORIGINAL, "Original", requirements, QualityVector.uniform(6.0));

        assertEquals(StopReason.TARGET_ACHIEVED, result.getStopReason());
        assertEquals(1, result.getPassCount());
        assertEquals("revision 1", result.getContent());
        assertEquals(2.2, result.getTotalImprovement(), 1e-9);
    }

    @Test
    @DisplayName("Should keep the current title when a revision comes back without one")
    void testUntitledRevision_ShouldKeepTitle() {
        generation.thenReturn("untitled revision", null);
        scoring.thenUniform(8.5);

        EnhancementResult result = loop.enhance(ORIGINAL, "Original", requirements, QualityVector.uniform(6.0));

        assertEquals("untitled revision", result.getContent());
        assertEquals("Original", result.getTitle());
    }

    @Test
    @DisplayName("Should record before/after vectors, focus dimensions and token estimate for each pass")
    void testPassBookkeeping_ShouldBeComplete() {
        scoring.thenUniform(8.5);

        EnhancementResult result = loop.enhance(ORIGINAL, "Original", requirements, QualityVector.uniform(6.0));

        EnhancementPass pass = result.getPasses().get(0);
        assertEquals(1, pass.getPassNumber());
        assertEquals(6.0, pass.getBefore().getOverall(), 1e-9);
        assertEquals(8.5, pass.getAfter().getOverall(), 1e-9);
        assertEquals(2.5, pass.getDelta(), 1e-9);
        assertEquals(EnhancementStrategy.EMOTIONAL_FOCUS.focusDimensions(), pass.getFocusDimensions());
        assertEquals(EnhancementLoop.estimateTokens(ORIGINAL, "revision 1"), pass.getTokensUsed());
        assertEquals(pass.getTokensUsed(), result.getTotalTokens());
        assertNotNull(pass.getElapsed());
        assertNotNull(result.getFeedback());
    }

    @Test
    @DisplayName("Should abort with the best known story when generation fails mid-loop")
    void testGenerationFailure_ShouldCarryBestKnownResult() {
        // Given: pass 1 succeeds, pass 2 generation fails
        scoring.thenUniform(6.5);
        generation.thenReturn("first revision", "First").thenThrow(new GenerationException("model overloaded"));

        // When
        EnhancementPassException e = assertThrows(EnhancementPassException.class,
                () -> loop.enhance(ORIGINAL, "Original", requirements, QualityVector.uniform(6.0)));

        // Then
        assertEquals(2, e.getPassNumber());
        assertInstanceOf(GenerationException.class, e.getCause());
        EnhancementResult bestKnown = e.getBestKnown();
        assertEquals(StopReason.PASS_FAILED, bestKnown.getStopReason());
        assertEquals("first revision", bestKnown.getContent());
        assertEquals("First", bestKnown.getTitle());
        assertEquals(1, bestKnown.getPassCount());
        assertEquals(6.5, bestKnown.getFinalQuality().getOverall(), 1e-9);
    }

    @Test
    @DisplayName("Should abort when re-scoring returns an out-of-range score")
    void testOutOfRangeScore_ShouldAbortPass() {
        scoring.thenOutOfRange();

        EnhancementPassException e = assertThrows(EnhancementPassException.class,
                () -> loop.enhance(ORIGINAL, "Original", requirements, QualityVector.uniform(6.0)));

        assertEquals(1, e.getPassNumber());
        assertInstanceOf(QualityAssessmentException.class, e.getCause());
        assertEquals(ORIGINAL, e.getBestKnown().getContent());
        assertEquals(0, e.getBestKnown().getPassCount());
    }

    @Test
    @DisplayName("Pass history should never exceed the budget for any score sequence")
    void testRandomSequences_ShouldRespectBudget() {
        java.util.Random random = new java.util.Random(3);
        for (int run = 0; run < 200; run++) {
            // Given
            setUp();
            int maxPasses = random.nextInt(5);
            double[] scores = new double[maxPasses];
            for (int i = 0; i < maxPasses; i++) {
                scores[i] = Math.round(random.nextDouble() * 1000.0) / 100.0;
            }
            scoring.thenUniform(scores);

            // When
            EnhancementResult result = loop.enhance(ORIGINAL, "Original", requirements,
                    QualityVector.uniform(4.0), 8.0, maxPasses);

            // Then
            assertTrue(result.getPassCount() <= maxPasses);
        }
    }
}
