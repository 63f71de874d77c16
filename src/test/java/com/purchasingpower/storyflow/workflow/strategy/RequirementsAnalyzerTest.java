package com.purchasingpower.storyflow.workflow.strategy;

import com.purchasingpower.storyflow.StoryFixtures;
import com.purchasingpower.storyflow.model.RequirementAnalysis;
import com.purchasingpower.storyflow.model.StoryGenre;
import com.purchasingpower.storyflow.model.StoryLength;
import com.purchasingpower.storyflow.model.StoryRequirements;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Requirements Analyzer Tests")
class RequirementsAnalyzerTest {

    private final RequirementsAnalyzer analyzer = new RequirementsAnalyzer();

    @Test
    @DisplayName("Word count buckets should map to 0.2 .. 1.0")
    void testWordCountComplexity_ShouldFollowBuckets() {
        assertEquals(0.2, RequirementsAnalyzer.wordCountComplexity(500));
        assertEquals(0.4, RequirementsAnalyzer.wordCountComplexity(501));
        assertEquals(0.4, RequirementsAnalyzer.wordCountComplexity(1000));
        assertEquals(0.6, RequirementsAnalyzer.wordCountComplexity(1500));
        assertEquals(0.8, RequirementsAnalyzer.wordCountComplexity(3000));
        assertEquals(0.9, RequirementsAnalyzer.wordCountComplexity(5000));
        assertEquals(1.0, RequirementsAnalyzer.wordCountComplexity(7500));
    }

    @Test
    @DisplayName("More words in a hint should mean more specificity")
    void testSpecificity_ShouldGrowWithWords() {
        assertEquals(0.1, RequirementsAnalyzer.themeSpecificity(null));
        assertEquals(0.1, RequirementsAnalyzer.themeSpecificity("   "));
        assertEquals(0.3, RequirementsAnalyzer.themeSpecificity("betrayal"));
        assertEquals(0.5, RequirementsAnalyzer.themeSpecificity("loss and hope"));
        assertEquals(0.7, RequirementsAnalyzer.themeSpecificity("the price of keeping a promise"));

        assertEquals(0.1, RequirementsAnalyzer.settingSpecificity(""));
        assertEquals(0.3, RequirementsAnalyzer.settingSpecificity("Victorian London"));
        assertEquals(0.5, RequirementsAnalyzer.settingSpecificity("a lighthouse in winter"));
        assertEquals(0.7, RequirementsAnalyzer.settingSpecificity("a crowded night market on a floating city"));
    }

    @Test
    @DisplayName("Feasibility should apply length penalties and stay within [0.3, 1.0]")
    void testFeasibility_ShouldBeClamped() {
        assertEquals(0.8, RequirementsAnalyzer.feasibility(1500, 0.5), 1e-9);
        assertEquals(0.7, RequirementsAnalyzer.feasibility(7500, 0.5), 1e-9);
        assertEquals(0.6, RequirementsAnalyzer.feasibility(50, 0.5), 1e-9);
        assertEquals(0.3, RequirementsAnalyzer.feasibility(50, 5.0), 1e-9);
    }

    @Test
    @DisplayName("Should analyze a medium mystery request")
    void testAnalyze_ShouldCombineFactors() {
        // Given: 3000 words (0.8), mystery (0.7), one-word theme (0.3), four-word setting (0.5)
        StoryRequirements requirements = StoryFixtures.mysteryRequirements().toBuilder()
                .targetWordCount(3000)
                .build();

        // When
        RequirementAnalysis analysis = analyzer.analyze(requirements);

        // Then
        assertEquals(0.575, analysis.getComplexity(), 1e-9);
        assertEquals(0.785, analysis.getFeasibility(), 1e-9);
        assertEquals(RequirementAnalysis.Difficulty.MEDIUM, analysis.getDifficulty());
        assertTrue(analysis.getPotentialChallenges().isEmpty());
        assertEquals(1, analysis.getSuccessPredictors().size());
        assertTrue(analysis.getSuccessPredictors().get(0).contains("simple theme"));
    }

    @Test
    @DisplayName("Should flag world-building and length challenges for long fantasy")
    void testAnalyze_ShouldListChallenges() {
        StoryRequirements requirements = StoryRequirements.builder()
                .genre(StoryGenre.FANTASY)
                .length(StoryLength.SHORT)
                .targetWordCount(6000)
                .theme("the weight of an inherited crown")
                .setting("a drowned kingdom whose bells still ring at low tide")
                .build();

        RequirementAnalysis analysis = analyzer.analyze(requirements);

        // (1.0 + 0.9 + 0.7 + 0.7) / 4
        assertEquals(0.825, analysis.getComplexity(), 1e-9);
        assertEquals(RequirementAnalysis.Difficulty.HARD, analysis.getDifficulty());
        assertEquals(4, analysis.getPotentialChallenges().size());
    }

    @Test
    @DisplayName("Difficulty should switch at 0.4 and 0.7")
    void testDifficulty_ShouldFollowThresholds() {
        assertEquals(RequirementAnalysis.Difficulty.EASY, RequirementAnalysis.Difficulty.fromComplexity(0.39));
        assertEquals(RequirementAnalysis.Difficulty.MEDIUM, RequirementAnalysis.Difficulty.fromComplexity(0.4));
        assertEquals(RequirementAnalysis.Difficulty.HARD, RequirementAnalysis.Difficulty.fromComplexity(0.7));
    }
}
