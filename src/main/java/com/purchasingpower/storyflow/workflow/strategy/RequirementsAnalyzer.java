package com.purchasingpower.storyflow.workflow.strategy;

import com.purchasingpower.storyflow.model.RequirementAnalysis;
import com.purchasingpower.storyflow.model.StoryGenre;
import com.purchasingpower.storyflow.model.StoryRequirements;
import org.springframework.stereotype.Component;

/**
 * Estimates how hard a story request is.
 *
 * <p>Complexity is the mean of four factors in [0, 1]: target length, genre, theme specificity
 * and setting specificity. Longer hints count as more specific.
 */
@Component
public class RequirementsAnalyzer {

    public RequirementAnalysis analyze(StoryRequirements requirements) {
        double wordCountFactor = wordCountComplexity(requirements.getTargetWordCount());
        double genreComplexity = requirements.getGenre() != null ? requirements.getGenre().getComplexity() : 0.7;
        double themeSpecificity = themeSpecificity(requirements.getTheme());
        double settingSpecificity = settingSpecificity(requirements.getSetting());

        double complexity = (wordCountFactor + genreComplexity + themeSpecificity + settingSpecificity) / 4.0;
        double feasibility = feasibility(requirements.getTargetWordCount(), complexity);

        RequirementAnalysis.RequirementAnalysisBuilder analysis = RequirementAnalysis.builder()
                .complexity(complexity)
                .feasibility(feasibility)
                .difficulty(RequirementAnalysis.Difficulty.fromComplexity(complexity))
                .wordCountFactor(wordCountFactor)
                .genreComplexity(genreComplexity)
                .themeSpecificity(themeSpecificity)
                .settingSpecificity(settingSpecificity);

        int words = requirements.getTargetWordCount();
        StoryGenre genre = requirements.getGenre();

        if (complexity > 0.8) {
            analysis.potentialChallenge("High complexity requirements may require multiple iterations");
        }
        if (words > 5000) {
            analysis.potentialChallenge("Long story length may impact coherence and pacing");
        }
        if (genre == StoryGenre.SCIENCE_FICTION || genre == StoryGenre.FANTASY) {
            analysis.potentialChallenge("World-building requirements may increase generation complexity");
        }
        if (themeSpecificity > 0.6) {
            analysis.potentialChallenge("Complex theme integration may require careful handling");
        }

        if (feasibility > 0.8) {
            analysis.successPredictor("High feasibility score indicates good success potential");
        }
        if (words >= 1000 && words < 3000) {
            analysis.successPredictor("Target word count is in optimal range for quality generation");
        }
        if (requirements.hasTheme() && themeSpecificity < 0.5) {
            analysis.successPredictor("Clear, simple theme provides good guidance");
        }
        if (genre == StoryGenre.LITERARY || genre == StoryGenre.ROMANCE) {
            analysis.successPredictor("Genre has well-established conventions for reliable generation");
        }

        return analysis.build();
    }

    static double wordCountComplexity(int wordCount) {
        if (wordCount <= 500) {
            return 0.2;
        }
        if (wordCount <= 1000) {
            return 0.4;
        }
        if (wordCount <= 1500) {
            return 0.6;
        }
        if (wordCount <= 3000) {
            return 0.8;
        }
        return wordCount <= 5000 ? 0.9 : 1.0;
    }

    static double themeSpecificity(String theme) {
        int words = wordCount(theme);
        if (words == 0) {
            return 0.1;
        }
        if (words == 1) {
            return 0.3;
        }
        return words <= 3 ? 0.5 : 0.7;
    }

    static double settingSpecificity(String setting) {
        int words = wordCount(setting);
        if (words == 0) {
            return 0.1;
        }
        if (words <= 2) {
            return 0.3;
        }
        return words <= 5 ? 0.5 : 0.7;
    }

    static double feasibility(int wordCount, double complexity) {
        double lengthPenalty = 0.0;
        if (wordCount > 7000) {
            lengthPenalty = 0.1;
        } else if (wordCount < 100) {
            lengthPenalty = 0.2;
        }
        double feasibility = 0.9 - complexity * 0.2 - lengthPenalty;
        return Math.max(0.3, Math.min(1.0, feasibility));
    }

    private static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
