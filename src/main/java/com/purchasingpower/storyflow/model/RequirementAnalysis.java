package com.purchasingpower.storyflow.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Output of the analysis stage: how hard the request is and what is likely to go wrong.
 */
@Value
@Builder
public class RequirementAnalysis {

    /**
     * Mean of the word-count, genre, theme and setting factors (0.0 - 1.0).
     */
    double complexity;

    /**
     * Estimated chance of producing a good story (0.3 - 1.0).
     */
    double feasibility;

    Difficulty difficulty;

    double wordCountFactor;
    double genreComplexity;
    double themeSpecificity;
    double settingSpecificity;

    @Singular
    List<String> potentialChallenges;

    @Singular
    List<String> successPredictors;

    public enum Difficulty {
        EASY, MEDIUM, HARD;

        public static Difficulty fromComplexity(double complexity) {
            if (complexity < 0.4) {
                return EASY;
            }
            return complexity < 0.7 ? MEDIUM : HARD;
        }
    }
}
