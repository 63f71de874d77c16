package com.purchasingpower.storyflow.workflow.enhancement;

import com.purchasingpower.storyflow.config.EnhancementConfig;
import com.purchasingpower.storyflow.model.EnhancementPass;
import com.purchasingpower.storyflow.model.EnhancementStrategy;
import com.purchasingpower.storyflow.model.QualityDimension;
import com.purchasingpower.storyflow.model.QualityFeedback;
import com.purchasingpower.storyflow.model.QualityImprovement;
import com.purchasingpower.storyflow.model.QualityTier;
import com.purchasingpower.storyflow.model.QualityVector;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns the final quality vector and pass history into {@link QualityFeedback}.
 */
@Component
@RequiredArgsConstructor
public class QualityFeedbackAnalyzer {

    private static final double EXCELLENT_DIMENSION = 8.5;
    private static final double STRONG_DIMENSION = 8.0;
    private static final double STABLE_BAND = 0.05;

    private static final Map<QualityDimension, String> SUGGESTIONS = new EnumMap<>(QualityDimension.class);

    static {
        SUGGESTIONS.put(QualityDimension.STRUCTURE, "Strengthen the story arc with a clearer beginning, middle and end");
        SUGGESTIONS.put(QualityDimension.COHERENCE, "Strengthen logical flow and eliminate plot inconsistencies");
        SUGGESTIONS.put(QualityDimension.CHARACTER_DEVELOPMENT, "Develop character motivations and growth arcs more deeply");
        SUGGESTIONS.put(QualityDimension.GENRE_COMPLIANCE, "Lean into the conventions readers expect from the genre");
        SUGGESTIONS.put(QualityDimension.PACING_QUALITY, "Optimize story rhythm and tension building");
        SUGGESTIONS.put(QualityDimension.THEME_INTEGRATION, "Weave the theme more naturally into the narrative");
        SUGGESTIONS.put(QualityDimension.DIALOGUE_QUALITY, "Make dialogue more natural and character-specific");
        SUGGESTIONS.put(QualityDimension.SETTING_IMMERSION, "Add immersive sensory details and atmosphere");
        SUGGESTIONS.put(QualityDimension.EMOTIONAL_IMPACT, "Raise emotional stakes and reader connection to characters");
        SUGGESTIONS.put(QualityDimension.ORIGINALITY_SCORE, "Add more unique and creative elements to stand out");
        SUGGESTIONS.put(QualityDimension.TECHNICAL_QUALITY, "Improve prose style, word choice and sentence variety");
    }

    private final EnhancementConfig config;

    public QualityFeedback analyze(QualityVector finalQuality, List<EnhancementPass> passes) {
        QualityFeedback.QualityFeedbackBuilder feedback = QualityFeedback.builder()
                .tier(QualityTier.fromScore(finalQuality.getOverall()))
                .overallAssessment(assessment(finalQuality.getOverall()))
                .trend(trend(passes))
                .mostEffectiveStrategy(mostEffective(passes));

        finalQuality.getScores().forEach((dimension, score) -> {
            if (score >= EXCELLENT_DIMENSION) {
                feedback.strength(String.format(Locale.ROOT, "Excellent %s (%.1f/10)",
                        dimension.getDisplayName().toLowerCase(Locale.ROOT), score));
            } else if (score >= STRONG_DIMENSION) {
                feedback.strength(String.format(Locale.ROOT, "Strong %s (%.1f/10)",
                        dimension.getDisplayName().toLowerCase(Locale.ROOT), score));
            }
        });

        for (QualityDimension dimension : finalQuality.weakestDimensions(config.getWeakDimensionThreshold())) {
            double score = finalQuality.score(dimension);
            feedback.improvement(QualityImprovement.builder()
                    .dimension(dimension)
                    .currentScore(score)
                    .priority(priority(score))
                    .effort(score > 5.0 ? QualityImprovement.Effort.MEDIUM : QualityImprovement.Effort.HIGH)
                    .suggestion(SUGGESTIONS.get(dimension))
                    .build());
        }

        return feedback.build();
    }

    /**
     * 1 is most urgent.
     */
    static int priority(double score) {
        if (score < 5.0) {
            return 1;
        }
        if (score < 6.5) {
            return 2;
        }
        if (score < 7.5) {
            return 3;
        }
        return score < 8.5 ? 4 : 5;
    }

    private static String assessment(double overall) {
        if (overall >= 9.0) {
            return "Exceptional story with outstanding execution across all dimensions.";
        }
        if (overall >= 8.0) {
            return "High quality story with strong execution and an engaging narrative.";
        }
        if (overall >= 7.0) {
            return "Good story with solid fundamentals and room for minor improvements.";
        }
        if (overall >= 6.0) {
            return "Acceptable story with noticeable areas for improvement.";
        }
        return "Story shows potential but needs significant improvement in several areas.";
    }

    private static QualityFeedback.Trend trend(List<EnhancementPass> passes) {
        if (passes.isEmpty()) {
            return QualityFeedback.Trend.NO_PASSES;
        }
        double change = passes.get(passes.size() - 1).getAfter().getOverall()
                - passes.get(0).getBefore().getOverall();
        if (change > STABLE_BAND) {
            return QualityFeedback.Trend.IMPROVING;
        }
        return change < -STABLE_BAND ? QualityFeedback.Trend.DECLINING : QualityFeedback.Trend.STABLE;
    }

    private static EnhancementStrategy mostEffective(List<EnhancementPass> passes) {
        EnhancementStrategy best = null;
        double bestDelta = 0.0;
        for (EnhancementPass pass : passes) {
            if (pass.getDelta() > bestDelta) {
                best = pass.getStrategy();
                bestDelta = pass.getDelta();
            }
        }
        return best;
    }
}
