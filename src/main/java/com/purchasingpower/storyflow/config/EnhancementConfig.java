package com.purchasingpower.storyflow.config;

import com.purchasingpower.storyflow.model.QualityDimension;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.EnumMap;
import java.util.Map;

/**
 * Settings for the enhancement loop.
 *
 * <p>Properties are loaded from the {@code app.enhancement} namespace in application.yml.
 * Dimension weights are keyed by dimension name in kebab case:
 * <pre>
 * app:
 *   enhancement:
 *     target-quality-score: 8.0
 *     max-enhancement-passes: 3
 *     dimension-weights:
 *       emotional-impact: 1.3
 * </pre>
 * Dimensions without a configured weight use 1.0.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.enhancement")
public class EnhancementConfig {

    @DecimalMin("0.0")
    @DecimalMax("10.0")
    private double targetQualityScore = 8.0;

    @Min(0)
    private int maxEnhancementPasses = 3;

    /**
     * Deltas below this count as no progress for plateau detection.
     */
    @DecimalMin("0.0")
    private double qualityConvergenceThreshold = 0.1;

    /**
     * Dimensions strictly below this score are candidates for a focused pass.
     */
    @DecimalMin("0.0")
    @DecimalMax("10.0")
    private double weakDimensionThreshold = 7.0;

    private Map<QualityDimension, Double> dimensionWeights = defaultWeights();

    public double weightFor(QualityDimension dimension) {
        if (dimensionWeights == null) {
            return 1.0;
        }
        return dimensionWeights.getOrDefault(dimension, 1.0);
    }

    public static Map<QualityDimension, Double> defaultWeights() {
        Map<QualityDimension, Double> weights = new EnumMap<>(QualityDimension.class);
        weights.put(QualityDimension.STRUCTURE, 1.0);
        weights.put(QualityDimension.CHARACTER_DEVELOPMENT, 1.2);
        weights.put(QualityDimension.PACING_QUALITY, 1.1);
        weights.put(QualityDimension.DIALOGUE_QUALITY, 0.9);
        weights.put(QualityDimension.SETTING_IMMERSION, 0.8);
        weights.put(QualityDimension.EMOTIONAL_IMPACT, 1.3);
        weights.put(QualityDimension.ORIGINALITY_SCORE, 0.7);
        weights.put(QualityDimension.TECHNICAL_QUALITY, 1.0);
        return weights;
    }
}
