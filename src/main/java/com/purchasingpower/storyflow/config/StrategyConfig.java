package com.purchasingpower.storyflow.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds used when choosing a generation strategy.
 *
 * <p>Properties are loaded from the {@code app.strategy} namespace in application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.strategy")
public class StrategyConfig {

    /**
     * Stories up to this length get a bonus for direct generation.
     */
    @Min(1)
    private int simpleStoryMaxWords = 1000;

    /**
     * Stories from this length get the larger iterative bonus.
     */
    @Min(1)
    private int complexStoryMinWords = 1500;

    /**
     * Stories from this length get an extra iterative bonus.
     */
    @Min(1)
    private int longStoryMinWords = 1800;

    /**
     * Adjust strategy scores using outcomes of earlier runs.
     */
    private boolean enableStrategyLearning = true;

    /**
     * Outcomes kept per strategy.
     */
    @Min(1)
    private int historyWindow = 100;

    /**
     * Past runs whose word count is within this fraction of the request count as similar.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarWordCountTolerance = 0.3;
}
