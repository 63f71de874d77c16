package com.purchasingpower.storyflow.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers all {@code app.*} configuration property classes.
 *
 * <p>Enabled configuration classes:
 * <ul>
 *   <li>{@link GlobalRetryConfig} - step retry backoff
 *   <li>{@link WorkflowConfig} - step timeouts, retry counts and the run time budget
 *   <li>{@link EnhancementConfig} - enhancement loop targets and weights
 *   <li>{@link StrategyConfig} - generation strategy thresholds
 *   <li>{@link LlmConfig} - chat completion endpoint
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    GlobalRetryConfig.class,
    WorkflowConfig.class,
    EnhancementConfig.class,
    StrategyConfig.class,
    LlmConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
