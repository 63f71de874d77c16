package com.purchasingpower.storyflow.workflow.strategy;

import com.purchasingpower.storyflow.config.StrategyConfig;
import com.purchasingpower.storyflow.model.GenerationStrategy;
import com.purchasingpower.storyflow.model.RequirementAnalysis;
import com.purchasingpower.storyflow.model.StoryGenre;
import com.purchasingpower.storyflow.model.StoryRequirements;
import com.purchasingpower.storyflow.model.StrategyCandidate;
import com.purchasingpower.storyflow.model.StrategyRecommendation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the generation strategy for a request.
 *
 * <p>Each strategy gets a score from its own formula (base affinity, complexity and length
 * bonuses, and a bounded adjustment from past runs). The best score wins; its confidence is the
 * score clamped into that strategy's confidence range. The next two are returned as
 * alternatives. Ties keep {@link GenerationStrategy} declaration order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StrategySelector {

    private static final int ALTERNATIVES = 2;

    private final RequirementsAnalyzer analyzer;
    private final PerformanceHistoryStore history;
    private final StrategyConfig config;

    public StrategyRecommendation selectStrategy(StoryRequirements requirements) {
        return selectStrategy(requirements, analyzer.analyze(requirements));
    }

    public StrategyRecommendation selectStrategy(StoryRequirements requirements, RequirementAnalysis analysis) {
        Instant start = Instant.now();
        double complexity = analysis.getComplexity();

        List<StrategyCandidate> candidates = new ArrayList<>();
        for (GenerationStrategy strategy : GenerationStrategy.values()) {
            candidates.add(score(strategy, requirements, complexity));
        }
        candidates.sort(Comparator.comparingDouble(StrategyCandidate::getScore).reversed());

        StrategyCandidate selected = candidates.get(0);
        StrategyRecommendation recommendation = StrategyRecommendation.builder()
                .selected(selected)
                .alternatives(candidates.subList(1, Math.min(1 + ALTERNATIVES, candidates.size())))
                .complexity(complexity)
                .selectionTime(Duration.between(start, Instant.now()))
                .build();

        log.info("🧭 Selected strategy: {} (confidence: {}, complexity: {})",
                selected.getStrategy(), String.format("%.2f", selected.getConfidence()),
                String.format("%.2f", complexity));
        return recommendation;
    }

    StrategyCandidate score(GenerationStrategy strategy, StoryRequirements requirements, double complexity) {
        int words = requirements.getTargetWordCount();
        double bonus = history.queryBonus(strategy, requirements);

        return switch (strategy) {
            case DIRECT -> {
                double score = 0.7 - complexity * 0.3
                        + (words <= config.getSimpleStoryMaxWords() ? 0.2 : 0.0) + bonus;
                yield candidate(strategy, score, clamp(score, 0.3, 0.9), bonus,
                        "Direct strategy suitable for " + (complexity < 0.5 ? "simple" : "moderately complex")
                                + " requirements",
                        60.0 + words * 0.02, 7.0 - complexity * 2.0);
            }
            case OUTLINE -> {
                boolean structured = requirements.getGenre() == StoryGenre.MYSTERY
                        || requirements.getGenre() == StoryGenre.LITERARY;
                double score = 0.8 + Math.min(complexity * 0.4, 0.3) + (structured ? 0.2 : 0.1) + bonus;
                yield candidate(strategy, score, clamp(score, 0.4, 0.95), bonus,
                        "Outline strategy provides structure for well-planned narratives",
                        120.0 + words * 0.03, 7.5 + complexity);
            }
            case ITERATIVE -> {
                double score = 0.7 + complexity * 0.7
                        + (words >= config.getComplexStoryMinWords() ? 0.5 : 0.1)
                        + (words >= config.getLongStoryMinWords() ? 0.3 : 0.0)
                        - 0.05 + bonus;
                yield candidate(strategy, score, clamp(score, 0.3, 0.95), bonus,
                        "Iterative strategy refines quality over several passes, especially for longer stories",
                        240.0 + words * 0.05, 8.0 + complexity * 0.5);
            }
            case ADAPTIVE -> {
                double score = 0.75 + (complexity >= 0.4 && complexity <= 0.7 ? 0.1 : 0.0) + bonus;
                yield candidate(strategy, score, clamp(score, 0.5, 0.85), bonus,
                        "Adaptive strategy adjusts its approach as the content develops",
                        150.0 + words * 0.035, 7.2 + complexity * 0.8);
            }
        };
    }

    private static StrategyCandidate candidate(GenerationStrategy strategy, double score, double confidence,
                                               double bonus, String reasoning, double seconds, double quality) {
        return StrategyCandidate.builder()
                .strategy(strategy)
                .score(score)
                .confidence(confidence)
                .historicalBonus(bonus)
                .reasoning(reasoning)
                .estimatedTime(Duration.ofMillis(Math.round(seconds * 1000)))
                .estimatedQuality(Math.min(10.0, Math.max(0.0, quality)))
                .build();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
