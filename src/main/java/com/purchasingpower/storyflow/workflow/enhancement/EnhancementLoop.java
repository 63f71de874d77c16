package com.purchasingpower.storyflow.workflow.enhancement;

import com.purchasingpower.storyflow.config.EnhancementConfig;
import com.purchasingpower.storyflow.exception.EnhancementPassException;
import com.purchasingpower.storyflow.model.ConvergenceState;
import com.purchasingpower.storyflow.model.EnhancementPass;
import com.purchasingpower.storyflow.model.EnhancementResult;
import com.purchasingpower.storyflow.model.EnhancementStrategy;
import com.purchasingpower.storyflow.model.GeneratedContent;
import com.purchasingpower.storyflow.model.QualityVector;
import com.purchasingpower.storyflow.model.StopReason;
import com.purchasingpower.storyflow.model.StoryRequirements;
import com.purchasingpower.storyflow.service.GenerationService;
import com.purchasingpower.storyflow.service.QualityAssessmentService;
import com.purchasingpower.storyflow.service.StoryInstructionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Repeatedly revises a story until it is good enough, the pass budget is spent, or further
 * passes stop paying off.
 *
 * <p>Each iteration checks, in order:
 * <ol>
 *   <li>current overall ≥ target: stop with {@link StopReason#TARGET_ACHIEVED}
 *   <li>passes executed ≥ max passes: stop with {@link StopReason#PASS_BUDGET_EXHAUSTED}
 *   <li>otherwise run a pass: pick a strategy, generate a revision, re-score it, record the
 *       pass and feed its delta to the {@link ConvergenceTracker}. On plateau or diminishing
 *       returns stop with {@link StopReason#CONVERGED}; the converging revision stays in the pass
 *       history but is not adopted. Otherwise the revision becomes the current story.
 * </ol>
 *
 * <p>Generation and scoring failures are not retried here. They abort the loop with an
 * {@link EnhancementPassException} carrying the best story known before the failing pass.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnhancementLoop {

    private final GenerationService generationService;
    private final QualityAssessmentService qualityAssessment;
    private final EnhancementStrategySelector strategySelector;
    private final StoryInstructionService instructions;
    private final QualityFeedbackAnalyzer feedbackAnalyzer;
    private final EnhancementConfig config;

    /**
     * Enhance with the configured target and pass budget.
     */
    public EnhancementResult enhance(String content, String title, StoryRequirements requirements,
                                     QualityVector knownQuality) {
        return enhance(content, title, requirements, knownQuality,
                config.getTargetQualityScore(), config.getMaxEnhancementPasses());
    }

    /**
     * @param knownQuality quality of {@code content} if already assessed; null to assess it first
     */
    public EnhancementResult enhance(String content, String title, StoryRequirements requirements,
                                     QualityVector knownQuality, double targetQuality, int maxPasses) {
        if (maxPasses < 0) {
            throw new IllegalArgumentException("maxPasses must be >= 0, got " + maxPasses);
        }

        Instant start = Instant.now();
        ConvergenceTracker tracker = new ConvergenceTracker(config.getQualityConvergenceThreshold());
        List<EnhancementPass> passes = new ArrayList<>();

        String currentContent = content;
        String currentTitle = title;
        QualityVector quality = knownQuality != null ? knownQuality : qualityAssessment.assess(content, requirements);
        QualityVector initialQuality = quality;
        StopReason stopReason;

        log.info("🔁 Enhancement starting: overall={} target={} maxPasses={}",
                quality.getOverall(), targetQuality, maxPasses);

        while (true) {
            if (quality.getOverall() >= targetQuality) {
                stopReason = StopReason.TARGET_ACHIEVED;
                break;
            }
            if (passes.size() >= maxPasses) {
                stopReason = StopReason.PASS_BUDGET_EXHAUSTED;
                break;
            }

            int passNumber = passes.size() + 1;
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Enhancement interrupted before pass " + passNumber);
            }

            EnhancementStrategy strategy = strategySelector.select(quality);
            log.info("✏️ Enhancement pass {}/{} using {} (overall {})",
                    passNumber, maxPasses, strategy, quality.getOverall());

            Instant passStart = Instant.now();
            GeneratedContent revised;
            QualityVector after;
            try {
                String instruction = instructions.enhancementInstruction(strategy, quality, currentTitle, requirements);
                revised = generationService.generate(currentContent, instruction, requirements);
                after = qualityAssessment.assess(revised.content(), requirements);
            } catch (RuntimeException e) {
                log.error("❌ Enhancement pass {} ({}) failed: {}", passNumber, strategy, e.getMessage());
                EnhancementResult bestKnown = buildResult(currentContent, currentTitle, passes, initialQuality,
                        quality, tracker.state(), StopReason.PASS_FAILED, start);
                throw new EnhancementPassException(passNumber, strategy, bestKnown, e);
            }

            EnhancementPass pass = EnhancementPass.builder()
                    .passNumber(passNumber)
                    .strategy(strategy)
                    .focusDimensions(strategy.focusDimensions())
                    .before(quality)
                    .after(after)
                    .elapsed(Duration.between(passStart, Instant.now()))
                    .tokensUsed(estimateTokens(currentContent, revised.content()))
                    .build();
            passes.add(pass);

            ConvergenceState convergence = tracker.record(pass.getDelta());
            log.info("📈 Pass {} complete: {} → {} (delta {})", passNumber,
                    quality.getOverall(), after.getOverall(), String.format("%+.2f", pass.getDelta()));

            if (convergence.isConverged()) {
                log.info("🛑 Convergence after pass {} (plateau={}, diminishingReturns={})", passNumber,
                        convergence.isPlateauDetected(), convergence.isDiminishingReturnsDetected());
                stopReason = StopReason.CONVERGED;
                break;
            }

            currentContent = revised.content();
            currentTitle = revised.hasTitle() ? revised.title() : currentTitle;
            quality = after;
        }

        EnhancementResult result = buildResult(currentContent, currentTitle, passes, initialQuality,
                quality, tracker.state(), stopReason, start);
        log.info("✅ Enhancement finished: {} after {} pass(es), {} → {}", stopReason, passes.size(),
                initialQuality.getOverall(), quality.getOverall());
        return result;
    }

    private EnhancementResult buildResult(String content, String title, List<EnhancementPass> passes,
                                          QualityVector initialQuality, QualityVector finalQuality,
                                          ConvergenceState convergence, StopReason stopReason, Instant start) {
        List<EnhancementPass> history = List.copyOf(passes);
        return EnhancementResult.builder()
                .content(content)
                .title(title)
                .passes(history)
                .initialQuality(initialQuality)
                .finalQuality(finalQuality)
                .convergence(convergence)
                .stopReason(stopReason)
                .feedback(feedbackAnalyzer.analyze(finalQuality, history))
                .totalTokens(history.stream().mapToLong(EnhancementPass::getTokensUsed).sum())
                .elapsed(Duration.between(start, Instant.now()))
                .build();
    }

    /**
     * Rough token cost of one revision: both texts at ~4 characters per token plus prompt overhead.
     */
    static long estimateTokens(String before, String after) {
        return before.length() / 4 + after.length() / 4 + 500;
    }
}
