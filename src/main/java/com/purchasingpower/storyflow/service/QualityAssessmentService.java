package com.purchasingpower.storyflow.service;

import com.purchasingpower.storyflow.exception.QualityAssessmentException;
import com.purchasingpower.storyflow.model.QualityVector;
import com.purchasingpower.storyflow.model.StoryRequirements;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Front door for quality scoring used by the workflow and the enhancement loop.
 *
 * <p>Every failure of the underlying scorer, including an out-of-range score rejected by
 * {@link QualityVector}, surfaces as {@link QualityAssessmentException}. There is no fallback
 * vector.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QualityAssessmentService {

    private final QualityScoringService scoringService;

    public QualityVector assess(String content, StoryRequirements requirements) {
        if (content == null || content.isBlank()) {
            throw new QualityAssessmentException("Cannot assess empty content", null);
        }

        Instant start = Instant.now();
        try {
            QualityVector vector = scoringService.score(content, requirements);
            if (vector == null) {
                throw new QualityAssessmentException("Scoring service returned no quality vector", null);
            }
            Duration elapsed = Duration.between(start, Instant.now());
            log.info("📊 Quality assessed: overall={} in {}ms", vector.getOverall(), elapsed.toMillis());
            return vector.withAssessmentDuration(elapsed);

        } catch (QualityAssessmentException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new QualityAssessmentException("Scoring service violated score contract: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new QualityAssessmentException("Quality assessment failed: " + e.getMessage(), e);
        }
    }
}
