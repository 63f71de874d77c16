package com.purchasingpower.storyflow.service.impl;

import com.purchasingpower.storyflow.StoryFixtures;
import com.purchasingpower.storyflow.exception.QualityAssessmentException;
import com.purchasingpower.storyflow.model.QualityDimension;
import com.purchasingpower.storyflow.model.QualityVector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Parallel Quality Scoring Service Tests")
class ParallelQualityScoringServiceTest {

    private static final int DIMENSIONS = QualityDimension.values().length;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(DIMENSIONS);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should combine one score per dimension into a vector")
    void testScore_ShouldScoreEveryDimension() {
        // Given
        ParallelQualityScoringService service = new ParallelQualityScoringService(
                (dimension, content, requirements) -> dimension.ordinal() % 2 == 0 ? 8.0 : 6.0, executor);

        // When
        QualityVector vector = service.score("The lamp went dark.", StoryFixtures.mysteryRequirements());

        // Then
        for (QualityDimension dimension : QualityDimension.values()) {
            assertEquals(dimension.ordinal() % 2 == 0 ? 8.0 : 6.0, vector.score(dimension));
        }
    }

    @Test
    @DisplayName("First failing dimension should fail the call and cancel the rest")
    void testScore_ShouldFailFastAndCancelOthers() throws InterruptedException {
        // Given: every other dimension blocks until interrupted
        CountDownLatch started = new CountDownLatch(DIMENSIONS - 1);
        CountDownLatch interrupted = new CountDownLatch(DIMENSIONS - 1);
        ParallelQualityScoringService service = new ParallelQualityScoringService((dimension, content, requirements) -> {
            if (dimension == QualityDimension.PACING_QUALITY) {
                try {
                    started.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new IllegalStateException("scorer unavailable");
            }
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return 5.0;
        }, executor);

        // When
        long start = System.nanoTime();
        QualityAssessmentException ex = assertThrows(QualityAssessmentException.class,
                () -> service.score("The lamp went dark.", StoryFixtures.mysteryRequirements()));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        // Then
        assertEquals(QualityDimension.PACING_QUALITY, ex.getDimension());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertTrue(elapsedMs < 5_000, "should not wait for the slow dimensions");
        assertTrue(interrupted.await(2, TimeUnit.SECONDS), "in-flight dimensions should be interrupted");
    }

    @Test
    @DisplayName("Assessment failures from the scorer should pass through unchanged")
    void testScore_ShouldPropagateAssessmentFailures() {
        QualityAssessmentException failure = new QualityAssessmentException("bad answer",
                QualityDimension.DIALOGUE_QUALITY, null);
        ParallelQualityScoringService service = new ParallelQualityScoringService((dimension, content, requirements) -> {
            if (dimension == QualityDimension.DIALOGUE_QUALITY) {
                throw failure;
            }
            return 7.0;
        }, executor);

        QualityAssessmentException ex = assertThrows(QualityAssessmentException.class,
                () -> service.score("text", StoryFixtures.mysteryRequirements()));

        assertSame(failure, ex);
    }
}
