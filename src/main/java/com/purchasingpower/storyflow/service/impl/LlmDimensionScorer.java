package com.purchasingpower.storyflow.service.impl;

import com.purchasingpower.storyflow.client.LlmClient;
import com.purchasingpower.storyflow.config.LlmConfig;
import com.purchasingpower.storyflow.exception.QualityAssessmentException;
import com.purchasingpower.storyflow.model.QualityDimension;
import com.purchasingpower.storyflow.model.QualityVector;
import com.purchasingpower.storyflow.model.ServiceType;
import com.purchasingpower.storyflow.model.StoryRequirements;
import com.purchasingpower.storyflow.service.DimensionScorer;
import com.purchasingpower.storyflow.service.PromptLibraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the model for a single 0-10 score on one dimension, using the per-dimension criteria in
 * the {@code dimension-scoring} prompt.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmDimensionScorer implements DimensionScorer {

    private static final Pattern LABELLED_SCORE = Pattern.compile("(?i)score\\s*[:=]\\s*(-?\\d+(?:\\.\\d+)?)");
    private static final Pattern ANY_NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");

    private final LlmClient llmClient;
    private final PromptLibraryService promptLibrary;
    private final LlmConfig llmConfig;

    @Override
    public double score(QualityDimension dimension, String content, StoryRequirements requirements) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("genre", requirements.getDisplayGenre());
        variables.put("theme", requirements.getTheme());
        variables.put("setting", requirements.getSetting());
        variables.put("targetWordCount", requirements.getTargetWordCount());
        variables.put("dimension", dimension.getDisplayName());
        variables.put("content", content);
        variables.put("criteria", promptLibrary.renderSection("dimension-scoring", dimension.key(), variables));

        String prompt = promptLibrary.render("dimension-scoring", variables);
        String answer = llmClient.chat(prompt, llmConfig.getScoringTemperature(), ServiceType.SCORING,
                "score-" + dimension.key());

        double score = extractScore(dimension, answer);
        log.debug("Scored {}: {}", dimension.key(), score);
        return score;
    }

    /**
     * Read the score from a model answer. A {@code SCORE: x} label wins; otherwise the first
     * number in the text is used. A missing or out-of-range number is an error, never clamped.
     */
    static double extractScore(QualityDimension dimension, String answer) {
        if (answer == null || answer.isBlank()) {
            throw new QualityAssessmentException("Empty scoring answer for " + dimension.key(), dimension, null);
        }

        String number = null;
        Matcher labelled = LABELLED_SCORE.matcher(answer);
        if (labelled.find()) {
            number = labelled.group(1);
        } else {
            Matcher any = ANY_NUMBER.matcher(answer);
            if (any.find()) {
                number = any.group();
            }
        }
        if (number == null) {
            throw new QualityAssessmentException("No numerical score in answer for " + dimension.key()
                    + ": " + answer.substring(0, Math.min(200, answer.length())), dimension, null);
        }

        double score = Double.parseDouble(number);
        if (score < QualityVector.MIN_SCORE || score > QualityVector.MAX_SCORE) {
            throw new QualityAssessmentException("Score for " + dimension.key() + " out of range [0, 10]: " + score,
                    dimension, null);
        }
        return score;
    }
}
