package com.purchasingpower.storyflow.service;

import com.purchasingpower.storyflow.model.EnhancementStrategy;
import com.purchasingpower.storyflow.model.QualityDimension;
import com.purchasingpower.storyflow.model.QualityVector;
import com.purchasingpower.storyflow.model.StoryRequirements;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the instruction text handed to the {@link GenerationService} for each kind of call:
 * outline, first draft, and focused revision.
 */
@Service
@RequiredArgsConstructor
public class StoryInstructionService {

    static final String INSTRUCTIONS = "story-instructions";
    static final String ENHANCEMENT = "story-enhancement";

    private final PromptLibraryService promptLibrary;

    public String outlineInstruction(StoryRequirements requirements) {
        return promptLibrary.renderSection(INSTRUCTIONS, "outline", baseVariables(requirements));
    }

    /**
     * Instruction for the first draft. {@code outline} may be null for direct generation.
     */
    public String draftInstruction(StoryRequirements requirements, String outline) {
        Map<String, Object> variables = baseVariables(requirements);
        boolean hasOutline = outline != null && !outline.isBlank();
        variables.put("outline", outline);
        return promptLibrary.renderSection(INSTRUCTIONS, hasOutline ? "draft-from-outline" : "draft", variables);
    }

    public String enhancementInstruction(EnhancementStrategy strategy, QualityVector quality,
                                         String title, StoryRequirements requirements) {
        Map<String, Object> variables = baseVariables(requirements);
        variables.put("title", title == null ? "Untitled" : title);
        variables.put("strategyName", displayName(strategy));
        variables.put("overall", format(quality.getOverall()));
        for (QualityDimension dimension : QualityDimension.values()) {
            variables.put(dimension.key(), format(quality.score(dimension)));
        }

        String guidance = promptLibrary.hasSection(ENHANCEMENT, strategy.templateKey())
                ? promptLibrary.renderSection(ENHANCEMENT, strategy.templateKey(), variables)
                : promptLibrary.renderSection(ENHANCEMENT, EnhancementStrategy.COMPREHENSIVE.templateKey(), variables);
        variables.put("guidance", guidance);

        return promptLibrary.render(ENHANCEMENT, variables);
    }

    private static Map<String, Object> baseVariables(StoryRequirements requirements) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("genre", requirements.getDisplayGenre());
        variables.put("targetWordCount", requirements.getTargetWordCount());
        variables.put("length", requirements.getLength() == null ? null
                : requirements.getLength().name().toLowerCase(Locale.ROOT));
        variables.put("theme", requirements.getTheme());
        variables.put("setting", requirements.getSetting());
        return variables;
    }

    private static String displayName(EnhancementStrategy strategy) {
        String[] words = strategy.name().toLowerCase(Locale.ROOT).split("_");
        StringBuilder name = new StringBuilder();
        for (String word : words) {
            if (!name.isEmpty()) {
                name.append(' ');
            }
            name.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return name.toString();
    }

    private static String format(double score) {
        return String.format(Locale.ROOT, "%.1f", score);
    }
}
