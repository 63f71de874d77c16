package com.purchasingpower.storyflow.service.impl;

import com.purchasingpower.storyflow.client.LlmClient;
import com.purchasingpower.storyflow.config.LlmConfig;
import com.purchasingpower.storyflow.exception.GenerationException;
import com.purchasingpower.storyflow.model.GeneratedContent;
import com.purchasingpower.storyflow.model.ServiceType;
import com.purchasingpower.storyflow.model.StoryRequirements;
import com.purchasingpower.storyflow.service.GenerationService;
import com.purchasingpower.storyflow.service.PromptLibraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link GenerationService} backed by the chat completion endpoint.
 *
 * <p>Writing from scratch uses the {@code story-generation} prompt; working from existing text
 * (an outline or a previous draft) uses {@code story-revision}. The model is asked to start its
 * answer with a {@code **Title:**} line, which is split off by {@link #parseStory(String)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmGenerationService implements GenerationService {

    private static final int TITLE_SEARCH_LINES = 5;

    private final LlmClient llmClient;
    private final PromptLibraryService promptLibrary;
    private final LlmConfig llmConfig;

    @Override
    public GeneratedContent generate(String content, String instruction, StoryRequirements requirements) {
        boolean fromScratch = content == null || content.isBlank();

        Map<String, Object> variables = new HashMap<>();
        variables.put("genre", requirements.getDisplayGenre());
        variables.put("targetWordCount", requirements.getTargetWordCount());
        variables.put("theme", requirements.getTheme());
        variables.put("setting", requirements.getSetting());
        variables.put("instruction", instruction);
        variables.put("content", content);

        String prompt = promptLibrary.render(fromScratch ? "story-generation" : "story-revision", variables);
        String raw = llmClient.chat(prompt, llmConfig.getTemperature(), ServiceType.GENERATION,
                fromScratch ? "generate" : "revise");

        GeneratedContent generated = parseStory(raw);
        log.debug("Generated {} chars, title={}", generated.content().length(), generated.title());
        return generated;
    }

    /**
     * Split a model answer into title and body. The title is looked for in the first five
     * lines as {@code **Title:** ...} or {@code Title: ...}; blank lines after it are dropped.
     * Without a title line the whole answer is the body and the title is null.
     */
    static GeneratedContent parseStory(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new GenerationException("Generation returned an empty response");
        }

        List<String> lines = Arrays.asList(raw.strip().split("\\R", -1));
        String title = null;
        int contentStart = 0;

        for (int i = 0; i < Math.min(TITLE_SEARCH_LINES, lines.size()); i++) {
            String line = lines.get(i).strip();
            if (line.startsWith("**Title:**")) {
                title = cleanTitle(line.substring("**Title:**".length()));
                contentStart = i + 1;
                break;
            }
            if (line.startsWith("Title:")) {
                title = cleanTitle(line.substring("Title:".length()));
                contentStart = i + 1;
                break;
            }
        }

        while (contentStart < lines.size() && lines.get(contentStart).isBlank()) {
            contentStart++;
        }

        String body = String.join("\n", lines.subList(contentStart, lines.size())).strip();
        if (body.isEmpty()) {
            throw new GenerationException("Generation produced a title but no story content");
        }
        return new GeneratedContent(body, title == null || title.isEmpty() ? null : title);
    }

    private static String cleanTitle(String title) {
        return title.replace("*", "").replace("\"", "").strip();
    }
}
