package com.purchasingpower.storyflow.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Prompt template loaded from YAML.
 *
 * <p>YAML structure:
 * <pre>
 * name: story-enhancement
 * version: 1.0
 * systemPrompt: |
 *   You are an expert editor...
 * userPrompt: |
 *   Enhance this {{genre}} story...
 * sections:
 *   structure-focus: |
 *     Focus on improving narrative structure...
 * </pre>
 * {@code sections} holds named fragments (per enhancement strategy, per quality dimension)
 * that are rendered on their own and spliced into the main prompt.
 *
 * @see com.purchasingpower.storyflow.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String systemPrompt;
    private String userPrompt;
    private Map<String, String> sections = new LinkedHashMap<>();
}
