package com.purchasingpower.storyflow.service;

import com.purchasingpower.storyflow.model.GeneratedContent;
import com.purchasingpower.storyflow.model.StoryRequirements;

/**
 * Produces story text.
 *
 * <p>Calls are not idempotent: the same input may legitimately produce different output.
 */
public interface GenerationService {

    /**
     * @param content     current text to work from; empty when writing from scratch
     * @param instruction what to do with it (write a draft, an outline, a focused revision)
     * @param requirements the story being written
     * @throws com.purchasingpower.storyflow.exception.GenerationException if no content could be produced
     */
    GeneratedContent generate(String content, String instruction, StoryRequirements requirements);
}
