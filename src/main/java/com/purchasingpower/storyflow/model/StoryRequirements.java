package com.purchasingpower.storyflow.model;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable description of the story a caller asked for.
 *
 * <p>Request validation happens at the API boundary; by the time a workflow runs the values
 * are assumed to be well-formed.
 */
@Value
@Builder(toBuilder = true)
public class StoryRequirements {

    StoryGenre genre;

    StoryLength length;

    int targetWordCount;

    /**
     * Optional theme hint. More words means a more specific (harder) request.
     */
    String theme;

    /**
     * Optional setting hint.
     */
    String setting;

    /**
     * Genre exactly as the user typed it, e.g. "cozy whodunit".
     */
    String originalGenre;

    /**
     * Genre name used in prompts and output.
     */
    public String getDisplayGenre() {
        return originalGenre != null && !originalGenre.isBlank() ? originalGenre : genre.getValue();
    }

    public boolean hasTheme() {
        return theme != null && !theme.isBlank();
    }

    public boolean hasSetting() {
        return setting != null && !setting.isBlank();
    }
}
