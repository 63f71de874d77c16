package com.purchasingpower.storyflow.model;

/**
 * Text returned by the generation service. {@code title} may be null when the model did not
 * produce one.
 */
public record GeneratedContent(String content, String title) {

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }
}
