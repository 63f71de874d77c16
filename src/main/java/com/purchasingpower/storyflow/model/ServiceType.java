package com.purchasingpower.storyflow.model;

/**
 * External call categories for unified logging.
 *
 * @see com.purchasingpower.storyflow.util.ExternalCallLogger
 */
public enum ServiceType {
    GENERATION("✍️", "Generation"),
    SCORING("📊", "Scoring");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
