package com.purchasingpower.storyflow.model;

/**
 * Independently scored axes of story quality, each on a 0-10 scale.
 *
 * <p>The weights feed {@link QualityVector#getOverall()} and sum to exactly 1.0.
 */
public enum QualityDimension {

    STRUCTURE(0.12, "Structure"),
    COHERENCE(0.10, "Coherence"),
    CHARACTER_DEVELOPMENT(0.12, "Character Development"),
    GENRE_COMPLIANCE(0.08, "Genre Compliance"),
    PACING_QUALITY(0.10, "Pacing"),
    THEME_INTEGRATION(0.08, "Theme Integration"),
    DIALOGUE_QUALITY(0.10, "Dialogue"),
    SETTING_IMMERSION(0.08, "Setting"),
    EMOTIONAL_IMPACT(0.12, "Emotional Impact"),
    ORIGINALITY_SCORE(0.06, "Originality"),
    TECHNICAL_QUALITY(0.04, "Technical Quality");

    private final double overallWeight;
    private final String displayName;

    QualityDimension(double overallWeight, String displayName) {
        this.overallWeight = overallWeight;
        this.displayName = displayName;
    }

    public double getOverallWeight() {
        return overallWeight;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Lower-case key used in prompt templates and logs, e.g. "character_development".
     */
    public String key() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
