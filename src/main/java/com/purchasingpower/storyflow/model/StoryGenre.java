package com.purchasingpower.storyflow.model;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Supported story genres.
 *
 * <p>Free-text genre input is mapped onto one of these values by {@link #fromString(String)}.
 * Anything that cannot be matched falls back to {@link #LITERARY}, so callers never have to
 * reject an unusual genre name; the original wording is kept on {@link StoryRequirements}.
 */
public enum StoryGenre {

    LITERARY("literary", 0.8),
    MYSTERY("mystery", 0.7),
    SCIENCE_FICTION("science_fiction", 0.9),
    FANTASY("fantasy", 0.9),
    ROMANCE("romance", 0.6);

    private static final Map<String, StoryGenre> ALIASES = new LinkedHashMap<>();

    static {
        ALIASES.put("sci_fi", SCIENCE_FICTION);
        ALIASES.put("scifi", SCIENCE_FICTION);
        ALIASES.put("sf", SCIENCE_FICTION);
        ALIASES.put("science", SCIENCE_FICTION);
        ALIASES.put("detective", MYSTERY);
        ALIASES.put("crime", MYSTERY);
        ALIASES.put("thriller", MYSTERY);
        ALIASES.put("whodunit", MYSTERY);
        ALIASES.put("love", ROMANCE);
        ALIASES.put("romantic", ROMANCE);
        ALIASES.put("drama", LITERARY);
        ALIASES.put("fiction", LITERARY);
        ALIASES.put("contemporary", LITERARY);
        ALIASES.put("magical", FANTASY);
        ALIASES.put("epic", FANTASY);
        ALIASES.put("urban_fantasy", FANTASY);
    }

    private final String value;

    /**
     * Static complexity weight used when estimating how hard a request is (0.0 - 1.0).
     */
    private final double complexity;

    StoryGenre(String value, double complexity) {
        this.value = value;
        this.complexity = complexity;
    }

    public String getValue() {
        return value;
    }

    public double getComplexity() {
        return complexity;
    }

    /**
     * Resolve a genre from user input, accepting aliases such as "sci-fi" or "whodunit".
     */
    public static StoryGenre fromString(String input) {
        if (input == null || input.isBlank()) {
            return LITERARY;
        }
        String normalized = input.trim().toLowerCase(Locale.ROOT)
                .replace('-', '_')
                .replace(' ', '_');

        for (StoryGenre genre : values()) {
            if (genre.value.equals(normalized) || genre.name().equalsIgnoreCase(normalized)) {
                return genre;
            }
        }

        StoryGenre direct = ALIASES.get(normalized);
        if (direct != null) {
            return direct;
        }

        for (Map.Entry<String, StoryGenre> alias : ALIASES.entrySet()) {
            if (normalized.contains(alias.getKey()) || alias.getKey().contains(normalized)) {
                return alias.getValue();
            }
        }

        for (StoryGenre genre : values()) {
            if (genre.value.contains(normalized)) {
                return genre;
            }
        }
        return LITERARY;
    }
}
