package com.purchasingpower.storyflow.model.dto;

import com.purchasingpower.storyflow.model.GenerationStrategy;
import com.purchasingpower.storyflow.model.StoryGenre;
import com.purchasingpower.storyflow.model.StoryLength;
import com.purchasingpower.storyflow.model.StoryRequirements;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for submitting a new story run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoryRequest {

    /**
     * Free-text genre; aliases such as "sci-fi" or "whodunit" are accepted.
     */
    @NotBlank
    @Size(max = 100)
    private String genre;

    /**
     * Derived from {@link #targetWordCount} when omitted.
     */
    private StoryLength length;

    @Min(100)
    @Max(7500)
    private int targetWordCount;

    @Size(max = 200)
    private String theme;

    @Size(max = 200)
    private String setting;

    /**
     * Forces a generation strategy instead of letting the selector decide.
     */
    private GenerationStrategy strategy;

    public StoryRequirements toRequirements() {
        StoryLength effectiveLength = length != null ? length
                : (targetWordCount <= 1000 ? StoryLength.FLASH : StoryLength.SHORT);
        return StoryRequirements.builder()
                .genre(StoryGenre.fromString(genre))
                .originalGenre(genre.trim())
                .length(effectiveLength)
                .targetWordCount(targetWordCount)
                .theme(blankToNull(theme))
                .setting(blankToNull(setting))
                .build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
