package com.purchasingpower.storyflow.model.dto;

import com.purchasingpower.storyflow.model.StoryGenre;
import com.purchasingpower.storyflow.model.StoryLength;
import com.purchasingpower.storyflow.model.StoryRequirements;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Story Request Tests")
class StoryRequestTest {

    @Test
    @DisplayName("Should derive the length and normalise optional hints")
    void testToRequirements_ShouldNormaliseInput() {
        // Given
        StoryRequest request = StoryRequest.builder()
                .genre("  Sci-Fi ")
                .targetWordCount(2500)
                .theme("")
                .setting("  Europa station ")
                .build();

        // When
        StoryRequirements requirements = request.toRequirements();

        // Then
        assertEquals(StoryGenre.SCIENCE_FICTION, requirements.getGenre());
        assertEquals("Sci-Fi", requirements.getOriginalGenre());
        assertEquals(StoryLength.SHORT, requirements.getLength());
        assertNull(requirements.getTheme());
        assertEquals("Europa station", requirements.getSetting());
    }

    @Test
    @DisplayName("Explicit length should win over the derived one")
    void testToRequirements_ShouldKeepExplicitLength() {
        StoryRequest request = StoryRequest.builder()
                .genre("romance")
                .targetWordCount(900)
                .length(StoryLength.SHORT)
                .build();

        assertEquals(StoryLength.SHORT, request.toRequirements().getLength());

        request.setLength(null);
        request.setTargetWordCount(1000);
        assertEquals(StoryLength.FLASH, request.toRequirements().getLength());
    }
}
