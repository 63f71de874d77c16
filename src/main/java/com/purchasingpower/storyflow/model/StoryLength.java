package com.purchasingpower.storyflow.model;

/**
 * Story length categories.
 */
public enum StoryLength {
    FLASH,  // 100-1000 words
    SHORT   // 1000-7500 words
}
