package com.purchasingpower.storyflow.model;

/**
 * High-level approaches for producing the first draft of a story.
 */
public enum GenerationStrategy {
    DIRECT,     // Single-pass generation
    OUTLINE,    // Outline first, then content
    ITERATIVE,  // Multiple passes with improvement
    ADAPTIVE    // Adjusts approach as the content develops
}
