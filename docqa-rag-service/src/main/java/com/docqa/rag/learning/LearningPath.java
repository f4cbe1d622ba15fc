package com.docqa.rag.learning;

import java.util.List;

/**
 * A week-by-week plan. {@code structured} is false when the provider's reply
 * could not be read as a plan and was kept as a single free-text step.
 */
public record LearningPath(
        String pathTitle,
        int totalDurationWeeks,
        List<LearningStep> steps,
        List<String> prerequisites,
        String providerUsed,
        boolean structured
) {}
