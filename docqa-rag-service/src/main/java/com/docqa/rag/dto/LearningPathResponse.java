package com.docqa.rag.dto;

import com.docqa.rag.learning.LearningPath;
import com.docqa.rag.learning.LearningStep;

import java.util.List;

public record LearningPathResponse(
        String pathTitle,
        int totalDurationWeeks,
        List<LearningStep> steps,
        List<String> prerequisites,
        String providerUsed,
        boolean structured
) {
    public static LearningPathResponse from(LearningPath p) {
        return new LearningPathResponse(p.pathTitle(), p.totalDurationWeeks(), p.steps(), p.prerequisites(),
                p.providerUsed(), p.structured());
    }
}
