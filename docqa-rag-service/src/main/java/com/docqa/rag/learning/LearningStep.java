package com.docqa.rag.learning;

import java.util.List;

public record LearningStep(
        int week,
        String title,
        String description,
        List<String> objectives,
        List<String> resources
) {}
