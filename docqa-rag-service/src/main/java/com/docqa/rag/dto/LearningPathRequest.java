package com.docqa.rag.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record LearningPathRequest(
        @NotEmpty List<@Valid LearningGoalRequest> goals,
        String background,
        Integer durationWeeks,
        String provider
) {}
