package com.docqa.rag.dto;

import com.docqa.rag.learning.LearningGoal;
import com.docqa.rag.learning.ProficiencyLevel;
import jakarta.validation.constraints.NotBlank;

public record LearningGoalRequest(
        @NotBlank String topic,
        String proficiencyLevel,
        String timeCommitment
) {
    public LearningGoal toGoal() {
        return new LearningGoal(topic, ProficiencyLevel.from(proficiencyLevel), timeCommitment);
    }
}
