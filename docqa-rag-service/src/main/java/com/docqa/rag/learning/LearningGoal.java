package com.docqa.rag.learning;

/**
 * One topic the learner wants to reach, with their current level and weekly time.
 */
public record LearningGoal(
        String topic,
        ProficiencyLevel proficiencyLevel,
        String timeCommitment
) {}
