package com.docqa.rag.learning;

import com.docqa.rag.error.InvalidRequestException;

import java.util.Locale;

public enum ProficiencyLevel {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED;

    /**
     * Case-insensitive; a missing level means BEGINNER.
     */
    public static ProficiencyLevel from(String value) {
        if (value == null || value.isBlank()) {
            return BEGINNER;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("proficiency_level must be beginner, intermediate or advanced, got '"
                    + value + "'");
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
