package com.docqa.rag.dto;

import jakarta.validation.constraints.NotBlank;

public record SummarizeRequest(
        @NotBlank String text,
        Integer maxLength,
        String provider
) {
    public static final int DEFAULT_MAX_LENGTH = 150;

    public int maxLengthOrDefault() {
        return maxLength != null ? maxLength : DEFAULT_MAX_LENGTH;
    }
}
