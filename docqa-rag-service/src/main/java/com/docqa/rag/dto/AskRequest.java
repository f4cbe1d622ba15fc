package com.docqa.rag.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record AskRequest(
        @NotBlank String question,
        List<String> documentIds,
        String provider,
        Integer k
) {}
