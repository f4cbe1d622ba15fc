package com.docqa.rag.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record AskBatchRequest(
        @NotEmpty List<String> questions,
        @NotEmpty List<String> documentIds,
        String provider,
        Integer k
) {}
