package com.docqa.rag.error;

import com.docqa.rag.llm.ProviderError;

import java.util.List;
import java.util.stream.Collectors;

public class AllProvidersExhaustedException extends DocQaException {

    private final List<ProviderError> errors;

    public AllProvidersExhaustedException(List<ProviderError> errors) {
        super(ErrorCode.ALL_PROVIDERS_EXHAUSTED, buildMessage(errors));
        this.errors = List.copyOf(errors);
    }

    public List<ProviderError> getErrors() {
        return errors;
    }

    private static String buildMessage(List<ProviderError> errors) {
        if (errors.isEmpty()) {
            return "No generation provider was attempted";
        }
        return "All providers failed: " + errors.stream()
                .map(e -> e.provider() + " (" + e.kind() + ": " + e.message() + ")")
                .collect(Collectors.joining(", "));
    }
}
