package com.docqa.rag.llm;

public interface GenerationProvider {

    String getName();

    String getModel();

    /**
     * Generates a whole answer for the prompt.
     *
     * @throws ProviderException when the call fails or the response cannot be used
     */
    String generate(String prompt, double temperature, int maxTokens);

    /**
     * Health check; may perform a network call.
     */
    default boolean isAvailable() {
        return true;
    }
}
