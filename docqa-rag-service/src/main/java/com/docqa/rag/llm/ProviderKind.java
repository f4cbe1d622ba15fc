package com.docqa.rag.llm;

public enum ProviderKind {
    EMBEDDING,
    GENERATION
}
