package com.docqa.rag.error;

public enum ErrorCode {
    UNSUPPORTED_FORMAT,
    EMPTY_DOCUMENT,
    EXTRACTION_FAILED,
    INVALID_CHUNK_CONFIG,
    EMBEDDING_FAILURE,
    DIMENSION_MISMATCH,
    INVALID_STATE_TRANSITION,
    ALL_PROVIDERS_EXHAUSTED,
    NOT_FOUND,
    CANCELLED,
    INVALID_REQUEST,
    INTERNAL_ERROR
}
