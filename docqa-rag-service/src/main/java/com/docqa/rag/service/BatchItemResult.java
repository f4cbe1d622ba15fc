package com.docqa.rag.service;

import com.docqa.rag.error.DocQaException;
import com.docqa.rag.error.ErrorCode;

/**
 * Outcome of one batch item, at the same position as its input.
 * Exactly one of {@code value} and {@code error} is set.
 */
public record BatchItemResult<T>(
        int index,
        T value,
        ErrorCode error,
        String message
) {
    public static <T> BatchItemResult<T> success(int index, T value) {
        return new BatchItemResult<>(index, value, null, null);
    }

    public static <T> BatchItemResult<T> failure(int index, Throwable cause) {
        if (cause instanceof DocQaException) {
            return new BatchItemResult<>(index, null, ((DocQaException) cause).getCode(), cause.getMessage());
        }
        String message = cause == null ? "unknown error" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return new BatchItemResult<>(index, null, ErrorCode.INTERNAL_ERROR, message);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
