package com.docqa.rag.dto;

import com.docqa.rag.service.BatchItemResult;

import java.util.function.Function;

public record BatchItemResponse<T>(
        int index,
        boolean success,
        T result,
        String error,
        String message
) {
    public static <S, T> BatchItemResponse<T> from(BatchItemResult<S> item, Function<S, T> mapper) {
        if (item.isSuccess()) {
            return new BatchItemResponse<>(item.index(), true, mapper.apply(item.value()), null, null);
        }
        return new BatchItemResponse<>(item.index(), false, null, item.error().name(), item.message());
    }
}
