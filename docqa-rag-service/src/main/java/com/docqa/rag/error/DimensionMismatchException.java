package com.docqa.rag.error;

public class DimensionMismatchException extends DocQaException {

    public DimensionMismatchException(String message) {
        super(ErrorCode.DIMENSION_MISMATCH, message);
    }

    public DimensionMismatchException(String message, Throwable cause) {
        super(ErrorCode.DIMENSION_MISMATCH, message, cause);
    }
}
