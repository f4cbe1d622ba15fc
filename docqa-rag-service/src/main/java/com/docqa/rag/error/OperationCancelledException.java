package com.docqa.rag.error;

public class OperationCancelledException extends DocQaException {

    public OperationCancelledException(String message) {
        super(ErrorCode.CANCELLED, message);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super(ErrorCode.CANCELLED, message, cause);
    }
}
