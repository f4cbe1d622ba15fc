package com.docqa.rag.error;

/**
 * Base class for every failure the core reports to its callers.
 * The {@link ErrorCode} is what the REST layer and batch results expose.
 */
public abstract class DocQaException extends RuntimeException {

    private final ErrorCode code;

    protected DocQaException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected DocQaException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
