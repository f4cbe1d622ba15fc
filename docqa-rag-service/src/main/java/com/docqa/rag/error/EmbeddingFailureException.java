package com.docqa.rag.error;

/**
 * An embedding call failed. For batch calls {@link #getFailedIndex()} is the
 * position of the first failing input, -1 for single calls.
 */
public class EmbeddingFailureException extends DocQaException {

    private final int failedIndex;

    public EmbeddingFailureException(int failedIndex, String message, Throwable cause) {
        super(ErrorCode.EMBEDDING_FAILURE, message, cause);
        this.failedIndex = failedIndex;
    }

    public EmbeddingFailureException(String message, Throwable cause) {
        this(-1, message, cause);
    }

    public int getFailedIndex() {
        return failedIndex;
    }
}
