package com.docqa.rag.error;

public class InvalidChunkConfigException extends DocQaException {

    public InvalidChunkConfigException(String message) {
        super(ErrorCode.INVALID_CHUNK_CONFIG, message);
    }

    public InvalidChunkConfigException(String message, Throwable cause) {
        super(ErrorCode.INVALID_CHUNK_CONFIG, message, cause);
    }
}
