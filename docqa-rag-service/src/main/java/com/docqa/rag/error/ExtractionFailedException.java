package com.docqa.rag.error;

public class ExtractionFailedException extends DocQaException {

    public ExtractionFailedException(String message) {
        super(ErrorCode.EXTRACTION_FAILED, message);
    }

    public ExtractionFailedException(String message, Throwable cause) {
        super(ErrorCode.EXTRACTION_FAILED, message, cause);
    }
}
