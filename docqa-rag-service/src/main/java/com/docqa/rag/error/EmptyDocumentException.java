package com.docqa.rag.error;

public class EmptyDocumentException extends DocQaException {

    public EmptyDocumentException(String filename) {
        super(ErrorCode.EMPTY_DOCUMENT, "No extractable text in document: " + filename);
    }
}
