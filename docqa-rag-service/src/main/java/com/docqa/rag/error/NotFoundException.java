package com.docqa.rag.error;

public class NotFoundException extends DocQaException {

    public NotFoundException(String kind, String id) {
        super(ErrorCode.NOT_FOUND, kind + " not found: " + id);
    }

    public static NotFoundException document(String documentId) {
        return new NotFoundException("Document", documentId);
    }
}
