package com.docqa.rag.error;

import com.docqa.rag.store.DocumentStatus;

public class InvalidStateTransitionException extends DocQaException {

    private final DocumentStatus from;
    private final DocumentStatus to;

    public InvalidStateTransitionException(String documentId, DocumentStatus from, DocumentStatus to) {
        super(ErrorCode.INVALID_STATE_TRANSITION,
                "Document " + documentId + " cannot move from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public DocumentStatus getFrom() {
        return from;
    }

    public DocumentStatus getTo() {
        return to;
    }
}
