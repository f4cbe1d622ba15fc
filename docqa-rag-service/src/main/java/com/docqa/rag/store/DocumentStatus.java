package com.docqa.rag.store;

/**
 * Ingestion lifecycle. Statuses only move forward in declaration order, except
 * that any in-progress status may move to {@link #FAILED}. READY and FAILED are terminal.
 */
public enum DocumentStatus {
    UPLOADING,
    EXTRACTING,
    CHUNKING,
    EMBEDDING,
    READY,
    FAILED;

    public boolean isTerminal() {
        return this == READY || this == FAILED;
    }

    public boolean canTransitionTo(DocumentStatus next) {
        if (next == null || isTerminal()) return false;
        if (next == FAILED) return true;
        return next.ordinal() > ordinal();
    }
}
