package com.docqa.rag.chunk;

/**
 * A window of the source text, [startOffset, endOffset).
 */
public record TextSegment(
        int index,
        String text,
        int startOffset,
        int endOffset
) {
    public int length() {
        return endOffset - startOffset;
    }

    /** Rough token count, four characters per token. */
    public int tokenEstimate() {
        return (text.length() + 3) / 4;
    }
}
