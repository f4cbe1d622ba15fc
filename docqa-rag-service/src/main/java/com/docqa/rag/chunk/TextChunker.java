package com.docqa.rag.chunk;

import com.docqa.rag.error.InvalidChunkConfigException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into overlapping windows of at most {@code maxChars} characters.
 *
 * <p>Each window ends at a sentence end or whitespace found within the last
 * {@code lookbackChars} characters when one exists; otherwise it is cut at
 * {@code maxChars}. The next window starts {@code overlapChars} before the end
 * of the previous one. Windows are exact substrings of the input, so the source
 * can be rebuilt from them with {@link #reconstruct(List)}.
 */
public class TextChunker {

    private final int maxChars;
    private final int overlapChars;
    private final int lookbackChars;

    public TextChunker(int maxChars, int overlapChars, int lookbackChars) {
        validate(maxChars, overlapChars);
        if (lookbackChars < 0) {
            throw new InvalidChunkConfigException("lookbackChars must be >= 0, got " + lookbackChars);
        }
        this.maxChars = maxChars;
        this.overlapChars = overlapChars;
        this.lookbackChars = lookbackChars;
    }

    public TextChunker(int maxChars, int overlapChars) {
        this(maxChars, overlapChars, Math.min(100, maxChars / 10));
    }

    public int getMaxChars() {
        return maxChars;
    }

    public int getOverlapChars() {
        return overlapChars;
    }

    public static List<String> chunk(String text, int maxChars, int overlapChars) {
        return new TextChunker(maxChars, overlapChars).chunk(text);
    }

    public List<String> chunk(String text) {
        return split(text).stream().map(TextSegment::text).toList();
    }

    public List<TextSegment> split(String text) {
        if (text == null || text.isEmpty()) return List.of();

        int n = text.length();
        List<TextSegment> out = new ArrayList<>();
        int start = 0;
        while (true) {
            int end = Math.min(start + maxChars, n);
            if (end < n) {
                end = findBreak(text, start, end);
            }
            out.add(new TextSegment(out.size(), text.substring(start, end), start, end));
            if (end >= n) break;
            start = end - overlapChars;
        }
        return out;
    }

    /**
     * Rebuilds the source text by dropping the overlapping prefix of every
     * segment after the first.
     */
    public static String reconstruct(List<TextSegment> segments) {
        StringBuilder sb = new StringBuilder();
        int covered = 0;
        for (TextSegment s : segments) {
            int skip = Math.max(0, covered - s.startOffset());
            if (skip < s.text().length()) {
                sb.append(s.text(), skip, s.text().length());
            }
            covered = Math.max(covered, s.endOffset());
        }
        return sb.toString();
    }

    // The break must leave the window longer than the overlap so the next start advances.
    private int findBreak(String text, int start, int hardEnd) {
        int floor = Math.max(start + overlapChars + 1, hardEnd - lookbackChars);
        if (floor >= hardEnd) return hardEnd;

        for (int i = hardEnd; i > floor; i--) {
            if (isSentenceEnd(text, i)) return i;
        }
        for (int i = hardEnd; i > floor; i--) {
            if (Character.isWhitespace(text.charAt(i - 1))) return i;
        }
        return hardEnd;
    }

    // True when position i directly follows sentence punctuation and the next char is whitespace.
    private static boolean isSentenceEnd(String text, int i) {
        char prev = text.charAt(i - 1);
        if (prev != '.' && prev != '!' && prev != '?' && prev != '\n') return false;
        return i >= text.length() || Character.isWhitespace(text.charAt(i));
    }

    private static void validate(int maxChars, int overlapChars) {
        if (maxChars <= 0) {
            throw new InvalidChunkConfigException("maxChars must be > 0, got " + maxChars);
        }
        if (overlapChars < 0) {
            throw new InvalidChunkConfigException("overlapChars must be >= 0, got " + overlapChars);
        }
        if (overlapChars >= maxChars) {
            throw new InvalidChunkConfigException(
                    "overlapChars (" + overlapChars + ") must be smaller than maxChars (" + maxChars + ")");
        }
    }
}
