package org.pragmatica.plc.tree;

import java.util.Collection;

/**
 * A half-open range {@code [start, end)} of byte offsets into the UTF-8 encoded source text.
 * Spans are attached to every token, AST node and diagnostic.
 */
public record SourceSpan(int start, int end) {

    public static final SourceSpan EMPTY = new SourceSpan(0, 0);

    public SourceSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span " + start + ".." + end);
        }
    }

    public static SourceSpan of(int start, int end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(int offset) {
        return new SourceSpan(offset, offset);
    }

    /**
     * Smallest span covering all given spans, or {@code fallback} when there are none.
     */
    public static SourceSpan covering(Collection<SourceSpan> spans, SourceSpan fallback) {
        SourceSpan result = null;

        for (var span : spans) {
            result = result == null ? span : result.merge(span);
        }
        return result == null ? fallback : result;
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public SourceSpan merge(SourceSpan other) {
        return new SourceSpan(Math.min(start, other.start), Math.max(end, other.end));
    }

    public boolean contains(SourceSpan other) {
        return start <= other.start && end >= other.end;
    }

    public SourceLocation startLocation(String source) {
        return SourceLocation.of(source, start);
    }

    /**
     * Extract the text covered by this span. Out-of-range spans are clamped to the source.
     */
    public String extract(String source) {
        var offsets = Utf8Offsets.of(source);
        return source.substring(offsets.charIndex(start), offsets.charIndex(end));
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
