package org.pragmatica.plc.tree;

/**
 * A position in source text: 1-based line, 1-based character column, and the byte offset it was computed from.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Resolve a byte offset into line and column. Offsets past the end are clamped.
     */
    public static SourceLocation of(String source, int offset) {
        var offsets = Utf8Offsets.of(source);
        int limit = offsets.charIndex(offset);
        int line = 1;
        int lineStart = 0;

        for (int i = 0; i < limit; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new SourceLocation(line, limit - lineStart + 1, offsets.byteOffset(limit));
    }

    /**
     * Text of the line this location falls on, without the line terminator.
     */
    public String lineText(String source) {
        int index = Utf8Offsets.of(source).charIndex(offset);
        int start = Math.max(index - (column - 1), 0);
        int end = source.indexOf('\n', start);

        if (end < 0) {
            end = source.length();
        }
        if (end > start && source.charAt(end - 1) == '\r') {
            end--;
        }
        return source.substring(Math.max(start, 0), end);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
