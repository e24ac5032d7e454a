package org.pragmatica.plc.rll;

import java.util.OptionalInt;

/**
 * Errors found while parsing ladder rung text. Positions are character offsets into the rung text.
 */
public sealed interface RllError {
    int CONTEXT_WIDTH = 80;
    int WINDOW_BEFORE = 30;
    int WINDOW_AFTER = 50;

    String message();

    default OptionalInt position() {
        return OptionalInt.empty();
    }

    /**
     * Multi-line rendering with the offending line and a caret under the error position.
     */
    default String formatWithContext(String source) {
        var sb = new StringBuilder("error: ").append(message()).append('\n');
        var position = position();

        if (position.isEmpty() || position.getAsInt() >= source.length()) {
            return sb.toString();
        }
        int pos = position.getAsInt();
        int lineStart = 0;
        int lineNumber = 1;
        for (int i = 0; i < pos; i++) {
            if (source.charAt(i) == '\n') {
                lineStart = i + 1;
                lineNumber++;
            }
        }
        int lineEnd = source.indexOf('\n', lineStart);
        var line = source.substring(lineStart, lineEnd < 0 ? source.length() : lineEnd);
        int column = pos - lineStart;

        sb.append(" --> position ").append(lineNumber).append(':').append(column).append('\n');

        var displayLine = line;
        int displayColumn = column;
        if (line.length() > CONTEXT_WIDTH) {
            int windowStart = Math.max(0, column - WINDOW_BEFORE);
            int windowEnd = Math.min(line.length(), column + WINDOW_AFTER);
            var prefix = windowStart > 0 ? "..." : "";
            var suffix = windowEnd < line.length() ? "..." : "";
            displayLine = prefix + line.substring(windowStart, windowEnd) + suffix;
            displayColumn = column - windowStart + prefix.length();
        }
        var gutter = lineNumber + " | ";
        sb.append(gutter).append(displayLine).append('\n');
        sb.append(" ".repeat(gutter.length() + displayColumn)).append("^ here");
        return sb.toString();
    }

    record UnexpectedChar(char character, int at) implements RllError {
        @Override
        public String message() {
            return "unexpected character '" + character + "' at position " + at;
        }

        @Override
        public OptionalInt position() {
            return OptionalInt.of(at);
        }
    }

    record Expected(String expected, int at) implements RllError {
        @Override
        public String message() {
            return "expected " + expected + " at position " + at;
        }

        @Override
        public OptionalInt position() {
            return OptionalInt.of(at);
        }
    }

    record UnclosedBracket(int at) implements RllError {
        @Override
        public String message() {
            return "unclosed bracket '[' at position " + at;
        }

        @Override
        public OptionalInt position() {
            return OptionalInt.of(at);
        }
    }

    record UnclosedParen(int at) implements RllError {
        @Override
        public String message() {
            return "unclosed parenthesis '(' at position " + at;
        }

        @Override
        public OptionalInt position() {
            return OptionalInt.of(at);
        }
    }

    record InvalidInstruction(int at) implements RllError {
        @Override
        public String message() {
            return "invalid instruction at position " + at;
        }

        @Override
        public OptionalInt position() {
            return OptionalInt.of(at);
        }
    }

    record EmptyInput() implements RllError {
        @Override
        public String message() {
            return "empty input";
        }
    }

    record MissingTerminator() implements RllError {
        @Override
        public String message() {
            return "missing rung terminator ';'";
        }
    }

    record UnexpectedEof() implements RllError {
        @Override
        public String message() {
            return "unexpected end of input";
        }
    }
}
