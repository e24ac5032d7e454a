package org.pragmatica.plc.error;

import org.pragmatica.plc.tree.SourceExcerpt;
import org.pragmatica.plc.tree.SourceSpan;

/**
 * Parse error types.
 */
public sealed interface ParseError {

    SourceSpan span();

    String message();

    default String formatWithSource(String source) {
        return SourceExcerpt.render("error: " + message(), span(), source);
    }

    /**
     * Security errors abort parsing even in recovering mode.
     */
    default boolean isFatal() {
        return this instanceof SecurityLimit;
    }

    record UnexpectedToken(SourceSpan span, String expected, String found) implements ParseError {
        @Override
        public String message() {
            return "expected " + expected + ", found " + found;
        }
    }

    record InvalidStatement(SourceSpan span, String detail) implements ParseError {
        @Override
        public String message() {
            return "invalid statement: " + detail;
        }
    }

    record InvalidExpression(SourceSpan span, String detail) implements ParseError {
        @Override
        public String message() {
            return "invalid expression: " + detail;
        }
    }

    record InvalidDeclaration(SourceSpan span, String detail) implements ParseError {
        @Override
        public String message() {
            return "invalid declaration: " + detail;
        }
    }

    record InvalidDirectAddress(SourceSpan span, String text) implements ParseError {
        @Override
        public String message() {
            return "invalid direct address '" + text + "'";
        }
    }

    record UnexpectedEof(SourceSpan span, String expected) implements ParseError {
        @Override
        public String message() {
            return "unexpected end of input, expected " + expected;
        }
    }

    record MissingTerminator(SourceSpan span, String terminator) implements ParseError {
        @Override
        public String message() {
            return "missing terminator '" + terminator + "'";
        }
    }

    record UnclosedBracket(SourceSpan span) implements ParseError {
        @Override
        public String message() {
            return "unclosed bracket '['";
        }
    }

    record UnclosedParen(SourceSpan span) implements ParseError {
        @Override
        public String message() {
            return "unclosed parenthesis '('";
        }
    }

    record UnclosedString(SourceSpan span) implements ParseError {
        @Override
        public String message() {
            return "unclosed string literal";
        }
    }

    record UnterminatedComment(SourceSpan span) implements ParseError {
        @Override
        public String message() {
            return "unterminated block comment";
        }
    }

    record InvalidNumber(SourceSpan span, String text) implements ParseError {
        @Override
        public String message() {
            return "invalid number '" + text + "'";
        }
    }

    record InvalidTimeUnit(SourceSpan span, String text) implements ParseError {
        @Override
        public String message() {
            return "invalid unit in time literal '" + text + "'";
        }
    }

    record SecurityLimit(SourceSpan span, SecurityError error) implements ParseError {
        @Override
        public String message() {
            return "security limit exceeded: " + error.message();
        }
    }
}
