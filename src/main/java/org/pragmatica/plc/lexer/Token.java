package org.pragmatica.plc.lexer;

import org.pragmatica.plc.ast.DirectAddress;
import org.pragmatica.plc.ast.TimeKind;
import org.pragmatica.plc.error.ParseError;
import org.pragmatica.plc.tree.SourceSpan;

/**
 * Tokens produced by the Structured Text lexers.
 */
public sealed interface Token {

    SourceSpan span();

    /**
     * Short human-readable form used in error messages.
     */
    String describe();

    default boolean is(Keyword keyword) {
        return this instanceof Reserved reserved && reserved.keyword() == keyword;
    }

    default boolean is(Symbol symbol) {
        return this instanceof Punct punct && punct.symbol() == symbol;
    }

    record Reserved(SourceSpan span, Keyword keyword, String text) implements Token {
        @Override
        public String describe() {
            return "'" + keyword.name() + "'";
        }
    }

    /**
     * @param quoted SCL {@code "Name"} spelling
     * @param local  SCL {@code #name} spelling
     */
    record Identifier(SourceSpan span, String name, boolean quoted, boolean local) implements Token {
        @Override
        public String describe() {
            return "identifier '" + name + "'";
        }
    }

    record IntLiteral(SourceSpan span, long value, String text) implements Token {
        @Override
        public String describe() {
            return "integer " + text;
        }
    }

    record RealLiteral(SourceSpan span, double value, String text) implements Token {
        @Override
        public String describe() {
            return "real " + text;
        }
    }

    record StringLiteral(SourceSpan span, String value, boolean wide) implements Token {
        @Override
        public String describe() {
            return "string literal";
        }
    }

    record TimeLiteral(SourceSpan span, TimeKind kind, String text) implements Token {
        @Override
        public String describe() {
            return "time literal " + text;
        }
    }

    record Address(SourceSpan span, DirectAddress address) implements Token {
        @Override
        public String describe() {
            return "address " + address.text();
        }
    }

    record Punct(SourceSpan span, Symbol symbol) implements Token {
        @Override
        public String describe() {
            return "'" + symbol.text() + "'";
        }
    }

    record Pragma(SourceSpan span, String content) implements Token {
        @Override
        public String describe() {
            return "pragma";
        }
    }

    /**
     * A character no rule accepts. Always one character wide.
     */
    record Unknown(SourceSpan span, char character) implements Token {
        @Override
        public String describe() {
            return "unexpected character '" + character + "'";
        }
    }

    /**
     * Malformed literal or comment. The parser reports the carried error when it reaches this token.
     */
    record Invalid(SourceSpan span, ParseError error) implements Token {
        @Override
        public String describe() {
            return error.message();
        }
    }

    record Eof(SourceSpan span) implements Token {
        @Override
        public String describe() {
            return "end of input";
        }
    }
}
