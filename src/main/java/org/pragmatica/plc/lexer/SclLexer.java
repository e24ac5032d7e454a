package org.pragmatica.plc.lexer;

import org.pragmatica.plc.error.ParseError;
import org.pragmatica.plc.parser.ParserLimits;

import java.util.List;

/**
 * Lexer for Siemens SCL.
 *
 * <p>Differences from the common rules: {@code "Name"} is a quoted identifier rather than a wide string,
 * {@code #name} marks a block-local variable, {@code { ... }} is a pragma token, compound assignment
 * operators are recognized and the {@code %P} peripheral area is accepted.
 */
public final class SclLexer extends StLexer {

    private SclLexer(String input, ParserLimits limits) {
        super(input, limits);
    }

    public static SclLexer create(String input) {
        return new SclLexer(input, ParserLimits.DEFAULT);
    }

    public static SclLexer create(String input, ParserLimits limits) {
        return new SclLexer(input, limits);
    }

    public static List<Token> tokenize(String input) {
        return create(input).tokenizeAll();
    }

    @Override
    public Dialect dialect() {
        return Dialect.SCL;
    }

    @Override
    protected Token scanDialectToken(int start, char c) {
        if (c == '"') {
            return scanQuotedIdentifier(start, false);
        }
        if (c == '#' && (isIdentifierStart(peekNext()) || peekNext() == '"')) {
            advance();
            if (peek() == '"') {
                return scanQuotedIdentifier(start, true);
            }
            return new Token.Identifier(span(start), readIdentifierText(), false, true);
        }
        if (c == '{' && (Character.isWhitespace(peekNext()) || isIdentifierStart(peekNext()))) {
            return scanPragma(start);
        }
        return null;
    }

    @Override
    protected boolean allowsCompoundAssignment() {
        return true;
    }

    @Override
    protected boolean allowsPeripheralArea() {
        return true;
    }

    private Token scanQuotedIdentifier(int start, boolean local) {
        advance();
        // skip opening quote
        int nameStart = pos;
        while (!isAtEnd() && peek() != '"' && peek() != '\n') {
            advance();
        }
        if (isAtEnd() || peek() != '"') {
            return new Token.Invalid(span(start), new ParseError.UnclosedString(span(start)));
        }
        var name = input.substring(nameStart, pos);
        advance();
        // skip closing quote
        return new Token.Identifier(span(start), name, true, local);
    }

    private Token scanPragma(int start) {
        int end = input.indexOf('}', pos);

        if (end < 0) {
            pos = input.length();
            return new Token.Invalid(span(start), new ParseError.MissingTerminator(span(start), "}"));
        }
        var content = input.substring(pos + 1, end).trim();
        pos = end + 1;
        return new Token.Pragma(span(start), content);
    }
}
