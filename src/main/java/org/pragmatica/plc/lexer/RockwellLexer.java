package org.pragmatica.plc.lexer;

import org.pragmatica.plc.parser.ParserLimits;

import java.util.List;

/**
 * Lexer for Rockwell Logix Structured Text.
 *
 * <p>Module-qualified tag names such as {@code Local:1:I} lex as one identifier, and {@code [:=]}
 * is the non-retentive assignment operator.
 */
public final class RockwellLexer extends StLexer {

    private RockwellLexer(String input, ParserLimits limits) {
        super(input, limits);
    }

    public static RockwellLexer create(String input) {
        return new RockwellLexer(input, ParserLimits.DEFAULT);
    }

    public static RockwellLexer create(String input, ParserLimits limits) {
        return new RockwellLexer(input, limits);
    }

    public static List<Token> tokenize(String input) {
        return create(input).tokenizeAll();
    }

    @Override
    public Dialect dialect() {
        return Dialect.ROCKWELL;
    }

    @Override
    protected Token scanDialectToken(int start, char c) {
        if (c == '[' && peekAt(1) == ':' && peekAt(2) == '=' && peekAt(3) == ']') {
            pos += 4;
            return new Token.Punct(span(start), Symbol.NON_RETENTIVE_ASSIGN);
        }
        return null;
    }

    /**
     * {@code Local:1:I} and {@code Rack:3} carry slot numbers after the module name.
     */
    @Override
    protected String extendIdentifier(String text) {
        var sb = new StringBuilder(text);

        while (peekIs(':') && isDigit(peekNext())) {
            sb.append(advance());
            while (!isAtEnd() && isDigit(peek())) {
                sb.append(advance());
            }
        }
        if (sb.length() > text.length() && peekIs(':') && isIdentifierStart(peekNext()) && !isIdentifierPart(peekAt(2))) {
            sb.append(advance()).append(advance());
        }
        return sb.toString();
    }

    private boolean peekIs(char c) {
        return !isAtEnd() && peek() == c;
    }
}
