package org.pragmatica.plc.lexer;

import org.pragmatica.plc.ast.DirectAddress;
import org.pragmatica.plc.ast.TimeKind;
import org.pragmatica.plc.error.ParseError;
import org.pragmatica.plc.error.SecurityError;
import org.pragmatica.plc.parser.ParserLimits;
import org.pragmatica.plc.tree.SourceSpan;
import org.pragmatica.plc.tree.Utf8Offsets;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Lexer for IEC 61131-3 Structured Text. Dialect lexers extend it and override the scanning hooks.
 *
 * <p>The lexer never fails: unknown characters become {@link Token.Unknown}, malformed literals and comments
 * become {@link Token.Invalid}, and {@link Token.Eof} is returned indefinitely once the input is exhausted.
 */
public class StLexer {
    private static final int DEFAULT_TOKEN_CAPACITY = 32;
    private static final Pattern DURATION = Pattern.compile(
        "-?(\\d+(\\.\\d+)?(d|h|ms|m|s|us|ns)_?)+", Pattern.CASE_INSENSITIVE);

    protected final String input;
    private final ParserLimits limits;
    private final Utf8Offsets offsets;
    protected int pos;

    protected StLexer(String input, ParserLimits limits) {
        this.input = input;
        this.limits = limits;
        this.offsets = Utf8Offsets.of(input);
        this.pos = !input.isEmpty() && input.charAt(0) == '\uFEFF' ? 1 : 0;
    }

    public static StLexer create(String input) {
        return new StLexer(input, ParserLimits.DEFAULT);
    }

    public static StLexer create(String input, ParserLimits limits) {
        return new StLexer(input, limits);
    }

    public static List<Token> tokenize(String input) {
        return create(input).tokenizeAll();
    }

    public Dialect dialect() {
        return Dialect.GENERIC;
    }

    /**
     * All tokens up to and including the first {@link Token.Eof}.
     */
    public List<Token> tokenizeAll() {
        var tokens = new ArrayList<Token>();

        while (true) {
            var token = nextToken();
            tokens.add(token);
            if (token instanceof Token.Eof) {
                return tokens;
            }
        }
    }

    public Token nextToken() {
        var trivia = skipWhitespaceAndComments();
        if (trivia != null) {
            return trivia;
        }
        if (isAtEnd()) {
            return new Token.Eof(SourceSpan.at(offsets.byteLength()));
        }
        int start = pos;
        char c = peek();
        var special = scanDialectToken(start, c);
        if (special != null) {
            return special;
        }
        if (isIdentifierStart(c)) {
            return scanWord(start);
        }
        if (isDigit(c)) {
            return scanNumber(start);
        }
        if (c == '\'') {
            return scanString(start, '\'', false);
        }
        if (c == '"') {
            return scanString(start, '"', true);
        }
        if (c == '%') {
            return scanAddress(start);
        }
        return scanOperator(start);
    }

    // === Dialect hooks ===

    /**
     * Scan a dialect-specific token starting at {@code c}, or return {@code null} to use the common rules.
     */
    protected Token scanDialectToken(int start, char c) {
        return null;
    }

    protected boolean allowsCompoundAssignment() {
        return false;
    }

    protected boolean allowsPeripheralArea() {
        return false;
    }

    /**
     * Extend an identifier that has just been scanned. Returns the full identifier text.
     */
    protected String extendIdentifier(String text) {
        return text;
    }

    // === Trivia ===

    private Token skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else if (c == '(' && peekNext() == '*') {
                int start = pos;
                if (!skipNestedComment()) {
                    return new Token.Invalid(span(start), new ParseError.UnterminatedComment(span(start)));
                }
            } else if (c == '/' && peekNext() == '*') {
                int start = pos;
                int end = input.indexOf("*/", pos + 2);
                if (end < 0) {
                    pos = input.length();
                    return new Token.Invalid(span(start), new ParseError.UnterminatedComment(span(start)));
                }
                pos = end + 2;
            } else {
                return null;
            }
        }
        return null;
    }

    private boolean skipNestedComment() {
        int depth = 0;

        while (!isAtEnd()) {
            if (peek() == '(' && peekNext() == '*') {
                depth++;
                pos += 2;
            } else if (peek() == '*' && peekNext() == ')') {
                depth--;
                pos += 2;
                if (depth == 0) {
                    return true;
                }
            } else {
                advance();
            }
        }
        return false;
    }

    // === Words ===

    protected Token scanWord(int start) {
        var text = extendIdentifier(readIdentifierText());

        if (!isAtEnd() && peek() == '#') {
            var timeKind = TimeKind.fromPrefix(text);
            if (timeKind != null) {
                return scanTimeLiteral(start, timeKind);
            }
            var keyword = Keyword.lookup(text, dialect());
            if (keyword.isPresent() && keyword.get().isTypeName()) {
                return scanTypedLiteral(start);
            }
        }
        return Keyword.lookup(text, dialect())
                      .<Token>map(keyword -> new Token.Reserved(span(start), keyword, text))
                      .orElseGet(() -> new Token.Identifier(span(start), text, false, false));
    }

    protected String readIdentifierText() {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);

        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        return sb.toString();
    }

    private Token scanTimeLiteral(int start, TimeKind kind) {
        advance();
        // skip #
        int contentStart = pos;
        while (!isAtEnd() && isTimeLiteralPart(peek())) {
            if (peek() == '-' && kind.isDuration() && pos != contentStart) {
                break;
            }
            advance();
        }
        var text = input.substring(start, pos);
        var content = text.substring(text.indexOf('#') + 1);

        if (kind.isDuration() && !DURATION.matcher(content).matches()) {
            return new Token.Invalid(span(start), new ParseError.InvalidTimeUnit(span(start), text));
        }
        if (content.isEmpty()) {
            return new Token.Invalid(span(start), new ParseError.InvalidTimeUnit(span(start), text));
        }
        return new Token.TimeLiteral(span(start), kind, text);
    }

    /**
     * {@code INT#5}, {@code WORD#16#FF}, {@code BOOL#TRUE}: the type prefix is kept in the text only.
     */
    private Token scanTypedLiteral(int start) {
        advance();
        // skip #
        if (isAtEnd()) {
            return new Token.Invalid(span(start), new ParseError.InvalidNumber(span(start), input.substring(start)));
        }
        char c = peek();
        if (isDigit(c) || c == '-') {
            boolean negative = c == '-';
            if (negative) {
                advance();
            }
            var literal = scanNumber(pos);
            var text = input.substring(start, pos);
            if (literal instanceof Token.IntLiteral integer) {
                return new Token.IntLiteral(span(start), negative ? -integer.value() : integer.value(), text);
            }
            if (literal instanceof Token.RealLiteral real) {
                return new Token.RealLiteral(span(start), negative ? -real.value() : real.value(), text);
            }
            return literal;
        }
        if (isIdentifierStart(c)) {
            var word = readIdentifierText();
            var keyword = Keyword.lookup(word, dialect());
            if (keyword.isPresent() && (keyword.get() == Keyword.TRUE || keyword.get() == Keyword.FALSE)) {
                return new Token.Reserved(span(start), keyword.get(), input.substring(start, pos));
            }
        }
        return new Token.Invalid(span(start), new ParseError.InvalidNumber(span(start), input.substring(start, pos)));
    }

    // === Numbers ===

    protected Token scanNumber(int start) {
        var digits = readDigits();

        if (!isAtEnd() && peek() == '#') {
            return scanBasedNumber(start, digits);
        }
        if (!isAtEnd() && peek() == '.' && isDigit(peekNext())) {
            return scanReal(start, digits);
        }
        var text = input.substring(start, pos);
        try {
            return new Token.IntLiteral(span(start), parseInteger(digits, 10), text);
        } catch (NumberFormatException e) {
            return new Token.Invalid(span(start), new ParseError.InvalidNumber(span(start), text));
        }
    }

    private Token scanBasedNumber(int start, String baseDigits) {
        advance();
        // skip #
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && (isHexDigit(peek()) || peek() == '_')) {
            char c = advance();
            if (c != '_') {
                sb.append(c);
            }
        }
        var text = input.substring(start, pos);
        try {
            int radix = Integer.parseInt(baseDigits);
            if (radix != 2 && radix != 8 && radix != 10 && radix != 16) {
                throw new NumberFormatException("Unsupported base " + radix);
            }
            return new Token.IntLiteral(span(start), parseInteger(sb.toString(), radix), text);
        } catch (NumberFormatException e) {
            return new Token.Invalid(span(start), new ParseError.InvalidNumber(span(start), text));
        }
    }

    private Token scanReal(int start, String integerPart) {
        var sb = new StringBuilder(integerPart);
        sb.append(advance());
        // the '.'
        sb.append(readDigits());

        if (!isAtEnd() && (peek() == 'e' || peek() == 'E')) {
            int mark = pos;
            var exponent = new StringBuilder().append(advance());
            if (!isAtEnd() && (peek() == '+' || peek() == '-')) {
                exponent.append(advance());
            }
            if (!isAtEnd() && isDigit(peek())) {
                exponent.append(readDigits());
                sb.append(exponent);
            } else {
                pos = mark;
            }
        }
        var text = input.substring(start, pos);
        try {
            return new Token.RealLiteral(span(start), Double.parseDouble(sb.toString()), text);
        } catch (NumberFormatException e) {
            return new Token.Invalid(span(start), new ParseError.InvalidNumber(span(start), text));
        }
    }

    private String readDigits() {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);

        while (!isAtEnd() && (isDigit(peek()) || peek() == '_')) {
            char c = advance();
            if (c != '_') {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static long parseInteger(String digits, int radix) {
        if (digits.isEmpty()) {
            throw new NumberFormatException("No digits");
        }
        return radix == 10 ? Long.parseLong(digits) : Long.parseUnsignedLong(digits, radix);
    }

    // === Strings ===

    protected Token scanString(int start, char quote, boolean wide) {
        advance();
        // skip opening quote
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);

        while (!isAtEnd()) {
            char c = advance();
            if (c == quote) {
                if (!isAtEnd() && peek() == quote) {
                    sb.append(advance());
                    continue;
                }
                if (sb.length() > limits.maxStringLength()) {
                    var error = new SecurityError.StringTooLong(sb.length(), limits.maxStringLength());
                    return new Token.Invalid(span(start), new ParseError.SecurityLimit(span(start), error));
                }
                return new Token.StringLiteral(span(start), sb.toString(), wide);
            }
            if (c == '$' && !isAtEnd()) {
                appendEscape(sb);
            } else {
                sb.append(c);
            }
        }
        return new Token.Invalid(span(start), new ParseError.UnclosedString(span(start)));
    }

    private void appendEscape(StringBuilder sb) {
        char c = peek();

        switch (Character.toUpperCase(c)) {
            case 'L', 'N' -> sb.append('\n');
            case 'P' -> sb.append('\f');
            case 'R' -> sb.append('\r');
            case 'T' -> sb.append('\t');
            case '$', '\'', '"' -> sb.append(c);
            default -> {
                if (isHexDigit(c) && pos + 1 < input.length() && isHexDigit(input.charAt(pos + 1))) {
                    sb.append((char) Integer.parseInt(input.substring(pos, pos + 2), 16));
                    advance();
                } else {
                    sb.append('$').append(c);
                }
            }
        }
        advance();
    }

    // === Direct addresses ===

    protected Token scanAddress(int start) {
        advance();
        // skip %
        var area = isAtEnd() ? null : DirectAddress.Area.fromLetter(peek());

        if (area == null || (area == DirectAddress.Area.PERIPHERAL && !allowsPeripheralArea())) {
            return invalidAddress(start);
        }
        advance();
        var size = DirectAddress.Size.BIT;
        if (!isAtEnd() && !isDigit(peek())) {
            size = DirectAddress.Size.fromLetter(peek());
            if (size == null) {
                return invalidAddress(start);
            }
            advance();
        }
        if (isAtEnd() || !isDigit(peek())) {
            return invalidAddress(start);
        }
        int byteOffset;
        try {
            byteOffset = Integer.parseInt(readDigits());
        } catch (NumberFormatException e) {
            return invalidAddress(start);
        }
        var bit = OptionalInt.empty();
        if (!isAtEnd() && peek() == '.' && isDigit(peekNext())) {
            advance();
            bit = OptionalInt.of(Integer.parseInt(readDigits()));
        }
        var address = new DirectAddress(area, size, byteOffset, bit, input.substring(start, pos));
        return new Token.Address(span(start), address);
    }

    private Token invalidAddress(int start) {
        while (!isAtEnd() && (isIdentifierPart(peek()) || peek() == '.')) {
            advance();
        }
        var text = input.substring(start, Math.max(pos, start + 1));
        pos = Math.max(pos, start + 1);
        return new Token.Invalid(span(start), new ParseError.InvalidDirectAddress(span(start), text));
    }

    // === Operators ===

    protected Token scanOperator(int start) {
        char c = advance();

        var symbol = switch (c) {
            case ':' -> match('=') ? Symbol.ASSIGN : Symbol.COLON;
            case '=' -> match('>') ? Symbol.OUTPUT_ASSIGN : Symbol.EQ;
            case '<' -> match('>') ? Symbol.NE : match('=') ? Symbol.LE : Symbol.LT;
            case '>' -> match('=') ? Symbol.GE : Symbol.GT;
            case '*' -> match('*') ? Symbol.POWER : compound(Symbol.MUL_ASSIGN, Symbol.STAR);
            case '+' -> compound(Symbol.ADD_ASSIGN, Symbol.PLUS);
            case '-' -> compound(Symbol.SUB_ASSIGN, Symbol.MINUS);
            case '/' -> compound(Symbol.DIV_ASSIGN, Symbol.SLASH);
            case '.' -> match('.') ? Symbol.RANGE : Symbol.DOT;
            case '&' -> Symbol.AMPERSAND;
            case '(' -> Symbol.LPAREN;
            case ')' -> Symbol.RPAREN;
            case '[' -> Symbol.LBRACKET;
            case ']' -> Symbol.RBRACKET;
            case ',' -> Symbol.COMMA;
            case ';' -> Symbol.SEMICOLON;
            case '^' -> Symbol.CARET;
            case '#' -> Symbol.HASH;
            default -> null;
        };
        if (symbol == null) {
            return new Token.Unknown(span(start), c);
        }
        return new Token.Punct(span(start), symbol);
    }

    private Symbol compound(Symbol compound, Symbol plain) {
        if (allowsCompoundAssignment() && match('=')) {
            return compound;
        }
        return plain;
    }

    // === Helper methods ===

    protected boolean isAtEnd() {
        return pos >= input.length();
    }

    protected char peek() {
        return input.charAt(pos);
    }

    protected char peekNext() {
        return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
    }

    protected char peekAt(int offset) {
        return pos + offset < input.length() ? input.charAt(pos + offset) : '\0';
    }

    protected char advance() {
        return input.charAt(pos++);
    }

    protected boolean match(char expected) {
        if (!isAtEnd() && peek() == expected) {
            pos++;
            return true;
        }
        return false;
    }

    /**
     * Byte span from the character index {@code start} to the current position.
     */
    protected SourceSpan span(int start) {
        return SourceSpan.of(offsets.byteOffset(start), offsets.byteOffset(pos));
    }

    protected ParserLimits limits() {
        return limits;
    }

    protected static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    protected static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    protected static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isTimeLiteralPart(char c) {
        return isIdentifierPart(c) || c == ':' || c == '.' || c == '-';
    }
}
