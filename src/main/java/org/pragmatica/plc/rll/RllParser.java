package org.pragmatica.plc.rll;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for the neutral text form of ladder rungs.
 *
 * <pre>
 * rung        = element* ";"
 * element     = instruction | parallel
 * parallel    = "[" branch ("," branch)* "]"
 * branch      = element+
 * instruction = MNEMONIC "(" [operand ("," operand)*] ")"
 * operand     = "?" | text with balanced () and []
 * </pre>
 *
 * Text after the terminating {@code ;} is ignored.
 */
public final class RllParser {
    private final String input;
    private int pos;

    private RllParser(String input) {
        this.input = input;
        this.pos = 0;
    }

    /**
     * Parse one rung. A blank rung parses to an empty element list; failures are kept on the returned rung.
     */
    public static Rung parseRung(String text) {
        if (text.isBlank()) {
            return Rung.parsed(text, List.of());
        }
        try {
            return Rung.parsed(text, new RllParser(text).rung());
        } catch (RllFailure failure) {
            return Rung.failed(text, failure.error);
        }
    }

    /**
     * Parse several rungs, one per element of the list.
     */
    public static List<Rung> parseRungs(List<String> texts) {
        var rungs = new ArrayList<Rung>(texts.size());
        texts.forEach(text -> rungs.add(parseRung(text)));
        return rungs;
    }

    // === Grammar ===

    private List<RungElement> rung() {
        var elements = new ArrayList<RungElement>();

        skipWhitespace();
        while (!isAtEnd() && peek() != ';') {
            elements.add(element());
            skipWhitespace();
        }
        if (isAtEnd()) {
            throw fail(new RllError.MissingTerminator());
        }
        pos++;
        return elements;
    }

    private RungElement element() {
        char c = peek();

        if (c == '[') {
            return parallel();
        }
        if (isMnemonicStart(c)) {
            return instruction();
        }
        throw fail(new RllError.UnexpectedChar(c, pos));
    }

    private RungElement parallel() {
        int open = pos++;
        var branches = new ArrayList<RungElement.Branch>();

        while (true) {
            branches.add(branch(open));
            skipWhitespace();
            if (isAtEnd()) {
                throw fail(new RllError.UnclosedBracket(open));
            }
            char c = advance();
            if (c == ']') {
                return new RungElement.Parallel(branches);
            }
            if (c != ',') {
                throw fail(new RllError.UnexpectedChar(c, pos - 1));
            }
        }
    }

    private RungElement.Branch branch(int open) {
        var elements = new ArrayList<RungElement>();

        skipWhitespace();
        while (!isAtEnd() && peek() != ',' && peek() != ']') {
            if (peek() == ';') {
                throw fail(new RllError.UnclosedBracket(open));
            }
            elements.add(element());
            skipWhitespace();
        }
        if (isAtEnd()) {
            throw fail(new RllError.UnclosedBracket(open));
        }
        if (elements.isEmpty()) {
            throw fail(new RllError.Expected("branch element", pos));
        }
        return new RungElement.Branch(elements);
    }

    private RungElement.Instruction instruction() {
        int start = pos;

        while (!isAtEnd() && isMnemonicPart(peek())) {
            pos++;
        }
        var mnemonic = input.substring(start, pos);
        if (mnemonic.isEmpty()) {
            throw fail(new RllError.InvalidInstruction(start));
        }
        skipWhitespace();
        if (isAtEnd()) {
            throw fail(new RllError.UnexpectedEof());
        }
        if (peek() != '(') {
            throw fail(new RllError.Expected("'('", pos));
        }
        int open = pos++;
        var operands = new ArrayList<Operand>();

        skipWhitespace();
        if (!isAtEnd() && peek() == ')') {
            pos++;
            return new RungElement.Instruction(mnemonic, operands);
        }
        while (true) {
            operands.add(operand(open));
            if (isAtEnd()) {
                throw fail(new RllError.UnclosedParen(open));
            }
            char c = advance();
            if (c == ')') {
                return new RungElement.Instruction(mnemonic, operands);
            }
            if (c != ',') {
                throw fail(new RllError.UnexpectedChar(c, pos - 1));
            }
        }
    }

    /**
     * Operand text up to the next {@code ,} or {@code )} outside nested parentheses and brackets.
     */
    private Operand operand(int instructionOpen) {
        skipWhitespace();
        if (!isAtEnd() && peek() == '?') {
            pos++;
            skipWhitespace();
            return Operand.inferred();
        }
        int start = pos;
        int parenDepth = 0;
        int bracketDepth = 0;
        int lastParen = -1;
        int lastBracket = -1;

        while (!isAtEnd()) {
            char c = peek();
            if (c == '(') {
                parenDepth++;
                lastParen = pos;
            } else if (c == ')') {
                if (parenDepth == 0) {
                    break;
                }
                parenDepth--;
            } else if (c == '[') {
                bracketDepth++;
                lastBracket = pos;
            } else if (c == ']') {
                if (bracketDepth == 0) {
                    break;
                }
                bracketDepth--;
            } else if (c == ',' && parenDepth == 0 && bracketDepth == 0) {
                break;
            }
            pos++;
        }
        if (isAtEnd()) {
            if (bracketDepth > 0) {
                throw fail(new RllError.UnclosedBracket(lastBracket));
            }
            throw fail(new RllError.UnclosedParen(parenDepth > 0 ? lastParen : instructionOpen));
        }
        var text = input.substring(start, pos).trim();
        if (text.isEmpty()) {
            throw fail(new RllError.Expected("operand", start));
        }
        return Operand.value(text);
    }

    // === Helper methods ===

    private static boolean isMnemonicStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isMnemonicPart(char c) {
        return isMnemonicStart(c) || (c >= '0' && c <= '9');
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private static RllFailure fail(RllError error) {
        return new RllFailure(error);
    }

    private static final class RllFailure extends RuntimeException {
        private final RllError error;

        RllFailure(RllError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }
    }
}
