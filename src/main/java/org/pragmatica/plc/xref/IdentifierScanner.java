package org.pragmatica.plc.xref;

import org.pragmatica.plc.lexer.Keyword;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Dialect-tolerant identifier extraction from ST and IL text. Comments, pragmas, string, numeric and typed
 * literals, direct addresses, member names, keywords and standard functions are skipped. Named call
 * parameters ({@code IN := x}, {@code Q => y}) are skipped as well.
 */
final class IdentifierScanner {
    private static final Set<String> STANDARD_FUNCTIONS = Set.of(
        "ABS", "SQRT", "LN", "LOG", "EXP", "EXPT", "SIN", "COS", "TAN", "ASIN", "ACOS", "ATAN", "ATAN2",
        "MOVE", "ADD", "SUB", "MUL", "DIV", "SHL", "SHR", "ROL", "ROR", "SEL", "MAX", "MIN", "LIMIT", "MUX",
        "GT", "GE", "EQ", "LE", "LT", "NE", "LEN", "LEFT", "RIGHT", "MID", "CONCAT", "INSERT", "DELETE",
        "REPLACE", "FIND", "TRUNC", "ROUND", "SIZEOF", "ADR", "REF");
    private static final Set<String> IL_OPERATORS = Set.of(
        "LD", "LDN", "ST", "STN", "S", "R", "ANDN", "ORN", "XORN", "ADD", "SUB", "MUL", "DIV", "GT", "GE",
        "EQ", "NE", "LE", "LT", "JMP", "JMPC", "JMPCN", "CAL", "CALC", "CALCN", "RET", "RETC", "RETCN");
    private static final Pattern CONVERSION = Pattern.compile("[A-Z_]*TO_[A-Z_]+");

    /**
     * @param name     identifier as written
     * @param operand  identifier with its member path, e.g. {@code Motor.Status.Run}
     * @param callee   followed by {@code (}
     */
    record Identifier(String name, String operand, boolean callee) {}

    private final String text;
    private final boolean instructionList;
    private final List<Identifier> result = new ArrayList<>();
    private int pos;
    private int depth;

    private IdentifierScanner(String text, boolean instructionList) {
        this.text = text;
        this.instructionList = instructionList;
    }

    static List<Identifier> scanStructuredText(String text) {
        return new IdentifierScanner(text, false).scan();
    }

    static List<Identifier> scanInstructionList(String text) {
        return new IdentifierScanner(text, true).scan();
    }

    /**
     * Standard functions and type conversions such as {@code INT_TO_REAL}.
     */
    static boolean isStandardFunction(String name) {
        var upper = name.toUpperCase(Locale.ROOT);
        return STANDARD_FUNCTIONS.contains(upper) || CONVERSION.matcher(upper).matches();
    }

    private List<Identifier> scan() {
        while (pos < text.length()) {
            char c = text.charAt(pos);

            if (startsWith("(*")) {
                skipPast("*)");
            } else if (startsWith("/*")) {
                skipPast("*/");
            } else if (startsWith("//")) {
                skipLine();
            } else if (c == '{') {
                skipPast("}");
            } else if (c == '\'' || c == '"') {
                skipString(c);
            } else if (Character.isDigit(c)) {
                skipNumber();
            } else if (c == '%') {
                skipAddress();
            } else if (isIdentifierStart(c)) {
                identifier();
            } else {
                if (c == '(') {
                    depth++;
                } else if (c == ')' && depth > 0) {
                    depth--;
                }
                pos++;
            }
        }
        return result;
    }

    private void identifier() {
        int start = pos;
        boolean member = start > 0 && text.charAt(start - 1) == '.'
                         && !(start > 1 && text.charAt(start - 2) == '.');

        while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
            pos++;
        }
        var name = text.substring(start, pos);

        if (pos < text.length() && text.charAt(pos) == '#') {
            skipTypedLiteral();
            return;
        }
        if (member || isReserved(name)) {
            return;
        }
        consumeQualifier();
        var operand = text.substring(start, pos);
        var next = nextSignificant();

        if (depth > 0 && (text.startsWith(":=", next) || text.startsWith("=>", next))) {
            return;
        }
        boolean callee = next < text.length() && text.charAt(next) == '(';
        if (callee && isStandardFunction(name)) {
            return;
        }
        result.add(new Identifier(name, operand, callee));
    }

    private boolean isReserved(String name) {
        if (Keyword.isReserved(name)) {
            return true;
        }
        return instructionList && IL_OPERATORS.contains(name.toUpperCase(Locale.ROOT));
    }

    /**
     * Member path ({@code .name}, {@code .5}) and module address parts ({@code Local:1:I}).
     */
    private void consumeQualifier() {
        while (pos + 1 < text.length()) {
            char c = text.charAt(pos);
            char next = text.charAt(pos + 1);

            if (c == '.' && (isIdentifierPart(next))) {
                pos++;
            } else if (c == ':' && Character.isDigit(next)) {
                pos++;
            } else {
                return;
            }
            while (pos < text.length() && (isIdentifierPart(text.charAt(pos)))) {
                pos++;
            }
        }
    }

    // === Skipping ===

    private void skipPast(String terminator) {
        int end = text.indexOf(terminator, pos + 1);
        pos = end < 0 ? text.length() : end + terminator.length();
    }

    private void skipLine() {
        int end = text.indexOf('\n', pos);
        pos = end < 0 ? text.length() : end + 1;
    }

    private void skipString(char quote) {
        pos++;
        while (pos < text.length() && text.charAt(pos) != quote) {
            pos += text.charAt(pos) == '$' ? 2 : 1;
        }
        pos = Math.min(pos + 1, text.length());
    }

    private void skipNumber() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            boolean fraction = c == '.' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1));

            if (!(isIdentifierPart(c) || c == '#' || fraction)) {
                return;
            }
            pos++;
        }
    }

    private void skipAddress() {
        pos++;
        while (pos < text.length() && (isIdentifierPart(text.charAt(pos)) || text.charAt(pos) == '.')) {
            pos++;
        }
    }

    private void skipTypedLiteral() {
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            boolean signedPart = c == '-' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1));

            if (!(isIdentifierPart(c) || c == '.' || c == ':' || signedPart)) {
                return;
            }
            pos++;
        }
    }

    // === Helper methods ===

    private boolean startsWith(String prefix) {
        return text.startsWith(prefix, pos);
    }

    private int nextSignificant() {
        int next = pos;
        while (next < text.length() && Character.isWhitespace(text.charAt(next))) {
            next++;
        }
        return next;
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
