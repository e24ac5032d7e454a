package org.pragmatica.plc.rll;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies operand text as a tag path, a numeric literal or an expression and extracts the tags in it.
 */
public final class OperandParser {
    private static final Set<String> EXPRESSION_FUNCTIONS = Set.of(
        "ABS", "SQRT", "LN", "LOG", "EXP", "SIN", "COS", "TAN", "ASN", "ACS", "ATN",
        "DEG", "RAD", "TRUNC", "NOT", "AND", "OR", "XOR", "MOD", "FRD", "TOD");

    private OperandParser() {}

    public static OperandValue parse(String text) {
        var trimmed = text.trim();

        if (trimmed.isEmpty()) {
            return new OperandValue.Literal("");
        }
        if (isNumericLiteral(trimmed)) {
            return new OperandValue.Literal(trimmed);
        }
        if (looksLikeExpression(trimmed)) {
            var terms = new ArrayList<OperandValue>();
            extractTerms(trimmed, terms);
            return new OperandValue.Expression(trimmed, terms);
        }
        return parseTagPath(trimmed);
    }

    static boolean isNumericLiteral(String text) {
        if (text.startsWith("16#") || text.startsWith("8#") || text.startsWith("2#")) {
            return true;
        }
        var unsigned = text;
        if (unsigned.startsWith("-") || unsigned.startsWith("+")) {
            unsigned = unsigned.substring(1);
        }
        if (unsigned.isEmpty() || !Character.isDigit(unsigned.charAt(0))) {
            return false;
        }
        return unsigned.chars()
                       .allMatch(c -> Character.isDigit(c) || c == '.' || c == 'e' || c == 'E'
                                      || c == '+' || c == '-' || c == '_');
    }

    /**
     * An operator outside parentheses and brackets, or a minus after a term.
     */
    static boolean looksLikeExpression(String text) {
        int parenDepth = 0;
        int bracketDepth = 0;
        boolean seenTerm = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean topLevel = parenDepth == 0 && bracketDepth == 0;
            switch (c) {
                case '(' -> parenDepth++;
                case ')' -> parenDepth--;
                case '[' -> bracketDepth++;
                case ']' -> bracketDepth--;
                case '+', '*', '/', '>', '<', '=' -> {
                    if (topLevel) {
                        return true;
                    }
                }
                case '-' -> {
                    if (topLevel && seenTerm) {
                        return true;
                    }
                }
                case ' ', '\t', '\n' -> {
                }
                default -> {
                    if (topLevel) {
                        seenTerm = true;
                    }
                }
            }
        }
        return false;
    }

    private static OperandValue parseTagPath(String text) {
        int pos = 0;
        int length = text.length();

        while (pos < length && !isPathDelimiter(text.charAt(pos))) {
            pos++;
        }
        var base = text.substring(0, pos);

        // module address such as :1:I in Local:1:I.Data
        while (pos < length && text.charAt(pos) == ':') {
            pos++;
            while (pos < length && !isPathDelimiter(text.charAt(pos))) {
                pos++;
            }
        }
        var indices = new ArrayList<OperandValue>();
        while (pos < length) {
            char c = text.charAt(pos);
            if (c == '[') {
                int close = matchingBracket(text, pos);
                var index = text.substring(pos + 1, close).trim();
                if (!index.isEmpty() && isTagStart(index.charAt(0))) {
                    indices.add(parse(index));
                }
                pos = Math.min(close + 1, length);
            } else if (c == '.') {
                pos++;
                if (pos < length && text.charAt(pos) == '[') {
                    int close = matchingBracket(text, pos);
                    indices.add(parse(text.substring(pos + 1, close)));
                    pos = Math.min(close + 1, length);
                }
            } else {
                pos++;
            }
        }
        return new OperandValue.Tag(base, text, indices);
    }

    private static void extractTerms(String text, List<OperandValue> terms) {
        var current = new StringBuilder();
        int parenDepth = 0;
        int bracketDepth = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean topLevel = parenDepth == 0 && bracketDepth == 0;
            switch (c) {
                case '(' -> {
                    parenDepth++;
                    current.append(c);
                }
                case ')' -> {
                    parenDepth--;
                    current.append(c);
                }
                case '[' -> {
                    bracketDepth++;
                    current.append(c);
                }
                case ']' -> {
                    bracketDepth--;
                    current.append(c);
                }
                case '+', '*', '/', '>', '<', '=' -> {
                    if (topLevel) {
                        processTerm(current.toString(), terms);
                        current.setLength(0);
                    } else {
                        current.append(c);
                    }
                }
                case '-' -> {
                    if (topLevel && !current.toString().isBlank()) {
                        processTerm(current.toString(), terms);
                        current.setLength(0);
                    } else {
                        current.append(c);
                    }
                }
                case ' ' -> {
                    if (!topLevel) {
                        current.append(c);
                    }
                }
                default -> current.append(c);
            }
        }
        processTerm(current.toString(), terms);
    }

    private static void processTerm(String term, List<OperandValue> terms) {
        var trimmed = term.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        int paren = trimmed.indexOf('(');
        if (paren > 0 && EXPRESSION_FUNCTIONS.contains(trimmed.substring(0, paren).toUpperCase(Locale.ROOT))) {
            if (trimmed.endsWith(")")) {
                for (var argument : splitArguments(trimmed.substring(paren + 1, trimmed.length() - 1))) {
                    if (!argument.isBlank()) {
                        addTerm(parse(argument), terms);
                    }
                }
            }
            return;
        }
        var stripped = stripOuterParens(trimmed);
        if (looksLikeExpression(stripped)) {
            extractTerms(stripped, terms);
        } else {
            addTerm(parse(stripped), terms);
        }
    }

    private static void addTerm(OperandValue value, List<OperandValue> terms) {
        if (value instanceof OperandValue.Tag) {
            terms.add(value);
        } else if (value instanceof OperandValue.Expression expression) {
            terms.addAll(expression.terms());
        }
    }

    private static List<String> splitArguments(String arguments) {
        var result = new ArrayList<String>();
        int start = 0;
        int depth = 0;

        for (int i = 0; i < arguments.length(); i++) {
            char c = arguments.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (c == ',' && depth == 0) {
                result.add(arguments.substring(start, i));
                start = i + 1;
            }
        }
        if (start < arguments.length()) {
            result.add(arguments.substring(start));
        }
        return result;
    }

    static String stripOuterParens(String text) {
        var trimmed = text.trim();

        while (trimmed.length() >= 2 && trimmed.startsWith("(") && trimmed.endsWith(")")) {
            var inner = trimmed.substring(1, trimmed.length() - 1);
            int depth = 0;
            for (int i = 0; i < inner.length() && depth >= 0; i++) {
                char c = inner.charAt(i);
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                }
            }
            if (depth != 0) {
                return trimmed;
            }
            trimmed = inner.trim();
        }
        return trimmed;
    }

    /**
     * Index of the bracket closing the one at {@code open}, or the text length if unbalanced.
     */
    private static int matchingBracket(String text, int open) {
        int depth = 0;

        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']' && --depth == 0) {
                return i;
            }
        }
        return text.length();
    }

    private static boolean isPathDelimiter(char c) {
        return c == '.' || c == '[' || c == ':';
    }

    private static boolean isTagStart(char c) {
        return Character.isLetter(c) || c == '_';
    }
}
