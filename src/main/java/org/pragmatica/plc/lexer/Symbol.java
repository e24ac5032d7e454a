package org.pragmatica.plc.lexer;

/**
 * Operators and punctuation.
 */
public enum Symbol {
    ASSIGN(":="),
    OUTPUT_ASSIGN("=>"),
    ADD_ASSIGN("+="),
    SUB_ASSIGN("-="),
    MUL_ASSIGN("*="),
    DIV_ASSIGN("/="),
    NON_RETENTIVE_ASSIGN("[:=]"),
    EQ("="),
    NE("<>"),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    POWER("**"),
    AMPERSAND("&"),
    LPAREN("("),
    RPAREN(")"),
    LBRACKET("["),
    RBRACKET("]"),
    COMMA(","),
    SEMICOLON(";"),
    COLON(":"),
    DOT("."),
    RANGE(".."),
    CARET("^"),
    HASH("#");

    private final String text;

    Symbol(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }
}
