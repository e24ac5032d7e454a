package org.pragmatica.plc.ast;

public enum UnaryOp {
    NEG("-"),
    NOT("NOT"),
    PLUS("+");

    private final String symbol;

    UnaryOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
