package org.pragmatica.plc.ast;

public enum BinaryOp {
    ADD("+", Category.ARITHMETIC),
    SUB("-", Category.ARITHMETIC),
    MUL("*", Category.ARITHMETIC),
    DIV("/", Category.ARITHMETIC),
    MOD("MOD", Category.ARITHMETIC),
    POWER("**", Category.ARITHMETIC),
    EQ("=", Category.COMPARISON),
    NE("<>", Category.COMPARISON),
    LT("<", Category.COMPARISON),
    LE("<=", Category.COMPARISON),
    GT(">", Category.COMPARISON),
    GE(">=", Category.COMPARISON),
    AND("AND", Category.LOGICAL),
    OR("OR", Category.LOGICAL),
    XOR("XOR", Category.LOGICAL);

    public enum Category {
        ARITHMETIC,
        COMPARISON,
        LOGICAL
    }

    private final String symbol;
    private final Category category;

    BinaryOp(String symbol, Category category) {
        this.symbol = symbol;
        this.category = category;
    }

    public String symbol() {
        return symbol;
    }

    public Category category() {
        return category;
    }

    public boolean isArithmetic() {
        return category == Category.ARITHMETIC;
    }

    public boolean isComparison() {
        return category == Category.COMPARISON;
    }

    public boolean isLogical() {
        return category == Category.LOGICAL;
    }
}
