package org.pragmatica.plc.ast;

import java.util.Optional;

/**
 * Assignment operators. Compound forms are SCL only; {@code [:=]} is the Rockwell non-retentive assignment.
 */
public enum AssignOp {
    ASSIGN(":=", null),
    ADD_ASSIGN("+=", BinaryOp.ADD),
    SUB_ASSIGN("-=", BinaryOp.SUB),
    MUL_ASSIGN("*=", BinaryOp.MUL),
    DIV_ASSIGN("/=", BinaryOp.DIV),
    NON_RETENTIVE("[:=]", null);

    private final String symbol;
    private final BinaryOp compound;

    AssignOp(String symbol, BinaryOp compound) {
        this.symbol = symbol;
        this.compound = compound;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * The arithmetic operator a compound assignment applies, if any.
     */
    public Optional<BinaryOp> compoundOperator() {
        return Optional.ofNullable(compound);
    }

    /**
     * Compound assignments read the target before writing it.
     */
    public boolean readsTarget() {
        return compound != null;
    }
}
