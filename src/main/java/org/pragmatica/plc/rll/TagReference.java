package org.pragmatica.plc.rll;

/**
 * A tag named by an instruction operand.
 *
 * @param name         base tag name, e.g. {@code Timer1} for {@code Timer1.PRE}
 * @param fullOperand  the operand as written
 * @param instruction  mnemonic of the instruction
 * @param operandIndex zero-based operand position
 */
public record TagReference(String name, String fullOperand, String instruction, int operandIndex) {}
