package org.pragmatica.plc.xref;

/**
 * One use of a tag.
 *
 * @param tagName     base tag name
 * @param fullOperand the operand as written, e.g. {@code Motor.Running}
 * @param instruction instruction mnemonic, or the body language ({@code ST}, {@code IL}, {@code SFC}) for
 *                    text bodies
 */
public record TagReference(String tagName, String fullOperand, String instruction, ReferenceLocation location) {}
