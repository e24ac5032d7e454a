package org.pragmatica.plc.rll;

import java.util.Optional;

/**
 * Instruction operand: {@code ?} or the operand text as written, trimmed.
 */
public sealed interface Operand {

    default boolean isInferred() {
        return this instanceof Inferred;
    }

    default Optional<String> asValue() {
        return this instanceof Value value ? Optional.of(value.text()) : Optional.empty();
    }

    static Operand inferred() {
        return new Inferred();
    }

    static Operand value(String text) {
        return new Value(text);
    }

    record Inferred() implements Operand {
        @Override
        public String toString() {
            return "?";
        }
    }

    record Value(String text) implements Operand {
        @Override
        public String toString() {
            return text;
        }
    }
}
