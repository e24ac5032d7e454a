package org.pragmatica.plc.ast;

import org.pragmatica.plc.tree.SourceSpan;

import java.util.Optional;

/**
 * A call argument.
 */
public sealed interface Argument {

    SourceSpan span();

    /**
     * The expression passed in, if the argument carries one.
     */
    default Optional<Expression> valueExpression() {
        if (this instanceof Positional positional) {
            return Optional.of(positional.value());
        }
        if (this instanceof Named named) {
            return Optional.of(named.value());
        }
        return Optional.empty();
    }

    record Positional(SourceSpan span, Expression value) implements Argument {}

    /**
     * {@code name := expr}.
     */
    record Named(SourceSpan span, String name, Expression value) implements Argument {}

    /**
     * {@code name => variable}, optionally negated with a leading {@code NOT}.
     */
    record Output(SourceSpan span, String name, Variable target, boolean negated) implements Argument {}

    /**
     * An empty slot between commas, where the dialect permits it.
     */
    record Inferred(SourceSpan span) implements Argument {}
}
