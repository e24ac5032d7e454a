package org.pragmatica.plc.ast;

import org.pragmatica.plc.tree.SourceSpan;

import java.util.List;

/**
 * The l-value grammar: something that can appear on the left of an assignment.
 */
public sealed interface Variable {

    SourceSpan span();

    /**
     * The identifier this access path starts from, or {@code null} for direct addresses.
     */
    default String rootName() {
        var current = this;

        while (true) {
            if (current instanceof Named named) {
                return named.name();
            } else if (current instanceof Member member) {
                current = member.base();
            } else if (current instanceof Index index) {
                current = index.base();
            } else if (current instanceof Deref deref) {
                current = deref.base();
            } else {
                return null;
            }
        }
    }

    /**
     * Text form such as {@code Motor.Status[2]^}.
     */
    default String path() {
        return AstPrinter.variable(this);
    }

    record Direct(SourceSpan span, DirectAddress address) implements Variable {}

    record Named(SourceSpan span, String name) implements Variable {}

    record Member(SourceSpan span, Variable base, String member) implements Variable {}

    record Index(SourceSpan span, Variable base, List<Expression> indices) implements Variable {
        public Index {
            indices = List.copyOf(indices);
        }
    }

    record Deref(SourceSpan span, Variable base) implements Variable {}
}
