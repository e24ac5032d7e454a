package org.pragmatica.plc.ast;

import org.pragmatica.plc.tree.SourceSpan;

import java.util.List;

/**
 * Structured Text expressions.
 */
public sealed interface Expression {

    SourceSpan span();

    // === Literals ===

    record BoolLiteral(SourceSpan span, boolean value) implements Expression {}

    /**
     * @param text original spelling, e.g. {@code 16#FF} or {@code 1_000}
     */
    record IntLiteral(SourceSpan span, long value, String text) implements Expression {}

    record RealLiteral(SourceSpan span, double value, String text) implements Expression {}

    record StringLiteral(SourceSpan span, String value, boolean wide) implements Expression {}

    /**
     * Duration or calendar literal kept as written, e.g. {@code T#1h30m}.
     */
    record TimeLiteral(SourceSpan span, TimeKind kind, String text) implements Expression {}

    record NullLiteral(SourceSpan span) implements Expression {}

    // === Composite ===

    record VariableRef(SourceSpan span, Variable variable) implements Expression {
        public static VariableRef of(Variable variable) {
            return new VariableRef(variable.span(), variable);
        }
    }

    record Unary(SourceSpan span, UnaryOp op, Expression operand) implements Expression {}

    record Binary(SourceSpan span, BinaryOp op, Expression left, Expression right) implements Expression {}

    record Paren(SourceSpan span, Expression inner) implements Expression {}

    /**
     * Function or method call used as a value.
     */
    record Call(SourceSpan span, Variable callee, List<Argument> arguments) implements Expression {
        public Call {
            arguments = List.copyOf(arguments);
        }

        public String name() {
            return callee.path();
        }
    }

    // === Initializers ===

    /**
     * {@code [1, 2, 3(0)]} in an initial value.
     */
    record ArrayInitializer(SourceSpan span, List<Expression> elements) implements Expression {
        public ArrayInitializer {
            elements = List.copyOf(elements);
        }
    }

    /**
     * {@code count(value)} inside an array initializer.
     */
    record Repeated(SourceSpan span, Expression count, Expression value) implements Expression {}

    /**
     * {@code (x := 1, y := 2)} in an initial value.
     */
    record StructInitializer(SourceSpan span, List<Argument.Named> fields) implements Expression {
        public StructInitializer {
            fields = List.copyOf(fields);
        }
    }
}
