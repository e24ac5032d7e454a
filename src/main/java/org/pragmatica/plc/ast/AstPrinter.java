package org.pragmatica.plc.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders AST fragments back to text. Binary operations are fully parenthesized so that the rendering
 * shows the parsed structure.
 */
public final class AstPrinter {
    private AstPrinter() {}

    public static String expression(Expression expression) {
        if (expression instanceof Expression.BoolLiteral literal) {
            return literal.value() ? "TRUE" : "FALSE";
        } else if (expression instanceof Expression.IntLiteral literal) {
            return literal.text();
        } else if (expression instanceof Expression.RealLiteral literal) {
            return literal.text();
        } else if (expression instanceof Expression.StringLiteral literal) {
            var quote = literal.wide() ? "\"" : "'";
            return quote + literal.value() + quote;
        } else if (expression instanceof Expression.TimeLiteral literal) {
            return literal.text();
        } else if (expression instanceof Expression.NullLiteral) {
            return "NULL";
        } else if (expression instanceof Expression.VariableRef ref) {
            return variable(ref.variable());
        } else if (expression instanceof Expression.Unary unary) {
            var separator = unary.op() == UnaryOp.NOT ? " " : "";
            return unary.op().symbol() + separator + expression(unary.operand());
        } else if (expression instanceof Expression.Binary binary) {
            return "(" + expression(binary.left()) + " " + binary.op().symbol() + " " + expression(binary.right()) + ")";
        } else if (expression instanceof Expression.Paren paren) {
            return "(" + expression(paren.inner()) + ")";
        } else if (expression instanceof Expression.Call call) {
            return call.name() + "(" + arguments(call.arguments()) + ")";
        } else if (expression instanceof Expression.ArrayInitializer init) {
            return init.elements().stream()
                       .map(AstPrinter::expression)
                       .collect(Collectors.joining(", ", "[", "]"));
        } else if (expression instanceof Expression.Repeated repeated) {
            return expression(repeated.count()) + "(" + expression(repeated.value()) + ")";
        } else if (expression instanceof Expression.StructInitializer init) {
            return init.fields().stream()
                       .map(field -> field.name() + " := " + expression(field.value()))
                       .collect(Collectors.joining(", ", "(", ")"));
        }
        throw new IllegalStateException("Unknown expression " + expression);
    }

    public static String variable(Variable variable) {
        if (variable instanceof Variable.Named named) {
            return named.name();
        } else if (variable instanceof Variable.Direct direct) {
            return direct.address().text();
        } else if (variable instanceof Variable.Member member) {
            return variable(member.base()) + "." + member.member();
        } else if (variable instanceof Variable.Index index) {
            return variable(index.base()) + index.indices().stream()
                                                 .map(AstPrinter::expression)
                                                 .collect(Collectors.joining(", ", "[", "]"));
        } else if (variable instanceof Variable.Deref deref) {
            return variable(deref.base()) + "^";
        }
        throw new IllegalStateException("Unknown variable " + variable);
    }

    public static String arguments(List<Argument> arguments) {
        return arguments.stream()
                        .map(AstPrinter::argument)
                        .collect(Collectors.joining(", "));
    }

    public static String argument(Argument argument) {
        if (argument instanceof Argument.Positional positional) {
            return expression(positional.value());
        } else if (argument instanceof Argument.Named named) {
            return named.name() + " := " + expression(named.value());
        } else if (argument instanceof Argument.Output output) {
            return (output.negated() ? "NOT " : "") + output.name() + " => " + variable(output.target());
        }
        return "";
    }

    public static String typeSpec(TypeSpec spec) {
        if (spec instanceof TypeSpec.Elementary elementary) {
            return elementary.name();
        } else if (spec instanceof TypeSpec.UserDefined userDefined) {
            return userDefined.name();
        } else if (spec instanceof TypeSpec.StringType string) {
            var name = string.wide() ? "WSTRING" : "STRING";
            return string.length()
                         .map(length -> name + "[" + expression(length) + "]")
                         .orElse(name);
        } else if (spec instanceof TypeSpec.ArrayType array) {
            return array.ranges().stream()
                        .map(range -> expression(range.low()) + ".." + expression(range.high()))
                        .collect(Collectors.joining(", ", "ARRAY[", "] OF ")) + typeSpec(array.element());
        } else if (spec instanceof TypeSpec.StructType) {
            return "STRUCT";
        } else if (spec instanceof TypeSpec.RefType ref) {
            return "REF_TO " + typeSpec(ref.target());
        } else if (spec instanceof TypeSpec.EnumType enumType) {
            var values = enumType.values().stream()
                                 .map(TypeSpec.EnumValue::name)
                                 .collect(Collectors.joining(", ", "(", ")"));
            return enumType.baseType().map(base -> base + " " + values).orElse(values);
        } else if (spec instanceof TypeSpec.SubrangeType subrange) {
            return typeSpec(subrange.base()) + "(" + expression(subrange.low()) + ".." + expression(subrange.high()) + ")";
        }
        throw new IllegalStateException("Unknown type spec " + spec);
    }
}
