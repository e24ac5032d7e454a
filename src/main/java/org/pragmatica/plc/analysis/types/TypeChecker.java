package org.pragmatica.plc.analysis.types;

import org.pragmatica.plc.analysis.symbols.Symbol;
import org.pragmatica.plc.analysis.symbols.SymbolKind;
import org.pragmatica.plc.analysis.symbols.SymbolTable;
import org.pragmatica.plc.ast.Argument;
import org.pragmatica.plc.ast.BinaryOp;
import org.pragmatica.plc.ast.Expression;
import org.pragmatica.plc.ast.Statement;
import org.pragmatica.plc.ast.Variable;
import org.pragmatica.plc.error.Diagnostic;
import org.pragmatica.plc.error.DiagnosticKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Infers expression types and checks statements against the declarations in a {@link SymbolTable}.
 *
 * <p>Reading a name marks its symbol used; writing it marks it assigned. An operand of type
 * {@code UNKNOWN} silences the rule it feeds, so each mistake is reported once.
 */
public final class TypeChecker {
    private final SymbolTable symbols;
    private final boolean lenient;

    public TypeChecker(SymbolTable symbols) {
        this(symbols, false);
    }

    private TypeChecker(SymbolTable symbols, boolean lenient) {
        this.symbols = symbols;
        this.lenient = lenient;
    }

    /**
     * Checker that treats undeclared names as {@code UNKNOWN} without reporting them. Used for routine bodies
     * whose tags are declared outside the parsed text.
     */
    public static TypeChecker lenient(SymbolTable symbols) {
        return new TypeChecker(symbols, true);
    }

    public List<Diagnostic> checkStatements(List<Statement> statements) {
        var diagnostics = new ArrayList<Diagnostic>();
        statements.forEach(statement -> diagnostics.addAll(checkStatement(statement)));
        return diagnostics;
    }

    public List<Diagnostic> checkStatement(Statement statement) {
        var diagnostics = new ArrayList<Diagnostic>();
        check(statement, diagnostics);
        return diagnostics;
    }

    // === Statements ===

    private void check(Statement statement, List<Diagnostic> sink) {
        if (statement instanceof Statement.Assignment assignment) {
            checkAssignment(assignment, sink);
        } else if (statement instanceof Statement.If ifStatement) {
            checkCondition(ifStatement.condition(), sink);
            checkBody(ifStatement.thenBody(), sink);
            for (var elsIf : ifStatement.elsIfs()) {
                checkCondition(elsIf.condition(), sink);
                checkBody(elsIf.body(), sink);
            }
            ifStatement.elseBody().ifPresent(body -> checkBody(body, sink));
        } else if (statement instanceof Statement.Case caseStatement) {
            inferType(caseStatement.selector(), sink);
            caseStatement.branches().forEach(branch -> checkBody(branch.body(), sink));
            caseStatement.elseBody().ifPresent(body -> checkBody(body, sink));
        } else if (statement instanceof Statement.For forLoop) {
            checkLoopVariable(forLoop, sink);
            requireInteger(forLoop.start(), sink);
            requireInteger(forLoop.end(), sink);
            forLoop.step().ifPresent(step -> requireInteger(step, sink));
            checkBody(forLoop.body(), sink);
        } else if (statement instanceof Statement.While whileLoop) {
            checkCondition(whileLoop.condition(), sink);
            checkBody(whileLoop.body(), sink);
        } else if (statement instanceof Statement.Repeat repeat) {
            checkBody(repeat.body(), sink);
            checkCondition(repeat.condition(), sink);
        } else if (statement instanceof Statement.Region region) {
            checkBody(region.body(), sink);
        } else if (statement instanceof Statement.FunctionCall call) {
            symbols.markUsed(call.name());
            checkArguments(call.arguments(), sink);
        } else if (statement instanceof Statement.FbInvocation invocation) {
            inferVariable(invocation.instance(), sink);
            checkArguments(invocation.arguments(), sink);
        } else if (statement instanceof Statement.Return returnStatement) {
            returnStatement.value().ifPresent(value -> inferType(value, sink));
        }
    }

    private void checkBody(List<Statement> body, List<Diagnostic> sink) {
        body.forEach(statement -> check(statement, sink));
    }

    private void checkAssignment(Statement.Assignment assignment, List<Diagnostic> sink) {
        var target = inferTarget(assignment.target(), assignment.op().readsTarget(), sink);
        var value = inferType(assignment.value(), sink);

        if (!target.type().isAssignableFrom(value.type())) {
            sink.add(Diagnostic.error(new DiagnosticKind.TypeMismatch(target.type().displayName(),
                                                                       value.type().displayName()),
                                      assignment.value().span()));
        }
        if (assignment.target() instanceof Variable.Named named) {
            var symbol = symbols.lookup(named.name());
            if (target.constant()) {
                sink.add(Diagnostic.error(new DiagnosticKind.AssignmentToConstant(named.name()), named.span()));
            } else if (symbol.map(Symbol::kind).filter(kind -> kind == SymbolKind.PARAMETER).isPresent()) {
                sink.add(Diagnostic.error(new DiagnosticKind.AssignmentToInput(named.name()), named.span()));
            }
        }
    }

    private void checkLoopVariable(Statement.For forLoop, List<Diagnostic> sink) {
        var symbol = symbols.lookupMut(forLoop.variable());

        if (symbol.isEmpty()) {
            if (!lenient) {
                sink.add(Diagnostic.error(new DiagnosticKind.UndefinedIdentifier(forLoop.variable()), forLoop.span()));
            }
            return;
        }
        symbol.get().markUsed();
        symbol.get().markAssigned();
    }

    private void checkCondition(Expression condition, List<Diagnostic> sink) {
        var type = inferType(condition, sink).type();

        if (!type.isBool() && !type.isUnknown()) {
            sink.add(Diagnostic.warning(new DiagnosticKind.TypeMismatch("BOOL", type.displayName()),
                                        condition.span()));
        }
    }

    private void requireInteger(Expression expression, List<Diagnostic> sink) {
        var type = inferType(expression, sink).type();

        if (!type.isInteger() && !type.isUnknown()) {
            sink.add(Diagnostic.error(new DiagnosticKind.TypeMismatch("integer", type.displayName()),
                                      expression.span()));
        }
    }

    /**
     * Check every argument of a call. Returns {@code false} when some argument value has an unknown type.
     */
    private boolean checkArguments(List<Argument> arguments, List<Diagnostic> sink) {
        boolean known = true;

        for (var argument : arguments) {
            var value = argument.valueExpression();
            if (value.isPresent() && inferType(value.get(), sink).type().isUnknown()) {
                known = false;
            }
            if (argument instanceof Argument.Output output) {
                inferTarget(output.target(), false, sink);
            }
        }
        return known;
    }

    // === Expressions ===

    /**
     * Type of an expression. Problems found on the way are added to {@code sink}.
     */
    public TypeInfo inferType(Expression expression, List<Diagnostic> sink) {
        if (expression instanceof Expression.IntLiteral) {
            return TypeInfo.constant(Type.Elementary.DINT);
        }
        if (expression instanceof Expression.RealLiteral) {
            return TypeInfo.constant(Type.Elementary.LREAL);
        }
        if (expression instanceof Expression.StringLiteral string) {
            return TypeInfo.constant(string.wide() ? Type.StringType.WIDE : Type.StringType.NARROW);
        }
        if (expression instanceof Expression.BoolLiteral) {
            return TypeInfo.constant(Type.Elementary.BOOL);
        }
        if (expression instanceof Expression.TimeLiteral time) {
            return TypeInfo.constant(Types.ofTimeLiteral(time.kind()));
        }
        if (expression instanceof Expression.NullLiteral) {
            return TypeInfo.constant(Type.Elementary.ANY);
        }
        if (expression instanceof Expression.VariableRef ref) {
            return inferVariable(ref.variable(), sink);
        }
        if (expression instanceof Expression.Paren paren) {
            return inferType(paren.inner(), sink);
        }
        if (expression instanceof Expression.Unary unary) {
            return TypeInfo.value(unaryResult(unary, inferType(unary.operand(), sink).type(), sink));
        }
        if (expression instanceof Expression.Binary binary) {
            var left = inferType(binary.left(), sink).type();
            var right = inferType(binary.right(), sink).type();
            return TypeInfo.value(binaryResult(binary, left, right, sink));
        }
        if (expression instanceof Expression.Call call) {
            boolean known = checkArguments(call.arguments(), sink);
            var root = call.callee().rootName();
            if (root != null) {
                symbols.markUsed(root);
            }
            return TypeInfo.value(known ? callResult(call) : Type.Elementary.UNKNOWN);
        }
        if (expression instanceof Expression.ArrayInitializer init) {
            init.elements().forEach(element -> inferType(element, sink));
            return TypeInfo.unknown();
        }
        if (expression instanceof Expression.Repeated repeated) {
            inferType(repeated.count(), sink);
            return inferType(repeated.value(), sink);
        }
        if (expression instanceof Expression.StructInitializer init) {
            init.fields().forEach(field -> inferType(field.value(), sink));
            return TypeInfo.unknown();
        }
        return TypeInfo.unknown();
    }

    private Type unaryResult(Expression.Unary unary, Type operand, List<Diagnostic> sink) {
        if (operand.isUnknown()) {
            return operand;
        }
        return switch (unary.op()) {
            case NEG, PLUS -> {
                if (operand.isNumeric()) {
                    yield operand;
                }
                sink.add(Diagnostic.error(new DiagnosticKind.InvalidOperator(unary.op().symbol(),
                                                                             operand.displayName()),
                                          unary.span()));
                yield Type.Elementary.UNKNOWN;
            }
            case NOT -> {
                if (operand.isBool()) {
                    yield Type.Elementary.BOOL;
                }
                if (operand.isInteger()) {
                    yield operand;
                }
                sink.add(Diagnostic.error(new DiagnosticKind.InvalidOperator("NOT", operand.displayName()),
                                          unary.span()));
                yield Type.Elementary.UNKNOWN;
            }
        };
    }

    private Type binaryResult(Expression.Binary binary, Type left, Type right, List<Diagnostic> sink) {
        var op = binary.op();

        if (left.isUnknown() || right.isUnknown()) {
            return Type.Elementary.UNKNOWN;
        }
        if (op.isComparison()) {
            return Type.Elementary.BOOL;
        }
        if (op.isArithmetic()) {
            if (left.isNumeric() && right.isNumeric()) {
                return left.isReal() || right.isReal() ? Type.Elementary.LREAL : Type.Elementary.DINT;
            }
            if (op == BinaryOp.ADD && left.isString() && right.isString()) {
                return Type.StringType.NARROW;
            }
            if ((op == BinaryOp.ADD || op == BinaryOp.SUB) && left.isTime() && right.isTime()) {
                return Type.Elementary.TIME;
            }
        } else {
            if (left.isBool() && right.isBool()) {
                return Type.Elementary.BOOL;
            }
            if (left.isInteger() && right.isInteger()) {
                return Type.Elementary.DINT;
            }
        }
        sink.add(Diagnostic.error(new DiagnosticKind.IncompatibleTypes(left.displayName(), right.displayName(),
                                                                       op.symbol()),
                                  binary.span()));
        return Type.Elementary.UNKNOWN;
    }

    /**
     * Standard functions and {@code X_TO_Y} conversions have known result types; other calls are {@code UNKNOWN}.
     */
    private Type callResult(Expression.Call call) {
        var builtin = Types.builtinReturnType(call.name());

        if (!builtin.isUnknown()) {
            return builtin;
        }
        return conversionTarget(call.name()).orElse(Type.Elementary.UNKNOWN);
    }

    private static Optional<Type> conversionTarget(String name) {
        var upper = name.toUpperCase(Locale.ROOT);
        int separator = upper.lastIndexOf("_TO_");

        if (separator <= 0) {
            return Optional.empty();
        }
        var target = Type.fromName(upper.substring(separator + 4));
        return target instanceof Type.StructType ? Optional.empty() : Optional.of(target);
    }

    // === Variables ===

    private TypeInfo inferVariable(Variable variable, List<Diagnostic> sink) {
        return resolve(variable, Access.READ, sink);
    }

    private TypeInfo inferTarget(Variable variable, boolean alsoRead, List<Diagnostic> sink) {
        return resolve(variable, alsoRead ? Access.READ_WRITE : Access.WRITE, sink);
    }

    private enum Access {
        READ,
        WRITE,
        READ_WRITE
    }

    private TypeInfo resolve(Variable variable, Access access, List<Diagnostic> sink) {
        if (variable instanceof Variable.Direct) {
            return TypeInfo.lvalue(Type.Elementary.BOOL);
        }
        if (variable instanceof Variable.Named named) {
            return resolveName(named, access, sink);
        }
        if (variable instanceof Variable.Member member) {
            resolve(member.base(), access, sink);
            return TypeInfo.lvalue(Type.Elementary.UNKNOWN);
        }
        if (variable instanceof Variable.Index index) {
            return resolveIndex(index, access, sink);
        }
        if (variable instanceof Variable.Deref deref) {
            var base = resolve(deref.base(), access, sink).type();
            if (base instanceof Type.ReferenceType reference) {
                return TypeInfo.lvalue(reference.target());
            }
            return TypeInfo.lvalue(Type.Elementary.UNKNOWN);
        }
        return TypeInfo.unknown();
    }

    private TypeInfo resolveName(Variable.Named named, Access access, List<Diagnostic> sink) {
        var name = named.name();

        if (isSelfReference(name)) {
            return TypeInfo.lvalue(Type.Elementary.UNKNOWN);
        }
        var found = symbols.lookupMut(name);
        if (found.isEmpty()) {
            if (!lenient) {
                sink.add(Diagnostic.error(new DiagnosticKind.UndefinedIdentifier(name), named.span()));
            }
            return TypeInfo.unknown();
        }
        var symbol = found.get();
        if (access != Access.WRITE) {
            symbol.markUsed();
        }
        if (access != Access.READ) {
            symbol.markAssigned();
        }
        var type = symbol.type().orElse(Type.Elementary.UNKNOWN);
        return symbol.isMutable() ? TypeInfo.lvalue(type) : TypeInfo.constant(type);
    }

    private TypeInfo resolveIndex(Variable.Index index, Access access, List<Diagnostic> sink) {
        var base = resolve(index.base(), access, sink).type();

        for (var subscript : index.indices()) {
            var type = inferType(subscript, sink).type();
            if (!type.isInteger() && !type.isUnknown()) {
                sink.add(Diagnostic.error(new DiagnosticKind.NonIntegerArrayIndex(), subscript.span()));
            }
        }
        if (base instanceof Type.ArrayType array) {
            if (array.dimensions() != index.indices().size()) {
                sink.add(Diagnostic.error(new DiagnosticKind.ArrayDimensionMismatch(array.dimensions(),
                                                                                    index.indices().size()),
                                          index.span()));
            }
            return TypeInfo.lvalue(array.element());
        }
        return TypeInfo.lvalue(Type.Elementary.UNKNOWN);
    }

    private static boolean isSelfReference(String name) {
        return "THIS".equalsIgnoreCase(name) || "SUPER".equalsIgnoreCase(name);
    }
}
