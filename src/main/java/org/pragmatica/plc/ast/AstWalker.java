package org.pragmatica.plc.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Pre-order traversal helpers over statements and expressions.
 */
public final class AstWalker {
    private AstWalker() {}

    /**
     * Visit every statement, including statements nested in control-flow bodies.
     */
    public static void walkStatements(List<Statement> statements, Consumer<Statement> visitor) {
        for (var statement : statements) {
            visitor.accept(statement);
            for (var body : nestedBodies(statement)) {
                walkStatements(body, visitor);
            }
        }
    }

    /**
     * Number of statements, counting nested ones.
     */
    public static int countStatements(List<Statement> statements) {
        int[] count = {0};
        walkStatements(statements, statement -> count[0]++);
        return count[0];
    }

    /**
     * Bodies directly owned by a statement, in source order.
     */
    public static List<List<Statement>> nestedBodies(Statement statement) {
        var bodies = new ArrayList<List<Statement>>();

        if (statement instanceof Statement.If ifStatement) {
            bodies.add(ifStatement.thenBody());
            ifStatement.elsIfs().forEach(elsIf -> bodies.add(elsIf.body()));
            ifStatement.elseBody().ifPresent(bodies::add);
        } else if (statement instanceof Statement.Case caseStatement) {
            caseStatement.branches().forEach(branch -> bodies.add(branch.body()));
            caseStatement.elseBody().ifPresent(bodies::add);
        } else if (statement instanceof Statement.For forStatement) {
            bodies.add(forStatement.body());
        } else if (statement instanceof Statement.While whileStatement) {
            bodies.add(whileStatement.body());
        } else if (statement instanceof Statement.Repeat repeat) {
            bodies.add(repeat.body());
        } else if (statement instanceof Statement.Region region) {
            bodies.add(region.body());
        }
        return bodies;
    }

    /**
     * Expressions directly owned by a statement (not those of nested statements).
     * Assignment targets and invocation instances are included as variable references.
     */
    public static List<Expression> directExpressions(Statement statement) {
        var result = new ArrayList<Expression>();

        if (statement instanceof Statement.Assignment assignment) {
            result.add(Expression.VariableRef.of(assignment.target()));
            result.add(assignment.value());
        } else if (statement instanceof Statement.If ifStatement) {
            result.add(ifStatement.condition());
            ifStatement.elsIfs().forEach(elsIf -> result.add(elsIf.condition()));
        } else if (statement instanceof Statement.Case caseStatement) {
            result.add(caseStatement.selector());
            for (var branch : caseStatement.branches()) {
                for (var label : branch.labels()) {
                    if (label instanceof CaseLabel.Value value) {
                        result.add(value.value());
                    } else if (label instanceof CaseLabel.Range range) {
                        result.add(range.low());
                        result.add(range.high());
                    }
                }
            }
        } else if (statement instanceof Statement.For forStatement) {
            result.add(forStatement.start());
            result.add(forStatement.end());
            forStatement.step().ifPresent(result::add);
        } else if (statement instanceof Statement.While whileStatement) {
            result.add(whileStatement.condition());
        } else if (statement instanceof Statement.Repeat repeat) {
            result.add(repeat.condition());
        } else if (statement instanceof Statement.Return returnStatement) {
            returnStatement.value().ifPresent(result::add);
        } else if (statement instanceof Statement.FunctionCall call) {
            addArguments(call.arguments(), result);
        } else if (statement instanceof Statement.FbInvocation invocation) {
            result.add(Expression.VariableRef.of(invocation.instance()));
            addArguments(invocation.arguments(), result);
        }
        return result;
    }

    /**
     * Visit an expression and every sub-expression, including array indices inside variables
     * and call arguments.
     */
    public static void walkExpression(Expression expression, Consumer<Expression> visitor) {
        visitor.accept(expression);

        if (expression instanceof Expression.Unary unary) {
            walkExpression(unary.operand(), visitor);
        } else if (expression instanceof Expression.Binary binary) {
            walkExpression(binary.left(), visitor);
            walkExpression(binary.right(), visitor);
        } else if (expression instanceof Expression.Paren paren) {
            walkExpression(paren.inner(), visitor);
        } else if (expression instanceof Expression.VariableRef ref) {
            walkVariableIndices(ref.variable(), visitor);
        } else if (expression instanceof Expression.Call call) {
            walkVariableIndices(call.callee(), visitor);
            var arguments = new ArrayList<Expression>();
            addArguments(call.arguments(), arguments);
            arguments.forEach(argument -> walkExpression(argument, visitor));
        } else if (expression instanceof Expression.ArrayInitializer init) {
            init.elements().forEach(element -> walkExpression(element, visitor));
        } else if (expression instanceof Expression.Repeated repeated) {
            walkExpression(repeated.count(), visitor);
            walkExpression(repeated.value(), visitor);
        } else if (expression instanceof Expression.StructInitializer init) {
            init.fields().forEach(field -> walkExpression(field.value(), visitor));
        }
    }

    /**
     * Visit every expression in a statement list, nested statements included.
     */
    public static void walkAllExpressions(List<Statement> statements, Consumer<Expression> visitor) {
        walkStatements(statements, statement -> directExpressions(statement).forEach(e -> walkExpression(e, visitor)));
    }

    private static void walkVariableIndices(Variable variable, Consumer<Expression> visitor) {
        if (variable instanceof Variable.Member member) {
            walkVariableIndices(member.base(), visitor);
        } else if (variable instanceof Variable.Index index) {
            walkVariableIndices(index.base(), visitor);
            index.indices().forEach(i -> walkExpression(i, visitor));
        } else if (variable instanceof Variable.Deref deref) {
            walkVariableIndices(deref.base(), visitor);
        }
    }

    private static void addArguments(List<Argument> arguments, List<Expression> sink) {
        for (var argument : arguments) {
            argument.valueExpression().ifPresent(sink::add);
            if (argument instanceof Argument.Output output) {
                sink.add(Expression.VariableRef.of(output.target()));
            }
        }
    }
}
