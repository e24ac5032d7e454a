package org.pragmatica.plc.analysis.smells;

import org.pragmatica.plc.ast.Argument;
import org.pragmatica.plc.ast.AstWalker;
import org.pragmatica.plc.ast.Expression;
import org.pragmatica.plc.ast.PouDeclaration;
import org.pragmatica.plc.ast.Statement;
import org.pragmatica.plc.ast.UnaryOp;
import org.pragmatica.plc.ast.Variable;
import org.pragmatica.plc.error.Diagnostic;
import org.pragmatica.plc.error.DiagnosticKind;
import org.pragmatica.plc.error.Severity;
import org.pragmatica.plc.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports maintainability problems in POU bodies.
 *
 * <p>Threshold rules grade their severity by how far the measurement exceeds the threshold: up to 1.5 times
 * is a hint, up to twice is a warning, beyond that an error.
 */
public final class SmellDetector {
    private static final String DEAD_CODE_REASON = "code after RETURN or EXIT";

    private final SmellConfig config;
    private int nesting;

    public SmellDetector(SmellConfig config) {
        this.config = config;
    }

    public SmellDetector() {
        this(SmellConfig.DEFAULT);
    }

    public SmellConfig config() {
        return config;
    }

    public List<Diagnostic> analyzePou(PouDeclaration pou) {
        return analyzeBody(pou.body(), pou.span());
    }

    /**
     * Analyze a statement list; {@code span} locates the long-function finding.
     */
    public List<Diagnostic> analyzeBody(List<Statement> body, SourceSpan span) {
        var diagnostics = new ArrayList<Diagnostic>();
        nesting = 0;

        int statementCount = AstWalker.countStatements(body);
        if (statementCount > config.maxFunctionLength()) {
            diagnostics.add(new Diagnostic(new DiagnosticKind.LongFunction(statementCount, config.maxFunctionLength()),
                                           span, tier(statementCount, config.maxFunctionLength())));
        }
        checkBody(body, diagnostics);
        checkDeadCode(body, diagnostics);
        return diagnostics;
    }

    // === Statements ===

    private void checkBody(List<Statement> body, List<Diagnostic> sink) {
        body.forEach(statement -> checkStatement(statement, sink));
    }

    private void checkStatement(Statement statement, List<Diagnostic> sink) {
        if (statement instanceof Statement.If ifStatement) {
            checkIf(ifStatement, sink);
        } else if (statement instanceof Statement.Case caseStatement) {
            checkCase(caseStatement, sink);
        } else if (statement instanceof Statement.For forLoop) {
            checkLoop(statement, "FOR", forLoop.body(), sink);
        } else if (statement instanceof Statement.While whileLoop) {
            checkCondition(whileLoop.condition(), sink);
            checkLoop(statement, "WHILE", whileLoop.body(), sink);
        } else if (statement instanceof Statement.Repeat repeat) {
            checkLoop(statement, "REPEAT", repeat.body(), sink);
            checkCondition(repeat.condition(), sink);
        } else if (statement instanceof Statement.Region region) {
            checkBody(region.body(), sink);
        } else if (statement instanceof Statement.Assignment assignment) {
            checkMagicNumbers(assignment.value(), sink);
            checkMagicNumbers(assignment.target(), sink);
        } else if (statement instanceof Statement.FunctionCall call) {
            checkArguments(call.arguments(), sink);
        } else if (statement instanceof Statement.FbInvocation invocation) {
            checkArguments(invocation.arguments(), sink);
        }
    }

    private void checkIf(Statement.If statement, List<Diagnostic> sink) {
        checkCondition(statement.condition(), sink);
        if (statement.thenBody().isEmpty()) {
            sink.add(Diagnostic.warning(new DiagnosticKind.EmptyBlock("IF"), statement.span()));
        }
        enter(statement, sink);
        checkBody(statement.thenBody(), sink);
        for (var elsIf : statement.elsIfs()) {
            checkCondition(elsIf.condition(), sink);
            checkBody(elsIf.body(), sink);
        }
        if (statement.elseBody().isPresent()) {
            var elseBody = statement.elseBody().get();
            if (elseBody.isEmpty()) {
                sink.add(Diagnostic.hint(new DiagnosticKind.EmptyBlock("ELSE"), statement.span()));
            }
            checkBody(elseBody, sink);
        }
        nesting--;
    }

    private void checkCase(Statement.Case statement, List<Diagnostic> sink) {
        enter(statement, sink);
        for (var branch : statement.branches()) {
            if (branch.body().isEmpty()) {
                sink.add(Diagnostic.warning(new DiagnosticKind.EmptyCaseBranch(), branch.span()));
            }
            checkBody(branch.body(), sink);
        }
        if (statement.elseBody().isPresent()) {
            checkBody(statement.elseBody().get(), sink);
        } else {
            sink.add(Diagnostic.hint(new DiagnosticKind.MissingCaseElse(), statement.span()));
        }
        nesting--;
    }

    private void checkLoop(Statement statement, String blockType, List<Statement> body, List<Diagnostic> sink) {
        enter(statement, sink);
        if (body.isEmpty()) {
            sink.add(Diagnostic.warning(new DiagnosticKind.EmptyBlock(blockType), statement.span()));
        }
        checkBody(body, sink);
        nesting--;
    }

    private void enter(Statement statement, List<Diagnostic> sink) {
        nesting++;
        if (nesting > config.maxNesting()) {
            sink.add(new Diagnostic(new DiagnosticKind.DeepNesting(nesting, config.maxNesting()),
                                    statement.span(), tier(nesting, config.maxNesting())));
        }
    }

    private void checkArguments(List<Argument> arguments, List<Diagnostic> sink) {
        arguments.forEach(argument -> argument.valueExpression().ifPresent(value -> checkMagicNumbers(value, sink)));
    }

    // === Conditions ===

    private void checkCondition(Expression condition, List<Diagnostic> sink) {
        int complexity = countLogicalOperators(condition);

        if (complexity > config.maxConditionComplexity()) {
            sink.add(new Diagnostic(new DiagnosticKind.ComplexCondition(complexity, config.maxConditionComplexity()),
                                    condition.span(), tier(complexity, config.maxConditionComplexity())));
        }
        if (condition instanceof Expression.BoolLiteral literal) {
            sink.add(Diagnostic.warning(new DiagnosticKind.RedundantCondition(literal.value()), condition.span()));
        }
    }

    private static int countLogicalOperators(Expression expression) {
        if (expression instanceof Expression.Binary binary) {
            int own = binary.op().isLogical() ? 1 : 0;
            return own + countLogicalOperators(binary.left()) + countLogicalOperators(binary.right());
        }
        if (expression instanceof Expression.Unary unary) {
            return countLogicalOperators(unary.operand());
        }
        if (expression instanceof Expression.Paren paren) {
            return countLogicalOperators(paren.inner());
        }
        return 0;
    }

    // === Magic numbers ===

    private void checkMagicNumbers(Expression expression, List<Diagnostic> sink) {
        if (!config.warnMagicNumbers()) {
            return;
        }
        if (expression instanceof Expression.IntLiteral literal) {
            reportMagic(literal.value(), literal.text(), literal.span(), sink);
        } else if (expression instanceof Expression.Unary unary) {
            if (unary.op() == UnaryOp.NEG && unary.operand() instanceof Expression.IntLiteral literal) {
                reportMagic(-literal.value(), "-" + literal.text(), unary.span(), sink);
            } else {
                checkMagicNumbers(unary.operand(), sink);
            }
        } else if (expression instanceof Expression.Binary binary) {
            checkMagicNumbers(binary.left(), sink);
            checkMagicNumbers(binary.right(), sink);
        } else if (expression instanceof Expression.Paren paren) {
            checkMagicNumbers(paren.inner(), sink);
        } else if (expression instanceof Expression.Call call) {
            checkArguments(call.arguments(), sink);
        } else if (expression instanceof Expression.VariableRef ref) {
            checkMagicNumbers(ref.variable(), sink);
        }
    }

    private void checkMagicNumbers(Variable variable, List<Diagnostic> sink) {
        if (variable instanceof Variable.Index index) {
            checkMagicNumbers(index.base(), sink);
            index.indices().forEach(subscript -> checkMagicNumbers(subscript, sink));
        } else if (variable instanceof Variable.Member member) {
            checkMagicNumbers(member.base(), sink);
        } else if (variable instanceof Variable.Deref deref) {
            checkMagicNumbers(deref.base(), sink);
        }
    }

    private void reportMagic(long value, String text, SourceSpan span, List<Diagnostic> sink) {
        if (config.isMagicNumber(value)) {
            sink.add(Diagnostic.hint(new DiagnosticKind.MagicNumber(text), span));
        }
    }

    // === Dead code ===

    private static void checkDeadCode(List<Statement> statements, List<Diagnostic> sink) {
        boolean terminated = false;

        for (var statement : statements) {
            if (terminated) {
                sink.add(Diagnostic.warning(new DiagnosticKind.DeadCode(DEAD_CODE_REASON), statement.span()));
            }
            if (statement instanceof Statement.Return || statement instanceof Statement.Exit) {
                terminated = true;
            }
            AstWalker.nestedBodies(statement).forEach(body -> checkDeadCode(body, sink));
        }
    }

    // === Helper methods ===

    static Severity tier(int measured, int threshold) {
        if (measured * 2 <= threshold * 3) {
            return Severity.HINT;
        }
        if (measured <= threshold * 2) {
            return Severity.WARNING;
        }
        return Severity.ERROR;
    }
}
