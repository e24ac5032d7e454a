package org.pragmatica.plc.analysis.smells;

import org.pragmatica.plc.ast.Statement;

import java.util.List;

/**
 * Nesting depth of control structures. IF, CASE, FOR, WHILE and REPEAT each add one level; regions do not.
 */
public final class Nesting {
    private Nesting() {}

    public static int maxNestingDepth(List<Statement> statements) {
        return depth(statements, 0);
    }

    private static int depth(List<Statement> statements, int current) {
        int max = current;

        for (var statement : statements) {
            max = Math.max(max, depth(statement, current));
        }
        return max;
    }

    private static int depth(Statement statement, int current) {
        int nested = current + 1;

        if (statement instanceof Statement.If ifStatement) {
            int max = depth(ifStatement.thenBody(), nested);
            for (var elsIf : ifStatement.elsIfs()) {
                max = Math.max(max, depth(elsIf.body(), nested));
            }
            if (ifStatement.elseBody().isPresent()) {
                max = Math.max(max, depth(ifStatement.elseBody().get(), nested));
            }
            return max;
        }
        if (statement instanceof Statement.Case caseStatement) {
            int max = nested;
            for (var branch : caseStatement.branches()) {
                max = Math.max(max, depth(branch.body(), nested));
            }
            if (caseStatement.elseBody().isPresent()) {
                max = Math.max(max, depth(caseStatement.elseBody().get(), nested));
            }
            return max;
        }
        if (statement instanceof Statement.For forLoop) {
            return depth(forLoop.body(), nested);
        }
        if (statement instanceof Statement.While whileLoop) {
            return depth(whileLoop.body(), nested);
        }
        if (statement instanceof Statement.Repeat repeat) {
            return depth(repeat.body(), nested);
        }
        if (statement instanceof Statement.Region region) {
            return depth(region.body(), current);
        }
        return current;
    }
}
