package org.pragmatica.plc.analysis.cfg;

import org.pragmatica.plc.ast.AstWalker;
import org.pragmatica.plc.ast.BinaryOp;
import org.pragmatica.plc.ast.Expression;
import org.pragmatica.plc.ast.Statement;

import java.util.List;

/**
 * Expression-level complexity measures.
 */
public final class Complexity {
    private Complexity() {}

    /**
     * Number of short-circuit style operators ({@code AND}, {@code OR}) in an expression tree.
     */
    public static int countExpressionDecisions(Expression expression) {
        if (expression instanceof Expression.Binary binary) {
            int own = binary.op() == BinaryOp.AND || binary.op() == BinaryOp.OR ? 1 : 0;
            return own + countExpressionDecisions(binary.left()) + countExpressionDecisions(binary.right());
        }
        if (expression instanceof Expression.Unary unary) {
            return countExpressionDecisions(unary.operand());
        }
        if (expression instanceof Expression.Paren paren) {
            return countExpressionDecisions(paren.inner());
        }
        return 0;
    }

    /**
     * Decision complexity of a statement list plus the AND/OR operators in its conditions.
     */
    public static int cognitiveComplexity(List<Statement> statements) {
        int[] total = {CfgBuilder.build(statements).decisionComplexity()};
        AstWalker.walkStatements(statements, statement -> {
            if (statement instanceof Statement.If ifStatement) {
                total[0] += countExpressionDecisions(ifStatement.condition());
                ifStatement.elsIfs().forEach(elsIf -> total[0] += countExpressionDecisions(elsIf.condition()));
            } else if (statement instanceof Statement.While whileLoop) {
                total[0] += countExpressionDecisions(whileLoop.condition());
            } else if (statement instanceof Statement.Repeat repeat) {
                total[0] += countExpressionDecisions(repeat.condition());
            }
        });
        return total[0];
    }
}
