package org.pragmatica.plc.ast;

import org.pragmatica.plc.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Structured Text statements. Control-flow variants own their bodies as statement lists.
 */
public sealed interface Statement {

    SourceSpan span();

    // === Simple statements ===

    record Assignment(SourceSpan span, Variable target, AssignOp op, Expression value) implements Statement {}

    /**
     * Free-standing call of a function, or of an FB instance named by a plain identifier.
     */
    record FunctionCall(SourceSpan span, String name, List<Argument> arguments) implements Statement {
        public FunctionCall {
            arguments = List.copyOf(arguments);
        }
    }

    /**
     * Call through a qualified instance path, e.g. {@code Motors[1].Start()} or {@code "Db".Timer(IN := x)}.
     */
    record FbInvocation(SourceSpan span, Variable instance, List<Argument> arguments) implements Statement {
        public FbInvocation {
            arguments = List.copyOf(arguments);
        }
    }

    record Return(SourceSpan span, Optional<Expression> value) implements Statement {}

    record Exit(SourceSpan span) implements Statement {}

    record Continue(SourceSpan span) implements Statement {}

    record Empty(SourceSpan span) implements Statement {}

    record Goto(SourceSpan span, String label) implements Statement {}

    record Label(SourceSpan span, String name) implements Statement {}

    // === Control flow ===

    record If(SourceSpan span,
              Expression condition,
              List<Statement> thenBody,
              List<ElsIf> elsIfs,
              Optional<List<Statement>> elseBody) implements Statement {
        public If {
            thenBody = List.copyOf(thenBody);
            elsIfs = List.copyOf(elsIfs);
            elseBody = elseBody.map(List::copyOf);
        }
    }

    record ElsIf(SourceSpan span, Expression condition, List<Statement> body) {
        public ElsIf {
            body = List.copyOf(body);
        }
    }

    record Case(SourceSpan span,
                Expression selector,
                List<CaseBranch> branches,
                Optional<List<Statement>> elseBody) implements Statement {
        public Case {
            branches = List.copyOf(branches);
            elseBody = elseBody.map(List::copyOf);
        }
    }

    record CaseBranch(SourceSpan span, List<CaseLabel> labels, List<Statement> body) {
        public CaseBranch {
            labels = List.copyOf(labels);
            body = List.copyOf(body);
        }
    }

    record For(SourceSpan span,
               String variable,
               Expression start,
               Expression end,
               Optional<Expression> step,
               List<Statement> body) implements Statement {
        public For {
            body = List.copyOf(body);
        }
    }

    record While(SourceSpan span, Expression condition, List<Statement> body) implements Statement {
        public While {
            body = List.copyOf(body);
        }
    }

    record Repeat(SourceSpan span, List<Statement> body, Expression condition) implements Statement {
        public Repeat {
            body = List.copyOf(body);
        }
    }

    /**
     * SCL {@code REGION name ... END_REGION}.
     */
    record Region(SourceSpan span, String name, List<Statement> body) implements Statement {
        public Region {
            body = List.copyOf(body);
        }
    }
}
