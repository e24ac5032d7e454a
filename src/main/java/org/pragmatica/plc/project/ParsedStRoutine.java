package org.pragmatica.plc.project;

import org.pragmatica.plc.ast.AstWalker;
import org.pragmatica.plc.ast.Expression;
import org.pragmatica.plc.ast.Statement;
import org.pragmatica.plc.error.Diagnostic;
import org.pragmatica.plc.error.ParseError;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An ST routine parsed in recovering mode. Statements that parsed are kept even when errors were found, and
 * analysis diagnostics cover those statements.
 *
 * @param source ST lines joined in line-number order
 */
public record ParsedStRoutine(String program, String routine, String source, List<Statement> statements,
                              List<ParseError> errors, List<Diagnostic> diagnostics) {

    public ParsedStRoutine {
        statements = List.copyOf(statements);
        errors = List.copyOf(errors);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isParsed() {
        return errors.isEmpty();
    }

    public String path() {
        return program + "/" + routine;
    }

    /**
     * Names of everything called from the routine: functions, instructions and block instances.
     */
    public Set<String> callNames() {
        var names = new LinkedHashSet<String>();

        AstWalker.walkStatements(statements, statement -> {
            if (statement instanceof Statement.FunctionCall call) {
                names.add(call.name());
            } else if (statement instanceof Statement.FbInvocation invocation) {
                names.add(invocation.instance().path());
            }
        });
        AstWalker.walkAllExpressions(statements, expression -> {
            if (expression instanceof Expression.Call call) {
                names.add(call.name());
            }
        });
        return names;
    }

    /**
     * Parse errors rendered with a source excerpt, each preceded by the routine path.
     */
    public List<String> formattedErrors() {
        return errors.stream()
                     .map(error -> "in " + path() + "\n" + error.formatWithSource(source))
                     .toList();
    }
}
