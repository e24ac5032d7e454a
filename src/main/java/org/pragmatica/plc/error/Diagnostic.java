package org.pragmatica.plc.error;

import org.pragmatica.plc.tree.SourceExcerpt;
import org.pragmatica.plc.tree.SourceSpan;

import java.util.Comparator;

/**
 * A finding produced by an analysis pass.
 *
 * <p>Diagnostics from a single pass are produced in source-scan order. Use {@link #BY_SEVERITY_THEN_POSITION}
 * for presentation order.
 */
public record Diagnostic(DiagnosticKind kind, SourceSpan span, Severity severity) {

    public static final Comparator<Diagnostic> BY_SEVERITY_THEN_POSITION =
        Comparator.comparing(Diagnostic::severity)
                  .reversed()
                  .thenComparingInt(d -> d.span().start());

    public static Diagnostic error(DiagnosticKind kind, SourceSpan span) {
        return new Diagnostic(kind, span, Severity.ERROR);
    }

    public static Diagnostic warning(DiagnosticKind kind, SourceSpan span) {
        return new Diagnostic(kind, span, Severity.WARNING);
    }

    public static Diagnostic hint(DiagnosticKind kind, SourceSpan span) {
        return new Diagnostic(kind, span, Severity.HINT);
    }

    public String message() {
        return kind.message();
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Format with a source excerpt and a caret under the offending range.
     */
    public String formatWithSource(String source) {
        return SourceExcerpt.render(severity.display() + ": " + message(), span, source);
    }

    @Override
    public String toString() {
        return severity.display() + ": " + message() + " at " + span;
    }
}
