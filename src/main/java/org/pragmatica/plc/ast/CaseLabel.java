package org.pragmatica.plc.ast;

import org.pragmatica.plc.tree.SourceSpan;

/**
 * A CASE selector.
 */
public sealed interface CaseLabel {

    SourceSpan span();

    record Value(SourceSpan span, Expression value) implements CaseLabel {}

    record Range(SourceSpan span, Expression low, Expression high) implements CaseLabel {}
}
