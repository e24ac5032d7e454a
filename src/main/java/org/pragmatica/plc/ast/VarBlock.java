package org.pragmatica.plc.ast;

import org.pragmatica.plc.tree.SourceSpan;

import java.util.List;

/**
 * A {@code VAR_* ... END_VAR} section.
 */
public record VarBlock(SourceSpan span,
                       VarClass varClass,
                       boolean constant,
                       Retain retain,
                       List<VarDecl> declarations) {

    public VarBlock {
        declarations = List.copyOf(declarations);
    }
}
