package org.pragmatica.plc.ast;

import org.pragmatica.plc.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * One declared variable. {@code a, b : INT;} produces two declarations sharing the type.
 */
public record VarDecl(SourceSpan span,
                      String name,
                      Optional<DirectAddress> address,
                      TypeSpec type,
                      Optional<Expression> initialValue,
                      List<Pragma> pragmas) {

    public VarDecl {
        pragmas = List.copyOf(pragmas);
    }

    public static VarDecl simple(SourceSpan span, String name, TypeSpec type) {
        return new VarDecl(span, name, Optional.empty(), type, Optional.empty(), List.of());
    }
}
