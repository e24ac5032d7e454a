package org.pragmatica.plc.ast;

import org.pragmatica.plc.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered sequence of top-level declarations parsed from one source text.
 */
public record CompilationUnit(SourceSpan span, List<PouDeclaration> declarations) {

    public CompilationUnit {
        declarations = List.copyOf(declarations);
    }

    /**
     * Every declaration, with namespace contents flattened in place.
     */
    public List<PouDeclaration> allDeclarations() {
        var result = new ArrayList<PouDeclaration>();
        collect(declarations, result);
        return result;
    }

    public Optional<PouDeclaration> find(String name) {
        return allDeclarations().stream()
                                .filter(declaration -> declaration.name().equals(name))
                                .findFirst();
    }

    private static void collect(List<PouDeclaration> source, List<PouDeclaration> sink) {
        for (var declaration : source) {
            if (declaration instanceof PouDeclaration.Namespace namespace) {
                collect(namespace.elements(), sink);
            } else {
                sink.add(declaration);
            }
        }
    }
}
