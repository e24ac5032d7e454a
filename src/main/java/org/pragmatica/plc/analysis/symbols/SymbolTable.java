package org.pragmatica.plc.analysis.symbols;

import org.pragmatica.plc.error.Diagnostic;
import org.pragmatica.plc.error.DiagnosticKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Nested scopes stored in a flat list, linked to their parents by index.
 *
 * <p>The table starts with a {@code global} scope. {@link #exitScope()} returns to the parent but keeps the
 * scope, so {@link #checkUnused()} still sees its symbols.
 */
public final class SymbolTable {
    private final List<Scope> scopes = new ArrayList<>();
    private int current;

    public SymbolTable() {
        scopes.add(new Scope("global", OptionalInt.empty()));
        current = 0;
    }

    public void enterScope(String name) {
        scopes.add(new Scope(name, OptionalInt.of(current)));
        current = scopes.size() - 1;
    }

    public void exitScope() {
        var parent = scopes.get(current).parent();
        if (parent.isPresent()) {
            current = parent.getAsInt();
        }
    }

    public String currentScopeName() {
        return scopes.get(current).name();
    }

    /**
     * Add a symbol to the current scope.
     *
     * @return a duplicate-definition error referring to the earlier declaration, or empty when the name was free
     */
    public Optional<Diagnostic> define(Symbol symbol) {
        var scope = scopes.get(current);
        var existing = scope.get(symbol.name());

        if (existing.isPresent()) {
            return Optional.of(Diagnostic.error(
                new DiagnosticKind.DuplicateDefinition(symbol.name(), existing.get().span()), symbol.span()));
        }
        scope.put(symbol);
        return Optional.empty();
    }

    /**
     * Find a symbol in the current scope or any enclosing one.
     */
    public Optional<Symbol> lookup(String name) {
        return owningScope(name).flatMap(scope -> scope.get(name));
    }

    /**
     * Same as {@link #lookup(String)}; the returned symbol is the live entry whose flags may be updated.
     */
    public Optional<Symbol> lookupMut(String name) {
        return lookup(name);
    }

    public void markUsed(String name) {
        lookupMut(name).ifPresent(Symbol::markUsed);
    }

    public void markAssigned(String name) {
        lookupMut(name).ifPresent(Symbol::markAssigned);
    }

    public boolean isDefinedLocally(String name) {
        return scopes.get(current).contains(name);
    }

    /**
     * Warnings for plain variables that were never read or never assigned, across all scopes.
     */
    public List<Diagnostic> checkUnused() {
        var diagnostics = new ArrayList<Diagnostic>();

        for (var scope : scopes) {
            for (var symbol : scope.symbols()) {
                if (symbol.kind() != SymbolKind.VARIABLE) {
                    continue;
                }
                if (!symbol.isUsed()) {
                    diagnostics.add(Diagnostic.warning(new DiagnosticKind.UnusedVariable(symbol.name()),
                                                       symbol.span()));
                }
                if (!symbol.isAssigned() && symbol.isMutable()) {
                    diagnostics.add(Diagnostic.warning(new DiagnosticKind.UninitializedVariable(symbol.name()),
                                                       symbol.span()));
                }
            }
        }
        return diagnostics;
    }

    public List<Scope> scopes() {
        return List.copyOf(scopes);
    }

    private Optional<Scope> owningScope(String name) {
        OptionalInt index = OptionalInt.of(current);

        while (index.isPresent()) {
            var scope = scopes.get(index.getAsInt());
            if (scope.contains(name)) {
                return Optional.of(scope);
            }
            index = scope.parent();
        }
        return Optional.empty();
    }
}
