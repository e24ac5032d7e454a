package org.pragmatica.plc.analysis.symbols;

import org.pragmatica.plc.analysis.types.Type;
import org.pragmatica.plc.tree.SourceSpan;

import java.util.Optional;

/**
 * A declared name. The {@code used} and {@code assigned} flags only ever go from {@code false} to {@code true}.
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final Optional<Type> type;
    private final SourceSpan span;
    private final boolean mutable;
    private boolean used;
    private boolean assigned;

    private Symbol(String name, SymbolKind kind, Optional<Type> type, SourceSpan span, boolean mutable,
                   boolean assigned) {
        this.name = name;
        this.kind = kind;
        this.type = type;
        this.span = span;
        this.mutable = mutable;
        this.assigned = assigned;
    }

    public static Symbol symbol(String name, SymbolKind kind, Type type, SourceSpan span, boolean mutable,
                                boolean assigned) {
        return new Symbol(name, kind, Optional.ofNullable(type), span, mutable, assigned);
    }

    /**
     * Mutable variable with the given type, not yet assigned.
     */
    public static Symbol variable(String name, Type type, SourceSpan span) {
        return symbol(name, SymbolKind.VARIABLE, type, span, true, false);
    }

    public String name() {
        return name;
    }

    public SymbolKind kind() {
        return kind;
    }

    public Optional<Type> type() {
        return type;
    }

    public SourceSpan span() {
        return span;
    }

    public boolean isMutable() {
        return mutable;
    }

    public boolean isUsed() {
        return used;
    }

    public boolean isAssigned() {
        return assigned;
    }

    public void markUsed() {
        used = true;
    }

    public void markAssigned() {
        assigned = true;
    }

    @Override
    public String toString() {
        return kind + " " + name + type.map(t -> " : " + t.displayName()).orElse("");
    }
}
