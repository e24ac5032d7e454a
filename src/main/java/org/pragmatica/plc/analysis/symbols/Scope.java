package org.pragmatica.plc.analysis.symbols;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One level of name visibility. The parent is referenced by its index in the owning {@link SymbolTable}.
 * Names are matched exactly as spelled; symbols keep declaration order.
 */
public final class Scope {
    private final String name;
    private final OptionalInt parent;
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();

    Scope(String name, OptionalInt parent) {
        this.name = name;
        this.parent = parent;
    }

    public String name() {
        return name;
    }

    public OptionalInt parent() {
        return parent;
    }

    public Optional<Symbol> get(String symbolName) {
        return Optional.ofNullable(symbols.get(symbolName));
    }

    public boolean contains(String symbolName) {
        return symbols.containsKey(symbolName);
    }

    public Collection<Symbol> symbols() {
        return symbols.values();
    }

    void put(Symbol symbol) {
        symbols.put(symbol.name(), symbol);
    }
}
