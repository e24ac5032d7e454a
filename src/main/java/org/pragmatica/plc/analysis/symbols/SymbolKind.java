package org.pragmatica.plc.analysis.symbols;

public enum SymbolKind {
    VARIABLE,
    PARAMETER,
    OUTPUT,
    IN_OUT,
    CONSTANT,
    FUNCTION,
    FUNCTION_BLOCK,
    PROGRAM,
    TYPE
}
