package org.pragmatica.plc.ast;

public enum PouKind {
    FUNCTION,
    FUNCTION_BLOCK,
    PROGRAM,
    CLASS,
    INTERFACE,
    METHOD,
    DATA_TYPE,
    GLOBAL_VAR,
    NAMESPACE,
    DATA_BLOCK,
    ORGANIZATION_BLOCK
}
