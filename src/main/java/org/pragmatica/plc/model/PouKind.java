package org.pragmatica.plc.model;

public enum PouKind {
    PROGRAM,
    FUNCTION_BLOCK,
    FUNCTION
}
