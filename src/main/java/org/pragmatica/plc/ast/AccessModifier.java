package org.pragmatica.plc.ast;

public enum AccessModifier {
    PUBLIC,
    PROTECTED,
    PRIVATE,
    INTERNAL
}
