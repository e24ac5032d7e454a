package org.pragmatica.plc.ast;

public enum Retain {
    NONE,
    RETAIN,
    NON_RETAIN
}
