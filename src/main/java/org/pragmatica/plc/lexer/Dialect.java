package org.pragmatica.plc.lexer;

import org.pragmatica.plc.parser.ParserLimits;

/**
 * Structured Text dialects understood by the front end.
 */
public enum Dialect {
    /**
     * IEC 61131-3 third edition, including classes, interfaces and namespaces.
     */
    GENERIC("IEC 61131-3 ST"),

    /**
     * Siemens SCL: numbered and quoted block names, {@code #local} variables, pragmas, regions.
     */
    SCL("Siemens SCL"),

    /**
     * Rockwell Logix ST: bare routine bodies, module-qualified tags, empty call arguments.
     */
    ROCKWELL("Rockwell ST");

    private final String displayName;

    Dialect(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Create the lexer for this dialect.
     */
    public StLexer lexer(String input, ParserLimits limits) {
        return switch (this) {
            case GENERIC -> StLexer.create(input, limits);
            case SCL -> SclLexer.create(input, limits);
            case ROCKWELL -> RockwellLexer.create(input, limits);
        };
    }
}
