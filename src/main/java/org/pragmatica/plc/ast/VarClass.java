package org.pragmatica.plc.ast;

/**
 * Variable section kinds.
 */
public enum VarClass {
    LOCAL("VAR"),
    INPUT("VAR_INPUT"),
    OUTPUT("VAR_OUTPUT"),
    IN_OUT("VAR_IN_OUT"),
    TEMP("VAR_TEMP"),
    GLOBAL("VAR_GLOBAL"),
    EXTERNAL("VAR_EXTERNAL"),
    ACCESS("VAR_ACCESS"),
    CONFIG("VAR_CONFIG");

    private final String keyword;

    VarClass(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
