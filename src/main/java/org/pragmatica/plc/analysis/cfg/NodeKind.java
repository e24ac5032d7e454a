package org.pragmatica.plc.analysis.cfg;

public enum NodeKind {
    ENTRY,
    EXIT,
    BASIC,
    /**
     * IF, ELSIF or CASE condition.
     */
    BRANCH,
    /**
     * FOR or WHILE header, REPEAT condition.
     */
    LOOP_HEADER,
    LOOP_EXIT;

    public boolean isDecision() {
        return this == BRANCH || this == LOOP_HEADER;
    }
}
