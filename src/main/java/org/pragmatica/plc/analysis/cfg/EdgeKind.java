package org.pragmatica.plc.analysis.cfg;

public enum EdgeKind {
    SEQUENTIAL,
    TRUE_BRANCH,
    FALSE_BRANCH,
    LOOP_BACK,
    LOOP_EXIT,
    RETURN,
    /**
     * GOTO to its label.
     */
    JUMP
}
