package org.pragmatica.plc.analysis.cfg;

import org.pragmatica.plc.ast.Statement;

import java.util.Optional;

/**
 * Node of a control-flow graph. Basic blocks and branch nodes carry the statement they stand for.
 */
public record CfgNode(int id, NodeKind kind, Optional<Statement> statement) {

    public String label() {
        return switch (kind) {
            case ENTRY -> "Entry";
            case EXIT -> "Exit";
            case BASIC -> "Block " + id;
            case BRANCH -> "Branch " + id;
            case LOOP_HEADER -> "Loop " + id;
            case LOOP_EXIT -> "LoopExit " + id;
        };
    }
}
