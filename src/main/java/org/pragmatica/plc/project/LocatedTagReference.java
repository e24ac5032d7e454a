package org.pragmatica.plc.project;

import org.pragmatica.plc.rll.TagReference;

public record LocatedTagReference(RungLocation location, TagReference reference) {

    public String tagName() {
        return reference.name();
    }

    public String fullOperand() {
        return reference.fullOperand();
    }

    public String instruction() {
        return reference.instruction();
    }
}
