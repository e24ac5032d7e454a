package org.pragmatica.plc.project;

import org.pragmatica.plc.rll.ErrorContext;

public record RungLocation(String program, String routine, int rungNumber) {

    public String path() {
        return toErrorContext().path();
    }

    public ErrorContext toErrorContext() {
        return new ErrorContext(program, routine, rungNumber);
    }
}
