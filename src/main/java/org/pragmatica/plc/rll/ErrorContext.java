package org.pragmatica.plc.rll;

/**
 * Where a rung lives in a controller project.
 */
public record ErrorContext(String program, String routine, int rungNumber) {

    public String path() {
        return program + "/" + routine + "/Rung#" + rungNumber;
    }
}
