package org.pragmatica.plc.error;

/**
 * Diagnostic severity, ordered from least to most severe.
 */
public enum Severity {
    HINT("hint"),
    WARNING("warning"),
    ERROR("error");

    private final String display;

    Severity(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
