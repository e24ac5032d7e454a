package org.pragmatica.plc.error;

/**
 * Unwinds the recursive-descent parser to the nearest recovery point or to the public entry.
 */
public final class ParseException extends RuntimeException {
    private final ParseError error;

    public ParseException(ParseError error) {
        super(error.message(), null, false, false);
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
