package org.pragmatica.plc.rll;

import java.util.Optional;

/**
 * A rung parse error together with the rung text and, when known, its location in the project.
 */
public record RllParseError(RllError error, String source, Optional<ErrorContext> context) {

    public static RllParseError of(RllError error, String source) {
        return new RllParseError(error, source, Optional.empty());
    }

    public RllParseError withContext(ErrorContext context) {
        return new RllParseError(error, source, Optional.of(context));
    }

    public String format() {
        var location = context.map(ctx -> "in " + ctx.path() + "\n").orElse("");
        return location + error.formatWithContext(source);
    }

    @Override
    public String toString() {
        return format();
    }
}
