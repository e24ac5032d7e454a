package org.pragmatica.plc.parser;

import org.pragmatica.plc.error.ParseError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of a recovering parse: whatever could be parsed, plus every error encountered on the way.
 *
 * @param value  the parsed value (partial when errors are present)
 * @param errors errors in the order they were found
 * @param source the original input, kept for formatting
 */
public record ParseResultWithErrors<T>(T value, List<ParseError> errors, String source) {

    public ParseResultWithErrors {
        errors = List.copyOf(errors);
    }

    public static <T> ParseResultWithErrors<T> success(T value, String source) {
        return new ParseResultWithErrors<>(value, List.of(), source);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int errorCount() {
        return errors.size();
    }

    /**
     * All errors rendered with source excerpts, separated by blank lines.
     */
    public String formatErrors() {
        return errors.stream()
                     .map(error -> error.formatWithSource(source))
                     .collect(Collectors.joining("\n\n"));
    }
}
