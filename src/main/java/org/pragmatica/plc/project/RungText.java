package org.pragmatica.plc.project;

import java.util.Optional;

/**
 * Ladder rung as stored in a controller export.
 */
public record RungText(int number, String text, Optional<String> comment) {

    public static RungText of(int number, String text) {
        return new RungText(number, text, Optional.empty());
    }
}
