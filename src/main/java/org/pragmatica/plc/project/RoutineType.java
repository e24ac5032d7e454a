package org.pragmatica.plc.project;

import java.util.Locale;
import java.util.Optional;

public enum RoutineType {
    RLL,
    ST,
    FBD,
    SFC;

    public static Optional<RoutineType> fromName(String name) {
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
