package org.pragmatica.plc.ast;

/**
 * Flavour of a duration or calendar literal, selected by its prefix.
 */
public enum TimeKind {
    TIME,
    LTIME,
    DATE,
    LDATE,
    TIME_OF_DAY,
    LTIME_OF_DAY,
    DATE_AND_TIME,
    LDATE_AND_TIME;

    /**
     * Map a literal prefix such as {@code T}, {@code TOD} or {@code LDT} to its kind.
     */
    public static TimeKind fromPrefix(String prefix) {
        return switch (prefix.toUpperCase()) {
            case "T", "TIME" -> TIME;
            case "LT", "LTIME" -> LTIME;
            case "D", "DATE" -> DATE;
            case "LD", "LDATE" -> LDATE;
            case "TOD", "TIME_OF_DAY" -> TIME_OF_DAY;
            case "LTOD", "LTIME_OF_DAY" -> LTIME_OF_DAY;
            case "DT", "DATE_AND_TIME" -> DATE_AND_TIME;
            case "LDT", "LDATE_AND_TIME" -> LDATE_AND_TIME;
            default -> null;
        };
    }

    public boolean isDuration() {
        return this == TIME || this == LTIME;
    }
}
