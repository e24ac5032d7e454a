package org.pragmatica.plc.analysis.types;

import java.util.Locale;
import java.util.OptionalInt;

/**
 * Types known to the checker.
 *
 * <p>{@link Elementary#UNKNOWN} marks a type that could not be determined. It is accepted everywhere, so a
 * single mistake does not produce a chain of follow-up errors.
 */
public sealed interface Type {

    String displayName();

    /**
     * Resolve a type name as written in a declaration. Names that are not elementary are treated as
     * structured user types.
     */
    static Type fromName(String name) {
        var upper = name.toUpperCase(Locale.ROOT);

        return switch (upper) {
            case "BOOL" -> Elementary.BOOL;
            case "BYTE" -> Elementary.BYTE;
            case "WORD" -> Elementary.WORD;
            case "DWORD" -> Elementary.DWORD;
            case "LWORD" -> Elementary.LWORD;
            case "SINT" -> Elementary.SINT;
            case "INT" -> Elementary.INT;
            case "DINT" -> Elementary.DINT;
            case "LINT" -> Elementary.LINT;
            case "USINT" -> Elementary.USINT;
            case "UINT" -> Elementary.UINT;
            case "UDINT" -> Elementary.UDINT;
            case "ULINT" -> Elementary.ULINT;
            case "REAL" -> Elementary.REAL;
            case "LREAL" -> Elementary.LREAL;
            case "TIME", "LTIME" -> Elementary.TIME;
            case "DATE", "LDATE" -> Elementary.DATE;
            case "TOD", "TIME_OF_DAY", "LTOD", "LTIME_OF_DAY" -> Elementary.TIME_OF_DAY;
            case "DT", "DATE_AND_TIME", "LDT", "LDATE_AND_TIME" -> Elementary.DATE_AND_TIME;
            case "STRING" -> StringType.NARROW;
            case "WSTRING" -> StringType.WIDE;
            case "ANY" -> Elementary.ANY;
            default -> new StructType(name);
        };
    }

    default boolean isInteger() {
        return this instanceof Elementary elementary && elementary.category() == Category.INTEGER;
    }

    default boolean isReal() {
        return this instanceof Elementary elementary && elementary.category() == Category.REAL;
    }

    default boolean isNumeric() {
        return isInteger() || isReal();
    }

    default boolean isBool() {
        return this == Elementary.BOOL;
    }

    default boolean isString() {
        return this instanceof StringType;
    }

    /**
     * Durations and calendar types.
     */
    default boolean isTime() {
        return this instanceof Elementary elementary && elementary.category() == Category.TIME;
    }

    default boolean isUnknown() {
        return this == Elementary.UNKNOWN;
    }

    /**
     * Whether a value of type {@code other} may be stored in a variable of this type. Integer conversions
     * are permitted in either direction, as are integer to real and real to real.
     */
    default boolean isAssignableFrom(Type other) {
        if (equals(other)) {
            return true;
        }
        if (this == Elementary.ANY || other == Elementary.ANY || isUnknown() || other.isUnknown()) {
            return true;
        }
        if (isReal() && other.isNumeric()) {
            return true;
        }
        if (isInteger() && other.isInteger()) {
            return true;
        }
        return isString() && other.isString();
    }

    enum Category {
        BOOL,
        INTEGER,
        REAL,
        TIME,
        OTHER
    }

    enum Elementary implements Type {
        BOOL("BOOL", Category.BOOL),
        BYTE("BYTE", Category.INTEGER),
        WORD("WORD", Category.INTEGER),
        DWORD("DWORD", Category.INTEGER),
        LWORD("LWORD", Category.INTEGER),
        SINT("SINT", Category.INTEGER),
        INT("INT", Category.INTEGER),
        DINT("DINT", Category.INTEGER),
        LINT("LINT", Category.INTEGER),
        USINT("USINT", Category.INTEGER),
        UINT("UINT", Category.INTEGER),
        UDINT("UDINT", Category.INTEGER),
        ULINT("ULINT", Category.INTEGER),
        REAL("REAL", Category.REAL),
        LREAL("LREAL", Category.REAL),
        TIME("TIME", Category.TIME),
        DATE("DATE", Category.TIME),
        TIME_OF_DAY("TOD", Category.TIME),
        DATE_AND_TIME("DT", Category.TIME),
        ANY("ANY", Category.OTHER),
        VOID("VOID", Category.OTHER),
        UNKNOWN("?", Category.OTHER);

        private final String displayName;
        private final Category category;

        Elementary(String displayName, Category category) {
            this.displayName = displayName;
            this.category = category;
        }

        @Override
        public String displayName() {
            return displayName;
        }

        public Category category() {
            return category;
        }
    }

    record StringType(boolean wide, OptionalInt maxLength) implements Type {
        public static final StringType NARROW = new StringType(false, OptionalInt.empty());
        public static final StringType WIDE = new StringType(true, OptionalInt.empty());

        @Override
        public String displayName() {
            var base = wide ? "WSTRING" : "STRING";
            return maxLength.isPresent() ? base + "[" + maxLength.getAsInt() + "]" : base;
        }
    }

    record ArrayType(Type element, int dimensions) implements Type {
        @Override
        public String displayName() {
            return "ARRAY[" + dimensions + "] OF " + element.displayName();
        }
    }

    record StructType(String name) implements Type {
        @Override
        public String displayName() {
            return name;
        }
    }

    record EnumType(String name) implements Type {
        @Override
        public String displayName() {
            return name;
        }
    }

    record FunctionBlockType(String name) implements Type {
        @Override
        public String displayName() {
            return name;
        }
    }

    record ReferenceType(Type target) implements Type {
        @Override
        public String displayName() {
            return "REF_TO " + target.displayName();
        }
    }
}
