package org.pragmatica.plc.analysis.types;

import org.pragmatica.plc.ast.Expression;
import org.pragmatica.plc.ast.TimeKind;
import org.pragmatica.plc.ast.TypeSpec;

import java.util.Locale;
import java.util.OptionalInt;

/**
 * Conversions from declarations and literals to checker types.
 */
public final class Types {
    private Types() {}

    /**
     * Checker type of a declared type. Subranges take the type of their base; anonymous structures and
     * enumerations get a placeholder name.
     */
    public static Type fromTypeSpec(TypeSpec spec) {
        if (spec instanceof TypeSpec.Elementary elementary) {
            return Type.fromName(elementary.name());
        }
        if (spec instanceof TypeSpec.StringType string) {
            var length = string.length()
                               .filter(Expression.IntLiteral.class::isInstance)
                               .map(expression -> OptionalInt.of((int) ((Expression.IntLiteral) expression).value()))
                               .orElse(OptionalInt.empty());
            return new Type.StringType(string.wide(), length);
        }
        if (spec instanceof TypeSpec.ArrayType array) {
            return new Type.ArrayType(fromTypeSpec(array.element()), array.ranges().size());
        }
        if (spec instanceof TypeSpec.StructType) {
            return new Type.StructType("STRUCT");
        }
        if (spec instanceof TypeSpec.RefType ref) {
            return new Type.ReferenceType(fromTypeSpec(ref.target()));
        }
        if (spec instanceof TypeSpec.UserDefined userDefined) {
            return Type.fromName(userDefined.name());
        }
        if (spec instanceof TypeSpec.EnumType enumType) {
            return enumType.baseType().map(Type::fromName).orElse(new Type.EnumType("ENUM"));
        }
        if (spec instanceof TypeSpec.SubrangeType subrange) {
            return fromTypeSpec(subrange.base());
        }
        return Type.Elementary.UNKNOWN;
    }

    public static Type ofTimeLiteral(TimeKind kind) {
        return switch (kind) {
            case TIME, LTIME -> Type.Elementary.TIME;
            case DATE, LDATE -> Type.Elementary.DATE;
            case TIME_OF_DAY, LTIME_OF_DAY -> Type.Elementary.TIME_OF_DAY;
            case DATE_AND_TIME, LDATE_AND_TIME -> Type.Elementary.DATE_AND_TIME;
        };
    }

    /**
     * Result type of a standard function, or {@code UNKNOWN} for anything else.
     */
    public static Type builtinReturnType(String name) {
        return switch (name.toUpperCase(Locale.ROOT)) {
            case "ABS", "SQRT", "LN", "LOG", "EXP", "SIN", "COS", "TAN", "ASIN", "ACOS", "ATAN", "ATAN2",
                 "INT_TO_REAL", "DINT_TO_REAL", "STRING_TO_REAL" -> Type.Elementary.LREAL;
            case "BOOL_TO_INT", "REAL_TO_INT", "TRUNC", "ROUND", "STRING_TO_INT", "LEN", "FIND" -> Type.Elementary.DINT;
            case "INT_TO_STRING", "REAL_TO_STRING", "LEFT", "RIGHT", "MID", "CONCAT", "INSERT", "DELETE",
                 "REPLACE" -> Type.StringType.NARROW;
            case "SHL", "SHR", "ROL", "ROR" -> Type.Elementary.DWORD;
            case "SEL", "MAX", "MIN", "LIMIT", "MUX" -> Type.Elementary.ANY;
            default -> Type.Elementary.UNKNOWN;
        };
    }
}
