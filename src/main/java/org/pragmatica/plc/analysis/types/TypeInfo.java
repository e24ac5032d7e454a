package org.pragmatica.plc.analysis.types;

/**
 * Inferred type of an expression together with whether it is a constant and whether it can be assigned to.
 */
public record TypeInfo(Type type, boolean constant, boolean lvalue) {

    public static TypeInfo value(Type type) {
        return new TypeInfo(type, false, false);
    }

    public static TypeInfo lvalue(Type type) {
        return new TypeInfo(type, false, true);
    }

    public static TypeInfo constant(Type type) {
        return new TypeInfo(type, true, false);
    }

    public static TypeInfo unknown() {
        return value(Type.Elementary.UNKNOWN);
    }
}
