package org.pragmatica.plc.analysis.types;

import org.junit.jupiter.api.Test;
import org.pragmatica.plc.ast.TimeKind;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class TypeTest {

    @Test
    void fromName_isCaseInsensitive() {
        assertEquals(Type.Elementary.DINT, Type.fromName("dint"));
        assertEquals(Type.Elementary.TIME_OF_DAY, Type.fromName("Time_Of_Day"));
        assertEquals(Type.StringType.WIDE, Type.fromName("WString"));
    }

    @Test
    void fromName_unknownName_isStructType() {
        assertEquals(new Type.StructType("MotorData"), Type.fromName("MotorData"));
    }

    @Test
    void unknown_isAssignableBothWays() {
        assertTrue(Type.Elementary.BOOL.isAssignableFrom(Type.Elementary.UNKNOWN));
        assertTrue(Type.Elementary.UNKNOWN.isAssignableFrom(Type.StringType.NARROW));
    }

    @Test
    void realFromInteger_isAssignable_butNotTheReverse() {
        assertTrue(Type.Elementary.LREAL.isAssignableFrom(Type.Elementary.SINT));
        assertFalse(Type.Elementary.DINT.isAssignableFrom(Type.Elementary.REAL));
    }

    @Test
    void boolFromInteger_isNotAssignable() {
        assertFalse(Type.Elementary.BOOL.isAssignableFrom(Type.Elementary.INT));
    }

    @Test
    void categories_areReportedByPredicates() {
        assertTrue(Type.Elementary.UDINT.isInteger());
        assertTrue(Type.Elementary.REAL.isNumeric());
        assertTrue(Type.Elementary.DATE.isTime());
        assertFalse(Type.Elementary.BOOL.isNumeric());
        assertTrue(Type.StringType.NARROW.isString());
    }

    @Test
    void displayNames_describeStructure() {
        var array = new Type.ArrayType(Type.Elementary.INT, 2);
        var bounded = new Type.StringType(false, OptionalInt.of(20));

        assertEquals("ARRAY[2] OF INT", array.displayName());
        assertEquals("STRING[20]", bounded.displayName());
        assertEquals("REF_TO REAL", new Type.ReferenceType(Type.Elementary.REAL).displayName());
    }

    @Test
    void timeLiteralKinds_mapToCheckerTypes() {
        assertEquals(Type.Elementary.TIME, Types.ofTimeLiteral(TimeKind.LTIME));
        assertEquals(Type.Elementary.DATE_AND_TIME, Types.ofTimeLiteral(TimeKind.DATE_AND_TIME));
    }

    @Test
    void builtinReturnType_unknownFunction_isUnknown() {
        assertEquals(Type.Elementary.DINT, Types.builtinReturnType("len"));
        assertTrue(Types.builtinReturnType("MyFunction").isUnknown());
    }
}
