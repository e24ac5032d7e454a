package org.pragmatica.plc.project;

import java.util.OptionalInt;

/**
 * A call of an add-on instruction. Ladder calls know their rung; ST calls only their routine.
 */
public record AoiReference(String aoiName, String program, String routine, OptionalInt rungNumber,
                           CallSource source) {

    public enum CallSource {
        RLL,
        ST
    }

    public static AoiReference fromRll(String aoiName, RungLocation location) {
        return new AoiReference(aoiName, location.program(), location.routine(),
                                OptionalInt.of(location.rungNumber()), CallSource.RLL);
    }

    public static AoiReference fromSt(String aoiName, ParsedStRoutine routine) {
        return new AoiReference(aoiName, routine.program(), routine.routine(), OptionalInt.empty(), CallSource.ST);
    }

    public boolean isFromAoi() {
        return program.startsWith(AddOnInstruction.PROGRAM_PREFIX);
    }

    public String path() {
        var base = program + "/" + routine;
        return rungNumber.isPresent() ? base + "/Rung#" + rungNumber.getAsInt() : base;
    }
}
