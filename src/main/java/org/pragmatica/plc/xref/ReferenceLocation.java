package org.pragmatica.plc.xref;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Where a tag reference occurs: the POU, and when known the routine and rung or network number.
 */
public record ReferenceLocation(String pou, Optional<String> routine, OptionalInt rung) {

    public static ReferenceLocation inPou(String pou) {
        return new ReferenceLocation(pou, Optional.empty(), OptionalInt.empty());
    }

    public static ReferenceLocation inRoutine(String pou, String routine) {
        return new ReferenceLocation(pou, Optional.of(routine), OptionalInt.empty());
    }

    public static ReferenceLocation atRung(String pou, Optional<String> routine, int rung) {
        return new ReferenceLocation(pou, routine, OptionalInt.of(rung));
    }

    /**
     * {@code Pou/Routine/Rung#n}, leaving out the parts that are not known.
     */
    public String path() {
        var path = new StringBuilder(pou);

        routine.ifPresent(name -> path.append('/').append(name));
        rung.ifPresent(number -> path.append("/Rung#").append(number));
        return path.toString();
    }
}
