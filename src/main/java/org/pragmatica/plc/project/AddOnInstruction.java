package org.pragmatica.plc.project;

import java.util.List;

/**
 * A user-defined instruction. Its routines are analyzed under the program name {@code AOI:<name>}.
 */
public record AddOnInstruction(String name, List<AoiParameter> parameters, List<ControllerTag> localTags,
                               List<Routine> routines) {

    public static final String PROGRAM_PREFIX = "AOI:";

    public AddOnInstruction {
        parameters = List.copyOf(parameters);
        localTags = List.copyOf(localTags);
        routines = List.copyOf(routines);
    }

    public String programName() {
        return PROGRAM_PREFIX + name;
    }
}
