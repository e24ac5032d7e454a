package org.pragmatica.plc.project;

import java.util.List;
import java.util.Optional;

public record ControllerProgram(String name, List<ControllerTag> tags, List<Routine> routines,
                                Optional<String> mainRoutine) {

    public ControllerProgram {
        tags = List.copyOf(tags);
        routines = List.copyOf(routines);
    }

    public Optional<Routine> routine(String routineName) {
        return routines.stream().filter(routine -> routine.name().equals(routineName)).findFirst();
    }
}
