package org.pragmatica.plc.project;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A routine of a program or add-on instruction. Ladder routines carry rungs, ST routines carry numbered lines;
 * FBD and SFC routines are kept opaque.
 */
public record Routine(String name, RoutineType type, List<RungText> rungs, List<StLine> stLines) {

    public Routine {
        rungs = List.copyOf(rungs);
        stLines = List.copyOf(stLines);
    }

    public static Routine rll(String name, List<RungText> rungs) {
        return new Routine(name, RoutineType.RLL, rungs, List.of());
    }

    public static Routine st(String name, List<StLine> lines) {
        return new Routine(name, RoutineType.ST, List.of(), lines);
    }

    /**
     * ST lines ordered by line number and joined with newlines.
     */
    public String stSource() {
        return stLines.stream()
                      .sorted(Comparator.comparingInt(StLine::number))
                      .map(StLine::text)
                      .collect(Collectors.joining("\n"));
    }
}
