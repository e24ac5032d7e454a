package org.pragmatica.plc.project;

import java.util.List;
import java.util.Map;

/**
 * Per-routine figures. For ladder routines {@code size} is the rung count, for ST routines the statement
 * count.
 *
 * @param instructions references per instruction mnemonic
 */
public record RoutineSummary(String program, String routine, RoutineType type, int size, int parseErrors,
                             List<String> tagsUsed, Map<String, Integer> instructions) {

    public RoutineSummary {
        tagsUsed = List.copyOf(tagsUsed);
        instructions = Map.copyOf(instructions);
    }
}
