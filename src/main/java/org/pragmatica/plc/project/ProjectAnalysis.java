package org.pragmatica.plc.project;

import org.pragmatica.plc.error.Diagnostic;
import org.pragmatica.plc.rll.RllParseError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Result of {@link ProjectAnalyzer}: every rung and ST routine with its location, the tag and instruction
 * indices, and add-on instruction usage.
 */
public final class ProjectAnalysis {
    private static final Comparator<Map.Entry<String, Integer>> BY_COUNT =
        Map.Entry.<String, Integer>comparingByValue()
                 .reversed()
                 .thenComparing(Map.Entry.<String, Integer>comparingByKey());

    private final List<LocatedRung> rungs;
    private final List<ParsedStRoutine> stRoutines;
    private final List<LocatedTagReference> tagReferences;
    private final Map<String, List<LocatedTagReference>> tagIndex;
    private final List<RoutineSummary> routines;
    private final Map<String, Integer> instructionUsage;
    private final List<String> aoiDefinitions;
    private final Map<String, List<AoiReference>> aoiUsage;
    private final ParseStats stats;

    ProjectAnalysis(List<LocatedRung> rungs,
                    List<ParsedStRoutine> stRoutines,
                    List<LocatedTagReference> tagReferences,
                    Map<String, List<LocatedTagReference>> tagIndex,
                    List<RoutineSummary> routines,
                    Map<String, Integer> instructionUsage,
                    List<String> aoiDefinitions,
                    Map<String, List<AoiReference>> aoiUsage,
                    ParseStats stats) {
        this.rungs = List.copyOf(rungs);
        this.stRoutines = List.copyOf(stRoutines);
        this.tagReferences = List.copyOf(tagReferences);
        this.tagIndex = Collections.unmodifiableMap(tagIndex);
        this.routines = List.copyOf(routines);
        this.instructionUsage = Collections.unmodifiableMap(instructionUsage);
        this.aoiDefinitions = List.copyOf(aoiDefinitions);
        this.aoiUsage = Collections.unmodifiableMap(aoiUsage);
        this.stats = stats;
    }

    public List<LocatedRung> rungs() {
        return rungs;
    }

    public List<ParsedStRoutine> stRoutines() {
        return stRoutines;
    }

    public List<LocatedTagReference> tagReferences() {
        return tagReferences;
    }

    public List<RoutineSummary> routines() {
        return routines;
    }

    public Map<String, Integer> instructionUsage() {
        return instructionUsage;
    }

    public List<String> aoiDefinitions() {
        return aoiDefinitions;
    }

    public ParseStats stats() {
        return stats;
    }

    // === Tags and instructions ===

    public List<LocatedTagReference> referencesTo(String tagName) {
        return tagIndex.getOrDefault(tagName, List.of());
    }

    public List<String> uniqueTags() {
        return List.copyOf(new TreeSet<>(tagIndex.keySet()));
    }

    /**
     * Distinct tags used as operands of the given instruction, sorted.
     */
    public List<String> tagsByInstruction(String mnemonic) {
        return tagReferences.stream()
                            .filter(reference -> reference.instruction().equals(mnemonic))
                            .map(LocatedTagReference::tagName)
                            .distinct()
                            .sorted()
                            .toList();
    }

    /**
     * The {@code count} most used instructions, most used first; ties are ordered by name.
     */
    public List<Map.Entry<String, Integer>> topInstructions(int count) {
        return instructionUsage.entrySet()
                               .stream()
                               .sorted(BY_COUNT)
                               .limit(count)
                               .map(entry -> Map.entry(entry.getKey(), entry.getValue()))
                               .toList();
    }

    // === Routines ===

    public Optional<RoutineSummary> routine(String program, String routine) {
        return routines.stream()
                       .filter(summary -> summary.program().equals(program) && summary.routine().equals(routine))
                       .findFirst();
    }

    public List<RoutineSummary> routinesInProgram(String program) {
        return routines.stream().filter(summary -> summary.program().equals(program)).toList();
    }

    /**
     * Programs that have routines, in analysis order. Add-on instructions are not included.
     */
    public List<String> programNames() {
        var names = new LinkedHashSet<String>();

        routines.stream()
                .map(RoutineSummary::program)
                .filter(program -> !program.startsWith(AddOnInstruction.PROGRAM_PREFIX))
                .forEach(names::add);
        return List.copyOf(names);
    }

    // === Errors ===

    public List<RllParseError> parseErrors() {
        return rungs.stream().flatMap(rung -> rung.parseError().stream()).toList();
    }

    public String formatParseErrors() {
        return parseErrors().stream().map(RllParseError::format).collect(Collectors.joining("\n\n"));
    }

    public List<String> stParseErrors() {
        return stRoutines.stream().flatMap(routine -> routine.formattedErrors().stream()).toList();
    }

    /**
     * Analysis diagnostics of ST routines keyed by routine path. Routines without diagnostics are left out.
     */
    public Map<String, List<Diagnostic>> stDiagnostics() {
        var result = new LinkedHashMap<String, List<Diagnostic>>();

        stRoutines.stream()
                  .filter(routine -> !routine.diagnostics().isEmpty())
                  .forEach(routine -> result.put(routine.path(), routine.diagnostics()));
        return result;
    }

    public List<ParsedStRoutine> stRoutinesWithErrors() {
        return stRoutines.stream().filter(routine -> !routine.isParsed()).toList();
    }

    // === Add-on instructions ===

    public List<AoiReference> aoiReferences(String aoiName) {
        return aoiUsage.getOrDefault(aoiName, List.of());
    }

    /**
     * Defined add-on instructions with no call from any routine, in definition order.
     */
    public List<String> unusedAois() {
        return aoiDefinitions.stream().filter(name -> aoiReferences(name).isEmpty()).toList();
    }

    /**
     * Every defined add-on instruction with its call count, most called first.
     */
    public List<Map.Entry<String, Integer>> aoisByUsage() {
        var counts = new ArrayList<Map.Entry<String, Integer>>();

        aoiDefinitions.forEach(name -> counts.add(Map.entry(name, aoiReferences(name).size())));
        counts.sort(BY_COUNT);
        return counts;
    }

    /**
     * Programs calling the add-on instruction, sorted. Callers that are themselves add-on instructions appear
     * as {@code AOI:<name>}.
     */
    public List<String> programsUsingAoi(String aoiName) {
        return aoiReferences(aoiName).stream()
                                     .map(AoiReference::program)
                                     .distinct()
                                     .sorted()
                                     .toList();
    }

    /**
     * Calls between add-on instructions: caller name to the names it calls, both without prefix.
     */
    public Map<String, Set<String>> aoiCallsAoi() {
        var calls = new TreeMap<String, Set<String>>();

        aoiUsage.forEach((callee, references) -> references.stream()
                                                           .filter(AoiReference::isFromAoi)
                                                           .forEach(reference -> calls.computeIfAbsent(
                                                               reference.program()
                                                                        .substring(AddOnInstruction.PROGRAM_PREFIX.length()),
                                                               key -> new TreeSet<>()).add(callee)));
        return calls;
    }
}
