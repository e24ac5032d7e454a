package org.pragmatica.plc.project;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.plc.analysis.PouAnalyzer;
import org.pragmatica.plc.analysis.smells.SmellConfig;
import org.pragmatica.plc.ast.AstWalker;
import org.pragmatica.plc.ast.Expression;
import org.pragmatica.plc.ast.Statement;
import org.pragmatica.plc.parser.RockwellStParser;
import org.pragmatica.plc.rll.RllParser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Parses and indexes every routine of a controller. Ladder routines go through {@link RllParser}, ST routines
 * through the Rockwell parser in recovering mode followed by {@link PouAnalyzer}; FBD and SFC routines are
 * counted but not parsed.
 */
public final class ProjectAnalyzer {
    private static final Logger logger = LogManager.getLogger(ProjectAnalyzer.class);

    private final PouAnalyzer pouAnalyzer;

    public ProjectAnalyzer(SmellConfig smellConfig) {
        this.pouAnalyzer = new PouAnalyzer(smellConfig);
    }

    public ProjectAnalyzer() {
        this(SmellConfig.DEFAULT);
    }

    public static ProjectAnalysis analyzeController(Controller controller) {
        return new ProjectAnalyzer().analyze(controller);
    }

    public ProjectAnalysis analyze(Controller controller) {
        var run = new Run(controller);

        for (var program : controller.programs()) {
            for (var routine : program.routines()) {
                run.routine(program.name(), routine, false);
            }
        }
        for (var aoi : controller.addOnInstructions()) {
            run.aoiNames.add(aoi.name());
            for (var routine : aoi.routines()) {
                run.routine(aoi.programName(), routine, true);
            }
        }
        var analysis = run.finish();

        logger.info("Analyzed controller {}: {}", controller.name(), analysis.stats());
        return analysis;
    }

    /**
     * State of one analysis.
     */
    private final class Run {
        private final Controller controller;
        private final List<LocatedRung> rungs = new ArrayList<>();
        private final List<ParsedStRoutine> stRoutines = new ArrayList<>();
        private final List<RoutineSummary> summaries = new ArrayList<>();
        private final List<String> aoiNames = new ArrayList<>();
        private int routineCount;
        private int rungsInPrograms;
        private int rungsInAois;
        private int stInPrograms;
        private int stInAois;

        private Run(Controller controller) {
            this.controller = controller;
        }

        private void routine(String program, Routine routine, boolean inAoi) {
            routineCount++;
            switch (routine.type()) {
                case RLL -> ladder(program, routine, inAoi);
                case ST -> structuredText(program, routine, inAoi);
                case FBD, SFC -> summaries.add(new RoutineSummary(program, routine.name(), routine.type(), 0, 0,
                                                                  List.of(), Map.of()));
            }
        }

        private void ladder(String program, Routine routine, boolean inAoi) {
            var tags = new TreeSet<String>();
            var instructions = new HashMap<String, Integer>();
            int errors = 0;

            for (var text : routine.rungs()) {
                var rung = new LocatedRung(new RungLocation(program, routine.name(), text.number()),
                                           RllParser.parseRung(text.text()));
                rungs.add(rung);
                if (rung.hasError()) {
                    errors++;
                    continue;
                }
                rung.tagReferences().forEach(reference -> tags.add(reference.tagName()));
                rung.rung().instructions().forEach(instruction -> instructions.merge(instruction.mnemonic(), 1,
                                                                                     Integer::sum));
            }
            if (inAoi) {
                rungsInAois += routine.rungs().size();
            } else {
                rungsInPrograms += routine.rungs().size();
            }
            logger.debug("Routine {}/{}: {} rungs, {} failed", program, routine.name(), routine.rungs().size(),
                         errors);
            summaries.add(new RoutineSummary(program, routine.name(), RoutineType.RLL, routine.rungs().size(),
                                             errors, List.copyOf(tags), instructions));
        }

        private void structuredText(String program, Routine routine, boolean inAoi) {
            var source = routine.stSource();
            var result = RockwellStParser.parseStatementsRecovering(source);
            var statements = result.value();
            var diagnostics = pouAnalyzer.analyzeBody(program + "/" + routine.name(), statements);
            var parsed = new ParsedStRoutine(program, routine.name(), source, statements, result.errors(),
                                             diagnostics);
            stRoutines.add(parsed);

            if (inAoi) {
                stInAois++;
            } else {
                stInPrograms++;
            }
            var calls = new HashMap<String, Integer>();
            parsed.callNames().forEach(name -> calls.merge(name, 1, Integer::sum));

            logger.debug("Routine {}: {} statements, {} parse errors", parsed.path(), statements.size(),
                         result.errorCount());
            summaries.add(new RoutineSummary(program, routine.name(), RoutineType.ST,
                                             AstWalker.countStatements(statements), result.errorCount(),
                                             List.copyOf(stTags(statements)), calls));
        }

        private ProjectAnalysis finish() {
            var aoiSet = new HashSet<>(aoiNames);
            var references = new ArrayList<LocatedTagReference>();
            var tagIndex = new LinkedHashMap<String, List<LocatedTagReference>>();
            var instructionUsage = new HashMap<String, Integer>();
            var aoiUsage = new LinkedHashMap<String, List<AoiReference>>();
            int parsedOk = 0;

            aoiNames.forEach(name -> aoiUsage.put(name, new ArrayList<>()));

            for (var rung : rungs) {
                if (rung.hasError()) {
                    continue;
                }
                parsedOk++;
                var calledInRung = new HashSet<String>();
                for (var instruction : rung.rung().instructions()) {
                    var mnemonic = instruction.mnemonic();
                    instructionUsage.merge(mnemonic, 1, Integer::sum);
                    if (aoiSet.contains(mnemonic) && calledInRung.add(mnemonic)) {
                        aoiUsage.get(mnemonic).add(AoiReference.fromRll(mnemonic, rung.location()));
                    }
                }
                for (var reference : rung.tagReferences()) {
                    references.add(reference);
                    tagIndex.computeIfAbsent(reference.tagName(), key -> new ArrayList<>()).add(reference);
                }
            }
            for (var routine : stRoutines) {
                for (var name : routine.callNames()) {
                    if (aoiSet.contains(name)) {
                        aoiUsage.get(name).add(AoiReference.fromSt(name, routine));
                    }
                }
            }
            int stParsedOk = (int) stRoutines.stream().filter(ParsedStRoutine::isParsed).count();
            var stats = new ParseStats(controller.programs().size(),
                                       controller.addOnInstructions().size(),
                                       routineCount,
                                       rungs.size(),
                                       rungsInPrograms,
                                       rungsInAois,
                                       parsedOk,
                                       rungs.size() - parsedOk,
                                       references.size(),
                                       tagIndex.size(),
                                       stRoutines.size(),
                                       stInPrograms,
                                       stInAois,
                                       stParsedOk,
                                       stRoutines.size() - stParsedOk);

            return new ProjectAnalysis(rungs, stRoutines, references, tagIndex, summaries, instructionUsage,
                                       aoiNames, aoiUsage, stats);
        }
    }

    // === Helper methods ===

    /**
     * Root names of variables read or written by the statements, sorted.
     */
    private static TreeSet<String> stTags(List<Statement> statements) {
        var tags = new TreeSet<String>();

        AstWalker.walkStatements(statements, statement -> {
            if (statement instanceof Statement.Assignment assignment) {
                tags.add(assignment.target().rootName());
            } else if (statement instanceof Statement.For loop) {
                tags.add(loop.variable());
            }
        });
        AstWalker.walkAllExpressions(statements, expression -> {
            if (expression instanceof Expression.VariableRef reference) {
                tags.add(reference.variable().rootName());
            }
        });
        return tags;
    }
}
