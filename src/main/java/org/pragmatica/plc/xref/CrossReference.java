package org.pragmatica.plc.xref;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.plc.model.Body;
import org.pragmatica.plc.model.ControllerToModel;
import org.pragmatica.plc.model.DataTypeDef;
import org.pragmatica.plc.model.Pou;
import org.pragmatica.plc.model.PouKind;
import org.pragmatica.plc.model.Project;
import org.pragmatica.plc.model.SfcBody;
import org.pragmatica.plc.rll.RllParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Tag, POU and type usage across a project. Tag names are compared exactly as written.
 */
public final class CrossReference {
    private static final Logger logger = LogManager.getLogger(CrossReference.class);
    private static final Pattern INSTRUCTION = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)\\s*\\(([^()]*)\\)");

    private final List<TagReference> references = new ArrayList<>();
    private final Map<String, List<TagReference>> byTag = new LinkedHashMap<>();
    private final Set<String> usedTags = new LinkedHashSet<>();
    private final Set<String> definedTags = new LinkedHashSet<>();
    private final Set<String> usedPous = new LinkedHashSet<>();
    private final Set<String> usedTypes = new LinkedHashSet<>();
    private final Set<String> pouNames = new LinkedHashSet<>();
    private final List<Pou> nonPrograms = new ArrayList<>();

    private CrossReference() {}

    public static CrossReference build(Project project) {
        var xref = new CrossReference();

        xref.collectDefinitions(project);
        project.pous().forEach(pou -> pou.body().ifPresent(body -> xref.body(body, pou.name())));

        logger.debug("Cross-reference of {}: {} references, {} used tags, {} defined tags, {} used POUs",
                     project.name(), xref.references.size(), xref.usedTags.size(), xref.definedTags.size(),
                     xref.usedPous.size());
        return xref;
    }

    // === Queries ===

    public List<TagReference> references() {
        return Collections.unmodifiableList(references);
    }

    public Set<String> usedTags() {
        return Collections.unmodifiableSet(usedTags);
    }

    public Set<String> definedTags() {
        return Collections.unmodifiableSet(definedTags);
    }

    public Set<String> usedPous() {
        return Collections.unmodifiableSet(usedPous);
    }

    public Set<String> usedTypes() {
        return Collections.unmodifiableSet(usedTypes);
    }

    /**
     * Defined tags never referenced, sorted.
     */
    public List<String> unusedTags() {
        var unused = new TreeSet<>(definedTags);
        unused.removeAll(usedTags);
        return List.copyOf(unused);
    }

    /**
     * Referenced tags that are neither declared nor the name of a POU, sorted.
     */
    public List<String> undefinedTags() {
        var undefined = new TreeSet<>(usedTags);
        undefined.removeAll(definedTags);
        undefined.removeAll(pouNames);
        return List.copyOf(undefined);
    }

    /**
     * Functions and function blocks that are neither called nor instantiated. Programs are run by tasks and
     * never count as unused.
     */
    public List<String> unusedPous() {
        return nonPrograms.stream()
                          .map(Pou::name)
                          .filter(name -> !usedPous.contains(name))
                          .sorted()
                          .toList();
    }

    public List<TagReference> referencesTo(String tagName) {
        return byTag.getOrDefault(tagName, List.of());
    }

    public boolean isTagUsed(String tagName) {
        return usedTags.contains(tagName);
    }

    public boolean isPouUsed(String pouName) {
        return usedPous.contains(pouName);
    }

    public boolean isTypeUsed(String typeName) {
        return usedTypes.contains(typeName);
    }

    /**
     * Number of distinct tags referenced.
     */
    public int tagCount() {
        return usedTags.size();
    }

    // === Definitions ===

    private void collectDefinitions(Project project) {
        for (var pou : project.pous()) {
            pouNames.add(pou.name());
            if (pou.kind() != PouKind.PROGRAM) {
                nonPrograms.add(pou);
            }
        }
        for (var pou : project.pous()) {
            for (var variable : pou.allVariables()) {
                definedTags.add(variable.name());
                useType(variable.dataType());
            }
            pou.pouInterface().returnType().ifPresent(this::useType);
        }
        project.configuration().ifPresent(configuration -> configuration.allGlobals().forEach(variable -> {
            definedTags.add(variable.name());
            useType(variable.dataType());
        }));
        project.dataTypes().forEach(this::dataTypeMembers);
    }

    private void dataTypeMembers(DataTypeDef type) {
        if (type instanceof DataTypeDef.Struct struct) {
            struct.members().forEach(member -> useType(member.dataType()));
        } else if (type instanceof DataTypeDef.Array array) {
            useType(array.elementType());
        } else if (type instanceof DataTypeDef.Alias alias) {
            useType(alias.target());
        } else if (type instanceof DataTypeDef.Subrange subrange) {
            useType(subrange.baseType());
        }
    }

    /**
     * A variable of a function block type is an instantiation of that block.
     */
    private void useType(String typeName) {
        usedTypes.add(typeName);
        if (pouNames.contains(typeName)) {
            usedPous.add(typeName);
        }
    }

    // === Bodies ===

    private void body(Body body, String pou) {
        if (body instanceof Body.St st) {
            text(IdentifierScanner.scanStructuredText(st.text()), "ST", ReferenceLocation.inPou(pou));
        } else if (body instanceof Body.Il il) {
            text(IdentifierScanner.scanInstructionList(il.text()), "IL", ReferenceLocation.inPou(pou));
        } else if (body instanceof Body.Ld ld) {
            ld.rungs().forEach(rung -> instructions(rung.instructions(),
                                                    ReferenceLocation.atRung(pou, Optional.empty(), rung.number())));
        } else if (body instanceof Body.Fbd fbd) {
            fbd.networks().forEach(network -> instructions(network.instructions(),
                                                           ReferenceLocation.atRung(pou, Optional.empty(),
                                                                                    network.number())));
        } else if (body instanceof Body.Sfc sfc) {
            chart(sfc.chart(), pou);
        } else if (body instanceof Body.Raw raw) {
            raw(raw, pou);
        }
    }

    private void text(List<IdentifierScanner.Identifier> identifiers, String language, ReferenceLocation location) {
        for (var identifier : identifiers) {
            if (identifier.callee()) {
                usedPous.add(identifier.name());
                if (!definedTags.contains(identifier.name())) {
                    continue;
                }
            }
            addReference(identifier.name(), identifier.operand(), language, location);
        }
    }

    private void instructions(List<Body.Instruction> instructions, ReferenceLocation location) {
        for (var instruction : instructions) {
            usedPous.add(instruction.mnemonic());
            for (var operand : instruction.operands()) {
                if (operand instanceof Body.InstructionOperand.Tag tag) {
                    addReference(tag.name(), tag.text(), instruction.mnemonic(), location);
                } else if (operand instanceof Body.InstructionOperand.Expression expression) {
                    IdentifierScanner.scanStructuredText(expression.text())
                                     .forEach(identifier -> addReference(identifier.name(), identifier.operand(),
                                                                         instruction.mnemonic(), location));
                }
            }
        }
    }

    private void chart(SfcBody chart, String pou) {
        for (var step : chart.steps()) {
            step.actions().forEach(action -> action.body().ifPresent(body -> body(body, pou)));
        }
        for (var transition : chart.transitions()) {
            text(IdentifierScanner.scanStructuredText(transition.condition()), "SFC", ReferenceLocation.inPou(pou));
        }
    }

    /**
     * Ladder text, one or more rungs per line. A {@code // Routine: name} line starts a routine and restarts
     * rung numbering; other comment lines are ignored.
     */
    private void raw(Body.Raw raw, String pou) {
        Optional<String> routine = Optional.empty();
        int rungNumber = 0;

        for (var line : raw.content().split("\n")) {
            var trimmed = line.trim();

            if (trimmed.startsWith(ControllerToModel.ROUTINE_HEADER)) {
                routine = Optional.of(trimmed.substring(ControllerToModel.ROUTINE_HEADER.length()).trim());
                rungNumber = 0;
                continue;
            }
            if (trimmed.isEmpty() || trimmed.startsWith("//")) {
                continue;
            }
            for (var rungText : trimmed.split(";")) {
                if (rungText.isBlank()) {
                    continue;
                }
                rung(rungText + ";", ReferenceLocation.atRung(pou, routine, rungNumber++));
            }
        }
    }

    private void rung(String text, ReferenceLocation location) {
        var rung = RllParser.parseRung(text);

        if (!rung.isParsed()) {
            scanInstructions(text, location);
            return;
        }
        rung.instructions().forEach(instruction -> usedPous.add(instruction.mnemonic()));
        for (var reference : rung.tagReferences()) {
            addReference(reference.name(), reference.fullOperand(), reference.instruction(), location);
        }
    }

    /**
     * Fallback for rungs the ladder parser rejects: every {@code MNEMONIC(op,op)} group with a flat operand
     * list.
     */
    private void scanInstructions(String text, ReferenceLocation location) {
        var matcher = INSTRUCTION.matcher(text);

        while (matcher.find()) {
            var mnemonic = matcher.group(1);
            usedPous.add(mnemonic);
            for (var operand : matcher.group(2).split(",")) {
                var trimmed = operand.trim();
                baseTag(trimmed).ifPresent(tag -> addReference(tag, trimmed, mnemonic, location));
            }
        }
    }

    /**
     * Text up to the first {@code .}, {@code [} or {@code :}. Addresses ({@code %}), literals and {@code ?}
     * have no base tag.
     */
    static Optional<String> baseTag(String operand) {
        if (operand.isEmpty() || !Character.isLetter(operand.charAt(0)) && operand.charAt(0) != '_') {
            return Optional.empty();
        }
        int end = 0;
        while (end < operand.length() && ".[:".indexOf(operand.charAt(end)) < 0) {
            end++;
        }
        return Optional.of(operand.substring(0, end).trim());
    }

    private void addReference(String tag, String operand, String instruction, ReferenceLocation location) {
        var reference = new TagReference(tag, operand, instruction, location);

        references.add(reference);
        byTag.computeIfAbsent(tag, key -> new ArrayList<>()).add(reference);
        usedTags.add(tag);
    }
}
