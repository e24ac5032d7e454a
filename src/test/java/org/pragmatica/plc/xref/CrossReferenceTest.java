package org.pragmatica.plc.xref;

import org.junit.jupiter.api.Test;
import org.pragmatica.plc.model.Body;
import org.pragmatica.plc.model.Configuration;
import org.pragmatica.plc.model.DataTypeDef;
import org.pragmatica.plc.model.Pou;
import org.pragmatica.plc.model.PouInterface;
import org.pragmatica.plc.model.PouKind;
import org.pragmatica.plc.model.Project;
import org.pragmatica.plc.model.VarClass;
import org.pragmatica.plc.model.Variable;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CrossReferenceTest {

    // === Ladder text ===

    @Test
    void rawLadderBody_collectsTagsAndInstructions() {
        var project = project(List.of(program("Main", new Body.Raw("RLL", "XIC(Start)OTE(Motor);MOV(Counter,Dest);"))),
                              List.of(global("NotUsed"), global("Start")));

        var xref = CrossReference.build(project);

        assertThat(xref.usedTags()).contains("Start", "Motor", "Counter", "Dest").doesNotContain("NotUsed");
        assertThat(xref.usedPous()).contains("XIC", "OTE", "MOV");
        assertEquals(List.of("NotUsed"), xref.unusedTags());
        assertEquals(List.of("Counter", "Dest", "Motor"), xref.undefinedTags());
        assertEquals(4, xref.tagCount());
    }

    @Test
    void rawLadderBody_numbersRungsPerRoutine() {
        var content = """
            // Routine: MainRoutine
            XIC(Start)OTE(Motor);
            MOV(Counter,Dest);
            // Routine: Faults
            XIC(Fault)OTE(Alarm);
            """;
        var xref = CrossReference.build(project(List.of(program("MainProgram", new Body.Raw("RLL", content))),
                                                List.of()));

        var counter = xref.referencesTo("Counter").get(0);
        assertEquals("MainProgram/MainRoutine/Rung#1", counter.location().path());
        assertEquals("MOV", counter.instruction());
        assertEquals("MainProgram/Faults/Rung#0", xref.referencesTo("Alarm").get(0).location().path());
    }

    @Test
    void memberOperand_isReferencedByBaseTag() {
        var xref = CrossReference.build(project(List.of(program("Main", new Body.Raw("RLL", "XIC(Pump.Running)OTE(Lamp[2]);"))),
                                                List.of()));

        var pump = xref.referencesTo("Pump");
        assertThat(pump).singleElement().satisfies(reference -> {
            assertEquals("Pump.Running", reference.fullOperand());
            assertEquals("XIC", reference.instruction());
        });
        assertTrue(xref.isTagUsed("Lamp"));
    }

    @Test
    void unparsableRung_fallsBackToInstructionScan() {
        var xref = CrossReference.build(project(List.of(program("Main", new Body.Raw("RLL", "[XIC(A) OTE(B);"))),
                                                List.of()));

        assertThat(xref.usedTags()).containsExactly("A", "B");
        assertThat(xref.usedPous()).contains("XIC", "OTE");
    }

    @Test
    void tagNames_areCaseSensitive() {
        var xref = CrossReference.build(project(List.of(program("Main", new Body.Raw("RLL", "XIC(start);"))),
                                                List.of(global("Start"))));

        assertEquals(List.of("Start"), xref.unusedTags());
        assertEquals(List.of("start"), xref.undefinedTags());
    }

    // === Structured Text ===

    @Test
    void stBody_skipsKeywordsLiteralsAndNamedParameters() {
        var body = new Body.St("""
            (* Motor.Hidden is only a comment *)
            IF Start AND NOT Stop THEN
                Motor.Status.Run := TRUE;
                Timer1(IN := Start, PT := T#5s);
                Level := 16#FF + Offset;
                Message := 'Stop pressed';
            END_IF;
            """);

        var xref = CrossReference.build(project(List.of(program("Main", body)), List.of()));

        assertThat(xref.usedTags()).containsExactly("Start", "Stop", "Motor", "Level", "Offset", "Message");
        assertEquals("Motor.Status.Run", xref.referencesTo("Motor").get(0).fullOperand());
        assertEquals("ST", xref.referencesTo("Motor").get(0).instruction());
        assertThat(xref.referencesTo("Start")).hasSize(2);
        assertTrue(xref.isPouUsed("Timer1"));
    }

    @Test
    void calledFunction_isUsedPouButNotTag() {
        var clamp = Pou.of("Clamp", PouKind.FUNCTION, PouInterface.EMPTY, Optional.empty());
        var body = new Body.St("y := Clamp(x); z := SQRT(x); w := INT_TO_REAL(x);");

        var xref = CrossReference.build(project(List.of(program("Main", body), clamp), List.of()));

        assertTrue(xref.isPouUsed("Clamp"));
        assertFalse(xref.isPouUsed("SQRT"));
        assertFalse(xref.isTagUsed("Clamp"));
        assertThat(xref.usedTags()).containsExactly("y", "x", "z", "w");
        assertThat(xref.unusedPous()).isEmpty();
    }

    @Test
    void instructionListBody_skipsOperators() {
        var body = new Body.Il("LD Start\nANDN Stop\nST Motor");

        var xref = CrossReference.build(project(List.of(program("Main", body)), List.of()));

        assertThat(xref.usedTags()).containsExactly("Start", "Stop", "Motor");
        assertEquals("IL", xref.referencesTo("Stop").get(0).instruction());
    }

    // === Graphical bodies ===

    @Test
    void ladderRungs_useOperandKinds() {
        var rung = new Body.LadderRung(3, Optional.empty(), List.of(
            new Body.Instruction("XIC", List.of(new Body.InstructionOperand.Tag("Sensor", "Sensor.Active"))),
            new Body.Instruction("CMP", List.of(new Body.InstructionOperand.Expression("Level > Limit"))),
            new Body.Instruction("MOV", List.of(new Body.InstructionOperand.Literal("5"),
                                                new Body.InstructionOperand.Tag("Target", "Target")))),
            Optional.empty());

        var xref = CrossReference.build(project(List.of(program("Main", new Body.Ld(List.of(rung)))), List.of()));

        assertThat(xref.usedTags()).containsExactly("Sensor", "Level", "Limit", "Target");
        assertEquals("Main/Rung#3", xref.referencesTo("Limit").get(0).location().path());
        assertThat(xref.usedPous()).contains("XIC", "CMP", "MOV");
    }

    // === Types and POUs ===

    @Test
    void blockTypedVariable_marksBlockAndTypeUsed() {
        var conveyor = Pou.of("Conveyor", PouKind.FUNCTION_BLOCK, PouInterface.EMPTY, Optional.empty());
        var spare = Pou.of("Spare", PouKind.FUNCTION_BLOCK, PouInterface.EMPTY, Optional.empty());
        var main = Pou.of("Main", PouKind.PROGRAM,
                          PouInterface.of(List.of(Variable.local("Belt", "Conveyor")), Optional.empty()),
                          Optional.empty());
        var recipe = new DataTypeDef.Struct("Recipe", List.of(DataTypeDef.StructMember.of("Temp", "LREAL")));
        var project = new Project("Plant", Optional.empty(), List.of(recipe), List.of(main, conveyor, spare),
                                  Optional.empty(), Optional.empty());

        var xref = CrossReference.build(project);

        assertTrue(xref.isPouUsed("Conveyor"));
        assertTrue(xref.isTypeUsed("Conveyor"));
        assertTrue(xref.isTypeUsed("LREAL"));
        assertEquals(List.of("Spare"), xref.unusedPous());
        assertEquals(List.of("Belt"), xref.unusedTags());
    }

    @Test
    void baseTag_stopsAtMemberIndexOrModuleSeparator() {
        assertEquals(Optional.of("Local"), CrossReference.baseTag("Local:1:I.Data"));
        assertEquals(Optional.of("Recipe"), CrossReference.baseTag("Recipe[3].Temp"));
        assertEquals(Optional.empty(), CrossReference.baseTag("%IX0.0"));
        assertEquals(Optional.empty(), CrossReference.baseTag("?"));
        assertEquals(Optional.empty(), CrossReference.baseTag("42"));
    }

    @Test
    void referenceLocation_pathOmitsUnknownParts() {
        assertEquals("Main", ReferenceLocation.inPou("Main").path());
        assertEquals("Main/Calc", ReferenceLocation.inRoutine("Main", "Calc").path());
        assertEquals("Main/Calc/Rung#7", ReferenceLocation.atRung("Main", Optional.of("Calc"), 7).path());
    }

    // === Helper methods ===

    private static Pou program(String name, Body body) {
        return Pou.of(name, PouKind.PROGRAM, PouInterface.EMPTY, Optional.of(body));
    }

    private static Variable global(String name) {
        return Variable.of(name, "BOOL", VarClass.GLOBAL);
    }

    private static Project project(List<Pou> pous, List<Variable> globals) {
        return new Project("Plant", Optional.empty(), List.of(), pous,
                           Optional.of(new Configuration("Plant", List.of(), globals)), Optional.empty());
    }
}
