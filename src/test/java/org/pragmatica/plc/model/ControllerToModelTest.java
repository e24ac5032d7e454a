package org.pragmatica.plc.model;

import org.junit.jupiter.api.Test;
import org.pragmatica.plc.project.AddOnInstruction;
import org.pragmatica.plc.project.AoiParameter;
import org.pragmatica.plc.project.Controller;
import org.pragmatica.plc.project.ControllerProgram;
import org.pragmatica.plc.project.ControllerTag;
import org.pragmatica.plc.project.Routine;
import org.pragmatica.plc.project.RungText;
import org.pragmatica.plc.project.StLine;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ControllerToModelTest {

    @Test
    void ladderRoutines_areJoinedIntoRawBodyWithHeaders() {
        var program = new ControllerProgram("MainProgram",
                                            List.of(ControllerTag.of("Step", "DINT")),
                                            List.of(Routine.rll("MainRoutine", List.of(RungText.of(0, "XIC(Start)OTE(Motor);"),
                                                                                      RungText.of(1, "NOP();"))),
                                                    Routine.rll("Faults", List.of(RungText.of(0, "OTU(Alarm);")))),
                                            Optional.of("MainRoutine"));

        var pou = convert(controller(List.of(program), List.of())).findPou("MainProgram").orElseThrow();

        var body = assertInstanceOf(Body.Raw.class, pou.body().orElseThrow());
        assertEquals("RLL", body.language());
        assertEquals("""
                         // Routine: MainRoutine
                         XIC(Start)OTE(Motor);
                         NOP();
                         // Routine: Faults
                         OTU(Alarm);
                         """, body.content());
        assertThat(pou.pouInterface().locals()).extracting(Variable::name).containsExactly("Step");
    }

    @Test
    void programWithOnlyStRoutines_usesStBody() {
        var routine = Routine.st("Calc", List.of(new StLine(2, "y := x * 2;"), new StLine(1, "x := 1;")));
        var program = new ControllerProgram("Calc", List.of(), List.of(routine), Optional.empty());

        var pou = convert(controller(List.of(program), List.of())).findPou("Calc").orElseThrow();

        var body = assertInstanceOf(Body.St.class, pou.body().orElseThrow());
        assertEquals("x := 1;\ny := x * 2;", body.text());
    }

    @Test
    void programWithoutRoutines_hasNoBody() {
        var program = new ControllerProgram("Empty", List.of(), List.of(), Optional.empty());

        assertTrue(convert(controller(List.of(program), List.of())).findPou("Empty").orElseThrow().isEmpty());
    }

    @Test
    void addOnInstruction_becomesFunctionBlockWithParameterClasses() {
        var aoi = new AddOnInstruction("Valve",
                                       List.of(new AoiParameter("Open", "BOOL", "Input"),
                                               new AoiParameter("IsOpen", "BOOL", "Output"),
                                               new AoiParameter("Config", "ValveCfg", "InOut"),
                                               new AoiParameter("EnableIn", "BOOL", null)),
                                       List.of(ControllerTag.of("Timer", "TIMER")),
                                       List.of(Routine.rll("Logic", List.of(RungText.of(0, "XIC(Open)OTE(IsOpen);")))));

        var pou = convert(controller(List.of(), List.of(aoi))).findPou("Valve").orElseThrow();

        assertEquals(PouKind.FUNCTION_BLOCK, pou.kind());
        assertThat(pou.pouInterface().inputs()).extracting(Variable::name).containsExactly("Open");
        assertThat(pou.pouInterface().outputs()).extracting(Variable::name).containsExactly("IsOpen");
        assertThat(pou.pouInterface().inOuts()).extracting(Variable::name).containsExactly("Config");
        assertThat(pou.pouInterface().locals()).extracting(Variable::name).containsExactly("EnableIn", "Timer");
    }

    @Test
    void controllerTags_becomeGlobalsWithDimensions() {
        var tags = List.of(new ControllerTag("Recipe", "REAL", Optional.of("4 8"), Optional.of("Recipe table")),
                           ControllerTag.of("Start", "BOOL"));
        var controller = new Controller("Line1", tags, List.of(), List.of());

        var project = convert(controller);

        assertEquals("Line1", project.name());
        assertEquals(Optional.of("L5X"), project.sourceFormat());
        var globals = project.configuration().orElseThrow().globalVars();
        assertThat(globals).extracting(Variable::name).containsExactly("Recipe", "Start");
        assertEquals(List.of(4, 8), globals.get(0).dimensions());
        assertEquals(32, globals.get(0).arraySize());
        assertEquals(Optional.of("Recipe table"), globals.get(0).description());
        assertEquals(VarClass.GLOBAL, globals.get(1).varClass());
    }

    @Test
    void programsPrecedeAddOnInstructions() {
        var program = new ControllerProgram("MainProgram", List.of(), List.of(), Optional.empty());
        var aoi = new AddOnInstruction("Valve", List.of(), List.of(), List.of());

        var project = convert(controller(List.of(program), List.of(aoi)));

        assertThat(project.pous()).extracting(Pou::name).containsExactly("MainProgram", "Valve");
        assertThat(project.programs()).hasSize(1);
    }

    // === Helper methods ===

    private static Controller controller(List<ControllerProgram> programs, List<AddOnInstruction> aois) {
        return new Controller("Plant", List.of(), programs, aois);
    }

    private static Project convert(Controller controller) {
        return new ControllerToModel().toPlcModel(controller);
    }
}
