package org.pragmatica.plc.model;

import org.junit.jupiter.api.Test;
import org.pragmatica.plc.parser.GenericStParser;
import org.pragmatica.plc.parser.RockwellStParser;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class StToModelTest {
    private static final String PLANT = """
        TYPE
            Mode : (Idle, Running := 5, Stopped);
            Level : INT (0..100);
            Buffer : ARRAY [1..10, 0..3] OF REAL;
            Point : STRUCT
                X : REAL;
                Y : REAL := 1.0;
            END_STRUCT;
            Name : STRING[32];
        END_TYPE

        VAR_GLOBAL
            Emergency AT %IX0.0 : BOOL;
        END_VAR

        FUNCTION Clamp : INT
        VAR_INPUT
            value : INT;
        END_VAR
        Clamp := value;
        END_FUNCTION

        FUNCTION_BLOCK Conveyor
        VAR_INPUT
            Start : BOOL;
        END_VAR
        VAR_OUTPUT
            Running : BOOL;
        END_VAR
        VAR RETAIN
            Hours : ARRAY [0..9] OF DINT;
        END_VAR
        Running := Start;
        END_FUNCTION_BLOCK

        PROGRAM Main
        VAR
            Belt : Conveyor;
            Limit : INT := 10;
        END_VAR
        Belt(Start := TRUE);
        Limit := Clamp(Limit);
        END_PROGRAM

        PROGRAM Standby
        END_PROGRAM
        """;

    // === POUs ===

    @Test
    void pous_keepDeclarationOrderAndKind() {
        var project = convert(PLANT);

        assertThat(project.pous()).extracting(Pou::name).containsExactly("Clamp", "Conveyor", "Main", "Standby");
        assertThat(project.programs()).extracting(Pou::name).containsExactly("Main", "Standby");
        assertThat(project.functionBlocks()).extracting(Pou::name).containsExactly("Conveyor");
        assertThat(project.functions()).extracting(Pou::name).containsExactly("Clamp");
        assertEquals(Optional.of("IEC 61131-3 ST"), project.sourceFormat());
    }

    @Test
    void function_keepsReturnType() {
        var clamp = convert(PLANT).findPou("Clamp").orElseThrow();

        assertEquals(Optional.of("INT"), clamp.pouInterface().returnType());
        assertThat(clamp.pouInterface().inputs()).extracting(Variable::name).containsExactly("value");
    }

    @Test
    void interface_groupsVariablesByClass() {
        var conveyor = convert(PLANT).findPou("Conveyor").orElseThrow();
        var pouInterface = conveyor.pouInterface();

        assertThat(pouInterface.inputs()).extracting(Variable::name).containsExactly("Start");
        assertThat(pouInterface.outputs()).extracting(Variable::name).containsExactly("Running");
        assertThat(pouInterface.locals()).extracting(Variable::name).containsExactly("Hours");
        assertEquals(3, pouInterface.variableCount());
    }

    @Test
    void arrayVariable_hasDimensionsAndRetainFlag() {
        var hours = convert(PLANT).findPou("Conveyor").orElseThrow().findVariable("Hours").orElseThrow();

        assertEquals(List.of(10), hours.dimensions());
        assertEquals(10, hours.arraySize());
        assertTrue(hours.retain());
        assertFalse(hours.constant());
        assertEquals("ARRAY[0..9] OF DINT", hours.dataType());
    }

    @Test
    void initialValue_isRenderedAsText() {
        var limit = convert(PLANT).findPou("Main").orElseThrow().findVariable("Limit").orElseThrow();

        assertEquals(Optional.of("10"), limit.initialValue());
        assertEquals(VarClass.LOCAL, limit.varClass());
    }

    @Test
    void body_isSourceTextOfStatements() {
        var main = convert(PLANT).findPou("Main").orElseThrow();

        var body = assertInstanceOf(Body.St.class, main.body().orElseThrow());
        assertEquals("Belt(Start := TRUE);\nLimit := Clamp(Limit);", body.text());
        assertEquals("ST", body.language());
    }

    @Test
    void emptyProgram_hasNoBody() {
        var standby = convert(PLANT).findPou("Standby").orElseThrow();

        assertTrue(standby.body().isEmpty());
        assertTrue(standby.isEmpty());
    }

    // === Globals and data types ===

    @Test
    void globalBlock_becomesConfigurationGlobals() {
        var configuration = convert(PLANT).configuration().orElseThrow();

        assertThat(configuration.allGlobals()).singleElement().satisfies(variable -> {
            assertEquals("Emergency", variable.name());
            assertEquals(VarClass.GLOBAL, variable.varClass());
            assertEquals(Optional.of("%IX0.0"), variable.address());
        });
    }

    @Test
    void dataTypes_areConvertedByShape() {
        var project = convert(PLANT);

        var mode = assertInstanceOf(DataTypeDef.Enumeration.class, project.findDataType("Mode").orElseThrow());
        assertThat(mode.members()).extracting(DataTypeDef.EnumMember::name).containsExactly("Idle", "Running", "Stopped");
        assertEquals(OptionalLong.of(5), mode.members().get(1).value());

        var level = assertInstanceOf(DataTypeDef.Subrange.class, project.findDataType("Level").orElseThrow());
        assertEquals("INT", level.baseType());
        assertEquals(0, level.lower());
        assertEquals(100, level.upper());

        var buffer = assertInstanceOf(DataTypeDef.Array.class, project.findDataType("Buffer").orElseThrow());
        assertThat(buffer.dimensions()).extracting(DataTypeDef.ArrayDimension::size).containsExactly(10L, 4L);

        var point = assertInstanceOf(DataTypeDef.Struct.class, project.findDataType("Point").orElseThrow());
        assertEquals(Optional.of("1.0"), point.members().get(1).initialValue());

        var name = assertInstanceOf(DataTypeDef.Alias.class, project.findDataType("Name").orElseThrow());
        assertEquals("STRING[32]", name.target());
    }

    @Test
    void stats_countModelContents() {
        var stats = ProjectStats.fromProject(convert(PLANT));

        assertEquals(2, stats.programs());
        assertEquals(1, stats.functionBlocks());
        assertEquals(1, stats.functions());
        assertEquals(4, stats.totalPous());
        assertEquals(5, stats.dataTypes());
        assertEquals(1, stats.globalVars());
        assertEquals(6, stats.totalVars());
        assertEquals(0, stats.tasks());
    }

    // === Classes and Rockwell units ===

    @Test
    void class_becomesFunctionBlock() {
        var project = convert("""
            CLASS Counter
            VAR
                count : INT;
            END_VAR
            METHOD Increment
                count := count + 1;
            END_METHOD
            END_CLASS
            """);

        assertThat(project.functionBlocks()).extracting(Pou::name).containsExactly("Counter");
        assertTrue(project.configuration().isEmpty());
    }

    @Test
    void rockwellUnit_usesItsOwnSourceFormat() {
        var text = """
            PROGRAM Main
            VAR
                Out : BOOL;
            END_VAR
            Out [:=] TRUE;
            END_PROGRAM
            """;
        var source = new SourceFile("main.st", text, RockwellStParser.parse(text).unwrap());

        var project = new RockwellToModel().toPlcModel(source);

        assertEquals(Optional.of("Rockwell ST"), project.sourceFormat());
        assertEquals("Out [:=] TRUE;", ((Body.St) project.pous().get(0).body().orElseThrow()).text());
    }

    // === Helper methods ===

    private static Project convert(String text) {
        return new StToModel().toPlcModel(new SourceFile("plant.st", text, GenericStParser.parse(text).unwrap()));
    }
}
