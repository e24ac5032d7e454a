package org.pragmatica.plc;

import org.junit.jupiter.api.Test;
import org.pragmatica.plc.ast.PouKind;
import org.pragmatica.plc.error.ParseException;
import org.pragmatica.plc.lexer.Dialect;
import org.pragmatica.plc.parser.ParserLimits;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PlcParserTest {
    private static final String PROGRAM = """
        PROGRAM Main
        VAR
            x : INT;
        END_VAR
        x := x + 1;
        END_PROGRAM
        """;

    @Test
    void parse_programInEveryDialect() {
        for (var dialect : Dialect.values()) {
            var unit = PlcParser.parse(dialect, PROGRAM).unwrap();

            assertThat(unit.declarations()).singleElement()
                                           .satisfies(declaration -> assertEquals(PouKind.PROGRAM, declaration.kind()));
        }
    }

    @Test
    void parse_sclBlock_needsSclDialect() {
        var source = """
            ORGANIZATION_BLOCK "Main"
            BEGIN
               #Count += 1;
            END_ORGANIZATION_BLOCK
            """;

        assertTrue(PlcParser.parse(Dialect.SCL, source).isSuccess());
        assertFalse(PlcParser.parse(Dialect.GENERIC, source).isSuccess());
    }

    @Test
    void parse_invalidSource_unwrapThrows() {
        var result = PlcParser.parse(Dialect.GENERIC, "PROGRAM Main x := ; END_PROGRAM");

        assertFalse(result.isSuccess());
        assertTrue(result.error().isPresent());
        assertThrows(ParseException.class, result::unwrap);
    }

    @Test
    void parseRecovering_reportsErrorsWithPartialTree() {
        var result = PlcParser.parseRecovering(Dialect.GENERIC, """
            PROGRAM Main
            x := ;
            y := 2;
            END_PROGRAM
            """);

        assertTrue(result.hasErrors());
        assertThat(result.value().declarations()).hasSize(1);
    }

    @Test
    void parseStatements_acceptsBareRoutineBody() {
        var statements = PlcParser.parseStatements(Dialect.ROCKWELL, "Out [:=] TRUE; Count := Count + 1;").unwrap();

        assertThat(statements).hasSize(2);
    }

    @Test
    void parseRung_delegatesToLadderParser() {
        assertTrue(PlcParser.parseRung("XIC(Start)OTE(Motor);").isParsed());
        assertFalse(PlcParser.parseRung("XIC(Start").isParsed());
    }

    @Test
    void builder_appliesLimits() {
        var parser = PlcParser.builder(Dialect.GENERIC)
                              .limits(ParserLimits.DEFAULT.withMaxInputSize(16))
                              .build();

        assertFalse(parser.parse(PROGRAM).isSuccess());
        assertTrue(PlcParser.forDialect(Dialect.GENERIC).parse(PROGRAM).isSuccess());
    }
}
