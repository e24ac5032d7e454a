package org.pragmatica.plc.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.plc.ast.Argument;
import org.pragmatica.plc.ast.AssignOp;
import org.pragmatica.plc.ast.Statement;
import org.pragmatica.plc.error.ParseError;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RockwellStParserTest {

    // === Routine bodies ===

    @Test
    void routineBody_withoutPouWrapper_parses() {
        var statements = RockwellStParser.parseStatements("""
            IF Start AND NOT Stop THEN
                Motor := 1;
            END_IF;
            Counter := Counter + 1;
            """).unwrap();

        assertThat(statements).hasSize(2);
        assertInstanceOf(Statement.If.class, statements.get(0));
    }

    @Test
    void nonRetentiveAssignment_isDistinctOperator() {
        var statements = RockwellStParser.parseStatements("Out [:=] In1;").unwrap();

        var assignment = (Statement.Assignment) statements.get(0);
        assertEquals(AssignOp.NON_RETENTIVE, assignment.op());
    }

    @Test
    void emptyArguments_areInferred() {
        var statements = RockwellStParser.parseStatements("TONR(Timer1, , Done);").unwrap();

        var call = (Statement.FunctionCall) statements.get(0);
        assertThat(call.arguments()).hasSize(3);
        assertInstanceOf(Argument.Positional.class, call.arguments().get(0));
        assertInstanceOf(Argument.Inferred.class, call.arguments().get(1));
        assertInstanceOf(Argument.Positional.class, call.arguments().get(2));
    }

    @Test
    void trailingEmptyArgument_isInferred() {
        var statements = RockwellStParser.parseStatements("JSR(Routine1, );").unwrap();

        var call = (Statement.FunctionCall) statements.get(0);
        assertInstanceOf(Argument.Inferred.class, call.arguments().get(1));
    }

    @Test
    void moduleQualifiedTag_isSingleRoot() {
        var statements = RockwellStParser.parseStatements("Local:1:O.Data.0 := Local:1:I.Data.3;").unwrap();

        var assignment = (Statement.Assignment) statements.get(0);
        assertEquals("Local:1:O", assignment.target().rootName());
        assertEquals("Local:1:O.Data.0", assignment.target().path());
    }

    @Test
    void arrayIndexedTag_parses() {
        var statements = RockwellStParser.parseStatements("Recipe[Idx].Temp := 72.5;").unwrap();

        var assignment = (Statement.Assignment) statements.get(0);
        assertEquals("Recipe", assignment.target().rootName());
    }

    // === Errors ===

    @Test
    void brokenStatement_strict_fails() {
        var result = RockwellStParser.parseStatements("Motor := ;");

        assertInstanceOf(ParseError.InvalidExpression.class, result.error().orElseThrow());
    }

    @Test
    void brokenStatement_recovering_keepsRest() {
        var result = RockwellStParser.parseStatementsRecovering("""
            Motor := ;
            Valve := 1;
            Pump := Valve;
            """);

        assertEquals(1, result.errorCount());
        assertThat(result.value()).hasSize(2);
    }
}
