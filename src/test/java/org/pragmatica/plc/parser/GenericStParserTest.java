package org.pragmatica.plc.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.plc.PlcParser;
import org.pragmatica.plc.ast.Argument;
import org.pragmatica.plc.ast.AstPrinter;
import org.pragmatica.plc.ast.CaseLabel;
import org.pragmatica.plc.ast.Expression;
import org.pragmatica.plc.ast.PouDeclaration;
import org.pragmatica.plc.ast.Retain;
import org.pragmatica.plc.ast.Statement;
import org.pragmatica.plc.ast.TypeSpec;
import org.pragmatica.plc.ast.VarClass;
import org.pragmatica.plc.error.ParseError;
import org.pragmatica.plc.error.ParseException;
import org.pragmatica.plc.lexer.Dialect;
import org.pragmatica.plc.tree.SourceSpan;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class GenericStParserTest {

    // === Expressions ===

    @Test
    void precedence_mixedOperators_bindsByLevel() {
        var statement = (Statement.Assignment) single("x := a OR b AND NOT c = d + e * f ** g;");

        assertEquals("(a OR (b AND NOT (c = (d + (e * (f ** g))))))", AstPrinter.expression(statement.value()));
    }

    @Test
    void power_isRightAssociative() {
        var statement = (Statement.Assignment) single("x := a ** b ** c;");

        assertEquals("(a ** (b ** c))", AstPrinter.expression(statement.value()));
    }

    @Test
    void subtraction_isLeftAssociative() {
        var statement = (Statement.Assignment) single("x := a - b - c;");

        assertEquals("((a - b) - c)", AstPrinter.expression(statement.value()));
    }

    @Test
    void unaryMinus_bindsTighterThanMultiplication() {
        var statement = (Statement.Assignment) single("x := -a * b;");

        assertEquals("(-a * b)", AstPrinter.expression(statement.value()));
    }

    @Test
    void parentheses_areKeptInTree() {
        var statement = (Statement.Assignment) single("x := (a + b) * c;");

        var binary = assertInstanceOf(Expression.Binary.class, statement.value());
        assertInstanceOf(Expression.Paren.class, binary.left());
    }

    @Test
    void functionCall_withNamedAndOutputArguments_parsesEachKind() {
        var statement = (Statement.FbInvocation) single("Timer1.Run(IN := Start, PT := T#5s, Q => Done, NOT Err => Fault);");

        assertEquals("Timer1.Run", statement.instance().path());
        assertThat(statement.arguments()).hasSize(4);
        assertInstanceOf(Argument.Named.class, statement.arguments().get(0));
        var output = (Argument.Output) statement.arguments().get(2);
        assertEquals("Q", output.name());
        assertFalse(output.negated());
        assertTrue(((Argument.Output) statement.arguments().get(3)).negated());
    }

    @Test
    void callOnPlainName_isFunctionCallStatement() {
        var statement = single("Reset();");

        var call = assertInstanceOf(Statement.FunctionCall.class, statement);
        assertEquals("Reset", call.name());
        assertThat(call.arguments()).isEmpty();
    }

    @Test
    void typeConversionCall_onTypeKeyword_isCallExpression() {
        var statement = (Statement.Assignment) single("x := INT(y);");

        var call = assertInstanceOf(Expression.Call.class, statement.value());
        assertEquals("INT", call.name());
    }

    @Test
    void variableAccess_withMemberIndexAndDeref_keepsPath() {
        var statement = (Statement.Assignment) single("a.b[i, 2].c^ := 1;");

        assertEquals("a", statement.target().rootName());
        assertEquals("a.b[i, 2].c^", AstPrinter.variable(statement.target()));
    }

    @Test
    void emptyArgument_inGenericDialect_isRejected() {
        var result = PlcParser.parseStatements(Dialect.GENERIC, "Foo(a, , b);");

        assertFalse(result.isSuccess());
        assertInstanceOf(ParseError.InvalidExpression.class, result.error().orElseThrow());
    }

    // === Statements ===

    @Test
    void keywordCasing_lowerAndUpper_parseIdentically() {
        var lower = PlcParser.parseStatements(Dialect.GENERIC, "if x then y := 1; end_if;").unwrap();
        var upper = PlcParser.parseStatements(Dialect.GENERIC, "IF x THEN y := 1; END_IF;").unwrap();

        assertEquals(upper, lower);
    }

    @Test
    void ifStatement_withElsifAndElse_collectsAllBranches() {
        var statement = (Statement.If) single("""
            IF a THEN x := 1;
            ELSIF b THEN x := 2;
            ELSIF c THEN x := 3;
            ELSE x := 4;
            END_IF;
            """);

        assertThat(statement.thenBody()).hasSize(1);
        assertThat(statement.elsIfs()).hasSize(2);
        assertTrue(statement.elseBody().isPresent());
    }

    @Test
    void caseStatement_withListsRangesAndElse_parsesLabels() {
        var statement = (Statement.Case) single("""
            CASE mode OF
                1, 2: x := 1;
                3..5: x := 2;
                -1: x := 3;
                Idle: x := 4; y := 5;
            ELSE
                x := 0;
            END_CASE;
            """);

        assertThat(statement.branches()).hasSize(4);
        assertThat(statement.branches().get(0).labels()).hasSize(2);
        assertInstanceOf(CaseLabel.Range.class, statement.branches().get(1).labels().get(0));
        assertThat(statement.branches().get(3).body()).hasSize(2);
        assertThat(statement.elseBody().orElseThrow()).hasSize(1);
    }

    @Test
    void forLoop_withStep_keepsAllParts() {
        var statement = (Statement.For) single("FOR i := 10 TO 0 BY -2 DO sum := sum + i; END_FOR;");

        assertEquals("i", statement.variable());
        assertEquals("10", AstPrinter.expression(statement.start()));
        assertEquals("-2", AstPrinter.expression(statement.step().orElseThrow()));
        assertThat(statement.body()).hasSize(1);
    }

    @Test
    void loops_whileAndRepeat_parseBodies() {
        var statements = PlcParser.parseStatements(Dialect.GENERIC, """
            WHILE n > 0 DO n := n - 1; IF n = 5 THEN EXIT; END_IF; END_WHILE;
            REPEAT n := n + 1; UNTIL n >= 10 END_REPEAT;
            """).unwrap();

        var whileLoop = assertInstanceOf(Statement.While.class, statements.get(0));
        assertThat(whileLoop.body()).hasSize(2);
        var repeat = assertInstanceOf(Statement.Repeat.class, statements.get(1));
        assertEquals("(n >= 10)", AstPrinter.expression(repeat.condition()));
    }

    @Test
    void returnStatement_withAndWithoutValue_parses() {
        var statements = PlcParser.parseStatements(Dialect.GENERIC, "RETURN; RETURN x + 1;").unwrap();

        assertTrue(((Statement.Return) statements.get(0)).value().isEmpty());
        assertTrue(((Statement.Return) statements.get(1)).value().isPresent());
    }

    @Test
    void emptyStatement_isKept() {
        var statements = PlcParser.parseStatements(Dialect.GENERIC, "x := 1;;").unwrap();

        assertInstanceOf(Statement.Empty.class, statements.get(1));
    }

    // === Declarations ===

    @Test
    void program_withVariableSections_parsesDeclarations() {
        var unit = GenericStParser.parse("""
            PROGRAM Main
            VAR_INPUT
                Start, Stop : BOOL;
            END_VAR
            VAR RETAIN
                Count : INT := 0;
                Sensor AT %IX0.1 : BOOL;
            END_VAR
            VAR CONSTANT
                Limit : DINT := 100;
            END_VAR
                Count := Count + 1;
            END_PROGRAM
            """).unwrap();

        var program = assertInstanceOf(PouDeclaration.Program.class, unit.declarations().get(0));
        assertEquals("Main", program.name());
        assertThat(program.varBlocks()).hasSize(3);
        assertThat(program.variables(VarClass.INPUT)).extracting(decl -> decl.name()).containsExactly("Start", "Stop");
        var retained = program.varBlocks().get(1);
        assertEquals(Retain.RETAIN, retained.retain());
        assertEquals("%IX0.1", retained.declarations().get(1).address().orElseThrow().text());
        assertTrue(program.varBlocks().get(2).constant());
        assertThat(program.body()).hasSize(1);
    }

    @Test
    void function_withReturnType_parses() {
        var unit = GenericStParser.parse("""
            FUNCTION Add : INT
            VAR_INPUT a, b : INT; END_VAR
                Add := a + b;
            END_FUNCTION
            """).unwrap();

        var function = assertInstanceOf(PouDeclaration.Function.class, unit.declarations().get(0));
        assertEquals("INT", function.returnType().orElseThrow().displayName());
    }

    @Test
    void functionBlock_withInheritanceAndMethods_parses() {
        var unit = GenericStParser.parse("""
            FUNCTION_BLOCK FINAL Pump EXTENDS Base IMPLEMENTS IRun, IStop
            VAR Speed : REAL; END_VAR
            METHOD PUBLIC Start : BOOL
                Speed := 1.0;
                Start := TRUE;
            END_METHOD
            END_FUNCTION_BLOCK
            """).unwrap();

        var block = assertInstanceOf(PouDeclaration.FunctionBlock.class, unit.declarations().get(0));
        assertTrue(block.isFinal());
        assertEquals("Base", block.extendsName().orElseThrow());
        assertThat(block.implementsNames()).containsExactly("IRun", "IStop");
        assertThat(block.methods()).singleElement().extracting(PouDeclaration.Method::name).isEqualTo("Start");
    }

    @Test
    void classAndInterface_inNamespace_areFlattened() {
        var unit = GenericStParser.parse("""
            NAMESPACE Plant.Line1
                INTERFACE IRun
                    METHOD Run : BOOL END_METHOD
                END_INTERFACE
                CLASS Motor IMPLEMENTS IRun
                    VAR Running : BOOL; END_VAR
                    METHOD Run : BOOL
                        Running := TRUE;
                    END_METHOD
                END_CLASS
            END_NAMESPACE
            """).unwrap();

        var namespace = assertInstanceOf(PouDeclaration.Namespace.class, unit.declarations().get(0));
        assertEquals("Plant.Line1", namespace.name());
        assertThat(unit.allDeclarations()).extracting(PouDeclaration::name).containsExactly("IRun", "Motor");
        var iface = (PouDeclaration.Interface) unit.allDeclarations().get(0);
        assertTrue(iface.methods().get(0).isAbstract());
    }

    @Test
    void typeBlock_withEveryTypeKind_parses() {
        var unit = GenericStParser.parse("""
            TYPE
                Mode : (Idle, Running := 5, Stopped);
                Level : INT (0..100);
                Buffer : ARRAY [1..10, 0..3] OF REAL;
                Name : STRING[32];
                Ptr : REF_TO INT;
                Point : STRUCT
                    X : REAL;
                    Y : REAL := 1.0;
                END_STRUCT;
            END_TYPE
            """).unwrap();

        var types = ((PouDeclaration.DataType) unit.declarations().get(0)).types();
        assertThat(types).hasSize(6);
        var mode = (TypeSpec.EnumType) types.get(0).type();
        assertThat(mode.values()).extracting(TypeSpec.EnumValue::name).containsExactly("Idle", "Running", "Stopped");
        assertInstanceOf(TypeSpec.SubrangeType.class, types.get(1).type());
        assertThat(((TypeSpec.ArrayType) types.get(2).type()).ranges()).hasSize(2);
        assertTrue(((TypeSpec.StringType) types.get(3).type()).length().isPresent());
        assertInstanceOf(TypeSpec.RefType.class, types.get(4).type());
        assertThat(((TypeSpec.StructType) types.get(5).type()).fields()).hasSize(2);
    }

    @Test
    void initialValues_arrayAndStruct_parse() {
        var unit = GenericStParser.parse("""
            VAR_GLOBAL
                Table : ARRAY [1..5] OF INT := [1, 2, 3(0)];
                Origin : Point := (X := 0.0, Y := 0.0);
            END_VAR
            """).unwrap();

        var globals = (PouDeclaration.GlobalVars) unit.declarations().get(0);
        var table = globals.block().declarations().get(0).initialValue().orElseThrow();
        var array = assertInstanceOf(Expression.ArrayInitializer.class, table);
        assertInstanceOf(Expression.Repeated.class, array.elements().get(2));
        var origin = globals.block().declarations().get(1).initialValue().orElseThrow();
        assertInstanceOf(Expression.StructInitializer.class, origin);
    }

    // === Errors ===

    @Test
    void missingSemicolon_failsWithMissingTerminator() {
        var result = PlcParser.parseStatements(Dialect.GENERIC, "x := 1\ny := 2;");

        var error = result.error().orElseThrow();
        var missing = assertInstanceOf(ParseError.MissingTerminator.class, error);
        assertEquals(";", missing.terminator());
        assertEquals(6, missing.span().start());
    }

    @Test
    void unclosedParen_atEndOfInput_pointsAtOpening() {
        var result = PlcParser.parseStatements(Dialect.GENERIC, "x := (a + b");

        var error = assertInstanceOf(ParseError.UnclosedParen.class, result.error().orElseThrow());
        assertEquals(5, error.span().start());
    }

    @Test
    void unexpectedToken_reportsExpectedAndFound() {
        var result = GenericStParser.parse("PROGRAM 42 END_PROGRAM");

        var error = assertInstanceOf(ParseError.UnexpectedToken.class, result.error().orElseThrow());
        assertEquals("identifier", error.expected());
    }

    @Test
    void strictMode_stopsAtFirstError() {
        var result = GenericStParser.parse("""
            PROGRAM A
                x := ;
                y := ;
            END_PROGRAM
            """);

        assertFalse(result.isSuccess());
        assertThrows(ParseException.class, result::unwrap);
    }

    @Test
    void emptySource_isEmptyUnit() {
        var unit = GenericStParser.parse("").unwrap();

        assertThat(unit.declarations()).isEmpty();
    }

    // === Spans ===

    @Test
    void statementAfterNonAsciiComment_spanCountsUtf8Bytes() {
        var statement = (Statement.Assignment) single("(* üü *) x := 1;");

        assertEquals(SourceSpan.of(11, 18), statement.span());
        assertEquals(SourceSpan.of(16, 17), statement.value().span());
    }

    @Test
    void nonAsciiSpan_extractsOriginalText() {
        var source = "s := '€€'; t := s;";
        var statements = PlcParser.parseStatements(Dialect.GENERIC, source).unwrap();

        assertEquals("t := s;", statements.get(1).span().extract(source));
        assertEquals(SourceSpan.of(5, 13), ((Statement.Assignment) statements.get(0)).value().span());
    }

    // === Helper methods ===

    private static Statement single(String source) {
        List<Statement> statements = PlcParser.parseStatements(Dialect.GENERIC, source).unwrap();
        assertThat(statements).hasSize(1);
        return statements.get(0);
    }
}
