package org.pragmatica.plc.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.plc.error.ParseError;
import org.pragmatica.plc.error.SecurityError;
import org.pragmatica.plc.lexer.Dialect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ParserLimitsTest {

    // === Presets ===

    @Test
    void presets_growFromStrictToRelaxed() {
        var strict = ParserLimits.strict();
        var balanced = ParserLimits.balanced();
        var relaxed = ParserLimits.relaxed();

        assertThat(strict.maxDepth()).isLessThan(balanced.maxDepth());
        assertThat(balanced.maxDepth()).isLessThan(relaxed.maxDepth());
        assertThat(strict.maxInputSize()).isLessThan(relaxed.maxInputSize());
        assertEquals(balanced, ParserLimits.DEFAULT);
    }

    @Test
    void withMethods_replaceSingleField() {
        var limits = ParserLimits.DEFAULT.withMaxDepth(7);

        assertEquals(7, limits.maxDepth());
        assertEquals(ParserLimits.DEFAULT.maxNodes(), limits.maxNodes());
    }

    @Test
    void nonPositiveLimit_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> ParserLimits.DEFAULT.withMaxDepth(0));
        assertThrows(IllegalArgumentException.class, () -> ParserLimits.DEFAULT.withMaxInputSize(-1));
    }

    // === Enforcement ===

    @Test
    void inputSize_atLimit_isAccepted() {
        var limits = ParserLimits.DEFAULT.withMaxInputSize(10);

        assertTrue(statements(limits, "x := 1234;").isSuccess());
    }

    @Test
    void inputSize_overLimit_isRejected() {
        var limits = ParserLimits.DEFAULT.withMaxInputSize(10);

        var security = securityError(statements(limits, "x := 12345;"));
        var error = assertInstanceOf(SecurityError.InputTooLarge.class, security);
        assertEquals(11, error.measured());
        assertEquals(10, error.limit());
    }

    @Test
    void depth_atLimit_isAccepted() {
        var limits = ParserLimits.DEFAULT.withMaxDepth(5);

        assertTrue(statements(limits, "x := (((1)));").isSuccess());
    }

    @Test
    void depth_overLimit_isRejected() {
        var limits = ParserLimits.DEFAULT.withMaxDepth(5);

        var security = securityError(statements(limits, "x := ((((1))));"));
        assertInstanceOf(SecurityError.DepthExceeded.class, security);
    }

    @Test
    void deepNesting_withDefaultLimits_isRejectedWithoutStackOverflow() {
        var source = "x := " + "(".repeat(5000) + "1" + ")".repeat(5000) + ";";

        var security = securityError(statements(ParserLimits.DEFAULT, source));
        assertInstanceOf(SecurityError.DepthExceeded.class, security);
    }

    @Test
    void deeplyNestedInitializer_isRejectedWithoutStackOverflow() {
        var source = "PROGRAM P\nVAR\n    a : ARRAY [0..1] OF INT := " + "[".repeat(50_000) + "1" + "]".repeat(50_000)
                     + ";\nEND_VAR\nEND_PROGRAM\n";

        var security = securityError(unit(ParserLimits.DEFAULT, source));
        assertInstanceOf(SecurityError.DepthExceeded.class, security);
    }

    @Test
    void nestedStructInitializer_countsDepth() {
        var source = """
            PROGRAM P
            VAR
                p : Outer := (inner := (x := 1));
            END_VAR
            END_PROGRAM
            """;

        assertTrue(unit(ParserLimits.DEFAULT, source).isSuccess());
        var security = securityError(unit(ParserLimits.DEFAULT.withMaxDepth(3), source));
        assertInstanceOf(SecurityError.DepthExceeded.class, security);
    }

    @Test
    void deeplyNestedNamespaces_areRejectedWithoutStackOverflow() {
        var source = "NAMESPACE a\n".repeat(50_000) + "END_NAMESPACE\n".repeat(50_000);

        var security = securityError(unit(ParserLimits.DEFAULT, source));
        assertInstanceOf(SecurityError.DepthExceeded.class, security);
    }

    @Test
    void nestedNamespaces_withinDepth_areAccepted() {
        var source = """
            NAMESPACE outer
                NAMESPACE inner
                END_NAMESPACE
            END_NAMESPACE
            """;

        assertTrue(unit(ParserLimits.DEFAULT.withMaxDepth(2), source).isSuccess());
        assertFalse(unit(ParserLimits.DEFAULT.withMaxDepth(1), source).isSuccess());
    }

    @Test
    void iterations_overLimit_areRejected() {
        var limits = ParserLimits.DEFAULT.withMaxIterations(10);

        var security = securityError(statements(limits, "x := 1;".repeat(20)));
        assertInstanceOf(SecurityError.TooManyIterations.class, security);
    }

    @Test
    void collection_atLimit_isAccepted() {
        var limits = ParserLimits.DEFAULT.withMaxCollectionSize(3);

        assertTrue(statements(limits, "a := 1; b := 2; c := 3;").isSuccess());
    }

    @Test
    void collection_overLimit_isRejected() {
        var limits = ParserLimits.DEFAULT.withMaxCollectionSize(3);

        var security = securityError(statements(limits, "a := 1; b := 2; c := 3; d := 4;"));
        var error = assertInstanceOf(SecurityError.CollectionTooLarge.class, security);
        assertEquals(4, error.measured());
    }

    @Test
    void nodes_overLimit_areRejected() {
        var limits = ParserLimits.DEFAULT.withMaxNodes(5);

        var security = securityError(statements(limits, "x := a + b + c + d;"));
        assertInstanceOf(SecurityError.TooManyNodes.class, security);
    }

    @Test
    void stringLength_overLimit_isRejected() {
        var limits = ParserLimits.DEFAULT.withMaxStringLength(3);

        var security = securityError(statements(limits, "s := 'abcd';"));
        assertInstanceOf(SecurityError.StringTooLong.class, security);
    }

    // === Recovering mode ===

    @Test
    void securityError_inRecoveringMode_abortsWithFallback() {
        var limits = ParserLimits.DEFAULT.withMaxDepth(5);
        var source = """
            PROGRAM P
                x := ;
                y := ((((((1))))));
            END_PROGRAM
            """;

        var result = GenericStParser.parseRecovering(source, limits);

        assertThat(result.value().declarations()).isEmpty();
        assertEquals(2, result.errorCount());
        assertInstanceOf(ParseError.InvalidExpression.class, result.errors().get(0));
        var last = result.errors().get(1);
        assertTrue(last.isFatal());
        assertInstanceOf(ParseError.SecurityLimit.class, last);
    }

    @Test
    void securityError_message_namesMeasuredAndLimit() {
        var limits = ParserLimits.DEFAULT.withMaxInputSize(4);

        var error = statements(limits, "x := 1;").error().orElseThrow();
        assertThat(error.message()).contains("7").contains("4");
    }

    // === Helper methods ===

    private static ParseResult<?> statements(ParserLimits limits, String source) {
        return StructuredTextParser.create(Dialect.GENERIC, limits).parseStatements(source);
    }

    private static ParseResult<?> unit(ParserLimits limits, String source) {
        return StructuredTextParser.create(Dialect.GENERIC, limits).parse(source);
    }

    private static SecurityError securityError(ParseResult<?> result) {
        assertFalse(result.isSuccess());
        var error = assertInstanceOf(ParseError.SecurityLimit.class, result.error().orElseThrow());
        return error.error();
    }
}
