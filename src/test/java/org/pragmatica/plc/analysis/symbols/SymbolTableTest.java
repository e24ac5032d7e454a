package org.pragmatica.plc.analysis.symbols;

import org.junit.jupiter.api.Test;
import org.pragmatica.plc.analysis.types.Type;
import org.pragmatica.plc.error.DiagnosticKind;
import org.pragmatica.plc.tree.SourceSpan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SymbolTableTest {

    // === Scopes ===

    @Test
    void newTable_startsInGlobalScope() {
        var table = new SymbolTable();

        assertEquals("global", table.currentScopeName());
        assertThat(table.scopes()).hasSize(1);
    }

    @Test
    void lookup_findsSymbolsOfEnclosingScopes() {
        var table = new SymbolTable();
        table.define(Symbol.variable("Counter", Type.Elementary.INT, SourceSpan.of(0, 7)));
        table.enterScope("Main");

        assertEquals("Main", table.currentScopeName());
        assertTrue(table.lookup("Counter").isPresent());
        assertFalse(table.isDefinedLocally("Counter"));
    }

    @Test
    void exitScope_returnsToParentAndHidesInnerSymbols() {
        var table = new SymbolTable();
        table.enterScope("Main");
        table.define(Symbol.variable("local", Type.Elementary.BOOL, SourceSpan.of(0, 5)));
        table.exitScope();

        assertEquals("global", table.currentScopeName());
        assertTrue(table.lookup("local").isEmpty());
        assertThat(table.scopes()).hasSize(2);
    }

    @Test
    void exitScope_atGlobal_staysAtGlobal() {
        var table = new SymbolTable();
        table.exitScope();

        assertEquals("global", table.currentScopeName());
    }

    @Test
    void innerDefinition_shadowsOuterOne() {
        var table = new SymbolTable();
        table.define(Symbol.variable("x", Type.Elementary.INT, SourceSpan.of(0, 1)));
        table.enterScope("Inner");
        table.define(Symbol.variable("x", Type.Elementary.REAL, SourceSpan.of(10, 11)));

        assertEquals(Type.Elementary.REAL, table.lookup("x").orElseThrow().type().orElseThrow());
    }

    // === Definitions ===

    @Test
    void define_duplicateInSameScope_reportsOriginalSpan() {
        var table = new SymbolTable();
        assertTrue(table.define(Symbol.variable("speed", Type.Elementary.INT, SourceSpan.of(4, 9))).isEmpty());

        var duplicate = table.define(Symbol.variable("speed", Type.Elementary.INT, SourceSpan.of(20, 25)));

        assertTrue(duplicate.isPresent());
        assertTrue(duplicate.get().isError());
        assertEquals(SourceSpan.of(20, 25), duplicate.get().span());
        var kind = assertInstanceOf(DiagnosticKind.DuplicateDefinition.class, duplicate.get().kind());
        assertEquals(SourceSpan.of(4, 9), kind.original());
    }

    @Test
    void lookup_matchesExactSpelling() {
        var table = new SymbolTable();
        table.define(Symbol.variable("MotorRunning", Type.Elementary.BOOL, SourceSpan.of(0, 12)));

        assertTrue(table.lookup("MotorRunning").isPresent());
        assertTrue(table.lookup("motorrunning").isEmpty());
        assertFalse(table.isDefinedLocally("MOTORRUNNING"));
    }

    @Test
    void define_namesDifferingOnlyInCase_areDistinct() {
        var table = new SymbolTable();
        table.define(Symbol.variable("Foo", Type.Elementary.INT, SourceSpan.of(4, 7)));

        var second = table.define(Symbol.variable("foo", Type.Elementary.REAL, SourceSpan.of(10, 13)));

        assertTrue(second.isEmpty());
        assertEquals(Type.Elementary.INT, table.lookup("Foo").orElseThrow().type().orElseThrow());
        assertEquals(Type.Elementary.REAL, table.lookup("foo").orElseThrow().type().orElseThrow());
    }

    // === Usage tracking ===

    @Test
    void markUsedAndAssigned_updateLiveSymbol() {
        var table = new SymbolTable();
        table.define(Symbol.variable("x", Type.Elementary.INT, SourceSpan.of(0, 1)));
        table.enterScope("Body");

        table.markUsed("x");
        table.markAssigned("x");

        var symbol = table.lookup("x").orElseThrow();
        assertTrue(symbol.isUsed());
        assertTrue(symbol.isAssigned());
    }

    @Test
    void markUsed_unknownName_isIgnored() {
        var table = new SymbolTable();

        assertDoesNotThrow(() -> table.markUsed("ghost"));
    }

    @Test
    void checkUnused_reportsUnusedAndUnassignedVariables() {
        var table = new SymbolTable();
        table.enterScope("Main");
        table.define(Symbol.variable("idle", Type.Elementary.INT, SourceSpan.of(0, 4)));
        table.exitScope();

        var diagnostics = table.checkUnused();

        assertThat(diagnostics).hasSize(2);
        assertInstanceOf(DiagnosticKind.UnusedVariable.class, diagnostics.get(0).kind());
        assertInstanceOf(DiagnosticKind.UninitializedVariable.class, diagnostics.get(1).kind());
        assertFalse(diagnostics.get(0).isError());
    }

    @Test
    void checkUnused_ignoresParametersAndConstants() {
        var table = new SymbolTable();
        table.define(Symbol.symbol("Start", SymbolKind.PARAMETER, Type.Elementary.BOOL, SourceSpan.of(0, 5),
                                   true, false));
        table.define(Symbol.symbol("LIMIT", SymbolKind.CONSTANT, Type.Elementary.INT, SourceSpan.of(6, 11),
                                   false, true));

        assertThat(table.checkUnused()).isEmpty();
    }

    @Test
    void checkUnused_usedAndAssignedVariable_isClean() {
        var table = new SymbolTable();
        table.define(Symbol.variable("x", Type.Elementary.INT, SourceSpan.of(0, 1)));
        table.markUsed("x");
        table.markAssigned("x");

        assertThat(table.checkUnused()).isEmpty();
    }
}
