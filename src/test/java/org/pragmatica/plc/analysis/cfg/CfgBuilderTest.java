package org.pragmatica.plc.analysis.cfg;

import org.junit.jupiter.api.Test;
import org.pragmatica.plc.PlcParser;
import org.pragmatica.plc.ast.Statement;
import org.pragmatica.plc.lexer.Dialect;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CfgBuilderTest {

    // === Structure ===

    @Test
    void emptyBody_connectsEntryToExit() {
        var cfg = CfgBuilder.build(List.of());

        assertThat(cfg.nodes()).hasSize(2);
        assertThat(cfg.successors(Cfg.ENTRY)).containsExactly(Cfg.EXIT);
        assertEquals(1, cfg.cyclomaticComplexity());
        assertEquals(1, cfg.decisionComplexity());
    }

    @Test
    void straightLine_hasOneBlockPerStatement() {
        var cfg = build("a := 1; b := 2; c := 3;");

        assertThat(cfg.nodes()).filteredOn(node -> node.kind() == NodeKind.BASIC).hasSize(3);
        assertEquals(1, cfg.cyclomaticComplexity());
        assertTrue(cfg.hasPath(Cfg.ENTRY, Cfg.EXIT));
    }

    @Test
    void entryAndExit_haveFixedIds() {
        var cfg = build("a := 1;");

        assertEquals(NodeKind.ENTRY, cfg.node(Cfg.ENTRY).orElseThrow().kind());
        assertEquals(NodeKind.EXIT, cfg.node(Cfg.EXIT).orElseThrow().kind());
        assertTrue(cfg.node(99).isEmpty());
    }

    @Test
    void predecessors_mirrorSuccessors() {
        var cfg = build("IF a THEN x := 1; END_IF;");

        for (var edge : cfg.edges()) {
            assertThat(cfg.predecessors(edge.to())).contains(edge.from());
        }
    }

    // === Complexity ===

    @Test
    void nestedControlFlow_countsEveryDecision() {
        var cfg = build("""
            IF a THEN
                WHILE b DO
                    IF c THEN x := 1; ELSE x := 2; END_IF;
                END_WHILE;
            ELSIF d THEN
                y := 1;
            ELSE
                FOR i := 1 TO 10 DO z := i; END_FOR;
            END_IF;
            """);

        assertEquals(6, cfg.decisionComplexity());
        assertEquals(6, cfg.cyclomaticComplexity());
    }

    @Test
    void caseWithoutElse_addsImplicitPath() {
        var cfg = build("""
            CASE mode OF
                1: x := 1;
                2: x := 2;
            END_CASE;
            """);

        assertEquals(2, cfg.decisionComplexity());
        assertEquals(3, cfg.cyclomaticComplexity());
    }

    @Test
    void repeatLoop_isOneDecision() {
        var cfg = build("REPEAT x := x + 1; UNTIL x > 5 END_REPEAT;");

        assertEquals(2, cfg.decisionComplexity());
        assertEquals(2, cfg.cyclomaticComplexity());
    }

    @Test
    void cognitiveComplexity_addsBooleanOperators() {
        var statements = parse("IF a AND b OR c THEN x := 1; END_IF;");

        assertEquals(2, CfgBuilder.build(statements).decisionComplexity());
        assertEquals(4, Complexity.cognitiveComplexity(statements));
    }

    // === Jumps and reachability ===

    @Test
    void statementAfterReturn_isUnreachable() {
        var cfg = build("x := 1; RETURN; y := 2;");

        var unreachable = cfg.unreachableNodes();
        assertThat(unreachable).hasSize(1);
        var node = cfg.node(unreachable.get(0)).orElseThrow();
        var statement = assertInstanceOf(Statement.Assignment.class, node.statement().orElseThrow());
        assertEquals("y", statement.target().rootName());
        assertThat(cfg.edges()).anyMatch(edge -> edge.kind() == EdgeKind.RETURN && edge.to() == Cfg.EXIT);
    }

    @Test
    void exitInsideLoop_jumpsToLoopExit() {
        var cfg = build("""
            WHILE a DO
                IF b THEN EXIT; END_IF;
                x := 1;
            END_WHILE;
            """);

        assertThat(cfg.edges()).anyMatch(edge -> edge.kind() == EdgeKind.LOOP_EXIT
                                                 && cfg.node(edge.to()).orElseThrow().kind() == NodeKind.LOOP_EXIT);
        assertThat(cfg.unreachableNodes()).isEmpty();
    }

    @Test
    void continueInsideLoop_jumpsBackToHeader() {
        var cfg = build("""
            FOR i := 1 TO 10 DO
                IF skip THEN CONTINUE; END_IF;
                total := total + i;
            END_FOR;
            """);

        assertThat(cfg.edges()).filteredOn(edge -> edge.kind() == EdgeKind.LOOP_BACK)
                               .allMatch(edge -> cfg.node(edge.to()).orElseThrow().kind() == NodeKind.LOOP_HEADER)
                               .hasSize(2);
    }

    @Test
    void statementAfterExit_isUnreachable() {
        var cfg = build("WHILE a DO EXIT; x := 1; END_WHILE;");

        assertThat(cfg.unreachableNodes()).hasSize(1);
    }

    @Test
    void gotoForward_jumpsToLabelAndSkipsStatements() {
        var cfg = buildScl("GOTO Done; x := 1; Done: y := 2;");

        var jump = singleEdge(cfg, EdgeKind.JUMP);
        assertInstanceOf(Statement.Goto.class, cfg.node(jump.from()).orElseThrow().statement().orElseThrow());
        var label = assertInstanceOf(Statement.Label.class, cfg.node(jump.to()).orElseThrow().statement().orElseThrow());
        assertEquals("Done", label.name());
        assertThat(cfg.unreachableNodes()).hasSize(1);
        assertTrue(cfg.hasPath(Cfg.ENTRY, Cfg.EXIT));
    }

    @Test
    void gotoBackward_formsLoop() {
        var cfg = buildScl("""
            Again: x := x + 1;
            IF x < 5 THEN GOTO Again; END_IF;
            """);

        var jump = singleEdge(cfg, EdgeKind.JUMP);
        assertTrue(cfg.hasPath(jump.to(), jump.from()));
        assertThat(cfg.unreachableNodes()).isEmpty();
    }

    @Test
    void gotoUndefinedLabel_hasNoJumpEdge() {
        var cfg = buildScl("GOTO Nowhere; x := 1;");

        assertThat(cfg.edges()).noneMatch(edge -> edge.kind() == EdgeKind.JUMP);
        assertFalse(cfg.hasPath(Cfg.ENTRY, Cfg.EXIT));
    }

    // === Branch edges ===

    @Test
    void ifWithoutElse_fallsThroughOnFalseEdge() {
        var cfg = build("IF a THEN x := 1; END_IF; y := 2;");

        int branch = 2;
        assertEquals(NodeKind.BRANCH, cfg.node(branch).orElseThrow().kind());
        assertThat(cfg.edges()).contains(new CfgEdge(branch, 3, EdgeKind.TRUE_BRANCH),
                                         new CfgEdge(branch, 4, EdgeKind.FALSE_BRANCH),
                                         new CfgEdge(3, 4, EdgeKind.SEQUENTIAL));
    }

    @Test
    void elsifWithoutElse_lastConditionFallsThroughOnFalseEdge() {
        var cfg = build("IF a THEN x := 1; ELSIF b THEN x := 2; END_IF;");

        assertThat(cfg.edges()).filteredOn(edge -> edge.kind() == EdgeKind.FALSE_BRANCH)
                               .extracting(CfgEdge::to)
                               .containsExactlyInAnyOrder(4, Cfg.EXIT);
    }

    @Test
    void caseWithoutElse_fallsThroughOnFalseEdge() {
        var cfg = build("CASE m OF 1: x := 1; 2: x := 2; END_CASE;");

        assertThat(cfg.edges()).filteredOn(edge -> edge.kind() == EdgeKind.FALSE_BRANCH)
                               .containsExactly(new CfgEdge(2, Cfg.EXIT, EdgeKind.FALSE_BRANCH));
        assertThat(cfg.edges()).filteredOn(edge -> edge.kind() == EdgeKind.TRUE_BRANCH).hasSize(2);
    }

    @Test
    void ifWithElse_hasNoFallThroughFromBranch() {
        var cfg = build("IF a THEN x := 1; ELSE x := 2; END_IF;");

        assertThat(cfg.successors(2)).doesNotContain(Cfg.EXIT);
    }

    // === Export ===

    @Test
    void toDot_rendersNodesAndEdges() {
        var dot = build("IF a THEN x := 1; END_IF;").toDot();

        assertThat(dot).startsWith("digraph CFG {\n");
        assertThat(dot).contains("n0 [label=\"Entry\" shape=ellipse];");
        assertThat(dot).contains("shape=diamond");
        assertThat(dot).contains("[label=\"T\" color=green]");
        assertThat(dot).endsWith("}\n");
    }

    // === Helper methods ===

    private static List<Statement> parse(String source) {
        return PlcParser.parseStatements(Dialect.GENERIC, source).unwrap();
    }

    private static Cfg build(String source) {
        return CfgBuilder.build(parse(source));
    }

    private static Cfg buildScl(String source) {
        return CfgBuilder.build(PlcParser.parseStatements(Dialect.SCL, source).unwrap());
    }

    private static CfgEdge singleEdge(Cfg cfg, EdgeKind kind) {
        var matching = cfg.edges().stream().filter(edge -> edge.kind() == kind).toList();
        assertThat(matching).hasSize(1);
        return matching.get(0);
    }
}
