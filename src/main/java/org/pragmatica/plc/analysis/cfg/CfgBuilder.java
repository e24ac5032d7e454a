package org.pragmatica.plc.analysis.cfg;

import org.pragmatica.plc.ast.Statement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds a {@link Cfg} from a statement list.
 *
 * <p>Each simple statement becomes one basic block. {@code EXIT} and {@code CONTINUE} jump to the innermost
 * loop exit or header, {@code RETURN} jumps to the graph exit; all three end their statement list.
 * {@code GOTO} jumps to the node of its label once the whole list is built; a jump to an undefined label has no edge.
 * When an IF or CASE has no ELSE, the branch node itself falls through to the next statement on its false edge.
 */
public final class CfgBuilder {
    private final List<CfgNode> nodes = new ArrayList<>();
    private final List<CfgEdge> edges = new ArrayList<>();
    private final Deque<Integer> loopExits = new ArrayDeque<>();
    private final Deque<Integer> loopHeaders = new ArrayDeque<>();
    private final Map<String, Integer> labels = new HashMap<>();
    private final List<PendingJump> jumps = new ArrayList<>();

    private CfgBuilder() {}

    public static Cfg build(List<Statement> statements) {
        return new CfgBuilder().buildGraph(statements);
    }

    private Cfg buildGraph(List<Statement> statements) {
        int entry = createNode(NodeKind.ENTRY, Optional.empty());
        int exit = createNode(NodeKind.EXIT, Optional.empty());

        if (statements.isEmpty()) {
            addEdge(entry, exit, EdgeKind.SEQUENTIAL);
        } else {
            var fragment = processStatements(statements);
            addEdge(entry, fragment.first(), EdgeKind.SEQUENTIAL);
            fragment.exits().forEach(last -> connect(last, exit, EdgeKind.SEQUENTIAL));
        }
        for (var jump : jumps) {
            var target = labels.get(jump.label());
            if (target != null) {
                addEdge(jump.node(), target, EdgeKind.JUMP);
            }
        }
        return new Cfg(nodes, edges);
    }

    /**
     * First node of a construct and the nodes that fall through to whatever follows it.
     */
    private record Fragment(int first, List<Exit> exits, boolean terminal) {
        static Fragment open(int node) {
            return new Fragment(node, List.of(new Exit(node, EdgeKind.SEQUENTIAL)), false);
        }
    }

    /**
     * A fall-through node and the kind of edge it leaves on. {@code SEQUENTIAL} takes the kind of the context.
     */
    private record Exit(int node, EdgeKind kind) {}

    private record PendingJump(int node, String label) {}

    private Fragment processStatements(List<Statement> statements) {
        if (statements.isEmpty()) {
            int empty = createNode(NodeKind.BASIC, Optional.empty());
            return Fragment.open(empty);
        }
        int first = -1;
        List<Exit> current = List.of();

        for (var statement : statements) {
            var fragment = processStatement(statement);
            if (first < 0) {
                first = fragment.first();
            }
            for (var previous : current) {
                connect(previous, fragment.first(), EdgeKind.SEQUENTIAL);
            }
            current = fragment.terminal() ? List.of() : fragment.exits();
        }
        return new Fragment(first, current, false);
    }

    private Fragment processStatement(Statement statement) {
        if (statement instanceof Statement.If ifStatement) {
            return processIf(ifStatement);
        }
        if (statement instanceof Statement.Case caseStatement) {
            return processCase(caseStatement);
        }
        if (statement instanceof Statement.For forLoop) {
            return processLoop(forLoop, forLoop.body());
        }
        if (statement instanceof Statement.While whileLoop) {
            return processLoop(whileLoop, whileLoop.body());
        }
        if (statement instanceof Statement.Repeat repeat) {
            return processRepeat(repeat);
        }
        if (statement instanceof Statement.Region region) {
            return processStatements(region.body());
        }
        int node = createNode(NodeKind.BASIC, Optional.of(statement));

        if (statement instanceof Statement.Return) {
            addEdge(node, Cfg.EXIT, EdgeKind.RETURN);
            return new Fragment(node, List.of(), true);
        }
        if (statement instanceof Statement.Exit) {
            if (!loopExits.isEmpty()) {
                addEdge(node, loopExits.peek(), EdgeKind.LOOP_EXIT);
            }
            return new Fragment(node, List.of(), true);
        }
        if (statement instanceof Statement.Continue) {
            if (!loopHeaders.isEmpty()) {
                addEdge(node, loopHeaders.peek(), EdgeKind.LOOP_BACK);
            }
            return new Fragment(node, List.of(), true);
        }
        if (statement instanceof Statement.Goto jump) {
            jumps.add(new PendingJump(node, jump.label()));
            return new Fragment(node, List.of(), true);
        }
        if (statement instanceof Statement.Label label) {
            labels.putIfAbsent(label.name(), node);
        }
        return Fragment.open(node);
    }

    private Fragment processIf(Statement.If statement) {
        int branch = createNode(NodeKind.BRANCH, Optional.of(statement));
        var exits = new ArrayList<Exit>();

        var then = processStatements(statement.thenBody());
        addEdge(branch, then.first(), EdgeKind.TRUE_BRANCH);
        exits.addAll(then.exits());

        int falseTarget = branch;
        for (var elsIf : statement.elsIfs()) {
            int elsIfBranch = createNode(NodeKind.BRANCH, Optional.of(statement));
            addEdge(falseTarget, elsIfBranch, EdgeKind.FALSE_BRANCH);
            var body = processStatements(elsIf.body());
            addEdge(elsIfBranch, body.first(), EdgeKind.TRUE_BRANCH);
            exits.addAll(body.exits());
            falseTarget = elsIfBranch;
        }
        if (statement.elseBody().isPresent()) {
            var elseFragment = processStatements(statement.elseBody().get());
            addEdge(falseTarget, elseFragment.first(), EdgeKind.FALSE_BRANCH);
            exits.addAll(elseFragment.exits());
        } else {
            exits.add(new Exit(falseTarget, EdgeKind.FALSE_BRANCH));
        }
        return new Fragment(branch, exits, false);
    }

    private Fragment processCase(Statement.Case statement) {
        int branch = createNode(NodeKind.BRANCH, Optional.of(statement));
        var exits = new ArrayList<Exit>();

        for (var caseBranch : statement.branches()) {
            var body = processStatements(caseBranch.body());
            addEdge(branch, body.first(), EdgeKind.TRUE_BRANCH);
            exits.addAll(body.exits());
        }
        if (statement.elseBody().isPresent()) {
            var elseFragment = processStatements(statement.elseBody().get());
            addEdge(branch, elseFragment.first(), EdgeKind.FALSE_BRANCH);
            exits.addAll(elseFragment.exits());
        } else {
            exits.add(new Exit(branch, EdgeKind.FALSE_BRANCH));
        }
        return new Fragment(branch, exits, false);
    }

    private Fragment processLoop(Statement statement, List<Statement> body) {
        int header = createNode(NodeKind.LOOP_HEADER, Optional.of(statement));
        int loopExit = createNode(NodeKind.LOOP_EXIT, Optional.empty());

        loopExits.push(loopExit);
        loopHeaders.push(header);
        var fragment = processStatements(body);
        loopExits.pop();
        loopHeaders.pop();

        addEdge(header, fragment.first(), EdgeKind.TRUE_BRANCH);
        addEdge(header, loopExit, EdgeKind.FALSE_BRANCH);
        fragment.exits().forEach(exit -> connect(exit, header, EdgeKind.LOOP_BACK));

        return new Fragment(header, List.of(new Exit(loopExit, EdgeKind.SEQUENTIAL)), false);
    }

    private Fragment processRepeat(Statement.Repeat statement) {
        int bodyStart = createNode(NodeKind.BASIC, Optional.empty());
        int condition = createNode(NodeKind.LOOP_HEADER, Optional.of(statement));
        int loopExit = createNode(NodeKind.LOOP_EXIT, Optional.empty());

        loopExits.push(loopExit);
        loopHeaders.push(bodyStart);
        var fragment = processStatements(statement.body());
        loopExits.pop();
        loopHeaders.pop();

        addEdge(bodyStart, fragment.first(), EdgeKind.SEQUENTIAL);
        fragment.exits().forEach(exit -> connect(exit, condition, EdgeKind.SEQUENTIAL));
        addEdge(condition, loopExit, EdgeKind.TRUE_BRANCH);
        addEdge(condition, bodyStart, EdgeKind.FALSE_BRANCH);

        return new Fragment(bodyStart, List.of(new Exit(loopExit, EdgeKind.SEQUENTIAL)), false);
    }

    private int createNode(NodeKind kind, Optional<Statement> statement) {
        int id = nodes.size();
        nodes.add(new CfgNode(id, kind, statement));
        return id;
    }

    private void connect(Exit exit, int to, EdgeKind kind) {
        addEdge(exit.node(), to, exit.kind() == EdgeKind.SEQUENTIAL ? kind : exit.kind());
    }

    private void addEdge(int from, int to, EdgeKind kind) {
        edges.add(new CfgEdge(from, to, kind));
    }
}
