package org.pragmatica.plc.analysis.cfg;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Control-flow graph of one statement list. Nodes and edges live in flat lists addressed by node id;
 * node 0 is the entry and node 1 the exit.
 */
public final class Cfg {
    public static final int ENTRY = 0;
    public static final int EXIT = 1;

    private final List<CfgNode> nodes;
    private final List<CfgEdge> edges;
    private final Map<Integer, List<Integer>> successors = new HashMap<>();
    private final Map<Integer, List<Integer>> predecessors = new HashMap<>();

    Cfg(List<CfgNode> nodes, List<CfgEdge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);

        for (var edge : edges) {
            successors.computeIfAbsent(edge.from(), key -> new ArrayList<>()).add(edge.to());
            predecessors.computeIfAbsent(edge.to(), key -> new ArrayList<>()).add(edge.from());
        }
    }

    public List<CfgNode> nodes() {
        return nodes;
    }

    public List<CfgEdge> edges() {
        return edges;
    }

    public Optional<CfgNode> node(int id) {
        return id >= 0 && id < nodes.size() ? Optional.of(nodes.get(id)) : Optional.empty();
    }

    public List<Integer> successors(int node) {
        return successors.getOrDefault(node, List.of());
    }

    public List<Integer> predecessors(int node) {
        return predecessors.getOrDefault(node, List.of());
    }

    // === Metrics ===

    /**
     * {@code E - N + 2}, never below 1.
     */
    public int cyclomaticComplexity() {
        return Math.max(1, edges.size() - nodes.size() + 2);
    }

    /**
     * One plus the number of branch and loop-header nodes.
     */
    public int decisionComplexity() {
        return 1 + (int) nodes.stream()
                              .filter(node -> node.kind().isDecision())
                              .count();
    }

    // === Reachability ===

    /**
     * Nodes no path from the entry reaches, in id order.
     */
    public List<Integer> unreachableNodes() {
        var visited = reachableFrom(ENTRY);
        var result = new ArrayList<Integer>();

        for (var node : nodes) {
            if (!visited.contains(node.id())) {
                result.add(node.id());
            }
        }
        return result;
    }

    public boolean hasPath(int from, int to) {
        return reachableFrom(from).contains(to);
    }

    private Set<Integer> reachableFrom(int start) {
        var visited = new HashSet<Integer>();
        var stack = new ArrayDeque<Integer>();
        stack.push(start);

        while (!stack.isEmpty()) {
            int node = stack.pop();
            if (visited.add(node)) {
                for (int successor : successors(node)) {
                    if (!visited.contains(successor)) {
                        stack.push(successor);
                    }
                }
            }
        }
        return visited;
    }

    // === Export ===

    /**
     * Graphviz rendering.
     */
    public String toDot() {
        var dot = new StringBuilder("digraph CFG {\n");
        dot.append("    node [shape=box];\n");

        for (var node : nodes) {
            var shape = switch (node.kind()) {
                case ENTRY, EXIT -> "ellipse";
                case BRANCH, LOOP_HEADER -> "diamond";
                default -> "box";
            };
            dot.append("    n").append(node.id())
               .append(" [label=\"").append(node.label()).append("\" shape=").append(shape).append("];\n");
        }
        for (var edge : edges) {
            var style = switch (edge.kind()) {
                case TRUE_BRANCH -> "label=\"T\" color=green";
                case FALSE_BRANCH -> "label=\"F\" color=red";
                case LOOP_BACK -> "style=dashed color=blue";
                case RETURN -> "color=purple";
                case JUMP -> "style=dotted";
                default -> "";
            };
            dot.append("    n").append(edge.from()).append(" -> n").append(edge.to())
               .append(" [").append(style).append("];\n");
        }
        dot.append("}\n");
        return dot.toString();
    }
}
