package org.pragmatica.plc.analysis.cfg;

public record CfgEdge(int from, int to, EdgeKind kind) {}
