package org.pragmatica.plc.parser;

import org.pragmatica.plc.error.ParseError;
import org.pragmatica.plc.error.ParseException;
import org.pragmatica.plc.error.SecurityError;
import org.pragmatica.plc.tree.SourceSpan;
import org.pragmatica.plc.tree.Utf8Offsets;

/**
 * Mutable counters checked against {@link ParserLimits} during one parse.
 * Every check throws {@link ParseException} carrying a {@link ParseError.SecurityLimit} when a limit is exceeded.
 */
public final class ParserState {
    private final ParserLimits limits;
    private int depth;
    private long iterations;
    private long nodes;

    private ParserState(ParserLimits limits) {
        this.limits = limits;
    }

    public static ParserState create(ParserLimits limits) {
        return new ParserState(limits);
    }

    public ParserLimits limits() {
        return limits;
    }

    // === Depth ===

    public void enter(SourceSpan at) {
        depth++;
        if (depth > limits.maxDepth()) {
            throw violation(at, new SecurityError.DepthExceeded(depth, limits.maxDepth()));
        }
    }

    public void exit() {
        if (depth > 0) {
            depth--;
        }
    }

    public int depth() {
        return depth;
    }

    // === Counters ===

    public void tick(SourceSpan at) {
        iterations++;
        if (iterations > limits.maxIterations()) {
            throw violation(at, new SecurityError.TooManyIterations(iterations, limits.maxIterations()));
        }
    }

    public void node(SourceSpan at) {
        nodes++;
        if (nodes > limits.maxNodes()) {
            throw violation(at, new SecurityError.TooManyNodes(nodes, limits.maxNodes()));
        }
    }

    public long nodeCount() {
        return nodes;
    }

    public long iterationCount() {
        return iterations;
    }

    // === Sizes ===

    public void checkCollection(int size, SourceSpan at) {
        if (size > limits.maxCollectionSize()) {
            throw violation(at, new SecurityError.CollectionTooLarge(size, limits.maxCollectionSize()));
        }
    }

    public void checkString(int length, SourceSpan at) {
        if (length > limits.maxStringLength()) {
            throw violation(at, new SecurityError.StringTooLong(length, limits.maxStringLength()));
        }
    }

    public static void checkInput(String input, ParserLimits limits) {
        int size = Utf8Offsets.byteLength(input);
        if (size > limits.maxInputSize()) {
            throw violation(SourceSpan.at(0), new SecurityError.InputTooLarge(size, limits.maxInputSize()));
        }
    }

    private static ParseException violation(SourceSpan at, SecurityError error) {
        return new ParseException(new ParseError.SecurityLimit(at, error));
    }
}
