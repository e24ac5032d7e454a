package org.pragmatica.plc.parser;

/**
 * Resource limits enforced while lexing and parsing untrusted input.
 *
 * @param maxInputSize      maximum source length
 * @param maxIterations     maximum iterations of any single scanning or parsing loop
 * @param maxDepth          maximum nesting of blocks and expressions
 * @param maxCollectionSize maximum size of one statement, declaration or argument list
 * @param maxNodes          maximum number of AST nodes
 * @param maxStringLength   maximum length of a string literal
 */
public record ParserLimits(long maxInputSize,
                           long maxIterations,
                           int maxDepth,
                           int maxCollectionSize,
                           long maxNodes,
                           int maxStringLength) {

    private static final long KB = 1024;
    private static final long MB = 1024 * KB;

    public static final ParserLimits DEFAULT = balanced();

    public ParserLimits {
        if (maxInputSize <= 0 || maxIterations <= 0 || maxDepth <= 0
            || maxCollectionSize <= 0 || maxNodes <= 0 || maxStringLength <= 0) {
            throw new IllegalArgumentException("Parser limits must be positive");
        }
    }

    public static ParserLimits strict() {
        return new ParserLimits(10 * MB, 100_000, 64, 10_000, 1_000_000, (int) (64 * KB));
    }

    public static ParserLimits balanced() {
        return new ParserLimits(100 * MB, 1_000_000, 256, 100_000, 10_000_000, (int) MB);
    }

    public static ParserLimits relaxed() {
        return new ParserLimits(1024 * MB, 10_000_000, 512, 1_000_000, 100_000_000, (int) (10 * MB));
    }

    public ParserLimits withMaxInputSize(long value) {
        return new ParserLimits(value, maxIterations, maxDepth, maxCollectionSize, maxNodes, maxStringLength);
    }

    public ParserLimits withMaxIterations(long value) {
        return new ParserLimits(maxInputSize, value, maxDepth, maxCollectionSize, maxNodes, maxStringLength);
    }

    public ParserLimits withMaxDepth(int value) {
        return new ParserLimits(maxInputSize, maxIterations, value, maxCollectionSize, maxNodes, maxStringLength);
    }

    public ParserLimits withMaxCollectionSize(int value) {
        return new ParserLimits(maxInputSize, maxIterations, maxDepth, value, maxNodes, maxStringLength);
    }

    public ParserLimits withMaxNodes(long value) {
        return new ParserLimits(maxInputSize, maxIterations, maxDepth, maxCollectionSize, value, maxStringLength);
    }

    public ParserLimits withMaxStringLength(int value) {
        return new ParserLimits(maxInputSize, maxIterations, maxDepth, maxCollectionSize, maxNodes, value);
    }
}
