package org.pragmatica.plc.error;

/**
 * A parser resource limit that was exceeded. Each variant carries the measured value and the configured limit.
 */
public sealed interface SecurityError {

    long measured();

    long limit();

    String message();

    record InputTooLarge(long measured, long limit) implements SecurityError {
        @Override
        public String message() {
            return "input size " + measured + " bytes exceeds limit of " + limit;
        }
    }

    record TooManyIterations(long measured, long limit) implements SecurityError {
        @Override
        public String message() {
            return "iteration count " + measured + " exceeds limit of " + limit;
        }
    }

    record DepthExceeded(long measured, long limit) implements SecurityError {
        @Override
        public String message() {
            return "nesting depth " + measured + " exceeds limit of " + limit;
        }
    }

    record CollectionTooLarge(long measured, long limit) implements SecurityError {
        @Override
        public String message() {
            return "collection size " + measured + " exceeds limit of " + limit;
        }
    }

    record TooManyNodes(long measured, long limit) implements SecurityError {
        @Override
        public String message() {
            return "AST node count " + measured + " exceeds limit of " + limit;
        }
    }

    record StringTooLong(long measured, long limit) implements SecurityError {
        @Override
        public String message() {
            return "string length " + measured + " exceeds limit of " + limit;
        }
    }
}
