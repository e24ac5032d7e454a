package org.pragmatica.plc.error;

/**
 * How the parser reacts to a syntax error.
 */
public enum RecoveryStrategy {
    /**
     * Stop at the first error and return it.
     */
    NONE,

    /**
     * Record the error, skip to the next statement or declaration boundary and continue.
     * Security-limit errors still abort.
     */
    SYNCHRONIZE
}
