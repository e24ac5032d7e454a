package org.pragmatica.plc.parser;

import org.pragmatica.plc.error.RecoveryStrategy;

/**
 * Configuration for a Structured Text parser.
 */
public record ParserConfig(ParserLimits limits, RecoveryStrategy recoveryStrategy) {

    public static final ParserConfig DEFAULT = new ParserConfig(ParserLimits.DEFAULT, RecoveryStrategy.NONE);

    public static ParserConfig withLimits(ParserLimits limits) {
        return new ParserConfig(limits, RecoveryStrategy.NONE);
    }

    public ParserConfig recovering() {
        return new ParserConfig(limits, RecoveryStrategy.SYNCHRONIZE);
    }

    public boolean isRecovering() {
        return recoveryStrategy == RecoveryStrategy.SYNCHRONIZE;
    }
}
