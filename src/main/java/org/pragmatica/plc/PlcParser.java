package org.pragmatica.plc;

import org.pragmatica.plc.ast.CompilationUnit;
import org.pragmatica.plc.ast.Statement;
import org.pragmatica.plc.error.RecoveryStrategy;
import org.pragmatica.plc.lexer.Dialect;
import org.pragmatica.plc.parser.ParseResult;
import org.pragmatica.plc.parser.ParseResultWithErrors;
import org.pragmatica.plc.parser.ParserConfig;
import org.pragmatica.plc.parser.ParserLimits;
import org.pragmatica.plc.parser.StructuredTextParser;
import org.pragmatica.plc.rll.RllParser;
import org.pragmatica.plc.rll.Rung;

import java.util.List;

/**
 * Entry point for parsing PLC source.
 *
 * <p>Example usage:
 * <pre>{@code
 * var unit = PlcParser.parse(Dialect.SCL, source).unwrap();
 *
 * var parser = PlcParser.builder(Dialect.ROCKWELL)
 *                       .limits(ParserLimits.strict())
 *                       .recovery(RecoveryStrategy.SYNCHRONIZE)
 *                       .build();
 * var result = parser.parseCollecting(source);
 * }</pre>
 */
public final class PlcParser {
    private PlcParser() {}

    /**
     * Parser for one dialect with default limits.
     */
    public static StructuredTextParser forDialect(Dialect dialect) {
        return StructuredTextParser.create(dialect);
    }

    public static ParseResult<CompilationUnit> parse(Dialect dialect, String source) {
        return forDialect(dialect).parse(source);
    }

    public static ParseResultWithErrors<CompilationUnit> parseRecovering(Dialect dialect, String source) {
        return forDialect(dialect).parseRecovering(source);
    }

    /**
     * Parse a routine body that has no POU wrapper.
     */
    public static ParseResult<List<Statement>> parseStatements(Dialect dialect, String source) {
        return forDialect(dialect).parseStatements(source);
    }

    /**
     * Parse one ladder rung in its text form.
     */
    public static Rung parseRung(String text) {
        return RllParser.parseRung(text);
    }

    /**
     * Create a builder for more complex parser configuration.
     */
    public static Builder builder(Dialect dialect) {
        return new Builder(dialect);
    }

    public static final class Builder {
        private final Dialect dialect;
        private ParserLimits limits = ParserLimits.DEFAULT;
        private RecoveryStrategy recoveryStrategy = RecoveryStrategy.NONE;

        private Builder(Dialect dialect) {
            this.dialect = dialect;
        }

        public Builder limits(ParserLimits limits) {
            this.limits = limits;
            return this;
        }

        public Builder recovery(RecoveryStrategy strategy) {
            this.recoveryStrategy = strategy;
            return this;
        }

        public StructuredTextParser build() {
            return StructuredTextParser.create(dialect, new ParserConfig(limits, recoveryStrategy));
        }
    }
}
