package org.pragmatica.plc.parser;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.plc.ast.CompilationUnit;
import org.pragmatica.plc.ast.Statement;
import org.pragmatica.plc.error.ParseError;
import org.pragmatica.plc.error.ParseException;
import org.pragmatica.plc.lexer.Dialect;
import org.pragmatica.plc.tree.SourceSpan;
import org.pragmatica.plc.tree.Utf8Offsets;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Lexes and parses Structured Text in one dialect.
 *
 * <p>Instances are immutable and may be shared; every call creates its own lexer and parser.
 */
public final class StructuredTextParser {
    private static final Logger logger = LogManager.getLogger(StructuredTextParser.class);

    private final Dialect dialect;
    private final ParserConfig config;

    private StructuredTextParser(Dialect dialect, ParserConfig config) {
        this.dialect = dialect;
        this.config = config;
    }

    public static StructuredTextParser create(Dialect dialect) {
        return new StructuredTextParser(dialect, ParserConfig.DEFAULT);
    }

    public static StructuredTextParser create(Dialect dialect, ParserLimits limits) {
        return new StructuredTextParser(dialect, ParserConfig.withLimits(limits));
    }

    public static StructuredTextParser create(Dialect dialect, ParserConfig config) {
        return new StructuredTextParser(dialect, config);
    }

    public Dialect dialect() {
        return dialect;
    }

    public ParserConfig config() {
        return config;
    }

    public ParserLimits limits() {
        return config.limits();
    }

    /**
     * Parse a source file, stopping at the first error.
     */
    public ParseResult<CompilationUnit> parse(String source) {
        return parseStrict(source, StParser::parseCompilationUnit);
    }

    /**
     * Parse a source file, collecting errors and continuing after each one.
     */
    public ParseResultWithErrors<CompilationUnit> parseRecovering(String source) {
        return parseWithRecovery(source, StParser::parseCompilationUnit,
                                 () -> emptyUnit(source));
    }

    /**
     * Parse a bare statement list, such as a routine body, stopping at the first error.
     */
    public ParseResult<List<Statement>> parseStatements(String source) {
        return parseStrict(source, StParser::parseStatementBody);
    }

    public ParseResultWithErrors<List<Statement>> parseStatementsRecovering(String source) {
        return parseWithRecovery(source, StParser::parseStatementBody, List::of);
    }

    /**
     * Parse a source file using the configured recovery strategy. Without recovery the result carries at most
     * one error and an empty unit on failure.
     */
    public ParseResultWithErrors<CompilationUnit> parseCollecting(String source) {
        if (config.isRecovering()) {
            return parseRecovering(source);
        }
        return parse(source).<ParseResultWithErrors<CompilationUnit>>fold(
            error -> new ParseResultWithErrors<>(emptyUnit(source), List.of(error), source),
            unit -> ParseResultWithErrors.success(unit, source));
    }

    private <T> ParseResult<T> parseStrict(String source, Function<StParser, T> production) {
        try {
            var parser = newParser(source, ParserConfig.withLimits(config.limits()));
            var value = production.apply(parser);
            logger.debug("Parsed {} characters of {} into {} nodes", source.length(), dialect.displayName(),
                         parser.nodeCount());
            return ParseResult.success(value);
        } catch (ParseException e) {
            logFailure(e.error());
            return ParseResult.failure(e.error());
        }
    }

    private <T> ParseResultWithErrors<T> parseWithRecovery(String source,
                                                           Function<StParser, T> production,
                                                           Supplier<T> fallback) {
        StParser parser = null;
        try {
            parser = newParser(source, ParserConfig.withLimits(config.limits()).recovering());
            var value = production.apply(parser);
            var errors = parser.errors();
            if (!errors.isEmpty()) {
                logger.debug("Recovered from {} errors in {} input", errors.size(), dialect.displayName());
            }
            return new ParseResultWithErrors<>(value, errors, source);
        } catch (ParseException e) {
            logFailure(e.error());
            var errors = new ArrayList<ParseError>();
            if (parser != null) {
                errors.addAll(parser.errors());
            }
            errors.add(e.error());
            return new ParseResultWithErrors<>(fallback.get(), errors, source);
        }
    }

    private StParser newParser(String source, ParserConfig config) {
        ParserState.checkInput(source, config.limits());
        var tokens = dialect.lexer(source, config.limits()).tokenizeAll();

        return switch (dialect) {
            case GENERIC -> new GenericStParser(source, tokens, config);
            case SCL -> new SclParser(source, tokens, config);
            case ROCKWELL -> new RockwellStParser(source, tokens, config);
        };
    }

    private void logFailure(ParseError error) {
        if (error.isFatal()) {
            logger.warn("{} parse aborted: {}", dialect.displayName(), error.message());
        } else {
            logger.debug("{} parse failed at {}: {}", dialect.displayName(), error.span(), error.message());
        }
    }

    private static CompilationUnit emptyUnit(String source) {
        return new CompilationUnit(SourceSpan.of(0, Utf8Offsets.byteLength(source)), List.of());
    }
}
