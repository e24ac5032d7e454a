package org.pragmatica.plc.parser;

import org.pragmatica.plc.ast.CompilationUnit;
import org.pragmatica.plc.ast.Statement;
import org.pragmatica.plc.lexer.Dialect;
import org.pragmatica.plc.lexer.Token;

import java.util.List;

/**
 * Rockwell Logix Structured Text. Routines are usually bare statement lists, so the statement entry points are
 * the common ones; empty call arguments ({@code TON(Timer,,)}) are accepted as inferred.
 */
public final class RockwellStParser extends StParser {

    RockwellStParser(String source, List<Token> tokens, ParserConfig config) {
        super(source, tokens, config);
    }

    @Override
    public Dialect dialect() {
        return Dialect.ROCKWELL;
    }

    @Override
    protected boolean allowsInferredArguments() {
        return true;
    }

    public static ParseResult<CompilationUnit> parse(String source) {
        return parse(source, ParserLimits.DEFAULT);
    }

    public static ParseResult<CompilationUnit> parse(String source, ParserLimits limits) {
        return StructuredTextParser.create(Dialect.ROCKWELL, limits).parse(source);
    }

    public static ParseResultWithErrors<CompilationUnit> parseRecovering(String source) {
        return StructuredTextParser.create(Dialect.ROCKWELL, ParserLimits.DEFAULT).parseRecovering(source);
    }

    public static ParseResult<List<Statement>> parseStatements(String source) {
        return parseStatements(source, ParserLimits.DEFAULT);
    }

    public static ParseResult<List<Statement>> parseStatements(String source, ParserLimits limits) {
        return StructuredTextParser.create(Dialect.ROCKWELL, limits).parseStatements(source);
    }

    public static ParseResultWithErrors<List<Statement>> parseStatementsRecovering(String source) {
        return StructuredTextParser.create(Dialect.ROCKWELL, ParserLimits.DEFAULT).parseStatementsRecovering(source);
    }
}
