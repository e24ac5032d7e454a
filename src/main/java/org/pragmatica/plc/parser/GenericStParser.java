package org.pragmatica.plc.parser;

import org.pragmatica.plc.ast.CompilationUnit;
import org.pragmatica.plc.lexer.Dialect;
import org.pragmatica.plc.lexer.Token;

import java.util.List;

/**
 * IEC 61131-3 Structured Text, third edition, with classes, interfaces and namespaces.
 */
public final class GenericStParser extends StParser {

    GenericStParser(String source, List<Token> tokens, ParserConfig config) {
        super(source, tokens, config);
    }

    @Override
    public Dialect dialect() {
        return Dialect.GENERIC;
    }

    public static ParseResult<CompilationUnit> parse(String source) {
        return parse(source, ParserLimits.DEFAULT);
    }

    public static ParseResult<CompilationUnit> parse(String source, ParserLimits limits) {
        return StructuredTextParser.create(Dialect.GENERIC, limits).parse(source);
    }

    public static ParseResultWithErrors<CompilationUnit> parseRecovering(String source) {
        return parseRecovering(source, ParserLimits.DEFAULT);
    }

    public static ParseResultWithErrors<CompilationUnit> parseRecovering(String source, ParserLimits limits) {
        return StructuredTextParser.create(Dialect.GENERIC, limits).parseRecovering(source);
    }
}
