package org.pragmatica.plc.parser;

import org.pragmatica.plc.ast.CompilationUnit;
import org.pragmatica.plc.ast.PouDeclaration;
import org.pragmatica.plc.ast.Pragma;
import org.pragmatica.plc.ast.Retain;
import org.pragmatica.plc.ast.Statement;
import org.pragmatica.plc.ast.TypeSpec;
import org.pragmatica.plc.ast.VarBlock;
import org.pragmatica.plc.ast.VarClass;
import org.pragmatica.plc.lexer.Dialect;
import org.pragmatica.plc.lexer.Keyword;
import org.pragmatica.plc.lexer.Symbol;
import org.pragmatica.plc.lexer.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Siemens SCL as exported by TIA Portal.
 *
 * <p>Adds data blocks, organization blocks, {@code REGION}, {@code GOTO} and jump labels, skips block
 * attributes such as {@code VERSION : 0.1}, and requires {@code ;} after {@code END_IF} and friends.
 */
public final class SclParser extends StParser {
    private static final Set<String> BLOCK_ATTRIBUTES = Set.of(
        "TITLE", "AUTHOR", "FAMILY", "NAME", "VERSION", "KNOW_HOW_PROTECT", "CODE_VERSION1", "UNLINKED",
        "READ_ONLY");

    SclParser(String source, List<Token> tokens, ParserConfig config) {
        super(source, tokens, config);
    }

    @Override
    public Dialect dialect() {
        return Dialect.SCL;
    }

    public static ParseResult<CompilationUnit> parse(String source) {
        return parse(source, ParserLimits.DEFAULT);
    }

    public static ParseResult<CompilationUnit> parse(String source, ParserLimits limits) {
        return StructuredTextParser.create(Dialect.SCL, limits).parse(source);
    }

    public static ParseResultWithErrors<CompilationUnit> parseRecovering(String source) {
        return parseRecovering(source, ParserLimits.DEFAULT);
    }

    public static ParseResultWithErrors<CompilationUnit> parseRecovering(String source, ParserLimits limits) {
        return StructuredTextParser.create(Dialect.SCL, limits).parseRecovering(source);
    }

    // === Hooks ===

    @Override
    protected boolean requiresSemicolonAfterBlockEnd() {
        return true;
    }

    @Override
    protected boolean skipBlockAttribute() {
        if (!(peek() instanceof Token.Identifier identifier) || identifier.quoted()
            || !BLOCK_ATTRIBUTES.contains(identifier.name().toUpperCase(Locale.ROOT))) {
            return false;
        }
        var next = peekAt(1);
        if (next.is(Symbol.COLON) && peekAt(2).is(Keyword.STRUCT)) {
            return false;
        }
        skip();
        if (next.is(Symbol.EQ) || next.is(Symbol.COLON)) {
            skip();
            skip();
        }
        return true;
    }

    @Override
    protected PouDeclaration parseDialectDeclaration(List<Pragma> pragmas) {
        if (check(Keyword.DATA_BLOCK)) {
            return parseDataBlock(pragmas);
        }
        if (check(Keyword.ORGANIZATION_BLOCK)) {
            return parseOrganizationBlock(pragmas);
        }
        return null;
    }

    @Override
    protected Statement parseDialectStatement() {
        var token = current();

        if (token.is(Keyword.REGION)) {
            return parseRegion();
        }
        if (token.is(Keyword.GOTO)) {
            advance();
            var label = expectName();
            expectTerminator();
            var span = spanFrom(token.span());
            return node(new Statement.Goto(span, label), span);
        }
        if (token instanceof Token.Identifier identifier && !identifier.local() && peekAt(1).is(Symbol.COLON)) {
            advance();
            advance();
            var span = spanFrom(token.span());
            return node(new Statement.Label(span, identifier.name()), span);
        }
        return null;
    }

    // === Blocks ===

    private PouDeclaration parseDataBlock(List<Pragma> pragmas) {
        var start = expect(Keyword.DATA_BLOCK).span();
        var name = expectName();
        parseHeaderExtras(pragmas);
        while (accept(Keyword.NON_RETAIN) || accept(Keyword.RETAIN)) {
            parseHeaderExtras(pragmas);
        }

        Optional<String> instanceOf = Optional.empty();
        var varBlocks = new ArrayList<VarBlock>();

        if (peek() instanceof Token.Identifier) {
            instanceOf = Optional.of(expectName());
        } else if (check(Keyword.STRUCT)) {
            var structStart = current().span();
            var struct = (TypeSpec.StructType) parseTypeSpec();
            accept(Symbol.SEMICOLON);
            var span = spanFrom(structStart);
            varBlocks.add(node(new VarBlock(span, VarClass.LOCAL, false, Retain.NONE, struct.fields()), span));
        }
        varBlocks.addAll(parseVarBlocks());
        accept(Keyword.BEGIN);
        var body = parseStatementList();
        expectPouEnd(Keyword.END_DATA_BLOCK);

        var span = spanFrom(start);
        return node(new PouDeclaration.DataBlock(span, name, instanceOf, varBlocks, body, pragmas), span);
    }

    private PouDeclaration parseOrganizationBlock(List<Pragma> pragmas) {
        var start = expect(Keyword.ORGANIZATION_BLOCK).span();
        var name = expectName();
        parseHeaderExtras(pragmas);
        var varBlocks = parseVarBlocks();
        accept(Keyword.BEGIN);
        var body = parseStatementList();
        expectPouEnd(Keyword.END_ORGANIZATION_BLOCK);

        var span = spanFrom(start);
        return node(new PouDeclaration.OrganizationBlock(span, name, varBlocks, body, pragmas), span);
    }

    /**
     * The region name is the raw rest of the {@code REGION} line.
     */
    private Statement parseRegion() {
        var start = expect(Keyword.REGION).span();
        int nameStart = offsets.charIndex(start.end());
        int lineEnd = source.indexOf('\n', nameStart);
        if (lineEnd < 0) {
            lineEnd = source.length();
        }
        var name = source.substring(nameStart, lineEnd).trim();
        int lineEndOffset = offsets.byteOffset(lineEnd);

        while (!isAtEnd() && peek().span().start() < lineEndOffset) {
            skip();
        }
        var body = parseStatementList();
        expect(Keyword.END_REGION);
        accept(Symbol.SEMICOLON);

        var span = spanFrom(start);
        return node(new Statement.Region(span, name, body), span);
    }
}
