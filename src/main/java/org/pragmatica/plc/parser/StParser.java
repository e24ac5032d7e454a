package org.pragmatica.plc.parser;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.plc.ast.AccessModifier;
import org.pragmatica.plc.ast.Argument;
import org.pragmatica.plc.ast.AssignOp;
import org.pragmatica.plc.ast.BinaryOp;
import org.pragmatica.plc.ast.CaseLabel;
import org.pragmatica.plc.ast.CompilationUnit;
import org.pragmatica.plc.ast.DirectAddress;
import org.pragmatica.plc.ast.Expression;
import org.pragmatica.plc.ast.PouDeclaration;
import org.pragmatica.plc.ast.Pragma;
import org.pragmatica.plc.ast.Retain;
import org.pragmatica.plc.ast.Statement;
import org.pragmatica.plc.ast.TypeDeclaration;
import org.pragmatica.plc.ast.TypeSpec;
import org.pragmatica.plc.ast.UnaryOp;
import org.pragmatica.plc.ast.VarBlock;
import org.pragmatica.plc.ast.VarClass;
import org.pragmatica.plc.ast.VarDecl;
import org.pragmatica.plc.ast.Variable;
import org.pragmatica.plc.error.ParseError;
import org.pragmatica.plc.error.ParseException;
import org.pragmatica.plc.lexer.Dialect;
import org.pragmatica.plc.lexer.Keyword;
import org.pragmatica.plc.lexer.Symbol;
import org.pragmatica.plc.lexer.Token;
import org.pragmatica.plc.tree.SourceSpan;
import org.pragmatica.plc.tree.Utf8Offsets;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Recursive-descent parser for Structured Text with a Pratt-style expression engine.
 *
 * <p>One instance parses one token stream. Dialect parsers extend this class and override the hooks in the
 * "Dialect hooks" section; the AST they produce has the same shape for every dialect.
 *
 * <p>Errors unwind as {@link ParseException}. In recovering mode statement lists, variable sections and the
 * top level catch them, record the error, skip to the next synchronization point and continue.
 * Security-limit errors are never recovered.
 */
public abstract class StParser {
    private static final Logger logger = LogManager.getLogger(StParser.class);

    private static final int PREC_OR = 1;
    private static final int PREC_XOR = 2;
    private static final int PREC_AND = 3;
    private static final int PREC_COMPARISON = 4;
    private static final int PREC_ADDITIVE = 5;
    private static final int PREC_MULTIPLICATIVE = 6;
    private static final int PREC_POWER = 7;

    private static final Set<Keyword> STATEMENT_STARTS = EnumSet.of(
        Keyword.IF, Keyword.CASE, Keyword.FOR, Keyword.WHILE, Keyword.REPEAT,
        Keyword.RETURN, Keyword.EXIT, Keyword.CONTINUE, Keyword.REGION, Keyword.GOTO);

    private static final Set<Keyword> DECLARATION_STARTS = EnumSet.of(
        Keyword.FUNCTION, Keyword.FUNCTION_BLOCK, Keyword.PROGRAM, Keyword.CLASS, Keyword.INTERFACE,
        Keyword.METHOD, Keyword.TYPE, Keyword.VAR_GLOBAL, Keyword.NAMESPACE,
        Keyword.DATA_BLOCK, Keyword.ORGANIZATION_BLOCK);

    private static final Set<Keyword> VAR_SECTIONS = EnumSet.of(
        Keyword.VAR, Keyword.VAR_INPUT, Keyword.VAR_OUTPUT, Keyword.VAR_IN_OUT, Keyword.VAR_TEMP,
        Keyword.VAR_GLOBAL, Keyword.VAR_EXTERNAL, Keyword.VAR_ACCESS, Keyword.VAR_CONFIG, Keyword.VAR_STAT);

    protected final String source;
    protected final Utf8Offsets offsets;
    private final List<Token> tokens;
    private final ParserState state;
    private final boolean recovering;
    private final List<ParseError> errors = new ArrayList<>();
    private int pos;

    protected StParser(String source, List<Token> tokens, ParserConfig config) {
        this.source = source;
        this.offsets = Utf8Offsets.of(source);
        this.tokens = tokens;
        this.state = ParserState.create(config.limits());
        this.recovering = config.isRecovering();
        this.pos = 0;
    }

    public abstract Dialect dialect();

    /**
     * Errors recorded in recovering mode.
     */
    public List<ParseError> errors() {
        return List.copyOf(errors);
    }

    public long nodeCount() {
        return state.nodeCount();
    }

    // === Dialect hooks ===

    /**
     * Parse a declaration only this dialect has, or return {@code null}.
     */
    protected PouDeclaration parseDialectDeclaration(List<Pragma> pragmas) {
        return null;
    }

    /**
     * Parse a statement only this dialect has, or return {@code null}.
     */
    protected Statement parseDialectStatement() {
        return null;
    }

    /**
     * Skip one vendor block attribute (e.g. {@code TITLE = 'Main'}) at the current position.
     */
    protected boolean skipBlockAttribute() {
        return false;
    }

    /**
     * Whether a comma with nothing before it is an inferred argument.
     */
    protected boolean allowsInferredArguments() {
        return false;
    }

    /**
     * Whether {@code END_IF}, {@code END_CASE} and the other statement ends must be followed by {@code ;}.
     */
    protected boolean requiresSemicolonAfterBlockEnd() {
        return false;
    }

    // === Entry points ===

    public CompilationUnit parseCompilationUnit() {
        var declarations = new ArrayList<PouDeclaration>();

        while (!isAtEnd()) {
            state.tick(peek().span());
            int start = pos;
            try {
                declarations.add(parseDeclaration());
            } catch (ParseException e) {
                recover(e);
                synchronizeDeclaration(start);
            }
            state.checkCollection(declarations.size(), peek().span());
        }
        return new CompilationUnit(SourceSpan.of(0, offsets.byteLength()), declarations);
    }

    /**
     * Parse a bare statement list such as a vendor routine body.
     */
    public List<Statement> parseStatementBody() {
        var statements = new ArrayList<Statement>();

        while (true) {
            statements.addAll(parseStatementList());
            if (isAtEnd()) {
                return statements;
            }
            var stray = peek();
            recover(new ParseException(new ParseError.InvalidStatement(stray.span(), "unexpected " + stray.describe())));
            pos++;
        }
    }

    // === Declarations ===

    protected PouDeclaration parseDeclaration() {
        state.enter(current().span());
        try {
            return parseDeclarationBody();
        } finally {
            state.exit();
        }
    }

    private PouDeclaration parseDeclarationBody() {
        var pragmas = collectPragmas();
        var dialectDeclaration = parseDialectDeclaration(pragmas);

        if (dialectDeclaration != null) {
            return dialectDeclaration;
        }
        var token = current();
        if (token instanceof Token.Reserved reserved) {
            switch (reserved.keyword()) {
                case FUNCTION:
                    return parseFunction(pragmas);
                case FUNCTION_BLOCK:
                    return parseFunctionBlock(pragmas);
                case PROGRAM:
                    return parseProgram();
                case CLASS:
                    return parseClass();
                case INTERFACE:
                    return parseInterface();
                case METHOD:
                    return parseMethod(false);
                case TYPE:
                    return parseTypeBlock();
                case VAR_GLOBAL:
                    return parseGlobalVars();
                case NAMESPACE:
                    return parseNamespace();
                default:
                    break;
            }
        }
        throw unexpected("declaration");
    }

    private PouDeclaration parseFunction(List<Pragma> pragmas) {
        var start = expect(Keyword.FUNCTION).span();
        var name = expectName();
        Optional<TypeSpec> returnType = accept(Symbol.COLON) ? Optional.of(parseTypeSpec()) : Optional.empty();
        parseHeaderExtras(pragmas);
        var varBlocks = parseVarBlocks();
        accept(Keyword.BEGIN);
        var body = parseStatementList();
        expectPouEnd(Keyword.END_FUNCTION);

        var span = spanFrom(start);
        return node(new PouDeclaration.Function(span, name, returnType, varBlocks, body, pragmas), span);
    }

    private PouDeclaration parseFunctionBlock(List<Pragma> pragmas) {
        var start = expect(Keyword.FUNCTION_BLOCK).span();
        boolean isFinal = false;
        boolean isAbstract = false;

        while (true) {
            if (accept(Keyword.FINAL)) {
                isFinal = true;
            } else if (accept(Keyword.ABSTRACT)) {
                isAbstract = true;
            } else {
                break;
            }
        }
        var name = expectName();
        var extendsName = accept(Keyword.EXTENDS) ? Optional.of(dottedName()) : Optional.<String>empty();
        var implementsNames = accept(Keyword.IMPLEMENTS) ? dottedNameList() : List.<String>of();
        parseHeaderExtras(pragmas);

        var varBlocks = new ArrayList<VarBlock>();
        var methods = new ArrayList<PouDeclaration.Method>();
        parseMembers(varBlocks, methods);
        accept(Keyword.BEGIN);
        var body = parseStatementList();
        parseMembers(varBlocks, methods);
        expectPouEnd(Keyword.END_FUNCTION_BLOCK);

        var span = spanFrom(start);
        return node(new PouDeclaration.FunctionBlock(span, name, extendsName, implementsNames, isFinal, isAbstract,
                                                     varBlocks, methods, body, pragmas), span);
    }

    private PouDeclaration parseProgram() {
        var start = expect(Keyword.PROGRAM).span();
        var name = expectName();
        parseHeaderExtras(new ArrayList<>());
        var varBlocks = parseVarBlocks();
        accept(Keyword.BEGIN);
        var body = parseStatementList();
        expectPouEnd(Keyword.END_PROGRAM);

        var span = spanFrom(start);
        return node(new PouDeclaration.Program(span, name, varBlocks, body), span);
    }

    private PouDeclaration parseClass() {
        var start = expect(Keyword.CLASS).span();
        boolean isFinal = false;
        boolean isAbstract = false;

        while (true) {
            if (accept(Keyword.FINAL)) {
                isFinal = true;
            } else if (accept(Keyword.ABSTRACT)) {
                isAbstract = true;
            } else {
                break;
            }
        }
        var name = expectName();
        var extendsName = accept(Keyword.EXTENDS) ? Optional.of(dottedName()) : Optional.<String>empty();
        var implementsNames = accept(Keyword.IMPLEMENTS) ? dottedNameList() : List.<String>of();

        var varBlocks = new ArrayList<VarBlock>();
        var methods = new ArrayList<PouDeclaration.Method>();
        parseMembers(varBlocks, methods);
        expectPouEnd(Keyword.END_CLASS);

        var span = spanFrom(start);
        return node(new PouDeclaration.ClassType(span, name, extendsName, implementsNames, isFinal, isAbstract,
                                                 varBlocks, methods), span);
    }

    private PouDeclaration parseInterface() {
        var start = expect(Keyword.INTERFACE).span();
        var name = expectName();
        var extendsNames = accept(Keyword.EXTENDS) ? dottedNameList() : List.<String>of();
        var methods = new ArrayList<PouDeclaration.Method>();

        while (check(Keyword.METHOD)) {
            state.tick(peek().span());
            methods.add(parseMethod(true));
            state.checkCollection(methods.size(), peek().span());
        }
        expectPouEnd(Keyword.END_INTERFACE);

        var span = spanFrom(start);
        return node(new PouDeclaration.Interface(span, name, extendsNames, methods), span);
    }

    private PouDeclaration.Method parseMethod(boolean prototype) {
        var start = expect(Keyword.METHOD).span();
        var access = AccessModifier.PUBLIC;
        boolean isFinal = false;
        boolean isAbstract = prototype;
        boolean isOverride = false;

        while (true) {
            if (accept(Keyword.PUBLIC)) {
                access = AccessModifier.PUBLIC;
            } else if (accept(Keyword.PROTECTED)) {
                access = AccessModifier.PROTECTED;
            } else if (accept(Keyword.PRIVATE)) {
                access = AccessModifier.PRIVATE;
            } else if (accept(Keyword.INTERNAL)) {
                access = AccessModifier.INTERNAL;
            } else if (accept(Keyword.FINAL)) {
                isFinal = true;
            } else if (accept(Keyword.ABSTRACT)) {
                isAbstract = true;
            } else if (accept(Keyword.OVERRIDE)) {
                isOverride = true;
            } else {
                break;
            }
        }
        var name = expectName();
        Optional<TypeSpec> returnType = accept(Symbol.COLON) ? Optional.of(parseTypeSpec()) : Optional.empty();
        var varBlocks = parseVarBlocks();
        List<Statement> body = prototype ? List.of() : parseStatementList();
        expectPouEnd(Keyword.END_METHOD);

        var span = spanFrom(start);
        return node(new PouDeclaration.Method(span, name, access, returnType, isFinal, isAbstract, isOverride,
                                              varBlocks, body), span);
    }

    private PouDeclaration parseTypeBlock() {
        var start = expect(Keyword.TYPE).span();
        var types = new ArrayList<TypeDeclaration>();

        while (!check(Keyword.END_TYPE) && !isAtEnd()) {
            state.tick(peek().span());
            var typeStart = current().span();
            var name = expectName();
            parseHeaderExtras(new ArrayList<>());
            accept(Symbol.COLON);
            var type = parseTypeSpec();
            var initialValue = accept(Symbol.ASSIGN) ? Optional.of(parseInitialValue()) : Optional.<Expression>empty();
            accept(Symbol.SEMICOLON);

            var span = spanFrom(typeStart);
            types.add(node(new TypeDeclaration(span, name, type, initialValue), span));
            state.checkCollection(types.size(), span);
        }
        expectPouEnd(Keyword.END_TYPE);

        var span = spanFrom(start);
        return node(new PouDeclaration.DataType(span, types), span);
    }

    private PouDeclaration parseGlobalVars() {
        var block = parseVarBlock();
        return node(new PouDeclaration.GlobalVars(block.span(), block), block.span());
    }

    private PouDeclaration parseNamespace() {
        var start = expect(Keyword.NAMESPACE).span();
        boolean internal = accept(Keyword.INTERNAL);
        var name = dottedName();
        var usings = new ArrayList<String>();

        while (accept(Keyword.USING)) {
            usings.addAll(dottedNameList());
            expectTerminator();
        }
        var elements = new ArrayList<PouDeclaration>();
        while (!check(Keyword.END_NAMESPACE) && !isAtEnd()) {
            state.tick(peek().span());
            elements.add(parseDeclaration());
            state.checkCollection(elements.size(), peek().span());
        }
        expectPouEnd(Keyword.END_NAMESPACE);

        var span = spanFrom(start);
        return node(new PouDeclaration.Namespace(span, name, internal, usings, elements), span);
    }

    /**
     * Variable sections and methods of a function block or class, in any order.
     */
    private void parseMembers(List<VarBlock> varBlocks, List<PouDeclaration.Method> methods) {
        while (true) {
            if (isVarSectionStart()) {
                varBlocks.add(parseVarBlock());
            } else if (check(Keyword.METHOD)) {
                methods.add(parseMethod(false));
            } else if (peek() instanceof Token.Pragma) {
                pos++;
            } else {
                return;
            }
            state.tick(peek().span());
        }
    }

    /**
     * Pragmas and vendor attributes between a block header and its variable sections.
     */
    protected void parseHeaderExtras(List<Pragma> pragmas) {
        while (true) {
            if (peek() instanceof Token.Pragma pragma) {
                pragmas.add(new Pragma(pragma.span(), pragma.content()));
                pos++;
            } else if (!skipBlockAttribute()) {
                return;
            }
        }
    }

    protected List<Pragma> collectPragmas() {
        var pragmas = new ArrayList<Pragma>();

        while (peek() instanceof Token.Pragma pragma) {
            pragmas.add(new Pragma(pragma.span(), pragma.content()));
            pos++;
        }
        return pragmas;
    }

    // === Variable sections ===

    protected List<VarBlock> parseVarBlocks() {
        var blocks = new ArrayList<VarBlock>();

        while (true) {
            if (isVarSectionStart()) {
                blocks.add(parseVarBlock());
            } else if (peek() instanceof Token.Pragma) {
                pos++;
            } else {
                return blocks;
            }
        }
    }

    protected boolean isVarSectionStart() {
        return peek() instanceof Token.Reserved reserved && VAR_SECTIONS.contains(reserved.keyword());
    }

    protected VarBlock parseVarBlock() {
        var token = advance();
        var start = token.span();
        var varClass = varClassOf(((Token.Reserved) token).keyword());
        boolean constant = false;
        var retain = Retain.NONE;

        while (true) {
            if (accept(Keyword.CONSTANT)) {
                constant = true;
            } else if (accept(Keyword.RETAIN)) {
                retain = Retain.RETAIN;
            } else if (accept(Keyword.NON_RETAIN)) {
                retain = Retain.NON_RETAIN;
            } else if (peek() instanceof Token.Pragma) {
                pos++;
            } else {
                break;
            }
        }
        var declarations = new ArrayList<VarDecl>();
        while (!check(Keyword.END_VAR) && !isAtEnd()) {
            state.tick(peek().span());
            int declarationStart = pos;
            try {
                declarations.addAll(parseVarDeclarations());
            } catch (ParseException e) {
                recover(e);
                synchronizeDeclarationItem(declarationStart);
            }
            state.checkCollection(declarations.size(), peek().span());
        }
        expect(Keyword.END_VAR);
        accept(Symbol.SEMICOLON);

        var span = spanFrom(start);
        return node(new VarBlock(span, varClass, constant, retain, declarations), span);
    }

    private static VarClass varClassOf(Keyword keyword) {
        return switch (keyword) {
            case VAR_INPUT -> VarClass.INPUT;
            case VAR_OUTPUT -> VarClass.OUTPUT;
            case VAR_IN_OUT -> VarClass.IN_OUT;
            case VAR_TEMP -> VarClass.TEMP;
            case VAR_GLOBAL -> VarClass.GLOBAL;
            case VAR_EXTERNAL -> VarClass.EXTERNAL;
            case VAR_ACCESS -> VarClass.ACCESS;
            case VAR_CONFIG -> VarClass.CONFIG;
            default -> VarClass.LOCAL;
        };
    }

    /**
     * {@code a, b AT %IX0.0 : BOOL := TRUE;} and struct fields.
     */
    protected List<VarDecl> parseVarDeclarations() {
        var pragmas = collectPragmas();
        var start = current().span();
        var names = new ArrayList<String>();

        names.add(expectName());
        pragmas.addAll(collectPragmas());
        while (accept(Symbol.COMMA)) {
            names.add(expectName());
            state.checkCollection(names.size(), previous().span());
        }
        Optional<DirectAddress> address = Optional.empty();
        if (accept(Keyword.AT)) {
            if (!(current() instanceof Token.Address addressToken)) {
                throw unexpected("direct address");
            }
            advance();
            address = Optional.of(addressToken.address());
        }
        expect(Symbol.COLON);
        var type = parseTypeSpec();
        var initialValue = accept(Symbol.ASSIGN) ? Optional.of(parseInitialValue()) : Optional.<Expression>empty();
        pragmas.addAll(collectPragmas());
        expectTerminator();

        var span = spanFrom(start);
        var declarations = new ArrayList<VarDecl>();
        for (var name : names) {
            declarations.add(node(new VarDecl(span, name, address, type, initialValue, pragmas), span));
        }
        return declarations;
    }

    // === Types ===

    protected TypeSpec parseTypeSpec() {
        var token = current();
        state.enter(token.span());
        try {
            if (token.is(Keyword.ARRAY)) {
                return parseArrayType();
            }
            if (token.is(Keyword.STRUCT)) {
                return parseStructType();
            }
            if (token.is(Keyword.REF_TO)) {
                advance();
                var target = parseTypeSpec();
                var span = spanFrom(token.span());
                return node(new TypeSpec.RefType(span, target), span);
            }
            if (token.is(Keyword.STRING) || token.is(Keyword.WSTRING)) {
                return parseStringType();
            }
            if (token instanceof Token.Reserved reserved && reserved.keyword().isTypeName()) {
                advance();
                TypeSpec base = node(new TypeSpec.Elementary(token.span(), reserved.text()), token.span());
                return check(Symbol.LPAREN) ? parseSubrangeOrEnum(base, token.span()) : base;
            }
            if (token instanceof Token.Identifier identifier) {
                advance();
                TypeSpec base = node(new TypeSpec.UserDefined(token.span(), identifier.name()), token.span());
                return check(Symbol.LPAREN) ? parseSubrangeOrEnum(base, token.span()) : base;
            }
            if (token.is(Symbol.LPAREN)) {
                return parseEnumValues(Optional.empty(), token.span());
            }
            throw unexpected("type");
        } finally {
            state.exit();
        }
    }

    private TypeSpec parseArrayType() {
        var start = expect(Keyword.ARRAY).span();
        expect(Symbol.LBRACKET);
        var ranges = new ArrayList<TypeSpec.Range>();

        do {
            var low = parseExpression();
            expect(Symbol.RANGE);
            var high = parseExpression();
            var rangeSpan = low.span().merge(high.span());
            ranges.add(node(new TypeSpec.Range(rangeSpan, low, high), rangeSpan));
            state.checkCollection(ranges.size(), rangeSpan);
        } while (accept(Symbol.COMMA));
        expectClosing(Symbol.RBRACKET, start);
        expect(Keyword.OF);
        var element = parseTypeSpec();

        var span = spanFrom(start);
        return node(new TypeSpec.ArrayType(span, ranges, element), span);
    }

    private TypeSpec parseStructType() {
        var start = expect(Keyword.STRUCT).span();
        var fields = new ArrayList<VarDecl>();

        while (!check(Keyword.END_STRUCT) && !isAtEnd()) {
            state.tick(peek().span());
            fields.addAll(parseVarDeclarations());
            state.checkCollection(fields.size(), peek().span());
        }
        expect(Keyword.END_STRUCT);

        var span = spanFrom(start);
        return node(new TypeSpec.StructType(span, fields), span);
    }

    private TypeSpec parseStringType() {
        var token = advance();
        boolean wide = token.is(Keyword.WSTRING);
        Optional<Expression> length = Optional.empty();

        if (accept(Symbol.LBRACKET)) {
            length = Optional.of(parseExpression());
            expectClosing(Symbol.RBRACKET, token.span());
        } else if (accept(Symbol.LPAREN)) {
            length = Optional.of(parseExpression());
            expectClosing(Symbol.RPAREN, token.span());
        }
        var span = spanFrom(token.span());
        return node(new TypeSpec.StringType(span, wide, length), span);
    }

    /**
     * {@code INT (0..100)} or {@code INT (Idle, Running)} after the base type name.
     */
    private TypeSpec parseSubrangeOrEnum(TypeSpec base, SourceSpan start) {
        var afterParen = peekAt(1);
        var next = peekAt(2);

        if (afterParen instanceof Token.Identifier && (next.is(Symbol.COMMA) || next.is(Symbol.RPAREN) || next.is(Symbol.ASSIGN))) {
            return parseEnumValues(Optional.of(base.displayName()), start);
        }
        expect(Symbol.LPAREN);
        var low = parseExpression();
        expect(Symbol.RANGE);
        var high = parseExpression();
        expectClosing(Symbol.RPAREN, start);

        var span = spanFrom(start);
        return node(new TypeSpec.SubrangeType(span, base, low, high), span);
    }

    private TypeSpec parseEnumValues(Optional<String> baseType, SourceSpan start) {
        var open = expect(Symbol.LPAREN).span();
        var values = new ArrayList<TypeSpec.EnumValue>();

        do {
            var valueStart = current().span();
            var name = expectName();
            var value = accept(Symbol.ASSIGN) ? Optional.of(parseExpression()) : Optional.<Expression>empty();
            var valueSpan = spanFrom(valueStart);
            values.add(node(new TypeSpec.EnumValue(valueSpan, name, value), valueSpan));
            state.checkCollection(values.size(), valueSpan);
        } while (accept(Symbol.COMMA));
        expectClosing(Symbol.RPAREN, open);

        var span = spanFrom(start);
        return node(new TypeSpec.EnumType(span, baseType, values), span);
    }

    // === Initial values ===

    protected Expression parseInitialValue() {
        state.enter(current().span());
        try {
            if (check(Symbol.LBRACKET)) {
                return parseArrayInitializer();
            }
            if (check(Symbol.LPAREN) && peekAt(1) instanceof Token.Identifier && peekAt(2).is(Symbol.ASSIGN)) {
                return parseStructInitializer();
            }
            return parseExpression();
        } finally {
            state.exit();
        }
    }

    private Expression parseArrayInitializer() {
        var start = expect(Symbol.LBRACKET).span();
        var elements = new ArrayList<Expression>();

        do {
            state.tick(peek().span());
            if (current() instanceof Token.IntLiteral && peekAt(1).is(Symbol.LPAREN)) {
                var count = parsePrimary();
                expect(Symbol.LPAREN);
                var value = parseInitialValue();
                expectClosing(Symbol.RPAREN, count.span());
                var span = spanFrom(count.span());
                elements.add(node(new Expression.Repeated(span, count, value), span));
            } else {
                elements.add(parseInitialValue());
            }
            state.checkCollection(elements.size(), peek().span());
        } while (accept(Symbol.COMMA));
        expectClosing(Symbol.RBRACKET, start);

        var span = spanFrom(start);
        return node(new Expression.ArrayInitializer(span, elements), span);
    }

    private Expression parseStructInitializer() {
        var start = expect(Symbol.LPAREN).span();
        var fields = new ArrayList<Argument.Named>();

        do {
            var fieldStart = current().span();
            var name = expectName();
            expect(Symbol.ASSIGN);
            var value = parseInitialValue();
            var fieldSpan = spanFrom(fieldStart);
            fields.add(node(new Argument.Named(fieldSpan, name, value), fieldSpan));
            state.checkCollection(fields.size(), fieldSpan);
        } while (accept(Symbol.COMMA));
        expectClosing(Symbol.RPAREN, start);

        var span = spanFrom(start);
        return node(new Expression.StructInitializer(span, fields), span);
    }

    // === Statements ===

    protected List<Statement> parseStatementList() {
        return parseStatementList(false);
    }

    private List<Statement> parseStatementList(boolean inCaseBranch) {
        var statements = new ArrayList<Statement>();

        while (!atStatementListEnd() && !(inCaseBranch && isCaseLabelStart())) {
            state.tick(peek().span());
            int start = pos;
            try {
                statements.add(parseStatement());
            } catch (ParseException e) {
                recover(e);
                synchronizeStatement(start);
            }
            state.checkCollection(statements.size(), peek().span());
        }
        return statements;
    }

    protected Statement parseStatement() {
        var token = current();
        state.enter(token.span());
        try {
            var dialectStatement = parseDialectStatement();
            if (dialectStatement != null) {
                return dialectStatement;
            }
            if (token.is(Symbol.SEMICOLON)) {
                advance();
                return node(new Statement.Empty(token.span()), token.span());
            }
            if (token instanceof Token.Reserved reserved) {
                return switch (reserved.keyword()) {
                    case IF -> parseIf();
                    case CASE -> parseCase();
                    case FOR -> parseFor();
                    case WHILE -> parseWhile();
                    case REPEAT -> parseRepeat();
                    case EXIT -> parseSimpleKeywordStatement(Statement.Exit::new);
                    case CONTINUE -> parseSimpleKeywordStatement(Statement.Continue::new);
                    case RETURN -> parseReturn();
                    case THIS, SUPER -> parseAssignmentOrCall();
                    default -> throw invalidStatement(token);
                };
            }
            if (token instanceof Token.Identifier || token instanceof Token.Address) {
                return parseAssignmentOrCall();
            }
            throw invalidStatement(token);
        } finally {
            state.exit();
        }
    }

    private Statement parseAssignmentOrCall() {
        var start = current().span();
        var target = parseVariable();

        if (check(Symbol.LPAREN)) {
            var arguments = parseArgumentList();
            expectTerminator();
            var span = spanFrom(start);
            if (target instanceof Variable.Named named) {
                return node(new Statement.FunctionCall(span, named.name(), arguments), span);
            }
            return node(new Statement.FbInvocation(span, target, arguments), span);
        }
        var op = assignOperator(current());
        if (op == null) {
            throw unexpected("':=' or '('");
        }
        advance();
        var value = parseExpression();
        expectTerminator();

        var span = spanFrom(start);
        return node(new Statement.Assignment(span, target, op, value), span);
    }

    private static AssignOp assignOperator(Token token) {
        if (!(token instanceof Token.Punct punct)) {
            return null;
        }
        return switch (punct.symbol()) {
            case ASSIGN -> AssignOp.ASSIGN;
            case ADD_ASSIGN -> AssignOp.ADD_ASSIGN;
            case SUB_ASSIGN -> AssignOp.SUB_ASSIGN;
            case MUL_ASSIGN -> AssignOp.MUL_ASSIGN;
            case DIV_ASSIGN -> AssignOp.DIV_ASSIGN;
            case NON_RETENTIVE_ASSIGN -> AssignOp.NON_RETENTIVE;
            default -> null;
        };
    }

    private Statement parseIf() {
        var start = expect(Keyword.IF).span();
        var condition = parseExpression();
        expect(Keyword.THEN);
        var thenBody = parseStatementList();
        var elsIfs = new ArrayList<Statement.ElsIf>();

        while (check(Keyword.ELSIF)) {
            state.tick(peek().span());
            var elsIfStart = advance().span();
            var elsIfCondition = parseExpression();
            expect(Keyword.THEN);
            var body = parseStatementList();
            var span = spanFrom(elsIfStart);
            elsIfs.add(node(new Statement.ElsIf(span, elsIfCondition, body), span));
            state.checkCollection(elsIfs.size(), span);
        }
        Optional<List<Statement>> elseBody = Optional.empty();
        if (accept(Keyword.ELSE)) {
            elseBody = Optional.of(parseStatementList());
        }
        expectBlockEnd(Keyword.END_IF);

        var span = spanFrom(start);
        return node(new Statement.If(span, condition, thenBody, elsIfs, elseBody), span);
    }

    private Statement parseCase() {
        var start = expect(Keyword.CASE).span();
        var selector = parseExpression();
        expect(Keyword.OF);
        var branches = new ArrayList<Statement.CaseBranch>();

        while (!check(Keyword.ELSE) && !check(Keyword.END_CASE) && !isAtEnd()) {
            state.tick(peek().span());
            var branchStart = current().span();
            var labels = new ArrayList<CaseLabel>();
            do {
                labels.add(parseCaseLabel());
                state.checkCollection(labels.size(), previous().span());
            } while (accept(Symbol.COMMA));
            expect(Symbol.COLON);
            var body = parseStatementList(true);
            var span = spanFrom(branchStart);
            branches.add(node(new Statement.CaseBranch(span, labels, body), span));
            state.checkCollection(branches.size(), span);
        }
        Optional<List<Statement>> elseBody = Optional.empty();
        if (accept(Keyword.ELSE)) {
            elseBody = Optional.of(parseStatementList());
        }
        expectBlockEnd(Keyword.END_CASE);

        var span = spanFrom(start);
        return node(new Statement.Case(span, selector, branches, elseBody), span);
    }

    private CaseLabel parseCaseLabel() {
        var low = parseExpression();

        if (accept(Symbol.RANGE)) {
            var high = parseExpression();
            var span = low.span().merge(high.span());
            return node(new CaseLabel.Range(span, low, high), span);
        }
        return node(new CaseLabel.Value(low.span(), low), low.span());
    }

    /**
     * A new CASE branch starts with a literal, a negative number, or an identifier directly followed by
     * {@code :}, {@code ,} or {@code ..}.
     */
    protected boolean isCaseLabelStart() {
        var token = peek();

        if (token instanceof Token.IntLiteral || token instanceof Token.RealLiteral || token instanceof Token.StringLiteral) {
            return true;
        }
        if (token.is(Symbol.MINUS)) {
            var next = peekAt(1);
            return next instanceof Token.IntLiteral || next instanceof Token.RealLiteral;
        }
        if (token instanceof Token.Identifier) {
            var next = peekAt(1);
            return next.is(Symbol.COLON) || next.is(Symbol.COMMA) || next.is(Symbol.RANGE);
        }
        return false;
    }

    private Statement parseFor() {
        var start = expect(Keyword.FOR).span();
        var variable = expectName();
        expect(Symbol.ASSIGN);
        var from = parseExpression();
        expect(Keyword.TO);
        var to = parseExpression();
        var step = accept(Keyword.BY) ? Optional.of(parseExpression()) : Optional.<Expression>empty();
        expect(Keyword.DO);
        var body = parseStatementList();
        expectBlockEnd(Keyword.END_FOR);

        var span = spanFrom(start);
        return node(new Statement.For(span, variable, from, to, step, body), span);
    }

    private Statement parseWhile() {
        var start = expect(Keyword.WHILE).span();
        var condition = parseExpression();
        expect(Keyword.DO);
        var body = parseStatementList();
        expectBlockEnd(Keyword.END_WHILE);

        var span = spanFrom(start);
        return node(new Statement.While(span, condition, body), span);
    }

    private Statement parseRepeat() {
        var start = expect(Keyword.REPEAT).span();
        var body = parseStatementList();
        expect(Keyword.UNTIL);
        var condition = parseExpression();
        boolean terminated = accept(Symbol.SEMICOLON);

        if (check(Keyword.END_REPEAT)) {
            expectBlockEnd(Keyword.END_REPEAT);
        } else if (!terminated) {
            throw unexpected("'END_REPEAT'");
        }
        var span = spanFrom(start);
        return node(new Statement.Repeat(span, body, condition), span);
    }

    private Statement parseReturn() {
        var start = expect(Keyword.RETURN).span();
        var value = check(Symbol.SEMICOLON) ? Optional.<Expression>empty() : Optional.of(parseExpression());
        expectTerminator();

        var span = spanFrom(start);
        return node(new Statement.Return(span, value), span);
    }

    private Statement parseSimpleKeywordStatement(Function<SourceSpan, Statement> factory) {
        var start = advance().span();
        expectTerminator();

        var span = spanFrom(start);
        return node(factory.apply(span), span);
    }

    // === Variables and calls ===

    protected Variable parseVariable() {
        var token = current();
        Variable base;

        if (token instanceof Token.Identifier identifier) {
            advance();
            base = node(new Variable.Named(token.span(), identifier.name()), token.span());
        } else if (token instanceof Token.Address address) {
            advance();
            base = node(new Variable.Direct(token.span(), address.address()), token.span());
        } else if (token.is(Keyword.THIS) || token.is(Keyword.SUPER)) {
            advance();
            base = node(new Variable.Named(token.span(), ((Token.Reserved) token).keyword().name()), token.span());
        } else {
            throw unexpected("variable");
        }
        return parseVariableSuffix(base);
    }

    private Variable parseVariableSuffix(Variable base) {
        var result = base;

        while (true) {
            state.tick(peek().span());
            if (accept(Symbol.DOT)) {
                var member = memberName();
                var span = result.span().merge(previous().span());
                result = node(new Variable.Member(span, result, member), span);
            } else if (check(Symbol.LBRACKET)) {
                var open = advance().span();
                var indices = new ArrayList<Expression>();
                do {
                    indices.add(parseExpression());
                    state.checkCollection(indices.size(), previous().span());
                } while (accept(Symbol.COMMA));
                expectClosing(Symbol.RBRACKET, open);
                var span = result.span().merge(previous().span());
                result = node(new Variable.Index(span, result, indices), span);
            } else if (accept(Symbol.CARET)) {
                var span = result.span().merge(previous().span());
                result = node(new Variable.Deref(span, result), span);
            } else {
                return result;
            }
        }
    }

    /**
     * Member names may be keywords ({@code .TIME}) or bit numbers ({@code .3}).
     */
    private String memberName() {
        var token = current();

        if (token instanceof Token.Identifier identifier) {
            advance();
            return identifier.name();
        }
        if (token instanceof Token.Reserved reserved) {
            advance();
            return reserved.text();
        }
        if (token instanceof Token.IntLiteral literal) {
            advance();
            return literal.text();
        }
        throw unexpected("member name");
    }

    protected List<Argument> parseArgumentList() {
        var open = expect(Symbol.LPAREN).span();
        var arguments = new ArrayList<Argument>();

        if (accept(Symbol.RPAREN)) {
            return arguments;
        }
        while (true) {
            state.tick(peek().span());
            arguments.add(parseArgument());
            state.checkCollection(arguments.size(), previous().span());
            if (accept(Symbol.COMMA)) {
                continue;
            }
            expectClosing(Symbol.RPAREN, open);
            return arguments;
        }
    }

    private Argument parseArgument() {
        var token = current();

        if (token.is(Symbol.COMMA) || token.is(Symbol.RPAREN)) {
            if (!allowsInferredArguments()) {
                throw new ParseException(new ParseError.InvalidExpression(token.span(), "empty argument"));
            }
            var span = SourceSpan.at(token.span().start());
            return node(new Argument.Inferred(span), span);
        }
        if (token instanceof Token.Identifier identifier) {
            var next = peekAt(1);
            if (next.is(Symbol.ASSIGN)) {
                advance();
                advance();
                var value = parseExpression();
                var span = spanFrom(token.span());
                return node(new Argument.Named(span, identifier.name(), value), span);
            }
            if (next.is(Symbol.OUTPUT_ASSIGN)) {
                return parseOutputArgument(token.span(), identifier.name(), false);
            }
        }
        if (token.is(Keyword.NOT) && peekAt(1) instanceof Token.Identifier identifier && peekAt(2).is(Symbol.OUTPUT_ASSIGN)) {
            advance();
            return parseOutputArgument(token.span(), identifier.name(), true);
        }
        var value = parseExpression();
        return node(new Argument.Positional(value.span(), value), value.span());
    }

    private Argument parseOutputArgument(SourceSpan start, String name, boolean negated) {
        advance();
        advance();
        var target = parseVariable();
        var span = spanFrom(start);
        return node(new Argument.Output(span, name, target, negated), span);
    }

    // === Expressions ===

    public Expression parseExpression() {
        return parseExpression(PREC_OR);
    }

    private Expression parseExpression(int minPrecedence) {
        state.enter(peek().span());
        try {
            var left = parseUnary();
            while (true) {
                var op = binaryOperator(peek());
                if (op == null || precedence(op) < minPrecedence) {
                    return left;
                }
                state.tick(peek().span());
                advance();
                int nextMinimum = op == BinaryOp.POWER ? precedence(op) : precedence(op) + 1;
                var right = parseExpression(nextMinimum);
                var span = left.span().merge(right.span());
                left = node(new Expression.Binary(span, op, left, right), span);
            }
        } finally {
            state.exit();
        }
    }

    /**
     * {@code NOT} takes a whole comparison as its operand; unary minus and plus bind tightest.
     */
    private Expression parseUnary() {
        var token = current();

        if (token.is(Keyword.NOT)) {
            advance();
            var operand = parseExpression(PREC_COMPARISON);
            return unary(token, UnaryOp.NOT, operand);
        }
        if (token.is(Symbol.MINUS) || token.is(Symbol.PLUS)) {
            advance();
            state.enter(token.span());
            try {
                var operand = parseUnary();
                return unary(token, token.is(Symbol.MINUS) ? UnaryOp.NEG : UnaryOp.PLUS, operand);
            } finally {
                state.exit();
            }
        }
        return parsePrimary();
    }

    private Expression unary(Token operator, UnaryOp op, Expression operand) {
        var span = operator.span().merge(operand.span());
        return node(new Expression.Unary(span, op, operand), span);
    }

    protected Expression parsePrimary() {
        var token = current();
        var span = token.span();

        if (token instanceof Token.IntLiteral literal) {
            advance();
            return node(new Expression.IntLiteral(span, literal.value(), literal.text()), span);
        }
        if (token instanceof Token.RealLiteral literal) {
            advance();
            return node(new Expression.RealLiteral(span, literal.value(), literal.text()), span);
        }
        if (token instanceof Token.StringLiteral literal) {
            advance();
            state.checkString(literal.value().length(), span);
            return node(new Expression.StringLiteral(span, literal.value(), literal.wide()), span);
        }
        if (token instanceof Token.TimeLiteral literal) {
            advance();
            return node(new Expression.TimeLiteral(span, literal.kind(), literal.text()), span);
        }
        if (token.is(Keyword.TRUE) || token.is(Keyword.FALSE)) {
            advance();
            return node(new Expression.BoolLiteral(span, token.is(Keyword.TRUE)), span);
        }
        if (token.is(Keyword.NULL)) {
            advance();
            return node(new Expression.NullLiteral(span), span);
        }
        if (token.is(Symbol.LPAREN)) {
            advance();
            var inner = parseExpression();
            expectClosing(Symbol.RPAREN, span);
            var parenSpan = spanFrom(span);
            return node(new Expression.Paren(parenSpan, inner), parenSpan);
        }
        if (token instanceof Token.Identifier || token instanceof Token.Address
            || token.is(Keyword.THIS) || token.is(Keyword.SUPER)) {
            return parseVariableOrCall();
        }
        if (token instanceof Token.Reserved reserved && reserved.keyword().isTypeName() && peekAt(1).is(Symbol.LPAREN)) {
            advance();
            var callee = node(new Variable.Named(span, reserved.text()), span);
            var arguments = parseArgumentList();
            var callSpan = spanFrom(span);
            return node(new Expression.Call(callSpan, callee, arguments), callSpan);
        }
        if (token instanceof Token.Eof) {
            throw new ParseException(new ParseError.UnexpectedEof(span, "expression"));
        }
        throw new ParseException(new ParseError.InvalidExpression(span, "unexpected " + token.describe()));
    }

    private Expression parseVariableOrCall() {
        var variable = parseVariable();

        if (check(Symbol.LPAREN)) {
            var arguments = parseArgumentList();
            var span = spanFrom(variable.span());
            return node(new Expression.Call(span, variable, arguments), span);
        }
        return node(Expression.VariableRef.of(variable), variable.span());
    }

    private static BinaryOp binaryOperator(Token token) {
        if (token instanceof Token.Reserved reserved) {
            return switch (reserved.keyword()) {
                case OR -> BinaryOp.OR;
                case XOR -> BinaryOp.XOR;
                case AND -> BinaryOp.AND;
                case MOD -> BinaryOp.MOD;
                default -> null;
            };
        }
        if (token instanceof Token.Punct punct) {
            return switch (punct.symbol()) {
                case AMPERSAND -> BinaryOp.AND;
                case EQ -> BinaryOp.EQ;
                case NE -> BinaryOp.NE;
                case LT -> BinaryOp.LT;
                case LE -> BinaryOp.LE;
                case GT -> BinaryOp.GT;
                case GE -> BinaryOp.GE;
                case PLUS -> BinaryOp.ADD;
                case MINUS -> BinaryOp.SUB;
                case STAR -> BinaryOp.MUL;
                case SLASH -> BinaryOp.DIV;
                case POWER -> BinaryOp.POWER;
                default -> null;
            };
        }
        return null;
    }

    private static int precedence(BinaryOp op) {
        return switch (op) {
            case OR -> PREC_OR;
            case XOR -> PREC_XOR;
            case AND -> PREC_AND;
            case EQ, NE, LT, LE, GT, GE -> PREC_COMPARISON;
            case ADD, SUB -> PREC_ADDITIVE;
            case MUL, DIV, MOD -> PREC_MULTIPLICATIVE;
            case POWER -> PREC_POWER;
        };
    }

    // === Recovery ===

    private void recover(ParseException e) {
        if (!recovering || e.error().isFatal()) {
            throw e;
        }
        errors.add(e.error());
        logger.debug("Recovering after parse error at {}: {}", e.error().span(), e.error().message());
    }

    /**
     * Skip to just after the next {@code ;}, or to the next statement start or list end.
     */
    private void synchronizeStatement(int start) {
        while (!isAtEnd()) {
            var token = peek();
            if (token.is(Symbol.SEMICOLON)) {
                pos++;
                return;
            }
            if (pos > start && (isStatementStart(token) || atStatementListEnd())) {
                return;
            }
            pos++;
        }
    }

    private void synchronizeDeclarationItem(int start) {
        while (!isAtEnd() && !check(Keyword.END_VAR)) {
            if (peek().is(Symbol.SEMICOLON)) {
                pos++;
                return;
            }
            pos++;
        }
        if (pos == start && !isAtEnd()) {
            pos++;
        }
    }

    private void synchronizeDeclaration(int start) {
        if (pos == start) {
            pos++;
        }
        while (!isAtEnd() && !isDeclarationStart(peek())) {
            pos++;
        }
    }

    private static boolean isStatementStart(Token token) {
        return token instanceof Token.Reserved reserved && STATEMENT_STARTS.contains(reserved.keyword());
    }

    private static boolean isDeclarationStart(Token token) {
        return token instanceof Token.Reserved reserved && DECLARATION_STARTS.contains(reserved.keyword());
    }

    private boolean atStatementListEnd() {
        var token = peek();

        if (token instanceof Token.Eof) {
            return true;
        }
        if (token instanceof Token.Reserved reserved) {
            var keyword = reserved.keyword();
            return keyword.isBlockEnd()
                   || keyword == Keyword.ELSIF
                   || keyword == Keyword.ELSE
                   || keyword == Keyword.UNTIL
                   || keyword == Keyword.METHOD
                   || DECLARATION_STARTS.contains(keyword);
        }
        return false;
    }

    // === Helper methods ===

    /**
     * The raw token at the current position; never throws.
     */
    protected Token peek() {
        return tokens.get(pos);
    }

    protected Token peekAt(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    /**
     * The current token; a malformed token raises the error the lexer attached to it.
     */
    protected Token current() {
        var token = tokens.get(pos);
        if (token instanceof Token.Invalid invalid) {
            throw new ParseException(invalid.error());
        }
        return token;
    }

    protected Token previous() {
        return tokens.get(Math.max(pos - 1, 0));
    }

    protected Token advance() {
        var token = current();
        if (!(token instanceof Token.Eof)) {
            pos++;
        }
        return token;
    }

    /**
     * Skip the current token without inspecting it.
     */
    protected void skip() {
        if (!isAtEnd()) {
            pos++;
        }
    }

    protected boolean isAtEnd() {
        return peek() instanceof Token.Eof;
    }

    protected boolean check(Keyword keyword) {
        return peek().is(keyword);
    }

    protected boolean check(Symbol symbol) {
        return peek().is(symbol);
    }

    protected boolean accept(Keyword keyword) {
        if (check(keyword)) {
            pos++;
            return true;
        }
        return false;
    }

    protected boolean accept(Symbol symbol) {
        if (check(symbol)) {
            pos++;
            return true;
        }
        return false;
    }

    protected Token expect(Keyword keyword) {
        if (check(keyword)) {
            return advance();
        }
        throw unexpected("'" + keyword.name() + "'");
    }

    protected Token expect(Symbol symbol) {
        if (check(symbol)) {
            return advance();
        }
        throw unexpected("'" + symbol.text() + "'");
    }

    /**
     * Closing bracket or parenthesis; at end of input the error points at the opening one.
     */
    protected void expectClosing(Symbol closing, SourceSpan opening) {
        if (check(closing)) {
            advance();
            return;
        }
        if (isAtEnd()) {
            throw new ParseException(closing == Symbol.RBRACKET
                                     ? new ParseError.UnclosedBracket(opening)
                                     : new ParseError.UnclosedParen(opening));
        }
        throw unexpected("'" + closing.text() + "'");
    }

    protected void expectTerminator() {
        if (accept(Symbol.SEMICOLON)) {
            return;
        }
        current();
        throw new ParseException(new ParseError.MissingTerminator(SourceSpan.at(previous().span().end()), ";"));
    }

    protected void expectBlockEnd(Keyword end) {
        expect(end);
        if (requiresSemicolonAfterBlockEnd()) {
            expectTerminator();
        } else {
            accept(Symbol.SEMICOLON);
        }
    }

    protected void expectPouEnd(Keyword end) {
        expect(end);
        accept(Symbol.SEMICOLON);
    }

    protected String expectName() {
        var token = current();
        if (token instanceof Token.Identifier identifier) {
            advance();
            return identifier.name();
        }
        throw unexpected("identifier");
    }

    protected String dottedName() {
        var sb = new StringBuilder(expectName());

        while (accept(Symbol.DOT)) {
            sb.append('.').append(expectName());
        }
        return sb.toString();
    }

    private List<String> dottedNameList() {
        var names = new ArrayList<String>();

        do {
            names.add(dottedName());
            state.checkCollection(names.size(), previous().span());
        } while (accept(Symbol.COMMA));
        return names;
    }

    protected SourceSpan spanFrom(SourceSpan start) {
        return start.merge(previous().span());
    }

    protected <N> N node(N value, SourceSpan span) {
        state.node(span);
        return value;
    }

    protected ParserState state() {
        return state;
    }

    protected ParseException unexpected(String expected) {
        var token = current();
        if (token instanceof Token.Eof) {
            return new ParseException(new ParseError.UnexpectedEof(token.span(), expected));
        }
        return new ParseException(new ParseError.UnexpectedToken(token.span(), expected, token.describe()));
    }

    private static ParseException invalidStatement(Token token) {
        if (token instanceof Token.Eof) {
            return new ParseException(new ParseError.UnexpectedEof(token.span(), "statement"));
        }
        return new ParseException(new ParseError.InvalidStatement(token.span(), "unexpected " + token.describe()));
    }
}
