package org.pragmatica.plc.analysis;

import org.pragmatica.plc.analysis.smells.SmellConfig;
import org.pragmatica.plc.analysis.smells.SmellDetector;
import org.pragmatica.plc.analysis.symbols.Symbol;
import org.pragmatica.plc.analysis.symbols.SymbolKind;
import org.pragmatica.plc.analysis.symbols.SymbolTable;
import org.pragmatica.plc.analysis.types.TypeChecker;
import org.pragmatica.plc.analysis.types.Types;
import org.pragmatica.plc.ast.PouDeclaration;
import org.pragmatica.plc.ast.Statement;
import org.pragmatica.plc.ast.TypeSpec;
import org.pragmatica.plc.ast.VarBlock;
import org.pragmatica.plc.ast.VarClass;
import org.pragmatica.plc.error.Diagnostic;
import org.pragmatica.plc.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the analysis passes over one POU: declarations, type checking, smells and the unused-variable sweep.
 * Diagnostics are returned in that order.
 */
public final class PouAnalyzer {
    private final SmellConfig smellConfig;

    public PouAnalyzer(SmellConfig smellConfig) {
        this.smellConfig = smellConfig;
    }

    public PouAnalyzer() {
        this(SmellConfig.DEFAULT);
    }

    public static List<Diagnostic> analyze(PouDeclaration pou) {
        return new PouAnalyzer().analyzePou(pou);
    }

    /**
     * Analyze a routine body without declarations. Names that are not declared are accepted silently and
     * there is no unused-variable sweep.
     */
    public static List<Diagnostic> analyzeStatements(String name, List<Statement> statements) {
        return new PouAnalyzer().analyzeBody(name, statements);
    }

    public List<Diagnostic> analyzePou(PouDeclaration pou) {
        var diagnostics = new ArrayList<Diagnostic>();
        var symbols = new SymbolTable();

        symbols.enterScope(pou.name());
        pou.returnType().ifPresent(type -> symbols.define(returnValue(pou, type)));
        pou.varBlocks().forEach(block -> defineBlock(block, symbols, diagnostics));

        diagnostics.addAll(new TypeChecker(symbols).checkStatements(pou.body()));
        diagnostics.addAll(new SmellDetector(smellConfig).analyzePou(pou));
        diagnostics.addAll(symbols.checkUnused());
        symbols.exitScope();
        return diagnostics;
    }

    public List<Diagnostic> analyzeBody(String name, List<Statement> statements) {
        var diagnostics = new ArrayList<Diagnostic>();
        var symbols = new SymbolTable();

        symbols.enterScope(name);
        diagnostics.addAll(TypeChecker.lenient(symbols).checkStatements(statements));
        diagnostics.addAll(new SmellDetector(smellConfig).analyzeBody(statements, bodySpan(statements)));
        symbols.exitScope();
        return diagnostics;
    }

    private static void defineBlock(VarBlock block, SymbolTable symbols, List<Diagnostic> diagnostics) {
        var kind = symbolKind(block);

        for (var declaration : block.declarations()) {
            var symbol = Symbol.symbol(declaration.name(),
                                       kind,
                                       Types.fromTypeSpec(declaration.type()),
                                       declaration.span(),
                                       !block.constant(),
                                       declaration.initialValue().isPresent()
                                       || block.varClass() == VarClass.EXTERNAL);
            symbols.define(symbol).ifPresent(diagnostics::add);
        }
    }

    /**
     * The result variable of a function or method, named after it.
     */
    private static Symbol returnValue(PouDeclaration pou, TypeSpec type) {
        return Symbol.symbol(pou.name(), SymbolKind.FUNCTION, Types.fromTypeSpec(type), pou.span(), true, false);
    }

    private static SymbolKind symbolKind(VarBlock block) {
        if (block.constant()) {
            return SymbolKind.CONSTANT;
        }
        if (block.varClass() == VarClass.INPUT) {
            return SymbolKind.PARAMETER;
        }
        if (block.varClass() == VarClass.OUTPUT) {
            return SymbolKind.OUTPUT;
        }
        if (block.varClass() == VarClass.IN_OUT) {
            return SymbolKind.IN_OUT;
        }
        return SymbolKind.VARIABLE;
    }

    private static SourceSpan bodySpan(List<Statement> statements) {
        return SourceSpan.covering(statements.stream().map(Statement::span).toList(), SourceSpan.EMPTY);
    }
}
