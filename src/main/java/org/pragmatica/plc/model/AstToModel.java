package org.pragmatica.plc.model;

import org.pragmatica.plc.ast.AstPrinter;
import org.pragmatica.plc.ast.Expression;
import org.pragmatica.plc.ast.PouDeclaration;
import org.pragmatica.plc.ast.Retain;
import org.pragmatica.plc.ast.Statement;
import org.pragmatica.plc.ast.TypeDeclaration;
import org.pragmatica.plc.ast.TypeSpec;
import org.pragmatica.plc.ast.UnaryOp;
import org.pragmatica.plc.ast.VarBlock;
import org.pragmatica.plc.ast.VarDecl;
import org.pragmatica.plc.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Shared conversion of Structured Text syntax trees. Dialects add their own block kinds through
 * {@link #convertDialect}.
 */
abstract class AstToModel implements ToPlcModel<SourceFile> {

    /**
     * Value of {@link Project#sourceFormat()}.
     */
    protected abstract String sourceFormat();

    /**
     * Convert a declaration the shared rules do not cover.
     *
     * @return {@code true} when the declaration was handled
     */
    protected boolean convertDialect(PouDeclaration declaration, SourceFile source, ModelParts parts) {
        return false;
    }

    @Override
    public Project toPlcModel(SourceFile source) {
        var parts = new ModelParts();

        for (var declaration : source.unit().allDeclarations()) {
            if (convertDialect(declaration, source, parts)) {
                continue;
            }
            convertDeclaration(declaration, source, parts);
        }
        var configuration = parts.globals.isEmpty()
                            ? Optional.<Configuration>empty()
                            : Optional.of(new Configuration(source.name(), List.of(), parts.globals));

        return new Project(source.name(), Optional.empty(), parts.dataTypes, parts.pous, configuration,
                           Optional.of(sourceFormat()));
    }

    /**
     * Collects the pieces of a project while declarations are converted.
     */
    protected static final class ModelParts {
        final List<Pou> pous = new ArrayList<>();
        final List<DataTypeDef> dataTypes = new ArrayList<>();
        final List<Variable> globals = new ArrayList<>();

        void addPou(Pou pou) {
            pous.add(pou);
        }

        void addGlobals(List<Variable> variables) {
            globals.addAll(variables);
        }
    }

    private void convertDeclaration(PouDeclaration declaration, SourceFile source, ModelParts parts) {
        if (declaration instanceof PouDeclaration.Program program) {
            parts.addPou(pou(program, PouKind.PROGRAM, source));
        } else if (declaration instanceof PouDeclaration.FunctionBlock functionBlock) {
            parts.addPou(pou(functionBlock, PouKind.FUNCTION_BLOCK, source));
        } else if (declaration instanceof PouDeclaration.ClassType classType) {
            parts.addPou(pou(classType, PouKind.FUNCTION_BLOCK, source));
        } else if (declaration instanceof PouDeclaration.Function function) {
            parts.addPou(pou(function, PouKind.FUNCTION, source));
        } else if (declaration instanceof PouDeclaration.DataType dataType) {
            dataType.types().forEach(type -> parts.dataTypes.add(dataType(type)));
        } else if (declaration instanceof PouDeclaration.GlobalVars globals) {
            parts.addGlobals(variables(globals.block()));
        }
    }

    // === POUs ===

    protected static Pou pou(PouDeclaration declaration, PouKind kind, SourceFile source) {
        var variables = new ArrayList<Variable>();
        declaration.varBlocks().forEach(block -> variables.addAll(variables(block)));

        var returnType = declaration.returnType().map(TypeSpec::displayName);
        return Pou.of(declaration.name(), kind, PouInterface.of(variables, returnType), body(declaration.body(), source));
    }

    protected static Optional<Body> body(List<Statement> statements, SourceFile source) {
        if (statements.isEmpty()) {
            return Optional.empty();
        }
        var span = SourceSpan.covering(statements.stream().map(Statement::span).toList(), SourceSpan.EMPTY);
        return Optional.of(new Body.St(span.extract(source.text())));
    }

    protected static List<Variable> variables(VarBlock block) {
        var varClass = VarClass.fromDeclaration(block.varClass());
        var result = new ArrayList<Variable>(block.declarations().size());

        for (var declaration : block.declarations()) {
            result.add(variable(declaration, varClass)
                           .withFlags(block.constant(), block.retain() == Retain.RETAIN));
        }
        return result;
    }

    protected static Variable variable(VarDecl declaration, VarClass varClass) {
        var variable = Variable.of(declaration.name(), declaration.type().displayName(), varClass)
                               .withDimensions(dimensions(declaration.type()));

        if (declaration.initialValue().isPresent()) {
            variable = variable.withInitialValue(AstPrinter.expression(declaration.initialValue().get()));
        }
        if (declaration.address().isPresent()) {
            variable = variable.withAddress(declaration.address().get().text());
        }
        return variable;
    }

    private static List<Integer> dimensions(TypeSpec type) {
        if (!(type instanceof TypeSpec.ArrayType array)) {
            return List.of();
        }
        var sizes = new ArrayList<Integer>();
        for (var range : array.ranges()) {
            var low = constant(range.low());
            var high = constant(range.high());
            if (low.isEmpty() || high.isEmpty()) {
                return List.of();
            }
            sizes.add((int) (high.getAsLong() - low.getAsLong() + 1));
        }
        return sizes;
    }

    // === Data types ===

    private static DataTypeDef dataType(TypeDeclaration declaration) {
        var name = declaration.name();
        var type = declaration.type();

        if (type instanceof TypeSpec.StructType struct) {
            var members = struct.fields()
                                .stream()
                                .map(field -> new DataTypeDef.StructMember(
                                    field.name(),
                                    field.type().displayName(),
                                    field.initialValue().map(AstPrinter::expression),
                                    dimensions(field.type())))
                                .toList();
            return new DataTypeDef.Struct(name, members);
        }
        if (type instanceof TypeSpec.EnumType enumeration) {
            var members = enumeration.values()
                                     .stream()
                                     .map(value -> new DataTypeDef.EnumMember(
                                         value.name(),
                                         value.value().map(AstToModel::constant).orElse(OptionalLong.empty())))
                                     .toList();
            return new DataTypeDef.Enumeration(name, enumeration.baseType(), members);
        }
        if (type instanceof TypeSpec.ArrayType array) {
            var dimensions = new ArrayList<DataTypeDef.ArrayDimension>();
            for (var range : array.ranges()) {
                dimensions.add(new DataTypeDef.ArrayDimension(constant(range.low()).orElse(0),
                                                              constant(range.high()).orElse(0)));
            }
            return new DataTypeDef.Array(name, array.element().displayName(), dimensions);
        }
        if (type instanceof TypeSpec.SubrangeType subrange) {
            return new DataTypeDef.Subrange(name, subrange.base().displayName(),
                                            constant(subrange.low()).orElse(0),
                                            constant(subrange.high()).orElse(0));
        }
        return new DataTypeDef.Alias(name, type.displayName());
    }

    /**
     * Value of an integer literal, possibly negated.
     */
    private static OptionalLong constant(Expression expression) {
        if (expression instanceof Expression.IntLiteral literal) {
            return OptionalLong.of(literal.value());
        }
        if (expression instanceof Expression.Unary unary && unary.op() == UnaryOp.NEG
            && unary.operand() instanceof Expression.IntLiteral literal) {
            return OptionalLong.of(-literal.value());
        }
        if (expression instanceof Expression.Paren paren) {
            return constant(paren.inner());
        }
        return OptionalLong.empty();
    }
}
