package org.pragmatica.plc.ast;

import org.pragmatica.plc.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Top-level declarations of a compilation unit.
 */
public sealed interface PouDeclaration {

    SourceSpan span();

    String name();

    PouKind kind();

    default Optional<TypeSpec> returnType() {
        return Optional.empty();
    }

    default List<VarBlock> varBlocks() {
        return List.of();
    }

    default List<Method> methods() {
        return List.of();
    }

    default List<Statement> body() {
        return List.of();
    }

    default List<Pragma> pragmas() {
        return List.of();
    }

    /**
     * All declarations of the given class, across every block of that class.
     */
    default List<VarDecl> variables(VarClass varClass) {
        return varBlocks().stream()
                          .filter(block -> block.varClass() == varClass)
                          .flatMap(block -> block.declarations().stream())
                          .toList();
    }

    record Function(SourceSpan span,
                    String name,
                    Optional<TypeSpec> returnType,
                    List<VarBlock> varBlocks,
                    List<Statement> body,
                    List<Pragma> pragmas) implements PouDeclaration {
        public Function {
            varBlocks = List.copyOf(varBlocks);
            body = List.copyOf(body);
            pragmas = List.copyOf(pragmas);
        }

        @Override
        public PouKind kind() {
            return PouKind.FUNCTION;
        }
    }

    record FunctionBlock(SourceSpan span,
                         String name,
                         Optional<String> extendsName,
                         List<String> implementsNames,
                         boolean isFinal,
                         boolean isAbstract,
                         List<VarBlock> varBlocks,
                         List<Method> methods,
                         List<Statement> body,
                         List<Pragma> pragmas) implements PouDeclaration {
        public FunctionBlock {
            implementsNames = List.copyOf(implementsNames);
            varBlocks = List.copyOf(varBlocks);
            methods = List.copyOf(methods);
            body = List.copyOf(body);
            pragmas = List.copyOf(pragmas);
        }

        @Override
        public PouKind kind() {
            return PouKind.FUNCTION_BLOCK;
        }
    }

    record Program(SourceSpan span,
                   String name,
                   List<VarBlock> varBlocks,
                   List<Statement> body) implements PouDeclaration {
        public Program {
            varBlocks = List.copyOf(varBlocks);
            body = List.copyOf(body);
        }

        @Override
        public PouKind kind() {
            return PouKind.PROGRAM;
        }
    }

    record ClassType(SourceSpan span,
                     String name,
                     Optional<String> extendsName,
                     List<String> implementsNames,
                     boolean isFinal,
                     boolean isAbstract,
                     List<VarBlock> varBlocks,
                     List<Method> methods) implements PouDeclaration {
        public ClassType {
            implementsNames = List.copyOf(implementsNames);
            varBlocks = List.copyOf(varBlocks);
            methods = List.copyOf(methods);
        }

        @Override
        public PouKind kind() {
            return PouKind.CLASS;
        }
    }

    /**
     * Interface with method prototypes only; method bodies are empty.
     */
    record Interface(SourceSpan span,
                     String name,
                     List<String> extendsNames,
                     List<Method> methods) implements PouDeclaration {
        public Interface {
            extendsNames = List.copyOf(extendsNames);
            methods = List.copyOf(methods);
        }

        @Override
        public PouKind kind() {
            return PouKind.INTERFACE;
        }
    }

    record Method(SourceSpan span,
                  String name,
                  AccessModifier access,
                  Optional<TypeSpec> returnType,
                  boolean isFinal,
                  boolean isAbstract,
                  boolean isOverride,
                  List<VarBlock> varBlocks,
                  List<Statement> body) implements PouDeclaration {
        public Method {
            varBlocks = List.copyOf(varBlocks);
            body = List.copyOf(body);
        }

        @Override
        public PouKind kind() {
            return PouKind.METHOD;
        }
    }

    record DataType(SourceSpan span, List<TypeDeclaration> types) implements PouDeclaration {
        public DataType {
            types = List.copyOf(types);
        }

        @Override
        public String name() {
            return types.isEmpty() ? "TYPE" : types.get(0).name();
        }

        @Override
        public PouKind kind() {
            return PouKind.DATA_TYPE;
        }
    }

    record GlobalVars(SourceSpan span, VarBlock block) implements PouDeclaration {

        @Override
        public String name() {
            return VarClass.GLOBAL.keyword();
        }

        @Override
        public PouKind kind() {
            return PouKind.GLOBAL_VAR;
        }

        @Override
        public List<VarBlock> varBlocks() {
            return List.of(block);
        }
    }

    /**
     * @param name     dotted namespace name
     * @param usings   {@code USING a.b;} directives, dotted
     * @param elements nested declarations
     */
    record Namespace(SourceSpan span,
                     String name,
                     boolean internal,
                     List<String> usings,
                     List<PouDeclaration> elements) implements PouDeclaration {
        public Namespace {
            usings = List.copyOf(usings);
            elements = List.copyOf(elements);
        }

        @Override
        public PouKind kind() {
            return PouKind.NAMESPACE;
        }
    }

    /**
     * SCL data block. An instance DB names the function block it instantiates; a global DB declares variables.
     */
    record DataBlock(SourceSpan span,
                     String name,
                     Optional<String> instanceOf,
                     List<VarBlock> varBlocks,
                     List<Statement> body,
                     List<Pragma> pragmas) implements PouDeclaration {
        public DataBlock {
            varBlocks = List.copyOf(varBlocks);
            body = List.copyOf(body);
            pragmas = List.copyOf(pragmas);
        }

        @Override
        public PouKind kind() {
            return PouKind.DATA_BLOCK;
        }
    }

    record OrganizationBlock(SourceSpan span,
                             String name,
                             List<VarBlock> varBlocks,
                             List<Statement> body,
                             List<Pragma> pragmas) implements PouDeclaration {
        public OrganizationBlock {
            varBlocks = List.copyOf(varBlocks);
            body = List.copyOf(body);
            pragmas = List.copyOf(pragmas);
        }

        @Override
        public PouKind kind() {
            return PouKind.ORGANIZATION_BLOCK;
        }
    }
}
