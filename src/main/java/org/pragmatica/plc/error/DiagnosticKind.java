package org.pragmatica.plc.error;

import org.pragmatica.plc.tree.SourceSpan;

/**
 * The condition a {@link Diagnostic} reports. Each variant renders its own message.
 */
public sealed interface DiagnosticKind {

    String message();

    // === Symbols ===

    record UndefinedIdentifier(String name) implements DiagnosticKind {
        @Override
        public String message() {
            return "undefined identifier '" + name + "'";
        }
    }

    record DuplicateDefinition(String name, SourceSpan original) implements DiagnosticKind {
        @Override
        public String message() {
            return "duplicate definition of '" + name + "'";
        }
    }

    record UnusedVariable(String name) implements DiagnosticKind {
        @Override
        public String message() {
            return "unused variable '" + name + "'";
        }
    }

    record UninitializedVariable(String name) implements DiagnosticKind {
        @Override
        public String message() {
            return "variable '" + name + "' may be uninitialized";
        }
    }

    record AssignmentToConstant(String name) implements DiagnosticKind {
        @Override
        public String message() {
            return "cannot assign to constant '" + name + "'";
        }
    }

    record AssignmentToInput(String name) implements DiagnosticKind {
        @Override
        public String message() {
            return "cannot assign to input parameter '" + name + "'";
        }
    }

    record ShadowedVariable(String name, SourceSpan original) implements DiagnosticKind {
        @Override
        public String message() {
            return "variable '" + name + "' shadows an outer variable";
        }
    }

    // === Types ===

    record TypeMismatch(String expected, String found) implements DiagnosticKind {
        @Override
        public String message() {
            return "type mismatch: expected '" + expected + "', found '" + found + "'";
        }
    }

    record IncompatibleTypes(String left, String right, String operator) implements DiagnosticKind {
        @Override
        public String message() {
            return "incompatible types '" + left + "' and '" + right + "' for operator '" + operator + "'";
        }
    }

    record WrongArgumentCount(int expected, int found) implements DiagnosticKind {
        @Override
        public String message() {
            return "wrong number of arguments: expected " + expected + ", found " + found;
        }
    }

    record WrongArgumentType(String parameter, String expected, String found) implements DiagnosticKind {
        @Override
        public String message() {
            return "wrong type for parameter '" + parameter + "': expected '" + expected + "', found '" + found + "'";
        }
    }

    record InvalidOperator(String operator, String operandType) implements DiagnosticKind {
        @Override
        public String message() {
            return "operator '" + operator + "' cannot be applied to type '" + operandType + "'";
        }
    }

    record NonIntegerArrayIndex() implements DiagnosticKind {
        @Override
        public String message() {
            return "array index must be an integer type";
        }
    }

    record ArrayDimensionMismatch(int expected, int found) implements DiagnosticKind {
        @Override
        public String message() {
            return "array dimension mismatch: expected " + expected + " indices, found " + found;
        }
    }

    // === Code smells ===

    record EmptyBlock(String blockType) implements DiagnosticKind {
        @Override
        public String message() {
            return "empty " + blockType + " block";
        }
    }

    record DeepNesting(int depth, int maxRecommended) implements DiagnosticKind {
        @Override
        public String message() {
            return "deeply nested code (depth " + depth + ", recommended max " + maxRecommended + ")";
        }
    }

    record LongFunction(int lines, int maxRecommended) implements DiagnosticKind {
        @Override
        public String message() {
            return "function is too long (" + lines + " lines, recommended max " + maxRecommended + ")";
        }
    }

    record ComplexCondition(int complexity, int maxRecommended) implements DiagnosticKind {
        @Override
        public String message() {
            return "complex condition (complexity " + complexity + ", recommended max " + maxRecommended + ")";
        }
    }

    record MagicNumber(String value) implements DiagnosticKind {
        @Override
        public String message() {
            return "magic number '" + value + "' should be a named constant";
        }
    }

    record RedundantCondition(boolean always) implements DiagnosticKind {
        @Override
        public String message() {
            return "condition is always " + always;
        }
    }

    record DuplicateCode(String description) implements DiagnosticKind {
        @Override
        public String message() {
            return "duplicate code: " + description;
        }
    }

    record DeadCode(String reason) implements DiagnosticKind {
        @Override
        public String message() {
            return "unreachable code: " + reason;
        }
    }

    record EmptyCaseBranch() implements DiagnosticKind {
        @Override
        public String message() {
            return "empty CASE branch";
        }
    }

    record MissingCaseElse() implements DiagnosticKind {
        @Override
        public String message() {
            return "CASE statement has no ELSE clause";
        }
    }

    record PossibleAssignmentInCondition() implements DiagnosticKind {
        @Override
        public String message() {
            return "possible assignment in condition (did you mean '=' for comparison?)";
        }
    }
}
