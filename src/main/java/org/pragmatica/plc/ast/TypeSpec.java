package org.pragmatica.plc.ast;

import org.pragmatica.plc.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Declared type of a variable, field or type alias.
 */
public sealed interface TypeSpec {

    SourceSpan span();

    /**
     * Canonical text form, e.g. {@code ARRAY[1..10] OF INT}.
     */
    default String displayName() {
        return AstPrinter.typeSpec(this);
    }

    /**
     * Keyword type such as {@code BOOL}, {@code DINT} or {@code TIME}. The original spelling is kept.
     */
    record Elementary(SourceSpan span, String name) implements TypeSpec {}

    /**
     * {@code STRING} or {@code WSTRING} with an optional maximum length.
     */
    record StringType(SourceSpan span, boolean wide, Optional<Expression> length) implements TypeSpec {}

    record ArrayType(SourceSpan span, List<Range> ranges, TypeSpec element) implements TypeSpec {
        public ArrayType {
            ranges = List.copyOf(ranges);
        }
    }

    /**
     * Inclusive dimension range {@code low..high}.
     */
    record Range(SourceSpan span, Expression low, Expression high) {}

    /**
     * {@code STRUCT ... END_STRUCT}; fields keep declaration order.
     */
    record StructType(SourceSpan span, List<VarDecl> fields) implements TypeSpec {
        public StructType {
            fields = List.copyOf(fields);
        }
    }

    record RefType(SourceSpan span, TypeSpec target) implements TypeSpec {}

    /**
     * A named type resolved later by name.
     */
    record UserDefined(SourceSpan span, String name) implements TypeSpec {}

    /**
     * {@code (Red, Green := 5, Blue)} with an optional base type, e.g. {@code INT (Idle, Busy)}.
     */
    record EnumType(SourceSpan span, Optional<String> baseType, List<EnumValue> values) implements TypeSpec {
        public EnumType {
            values = List.copyOf(values);
        }
    }

    record EnumValue(SourceSpan span, String name, Optional<Expression> value) {}

    /**
     * {@code INT (0..100)}.
     */
    record SubrangeType(SourceSpan span, TypeSpec base, Expression low, Expression high) implements TypeSpec {}
}
