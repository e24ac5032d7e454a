package org.pragmatica.plc.model;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A user-defined data type.
 */
public sealed interface DataTypeDef {

    String name();

    record Alias(String name, String target) implements DataTypeDef {}

    record Struct(String name, List<StructMember> members) implements DataTypeDef {
        public Struct {
            members = List.copyOf(members);
        }
    }

    record Enumeration(String name, Optional<String> baseType, List<EnumMember> members) implements DataTypeDef {
        public Enumeration {
            members = List.copyOf(members);
        }
    }

    record Array(String name, String elementType, List<ArrayDimension> dimensions) implements DataTypeDef {
        public Array {
            dimensions = List.copyOf(dimensions);
        }
    }

    record Subrange(String name, String baseType, long lower, long upper) implements DataTypeDef {}

    record StructMember(String name, String dataType, Optional<String> initialValue, List<Integer> dimensions) {
        public StructMember {
            dimensions = List.copyOf(dimensions);
        }

        public static StructMember of(String name, String dataType) {
            return new StructMember(name, dataType, Optional.empty(), List.of());
        }
    }

    record EnumMember(String name, OptionalLong value) {
        public static EnumMember of(String name) {
            return new EnumMember(name, OptionalLong.empty());
        }
    }

    /**
     * Inclusive bounds.
     */
    record ArrayDimension(long lower, long upper) {
        public static ArrayDimension zeroBased(long size) {
            return new ArrayDimension(0, size - 1);
        }

        public long size() {
            return upper - lower + 1;
        }
    }
}
