package org.pragmatica.plc.rll;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Structure of an operand as far as tag extraction needs it.
 */
public sealed interface OperandValue {

    /**
     * Base names of every tag the operand mentions, including tags used as indices.
     */
    List<String> allTags();

    default Optional<String> baseTag() {
        return this instanceof Tag tag ? Optional.of(tag.base()) : Optional.empty();
    }

    /**
     * A tag path such as {@code Timer1.DN}, {@code Data[idx]} or {@code Local:1:I.Data.0}.
     *
     * @param base     name before the first {@code .}, {@code [} or {@code :}
     * @param fullPath the path as written
     * @param indices  tag-valued indices and indirect references
     */
    record Tag(String base, String fullPath, List<OperandValue> indices) implements OperandValue {
        public Tag {
            indices = List.copyOf(indices);
        }

        public static Tag simple(String name) {
            return new Tag(name, name, List.of());
        }

        @Override
        public List<String> allTags() {
            var tags = new ArrayList<String>();
            tags.add(base);
            indices.forEach(index -> tags.addAll(index.allTags()));
            return tags;
        }
    }

    record Literal(String text) implements OperandValue {
        @Override
        public List<String> allTags() {
            return List.of();
        }
    }

    /**
     * An arithmetic or comparison expression, e.g. {@code ATN(Angle) > 1.0}.
     */
    record Expression(String text, List<OperandValue> terms) implements OperandValue {
        public Expression {
            terms = List.copyOf(terms);
        }

        @Override
        public List<String> allTags() {
            var tags = new ArrayList<String>();
            terms.forEach(term -> tags.addAll(term.allTags()));
            return tags;
        }
    }
}
