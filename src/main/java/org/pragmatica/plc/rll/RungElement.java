package org.pragmatica.plc.rll;

import java.util.List;
import java.util.function.Consumer;

/**
 * Element of a rung: an instruction or a set of parallel branches.
 */
public sealed interface RungElement {

    /**
     * Visit every instruction in this element, branches included, left to right.
     */
    void forEachInstruction(Consumer<Instruction> action);

    record Instruction(String mnemonic, List<Operand> operands) implements RungElement {
        public Instruction {
            operands = List.copyOf(operands);
        }

        @Override
        public void forEachInstruction(Consumer<Instruction> action) {
            action.accept(this);
        }

        void collectTagReferences(List<TagReference> sink) {
            for (int i = 0; i < operands.size(); i++) {
                if (operands.get(i) instanceof Operand.Value value) {
                    for (var tag : OperandParser.parse(value.text()).allTags()) {
                        sink.add(new TagReference(tag, value.text(), mnemonic, i));
                    }
                }
            }
        }
    }

    record Parallel(List<Branch> branches) implements RungElement {
        public Parallel {
            branches = List.copyOf(branches);
        }

        @Override
        public void forEachInstruction(Consumer<Instruction> action) {
            branches.forEach(branch -> branch.elements()
                                             .forEach(element -> element.forEachInstruction(action)));
        }
    }

    record Branch(List<RungElement> elements) {
        public Branch {
            elements = List.copyOf(elements);
        }
    }
}
