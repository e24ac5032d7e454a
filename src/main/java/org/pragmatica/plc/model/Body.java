package org.pragmatica.plc.model;

import java.util.List;
import java.util.Optional;

/**
 * Implementation of a POU in one of the IEC languages, or raw text in a language the model does not break down.
 */
public sealed interface Body {

    boolean isEmpty();

    /**
     * Short language name such as {@code ST}, {@code LD} or, for raw bodies, the declared language.
     */
    String language();

    record St(String text) implements Body {
        @Override
        public boolean isEmpty() {
            return text.isBlank();
        }

        @Override
        public String language() {
            return "ST";
        }
    }

    record Il(String text) implements Body {
        @Override
        public boolean isEmpty() {
            return text.isBlank();
        }

        @Override
        public String language() {
            return "IL";
        }
    }

    record Ld(List<LadderRung> rungs) implements Body {
        public Ld {
            rungs = List.copyOf(rungs);
        }

        @Override
        public boolean isEmpty() {
            return rungs.isEmpty();
        }

        @Override
        public String language() {
            return "LD";
        }
    }

    record Fbd(List<Network> networks) implements Body {
        public Fbd {
            networks = List.copyOf(networks);
        }

        @Override
        public boolean isEmpty() {
            return networks.isEmpty();
        }

        @Override
        public String language() {
            return "FBD";
        }
    }

    record Sfc(SfcBody chart) implements Body {
        @Override
        public boolean isEmpty() {
            return chart.steps().isEmpty();
        }

        @Override
        public String language() {
            return "SFC";
        }
    }

    /**
     * Text in a vendor language, e.g. Rockwell ladder text with {@code language} {@code RLL}.
     */
    record Raw(String language, String content) implements Body {
        @Override
        public boolean isEmpty() {
            return content.isBlank();
        }
    }

    // === Graphical elements ===

    record LadderRung(int number, Optional<String> comment, List<Instruction> instructions,
                      Optional<String> rawText) {
        public LadderRung {
            instructions = List.copyOf(instructions);
        }
    }

    record Network(int number, Optional<String> label, List<Instruction> instructions) {
        public Network {
            instructions = List.copyOf(instructions);
        }
    }

    record Instruction(String mnemonic, List<InstructionOperand> operands) {
        public Instruction {
            operands = List.copyOf(operands);
        }
    }

    sealed interface InstructionOperand {

        String text();

        /**
         * @param name base tag, {@code text} the operand as written
         */
        record Tag(String name, String text) implements InstructionOperand {}

        record Literal(String text) implements InstructionOperand {}

        record Expression(String text) implements InstructionOperand {}

        record Address(String text) implements InstructionOperand {}
    }
}
