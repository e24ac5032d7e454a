package org.pragmatica.plc.rll;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A ladder rung. Parsing is permissive: a rung that fails to parse keeps its text and the error.
 */
public record Rung(String rawText, Optional<List<RungElement>> elements, Optional<RllError> error) {

    public static Rung parsed(String rawText, List<RungElement> elements) {
        return new Rung(rawText, Optional.of(List.copyOf(elements)), Optional.empty());
    }

    public static Rung failed(String rawText, RllError error) {
        return new Rung(rawText, Optional.empty(), Optional.of(error));
    }

    public boolean isParsed() {
        return elements.isPresent();
    }

    /**
     * Instructions in source order, parallel branches flattened.
     */
    public List<RungElement.Instruction> instructions() {
        var result = new ArrayList<RungElement.Instruction>();
        elements.ifPresent(list -> list.forEach(element -> element.forEachInstruction(result::add)));
        return result;
    }

    public List<TagReference> tagReferences() {
        var result = new ArrayList<TagReference>();
        instructions().forEach(instruction -> instruction.collectTagReferences(result));
        return result;
    }

    public Optional<RllParseError> parseError() {
        return error.map(e -> RllParseError.of(e, rawText));
    }
}
