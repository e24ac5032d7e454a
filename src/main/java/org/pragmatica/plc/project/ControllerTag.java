package org.pragmatica.plc.project;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A tag declared at controller, program or AOI scope.
 *
 * @param dimensions array dimensions as exported, e.g. {@code 10} or {@code 4 8}
 */
public record ControllerTag(String name, String dataType, Optional<String> dimensions, Optional<String> description) {

    public static ControllerTag of(String name, String dataType) {
        return new ControllerTag(name, dataType, Optional.empty(), Optional.empty());
    }

    /**
     * Dimensions split on spaces, commas or {@code x}; parts that are not numbers are dropped.
     */
    public List<Integer> dimensionSizes() {
        var sizes = new ArrayList<Integer>();

        dimensions.ifPresent(text -> {
            for (var part : text.split("[ ,x]")) {
                var trimmed = part.trim();
                if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
                    sizes.add(Integer.parseInt(trimmed));
                }
            }
        });
        return sizes;
    }
}
