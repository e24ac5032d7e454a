package org.pragmatica.plc.project;

import java.util.List;

/**
 * Logix controller project tree as read from an export: controller tags, programs and add-on instructions.
 */
public record Controller(String name, List<ControllerTag> tags, List<ControllerProgram> programs,
                         List<AddOnInstruction> addOnInstructions) {

    public Controller {
        tags = List.copyOf(tags);
        programs = List.copyOf(programs);
        addOnInstructions = List.copyOf(addOnInstructions);
    }
}
