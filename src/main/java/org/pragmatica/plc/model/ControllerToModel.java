package org.pragmatica.plc.model;

import org.pragmatica.plc.project.AddOnInstruction;
import org.pragmatica.plc.project.Controller;
import org.pragmatica.plc.project.ControllerProgram;
import org.pragmatica.plc.project.ControllerTag;
import org.pragmatica.plc.project.Routine;
import org.pragmatica.plc.project.RoutineType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Logix controller tree. Programs keep their ladder routines as one {@code RLL} raw body, each routine
 * introduced by a {@code // Routine: name} line; a program without ladder routines uses its ST routines
 * instead. Add-on instructions become function blocks and controller tags become configuration globals.
 */
public final class ControllerToModel implements ToPlcModel<Controller> {
    public static final String ROUTINE_HEADER = "// Routine: ";

    @Override
    public Project toPlcModel(Controller controller) {
        var pous = new ArrayList<Pou>();

        controller.programs().forEach(program -> pous.add(program(program)));
        controller.addOnInstructions().forEach(aoi -> pous.add(addOnInstruction(aoi)));

        var globals = controller.tags()
                                .stream()
                                .map(tag -> variable(tag, VarClass.GLOBAL))
                                .toList();
        var configuration = new Configuration(controller.name(), List.of(), globals);

        return new Project(controller.name(), Optional.empty(), List.of(), pous, Optional.of(configuration),
                           Optional.of("L5X"));
    }

    private static Pou program(ControllerProgram program) {
        var locals = program.tags()
                            .stream()
                            .map(tag -> variable(tag, VarClass.LOCAL))
                            .toList();
        return Pou.of(program.name(), PouKind.PROGRAM, PouInterface.of(locals, Optional.empty()),
                      body(program.routines()));
    }

    private static Pou addOnInstruction(AddOnInstruction aoi) {
        var variables = new ArrayList<Variable>();

        aoi.parameters().forEach(parameter -> variables.add(
            Variable.of(parameter.name(), parameter.dataType(), VarClass.fromUsage(parameter.usage(), VarClass.LOCAL))));
        aoi.localTags().forEach(tag -> variables.add(variable(tag, VarClass.LOCAL)));

        return Pou.of(aoi.name(), PouKind.FUNCTION_BLOCK, PouInterface.of(variables, Optional.empty()),
                      body(aoi.routines()));
    }

    // === Helper methods ===

    private static Optional<Body> body(List<Routine> routines) {
        var ladder = new StringBuilder();
        var text = new StringBuilder();

        for (var routine : routines) {
            if (routine.type() == RoutineType.RLL) {
                ladder.append(ROUTINE_HEADER).append(routine.name()).append('\n');
                routine.rungs().forEach(rung -> ladder.append(rung.text()).append('\n'));
            } else if (routine.type() == RoutineType.ST) {
                if (text.length() > 0) {
                    text.append('\n');
                }
                text.append(routine.stSource());
            }
        }
        if (ladder.length() > 0) {
            return Optional.of(new Body.Raw("RLL", ladder.toString()));
        }
        if (text.length() > 0) {
            return Optional.of(new Body.St(text.toString()));
        }
        return Optional.empty();
    }

    private static Variable variable(ControllerTag tag, VarClass varClass) {
        var variable = Variable.of(tag.name(), tag.dataType(), varClass).withDimensions(tag.dimensionSizes());
        return tag.description().map(variable::withDescription).orElse(variable);
    }
}
