package org.pragmatica.plc.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Declared variables of a POU, grouped by class.
 */
public record PouInterface(List<Variable> inputs,
                           List<Variable> outputs,
                           List<Variable> inOuts,
                           List<Variable> locals,
                           List<Variable> temps,
                           List<Variable> externals,
                           Optional<String> returnType) {

    public static final PouInterface EMPTY = of(List.of(), Optional.empty());

    public PouInterface {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        inOuts = List.copyOf(inOuts);
        locals = List.copyOf(locals);
        temps = List.copyOf(temps);
        externals = List.copyOf(externals);
    }

    /**
     * Group variables by their class. Classes without a group of their own are kept with the locals.
     */
    public static PouInterface of(List<Variable> variables, Optional<String> returnType) {
        var inputs = new ArrayList<Variable>();
        var outputs = new ArrayList<Variable>();
        var inOuts = new ArrayList<Variable>();
        var locals = new ArrayList<Variable>();
        var temps = new ArrayList<Variable>();
        var externals = new ArrayList<Variable>();

        for (var variable : variables) {
            switch (variable.varClass()) {
                case INPUT -> inputs.add(variable);
                case OUTPUT -> outputs.add(variable);
                case IN_OUT -> inOuts.add(variable);
                case TEMP -> temps.add(variable);
                case EXTERNAL -> externals.add(variable);
                default -> locals.add(variable);
            }
        }
        return new PouInterface(inputs, outputs, inOuts, locals, temps, externals, returnType);
    }

    public List<Variable> allVariables() {
        var all = new ArrayList<Variable>(variableCount());
        all.addAll(inputs);
        all.addAll(outputs);
        all.addAll(inOuts);
        all.addAll(locals);
        all.addAll(temps);
        all.addAll(externals);
        return all;
    }

    public Optional<Variable> findVariable(String name) {
        return allVariables().stream()
                             .filter(variable -> variable.name().equals(name))
                             .findFirst();
    }

    public int variableCount() {
        return inputs.size() + outputs.size() + inOuts.size() + locals.size() + temps.size() + externals.size();
    }
}
