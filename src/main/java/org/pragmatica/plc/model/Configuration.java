package org.pragmatica.plc.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Top of the deployment hierarchy: resources with their tasks, plus configuration-wide globals.
 */
public record Configuration(String name, List<Resource> resources, List<Variable> globalVars) {

    public Configuration {
        resources = List.copyOf(resources);
        globalVars = List.copyOf(globalVars);
    }

    /**
     * Configuration globals followed by the globals of every resource.
     */
    public List<Variable> allGlobals() {
        var all = new ArrayList<Variable>(globalVars);
        resources.forEach(resource -> all.addAll(resource.globalVars()));
        return all;
    }

    public int taskCount() {
        return resources.stream().mapToInt(resource -> resource.tasks().size()).sum();
    }
}
