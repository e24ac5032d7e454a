package org.pragmatica.plc.model;

import java.util.List;

public record Resource(String name, List<Task> tasks, List<Variable> globalVars) {

    public Resource {
        tasks = List.copyOf(tasks);
        globalVars = List.copyOf(globalVars);
    }
}
