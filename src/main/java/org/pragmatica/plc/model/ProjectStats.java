package org.pragmatica.plc.model;

/**
 * Counts over a {@link Project}.
 */
public record ProjectStats(int programs,
                           int functionBlocks,
                           int functions,
                           int totalPous,
                           int dataTypes,
                           int globalVars,
                           int totalVars,
                           int tasks) {

    public static ProjectStats fromProject(Project project) {
        int totalVars = project.pous().stream().mapToInt(pou -> pou.pouInterface().variableCount()).sum();
        int globals = project.configuration().map(config -> config.allGlobals().size()).orElse(0);
        int tasks = project.configuration().map(Configuration::taskCount).orElse(0);

        return new ProjectStats(project.programs().size(),
                                project.functionBlocks().size(),
                                project.functions().size(),
                                project.pous().size(),
                                project.dataTypes().size(),
                                globals,
                                totalVars,
                                tasks);
    }
}
