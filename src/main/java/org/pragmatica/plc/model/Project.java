package org.pragmatica.plc.model;

import java.util.List;
import java.util.Optional;

/**
 * Vendor-neutral view of a PLC project.
 *
 * @param sourceFormat where the project came from, e.g. {@code SCL} or {@code L5X}
 */
public record Project(String name,
                      Optional<String> description,
                      List<DataTypeDef> dataTypes,
                      List<Pou> pous,
                      Optional<Configuration> configuration,
                      Optional<String> sourceFormat) {

    public Project {
        dataTypes = List.copyOf(dataTypes);
        pous = List.copyOf(pous);
    }

    public static Project of(String name, List<Pou> pous) {
        return new Project(name, Optional.empty(), List.of(), pous, Optional.empty(), Optional.empty());
    }

    public Optional<Pou> findPou(String pouName) {
        return pous.stream().filter(pou -> pou.name().equals(pouName)).findFirst();
    }

    public Optional<DataTypeDef> findDataType(String typeName) {
        return dataTypes.stream().filter(type -> type.name().equals(typeName)).findFirst();
    }

    public List<Pou> programs() {
        return ofKind(PouKind.PROGRAM);
    }

    public List<Pou> functionBlocks() {
        return ofKind(PouKind.FUNCTION_BLOCK);
    }

    public List<Pou> functions() {
        return ofKind(PouKind.FUNCTION);
    }

    private List<Pou> ofKind(PouKind kind) {
        return pous.stream().filter(pou -> pou.kind() == kind).toList();
    }
}
