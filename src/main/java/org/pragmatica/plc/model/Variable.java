package org.pragmatica.plc.model;

import java.util.List;
import java.util.Optional;

/**
 * A variable of a POU interface or a global list. The data type is kept as written.
 */
public record Variable(String name,
                       String dataType,
                       VarClass varClass,
                       Optional<String> initialValue,
                       Optional<String> description,
                       Optional<String> address,
                       List<Integer> dimensions,
                       boolean constant,
                       boolean retain) {

    public Variable {
        dimensions = List.copyOf(dimensions);
    }

    public static Variable of(String name, String dataType, VarClass varClass) {
        return new Variable(name, dataType, varClass, Optional.empty(), Optional.empty(), Optional.empty(), List.of(),
                            false, false);
    }

    public static Variable local(String name, String dataType) {
        return of(name, dataType, VarClass.LOCAL);
    }

    public Variable withInitialValue(String value) {
        return new Variable(name, dataType, varClass, Optional.of(value), description, address, dimensions,
                            constant, retain);
    }

    public Variable withDescription(String value) {
        return new Variable(name, dataType, varClass, initialValue, Optional.of(value), address, dimensions,
                            constant, retain);
    }

    public Variable withAddress(String value) {
        return new Variable(name, dataType, varClass, initialValue, description, Optional.of(value), dimensions,
                            constant, retain);
    }

    public Variable withDimensions(List<Integer> value) {
        return new Variable(name, dataType, varClass, initialValue, description, address, value, constant, retain);
    }

    public Variable withVarClass(VarClass value) {
        return new Variable(name, dataType, value, initialValue, description, address, dimensions, constant, retain);
    }

    public Variable withFlags(boolean isConstant, boolean isRetain) {
        return new Variable(name, dataType, varClass, initialValue, description, address, dimensions, isConstant,
                            isRetain);
    }

    public boolean isArray() {
        return !dimensions.isEmpty();
    }

    /**
     * Number of elements; 1 for a scalar.
     */
    public long arraySize() {
        long size = 1;
        for (int dimension : dimensions) {
            size *= dimension;
        }
        return size;
    }
}
