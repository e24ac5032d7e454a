package org.pragmatica.plc.model;

/**
 * Generic IEC 61131-3 Structured Text. Classes become function blocks; methods and interfaces are not carried.
 */
public final class StToModel extends AstToModel {

    @Override
    protected String sourceFormat() {
        return "IEC 61131-3 ST";
    }
}
