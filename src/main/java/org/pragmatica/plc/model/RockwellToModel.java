package org.pragmatica.plc.model;

/**
 * Rockwell Structured Text units.
 */
public final class RockwellToModel extends AstToModel {

    @Override
    protected String sourceFormat() {
        return "Rockwell ST";
    }
}
