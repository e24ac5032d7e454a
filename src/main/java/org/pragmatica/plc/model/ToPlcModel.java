package org.pragmatica.plc.model;

/**
 * Converts a parsed source of type {@code T} into the neutral model. Conversion is structural: declarations
 * and bodies are copied, not reinterpreted.
 */
@FunctionalInterface
public interface ToPlcModel<T> {

    Project toPlcModel(T source);
}
