package org.pragmatica.plc.project;

/**
 * @param usage {@code Input}, {@code Output} or {@code InOut}
 */
public record AoiParameter(String name, String dataType, String usage) {}
