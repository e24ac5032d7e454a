package org.pragmatica.plc.model;

/**
 * Role of a variable in the neutral model.
 */
public enum VarClass {
    INPUT,
    OUTPUT,
    IN_OUT,
    LOCAL,
    TEMP,
    EXTERNAL,
    GLOBAL,
    CONFIG,
    ACCESS;

    public static VarClass fromDeclaration(org.pragmatica.plc.ast.VarClass declared) {
        return switch (declared) {
            case INPUT -> INPUT;
            case OUTPUT -> OUTPUT;
            case IN_OUT -> IN_OUT;
            case LOCAL -> LOCAL;
            case TEMP -> TEMP;
            case EXTERNAL -> EXTERNAL;
            case GLOBAL -> GLOBAL;
            case CONFIG -> CONFIG;
            case ACCESS -> ACCESS;
        };
    }

    /**
     * Map a vendor usage attribute such as {@code Input} or {@code InOut}; anything else gets {@code fallback}.
     */
    public static VarClass fromUsage(String usage, VarClass fallback) {
        if (usage == null) {
            return fallback;
        }
        return switch (usage) {
            case "Input" -> INPUT;
            case "Output" -> OUTPUT;
            case "InOut" -> IN_OUT;
            default -> fallback;
        };
    }
}
