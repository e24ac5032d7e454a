package org.pragmatica.plc.lexer;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reserved words. Matching is case-insensitive; each keyword belongs to the dialects listed for its group
 * unless it names its own.
 */
public enum Keyword {
    // Control flow
    IF(Group.CONTROL), THEN(Group.CONTROL), ELSIF(Group.CONTROL), ELSE(Group.CONTROL), END_IF(Group.CONTROL),
    CASE(Group.CONTROL), OF(Group.CONTROL), END_CASE(Group.CONTROL),
    FOR(Group.CONTROL), TO(Group.CONTROL), BY(Group.CONTROL), DO(Group.CONTROL), END_FOR(Group.CONTROL),
    WHILE(Group.CONTROL), END_WHILE(Group.CONTROL),
    REPEAT(Group.CONTROL), UNTIL(Group.CONTROL), END_REPEAT(Group.CONTROL),
    EXIT(Group.CONTROL), CONTINUE(Group.CONTROL), RETURN(Group.CONTROL),

    // Operators and literals
    AND(Group.OPERATOR), OR(Group.OPERATOR), XOR(Group.OPERATOR), NOT(Group.OPERATOR), MOD(Group.OPERATOR),
    TRUE(Group.LITERAL), FALSE(Group.LITERAL),
    NULL(Group.LITERAL, Dialect.GENERIC),

    // Program organization units
    FUNCTION(Group.POU), END_FUNCTION(Group.POU),
    FUNCTION_BLOCK(Group.POU), END_FUNCTION_BLOCK(Group.POU),
    PROGRAM(Group.POU), END_PROGRAM(Group.POU),
    TYPE(Group.POU), END_TYPE(Group.POU),
    STRUCT(Group.POU), END_STRUCT(Group.POU),
    ARRAY(Group.POU),

    // Variable sections
    VAR(Group.VARIABLES), VAR_INPUT(Group.VARIABLES), VAR_OUTPUT(Group.VARIABLES), VAR_IN_OUT(Group.VARIABLES),
    VAR_TEMP(Group.VARIABLES), VAR_GLOBAL(Group.VARIABLES), VAR_EXTERNAL(Group.VARIABLES),
    VAR_ACCESS(Group.VARIABLES, Dialect.GENERIC), VAR_CONFIG(Group.VARIABLES, Dialect.GENERIC),
    VAR_STAT(Group.VARIABLES, Dialect.SCL),
    END_VAR(Group.VARIABLES), CONSTANT(Group.VARIABLES), RETAIN(Group.VARIABLES), NON_RETAIN(Group.VARIABLES),
    AT(Group.VARIABLES, Dialect.GENERIC, Dialect.SCL),

    // Object orientation and namespaces
    CLASS(Group.OBJECTS), END_CLASS(Group.OBJECTS),
    INTERFACE(Group.OBJECTS), END_INTERFACE(Group.OBJECTS),
    METHOD(Group.OBJECTS), END_METHOD(Group.OBJECTS),
    EXTENDS(Group.OBJECTS), IMPLEMENTS(Group.OBJECTS),
    ABSTRACT(Group.OBJECTS), FINAL(Group.OBJECTS), OVERRIDE(Group.OBJECTS),
    PUBLIC(Group.OBJECTS), PROTECTED(Group.OBJECTS), PRIVATE(Group.OBJECTS), INTERNAL(Group.OBJECTS),
    THIS(Group.OBJECTS), SUPER(Group.OBJECTS), REF_TO(Group.OBJECTS),
    NAMESPACE(Group.OBJECTS), END_NAMESPACE(Group.OBJECTS), USING(Group.OBJECTS),

    // Siemens blocks
    DATA_BLOCK(Group.BLOCKS), END_DATA_BLOCK(Group.BLOCKS),
    ORGANIZATION_BLOCK(Group.BLOCKS), END_ORGANIZATION_BLOCK(Group.BLOCKS),
    BEGIN(Group.BLOCKS), REGION(Group.BLOCKS), END_REGION(Group.BLOCKS), GOTO(Group.BLOCKS),

    // Elementary types
    BOOL(Group.TYPES), BYTE(Group.TYPES), WORD(Group.TYPES), DWORD(Group.TYPES), LWORD(Group.TYPES),
    SINT(Group.TYPES), INT(Group.TYPES), DINT(Group.TYPES), LINT(Group.TYPES),
    USINT(Group.TYPES), UINT(Group.TYPES), UDINT(Group.TYPES), ULINT(Group.TYPES),
    REAL(Group.TYPES), LREAL(Group.TYPES),
    TIME(Group.TYPES), LTIME(Group.TYPES), DATE(Group.TYPES), LDATE(Group.TYPES),
    TIME_OF_DAY(Group.TYPES), TOD(Group.TYPES), LTOD(Group.TYPES), LTIME_OF_DAY(Group.TYPES),
    DATE_AND_TIME(Group.TYPES), DT(Group.TYPES), LDT(Group.TYPES), LDATE_AND_TIME(Group.TYPES),
    STRING(Group.TYPES), WSTRING(Group.TYPES), CHAR(Group.TYPES), WCHAR(Group.TYPES);

    public enum Group {
        CONTROL(EnumSet.allOf(Dialect.class)),
        OPERATOR(EnumSet.allOf(Dialect.class)),
        LITERAL(EnumSet.allOf(Dialect.class)),
        POU(EnumSet.allOf(Dialect.class)),
        VARIABLES(EnumSet.allOf(Dialect.class)),
        OBJECTS(EnumSet.of(Dialect.GENERIC)),
        BLOCKS(EnumSet.of(Dialect.SCL)),
        TYPES(EnumSet.allOf(Dialect.class));

        private final Set<Dialect> dialects;

        Group(Set<Dialect> dialects) {
            this.dialects = dialects;
        }
    }

    private static final Map<String, Keyword> BY_NAME = new HashMap<>();

    static {
        for (var keyword : values()) {
            BY_NAME.put(keyword.name(), keyword);
        }
    }

    private final Group group;
    private final Set<Dialect> dialects;

    Keyword(Group group, Dialect... dialects) {
        this.group = group;
        this.dialects = dialects.length == 0 ? group.dialects : EnumSet.of(dialects[0], dialects);
    }

    /**
     * Case-insensitive lookup restricted to the keywords of one dialect.
     */
    public static Optional<Keyword> lookup(String text, Dialect dialect) {
        var keyword = BY_NAME.get(text.toUpperCase(Locale.ROOT));

        if (keyword == null || !keyword.dialects.contains(dialect)) {
            return Optional.empty();
        }
        return Optional.of(keyword);
    }

    /**
     * Whether the text is a keyword in any dialect.
     */
    public static boolean isReserved(String text) {
        return BY_NAME.containsKey(text.toUpperCase(Locale.ROOT));
    }

    public Group group() {
        return group;
    }

    public boolean isAvailableIn(Dialect dialect) {
        return dialects.contains(dialect);
    }

    public boolean isTypeName() {
        return group == Group.TYPES;
    }

    /**
     * {@code END_*} keywords close a construct.
     */
    public boolean isBlockEnd() {
        return name().startsWith("END_");
    }
}
