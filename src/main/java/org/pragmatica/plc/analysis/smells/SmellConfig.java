package org.pragmatica.plc.analysis.smells;

import java.util.Set;

/**
 * Thresholds for {@link SmellDetector}.
 *
 * @param maxNesting             deepest recommended nesting of control structures
 * @param maxFunctionLength      largest recommended statement count of a body, nested statements included
 * @param maxConditionComplexity largest recommended number of AND/OR/XOR operators in one condition
 * @param warnMagicNumbers       whether integer literals in code are reported
 * @param magicNumberExceptions  literals that are never reported
 */
public record SmellConfig(int maxNesting,
                          int maxFunctionLength,
                          int maxConditionComplexity,
                          boolean warnMagicNumbers,
                          Set<Long> magicNumberExceptions) {

    public static final SmellConfig DEFAULT = new SmellConfig(4, 50, 4, true, Set.of(-1L, 0L, 1L, 2L, 10L, 100L));

    public SmellConfig {
        if (maxNesting < 1 || maxFunctionLength < 1 || maxConditionComplexity < 1) {
            throw new IllegalArgumentException("Smell thresholds must be positive");
        }
        magicNumberExceptions = Set.copyOf(magicNumberExceptions);
    }

    public SmellConfig withMaxNesting(int value) {
        return new SmellConfig(value, maxFunctionLength, maxConditionComplexity, warnMagicNumbers,
                               magicNumberExceptions);
    }

    public SmellConfig withMaxFunctionLength(int value) {
        return new SmellConfig(maxNesting, value, maxConditionComplexity, warnMagicNumbers, magicNumberExceptions);
    }

    public SmellConfig withMaxConditionComplexity(int value) {
        return new SmellConfig(maxNesting, maxFunctionLength, value, warnMagicNumbers, magicNumberExceptions);
    }

    public SmellConfig withWarnMagicNumbers(boolean value) {
        return new SmellConfig(maxNesting, maxFunctionLength, maxConditionComplexity, value, magicNumberExceptions);
    }

    public SmellConfig withMagicNumberExceptions(Set<Long> value) {
        return new SmellConfig(maxNesting, maxFunctionLength, maxConditionComplexity, warnMagicNumbers, value);
    }

    public boolean isMagicNumber(long value) {
        return warnMagicNumbers && !magicNumberExceptions.contains(value);
    }
}
