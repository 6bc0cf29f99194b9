package org.pragmatica.devcmd.parser;

/**
 * Parser configuration options.
 *
 * @param maxErrors               error budget; parsing stops collecting once it is reached
 * @param strictMode              report unknown {@code @name} in decorator position instead of
 *                                treating it as shell text
 * @param allowUndefinedVariables when {@code false}, {@code @var(NAME)} without a matching
 *                                declaration is reported
 */
public record ParserConfig(int maxErrors, boolean strictMode, boolean allowUndefinedVariables) {
    public static final ParserConfig DEFAULT = new ParserConfig(10, false, true);

    public ParserConfig {
        if (maxErrors < 1) {
            throw new IllegalArgumentException("maxErrors must be positive, got " + maxErrors);
        }
    }
}
