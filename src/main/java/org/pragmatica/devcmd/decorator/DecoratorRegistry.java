package org.pragmatica.devcmd.decorator;

import java.util.Set;

/**
 * Classifies decorator names. The parser never hardcodes the decorator catalogue: whatever
 * registry it is given decides which {@code @name} occurrences are decorators and of which kind.
 */
public interface DecoratorRegistry {
    /**
     * Decorators that wrap a block, e.g. {@code @timeout(30s) { ... }}.
     */
    boolean isBlockDecorator(String name);

    /**
     * Expression-valued decorators, e.g. {@code @var(NAME)}.
     */
    boolean isFunctionDecorator(String name);

    /**
     * Decorators whose block holds {@code pattern: content} branches, e.g. {@code @when(ENV)}.
     */
    boolean isPatternDecorator(String name);

    default boolean knows(String name) {
        return isBlockDecorator(name) || isFunctionDecorator(name) || isPatternDecorator(name);
    }

    /**
     * Decorators that may be followed by a block.
     */
    default boolean takesBlock(String name) {
        return isBlockDecorator(name) || isPatternDecorator(name);
    }

    static DecoratorRegistry of(Set<String> block, Set<String> function, Set<String> pattern) {
        var blockNames = Set.copyOf(block);
        var functionNames = Set.copyOf(function);
        var patternNames = Set.copyOf(pattern);
        return new DecoratorRegistry() {
            @Override
            public boolean isBlockDecorator(String name) {
                return blockNames.contains(name);
            }

            @Override
            public boolean isFunctionDecorator(String name) {
                return functionNames.contains(name);
            }

            @Override
            public boolean isPatternDecorator(String name) {
                return patternNames.contains(name);
            }
        };
    }
}
