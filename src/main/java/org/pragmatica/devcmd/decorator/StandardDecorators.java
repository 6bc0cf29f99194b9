package org.pragmatica.devcmd.decorator;

import java.util.Set;

/**
 * The decorators shipped with devcmd.
 */
public final class StandardDecorators {
    public static final Set<String> BLOCK = Set.of("timeout", "retry", "parallel", "confirm", "debounce",
                                                   "watch-files", "cwd");
    public static final Set<String> FUNCTION = Set.of("var", "sh", "env");
    public static final Set<String> PATTERN = Set.of("when", "try");

    private static final DecoratorRegistry REGISTRY = DecoratorRegistry.of(BLOCK, FUNCTION, PATTERN);

    private StandardDecorators() {}

    public static DecoratorRegistry registry() {
        return REGISTRY;
    }
}
