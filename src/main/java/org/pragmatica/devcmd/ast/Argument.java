package org.pragmatica.devcmd.ast;

import java.util.Optional;

/**
 * Decorator argument; {@code name} is present for keyword arguments such as {@code attempts = 3}.
 */
public record Argument(Optional<String> name, Expression value) {

    public static Argument positional(Expression value) {
        return new Argument(Optional.empty(), value);
    }

    public static Argument named(String name, Expression value) {
        return new Argument(Optional.of(name), value);
    }
}
