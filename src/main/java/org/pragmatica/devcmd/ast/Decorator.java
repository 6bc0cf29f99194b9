package org.pragmatica.devcmd.ast;

import org.pragmatica.devcmd.lexer.Token;
import org.pragmatica.devcmd.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Block or pattern decorator. The content it wraps lives in the enclosing
 * {@link CommandContent.DecoratedContent} or {@link CommandContent.PatternContent}.
 */
public record Decorator(String name, List<Argument> arguments, Token nameToken, SourceSpan span) {

    public Decorator {
        arguments = List.copyOf(arguments);
    }

    public List<Expression> args() {
        return arguments.stream().map(Argument::value).toList();
    }

    public Optional<Expression> argument(String argumentName) {
        return arguments.stream()
                        .filter(arg -> arg.name().filter(argumentName::equals).isPresent())
                        .map(Argument::value)
                        .findFirst();
    }
}
