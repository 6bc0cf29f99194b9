package org.pragmatica.devcmd.ast;

import org.pragmatica.devcmd.lexer.Token;
import org.pragmatica.devcmd.tree.SourceSpan;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Expression-valued decorator such as {@code @var(NAME)} or {@code @sh(make)}. Appears inline in
 * shell text or as an argument of another decorator.
 */
public record FunctionDecorator(String name, List<Argument> arguments, Token nameToken, SourceSpan span)
    implements ShellPart, Expression {

    public FunctionDecorator {
        arguments = List.copyOf(arguments);
    }

    public List<Expression> args() {
        return arguments.stream().map(Argument::value).toList();
    }

    @Override
    public String text() {
        return "@" + name + "(" + arguments.stream()
                                           .map(arg -> arg.value().text())
                                           .collect(Collectors.joining(", ")) + ")";
    }
}
