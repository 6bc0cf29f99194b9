package org.pragmatica.devcmd.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Traversal and lookup helpers over a {@link Program}.
 */
public final class AstQueries {
    private AstQueries() {}

    /**
     * Callbacks for {@link #walk(Program, Visitor)}; override the ones of interest.
     */
    public interface Visitor {
        default void variable(VariableDecl variable) {}

        default void command(CommandDecl command) {}

        default void content(CommandContent content) {}

        default void decorator(Decorator decorator) {}

        default void functionDecorator(FunctionDecorator decorator) {}

        default void expression(Expression expression) {}
    }

    /**
     * Depth-first, source-order walk over every declaration and nested node.
     */
    public static void walk(Program program, Visitor visitor) {
        for (var variable : program.allVariables()) {
            visitor.variable(variable);
            walkExpression(variable.value(), visitor);
        }
        for (var command : program.commands()) {
            visitor.command(command);
            walkContent(command.body().content(), visitor);
        }
    }

    public static void walkContent(CommandContent content, Visitor visitor) {
        visitor.content(content);
        if (content instanceof CommandContent.ShellContent shell) {
            for (var part : shell.parts()) {
                if (part instanceof FunctionDecorator decorator) {
                    walkExpression(decorator, visitor);
                }
            }
        } else if (content instanceof CommandContent.DecoratedContent decorated) {
            decorated.decorators().forEach(decorator -> walkDecorator(decorator, visitor));
            walkContent(decorated.content(), visitor);
        } else if (content instanceof CommandContent.PatternContent pattern) {
            walkDecorator(pattern.decorator(), visitor);
            pattern.branches().forEach(branch -> walkContent(branch.content(), visitor));
        } else if (content instanceof CommandContent.BlockContent block) {
            block.contents().forEach(nested -> walkContent(nested, visitor));
        }
    }

    private static void walkDecorator(Decorator decorator, Visitor visitor) {
        visitor.decorator(decorator);
        decorator.args().forEach(arg -> walkExpression(arg, visitor));
    }

    private static void walkExpression(Expression expression, Visitor visitor) {
        visitor.expression(expression);
        if (expression instanceof FunctionDecorator decorator) {
            visitor.functionDecorator(decorator);
            decorator.args().forEach(arg -> walkExpression(arg, visitor));
        }
    }

    public static List<Decorator> findDecorators(Program program, String name) {
        var found = new ArrayList<Decorator>();
        walk(program, new Visitor() {
            @Override
            public void decorator(Decorator decorator) {
                if (decorator.name().equals(name)) {
                    found.add(decorator);
                }
            }
        });
        return List.copyOf(found);
    }

    public static List<FunctionDecorator> findFunctionDecorators(Program program, String name) {
        var found = new ArrayList<FunctionDecorator>();
        walk(program, new Visitor() {
            @Override
            public void functionDecorator(FunctionDecorator decorator) {
                if (decorator.name().equals(name)) {
                    found.add(decorator);
                }
            }
        });
        return List.copyOf(found);
    }

    /**
     * Every {@code @var(...)} occurrence, in source order.
     */
    public static List<FunctionDecorator> findVariableReferences(Program program) {
        return findFunctionDecorators(program, "var");
    }

    /**
     * Name a {@code @var(...)} refers to, when its first argument is a plain name.
     */
    public static Optional<String> referencedName(FunctionDecorator reference) {
        if (reference.arguments().isEmpty()) {
            return Optional.empty();
        }
        var first = reference.arguments().get(0).value();
        if (first instanceof Expression.Identifier identifier) {
            return Optional.of(identifier.name());
        }
        if (first instanceof Expression.StringLiteral literal) {
            return Optional.of(literal.value());
        }
        return Optional.empty();
    }

    public static List<FunctionDecorator> referencesTo(Program program, String variableName) {
        return findVariableReferences(program).stream()
                                              .filter(ref -> referencedName(ref).filter(variableName::equals)
                                                                                .isPresent())
                                              .toList();
    }

    public static Optional<PatternBranch> patternBranch(CommandContent content, String label) {
        if (content instanceof CommandContent.PatternContent pattern) {
            return pattern.branch(label);
        }
        return Optional.empty();
    }

    /**
     * Shell text of a body whose content is a single shell line.
     */
    public static Optional<String> shellText(CommandBody body) {
        if (body.content() instanceof CommandContent.ShellContent shell) {
            return Optional.of(shell.text());
        }
        return Optional.empty();
    }
}
