package org.pragmatica.devcmd.ast;

import org.pragmatica.devcmd.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Root of the tree: every declaration of one devcmd file.
 */
public record Program(List<VariableDecl> variables, List<VarGroup> varGroups, List<CommandDecl> commands,
                      SourceSpan span) {

    public Program {
        variables = List.copyOf(variables);
        varGroups = List.copyOf(varGroups);
        commands = List.copyOf(commands);
    }

    /**
     * Grouped and ungrouped variables in source order.
     */
    public List<VariableDecl> allVariables() {
        var all = new ArrayList<>(variables);
        varGroups.forEach(group -> all.addAll(group.variables()));
        all.sort(Comparator.comparingInt(variable -> variable.span().start().offset()));
        return List.copyOf(all);
    }

    public Optional<VariableDecl> variable(String name) {
        return allVariables().stream()
                             .filter(variable -> variable.name().equals(name))
                             .findFirst();
    }

    public Optional<CommandDecl> command(String name, CommandType type) {
        return commands.stream()
                       .filter(command -> command.name().equals(name) && command.type() == type)
                       .findFirst();
    }

    public Optional<CommandDecl> command(String name) {
        return command(name, CommandType.COMMAND);
    }
}
