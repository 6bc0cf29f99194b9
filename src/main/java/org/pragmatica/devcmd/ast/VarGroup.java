package org.pragmatica.devcmd.ast;

import org.pragmatica.devcmd.tree.SourceSpan;

import java.util.List;

/**
 * Variables declared together in one {@code var ( ... )} group.
 */
public record VarGroup(List<VariableDecl> variables, SourceSpan span) {
    public VarGroup {
        variables = List.copyOf(variables);
    }
}
