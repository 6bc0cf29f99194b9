package org.pragmatica.devcmd.ast;

import org.pragmatica.devcmd.tree.SourceSpan;

import java.util.Optional;

/**
 * @param group span of the enclosing {@code var ( ... )} group, if declared inside one
 */
public record VariableDecl(String name, Expression value, SourceSpan span, Optional<SourceSpan> group) {

    public boolean isGrouped() {
        return group.isPresent();
    }
}
