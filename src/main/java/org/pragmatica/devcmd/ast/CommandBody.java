package org.pragmatica.devcmd.ast;

import org.pragmatica.devcmd.tree.SourceSpan;

/**
 * @param isBlock {@code true} for braced bodies, written or implied by a leading block decorator
 */
public record CommandBody(boolean isBlock, CommandContent content, SourceSpan span) {}
