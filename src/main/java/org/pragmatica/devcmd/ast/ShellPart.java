package org.pragmatica.devcmd.ast;

import org.pragmatica.devcmd.tree.SourceSpan;

/**
 * Element of a shell command line.
 */
public sealed interface ShellPart permits ShellPart.TextPart, FunctionDecorator {
    SourceSpan span();

    /**
     * Literal shell text with the author's spacing preserved.
     */
    record TextPart(String text, SourceSpan span) implements ShellPart {}
}
