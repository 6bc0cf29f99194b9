package org.pragmatica.devcmd.ast;

import org.pragmatica.devcmd.tree.SourceSpan;

/**
 * Label of a pattern branch.
 */
public sealed interface Pattern {
    SourceSpan span();

    String label();

    record IdentifierPattern(String name, SourceSpan span) implements Pattern {
        @Override
        public String label() {
            return name;
        }
    }

    /**
     * The {@code *} branch, taken when no other label matches.
     */
    record Wildcard(SourceSpan span) implements Pattern {
        @Override
        public String label() {
            return "*";
        }
    }
}
