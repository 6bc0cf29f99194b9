package org.pragmatica.devcmd.ast;

import org.pragmatica.devcmd.tree.SourceSpan;

public record PatternBranch(Pattern pattern, CommandContent content, SourceSpan span) {}
