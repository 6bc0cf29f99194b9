package org.pragmatica.devcmd.ast;

import org.pragmatica.devcmd.tree.SourceSpan;

public record CommandDecl(String name, CommandType type, CommandBody body, SourceSpan span) {}
