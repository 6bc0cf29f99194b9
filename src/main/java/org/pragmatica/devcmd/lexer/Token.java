package org.pragmatica.devcmd.lexer;

import org.pragmatica.devcmd.tree.SourceLocation;
import org.pragmatica.devcmd.tree.SourceSpan;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Immutable classified token.
 *
 * @param kind  token classification
 * @param value processed text (unescaped content for strings)
 * @param raw   text exactly as written in the source
 * @param span  source range, end exclusive
 */
public record Token(TokenKind kind, String value, String raw, SourceSpan span) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(span, "span");
    }

    public static Token of(TokenKind kind, String text, SourceLocation start) {
        var end = start.shift(text.codePointCount(0, text.length()), text.getBytes(StandardCharsets.UTF_8).length);
        return new Token(kind, text, text, SourceSpan.of(start, end));
    }

    public int line() {
        return span.start().line();
    }

    public int column() {
        return span.start().column();
    }

    public int endLine() {
        return span.end().line();
    }

    public int endColumn() {
        return span.end().column();
    }

    public int offset() {
        return span.start().offset();
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    @Override
    public String toString() {
        return kind + "('" + value + "')@" + span.start();
    }
}
