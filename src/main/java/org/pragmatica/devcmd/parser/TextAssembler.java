package org.pragmatica.devcmd.parser;

import org.pragmatica.devcmd.ast.ShellPart;
import org.pragmatica.devcmd.lexer.Token;
import org.pragmatica.devcmd.lexer.TokenKind;
import org.pragmatica.devcmd.tree.SourceLocation;
import org.pragmatica.devcmd.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Rebuilds shell text from tokens with the author's spacing.
 *
 * <p>Between two tokens on the same line the whitespace written between them is kept exactly
 * (or, for token streams without whitespace tokens, one space per column of gap). A line break or
 * a {@code \}-continuation between them becomes a single space. Comments are dropped.
 */
final class TextAssembler {
    private final List<Token> tokens;
    private final StringBuilder text = new StringBuilder();
    private int previous = -1;
    private SourceLocation start;
    private SourceLocation end;

    TextAssembler(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Append the token at {@code index} preceded by the spacing that separates it from the
     * previously consumed token.
     */
    void token(int index) {
        var token = tokens.get(index);
        text.append(separatorBefore(index));
        extend(token.span());
        text.append(token.raw());
        previous = index;
    }

    /**
     * Append only the spacing in front of {@code index}, e.g. before a decorator that is not text.
     */
    void separator(int index) {
        text.append(separatorBefore(index));
    }

    /**
     * Append text taken from inside a token.
     */
    void piece(String value, SourceSpan span) {
        extend(span);
        text.append(value);
    }

    /**
     * Mark tokens up to {@code lastIndex} as consumed without adding text.
     */
    void consumed(int lastIndex) {
        previous = lastIndex;
    }

    Optional<ShellPart.TextPart> flush() {
        if (text.length() == 0) {
            return Optional.empty();
        }
        var location = start != null ? start : tokens.get(Math.max(previous, 0)).span().end();
        var part = new ShellPart.TextPart(text.toString(),
                                          SourceSpan.of(location, end != null ? end : location));
        text.setLength(0);
        start = null;
        end = null;
        return Optional.of(part);
    }

    String separatorBefore(int index) {
        if (previous < 0) {
            return "";
        }
        var prev = tokens.get(previous);
        var current = tokens.get(index);
        var spacing = new StringBuilder();
        boolean lineBreak = false;
        for (int k = previous + 1; k < index; k++) {
            var between = tokens.get(k);
            if (between.is(TokenKind.NEWLINE) || between.is(TokenKind.BACKSLASH)) {
                lineBreak = true;
            } else if (between.is(TokenKind.WHITESPACE)) {
                spacing.append(between.raw());
            }
        }
        if (lineBreak || current.line() != prev.endLine()) {
            return " ";
        }
        if (spacing.length() > 0) {
            return spacing.toString();
        }
        int gap = current.column() - prev.endColumn();
        return gap > 0 ? " ".repeat(gap) : "";
    }

    private void extend(SourceSpan span) {
        if (start == null) {
            start = span.start();
        }
        end = span.end();
    }
}
