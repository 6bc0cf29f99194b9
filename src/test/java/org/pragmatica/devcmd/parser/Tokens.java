package org.pragmatica.devcmd.parser;

import org.pragmatica.devcmd.lexer.Token;
import org.pragmatica.devcmd.lexer.TokenKind;
import org.pragmatica.devcmd.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds token sequences by hand, tracking positions, so both passes can be exercised without
 * the lexer.
 */
final class Tokens {
    private final List<Token> tokens = new ArrayList<>();
    private int line = 1;
    private int column = 1;
    private int offset = 0;

    private Tokens() {}

    static Tokens builder() {
        return new Tokens();
    }

    Tokens add(TokenKind kind, String text) {
        tokens.add(Token.of(kind, text, SourceLocation.at(line, column, offset)));
        column += text.length();
        offset += text.length();
        return this;
    }

    Tokens ident(String name) {
        return add(TokenKind.IDENTIFIER, name);
    }

    Tokens shellText(String text) {
        return add(TokenKind.SHELL_TEXT, text);
    }

    Tokens colon() {
        return add(TokenKind.COLON, ":");
    }

    Tokens space() {
        return add(TokenKind.WHITESPACE, " ");
    }

    /**
     * Leave a gap of {@code columns} without emitting a whitespace token.
     */
    Tokens skip(int columns) {
        column += columns;
        offset += columns;
        return this;
    }

    /**
     * Tokens so far; no EOF is appended, the parser adds one when missing.
     */
    List<Token> build() {
        return List.copyOf(tokens);
    }
}
