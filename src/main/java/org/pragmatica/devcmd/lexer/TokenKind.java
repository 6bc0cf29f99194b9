package org.pragmatica.devcmd.lexer;

/**
 * Token classification shared by the token source and both parser passes.
 */
public enum TokenKind {
    // Keywords, recognized only at statement start
    VAR,
    WATCH,
    STOP,

    // Literals and words
    IDENTIFIER,
    NUMBER,
    DURATION,
    STRING,
    SHELL_TEXT,

    // Punctuation
    AT,
    COLON,
    EQUALS,
    COMMA,
    SEMICOLON,
    ASTERISK,
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,

    // Layout
    BACKSLASH,
    COMMENT,
    WHITESPACE,
    NEWLINE,

    ILLEGAL,
    EOF;

    public boolean isKeyword() {
        return this == VAR || this == WATCH || this == STOP;
    }

    /**
     * Tokens that never carry meaning for structure: spacing, comments and line continuations.
     */
    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT || this == BACKSLASH;
    }

    /**
     * Tokens whose text may name something: identifiers, and keywords used as names.
     */
    public boolean isNameLike() {
        return this == IDENTIFIER || isKeyword();
    }
}
