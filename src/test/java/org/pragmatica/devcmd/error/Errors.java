package org.pragmatica.devcmd.error;

import org.pragmatica.devcmd.lexer.Token;
import org.pragmatica.devcmd.lexer.TokenKind;
import org.pragmatica.devcmd.tree.SourceLocation;

final class Errors {
    private Errors() {}

    static Token token(String text, int line, int column) {
        return Token.of(TokenKind.IDENTIFIER, text, SourceLocation.at(line, column, 0));
    }

    static ParseError syntax(String text, int line, int column, String message) {
        return ParseError.syntax(token(text, line, column), message, "test", "");
    }
}
