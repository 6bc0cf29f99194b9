package org.pragmatica.devcmd.error;

import org.pragmatica.devcmd.lexer.Token;

import java.util.List;
import java.util.Objects;

/**
 * Diagnostic produced while parsing, anchored at the offending token.
 */
public sealed interface ParseError {
    ErrorKind kind();

    Token token();

    String message();

    /**
     * Short description of the construct being parsed, e.g. "command declaration".
     */
    String context();

    /**
     * Suggested fix, or an empty string.
     */
    String hint();

    /**
     * Tokens elsewhere in the source this error refers to.
     */
    List<Token> related();

    default int line() {
        return token().line();
    }

    default int column() {
        return token().column();
    }

    default boolean hasHint() {
        return !hint().isEmpty();
    }

    static ParseError syntax(Token token, String message, String context, String hint) {
        return new SyntaxError(token, message, context, hint);
    }

    static ParseError semantic(Token token, String message, String context, String hint) {
        return new SemanticError(token, message, context, hint);
    }

    static ParseError duplicate(Token token, String message, String context, String hint, Token previous) {
        return new DuplicateError(token, message, context, hint, List.of(previous));
    }

    static ParseError reference(Token token, String message, String context, String hint) {
        return new ReferenceError(token, message, context, hint);
    }

    /**
     * Malformed construct: missing colon, equals, brace or parenthesis, invalid name.
     */
    record SyntaxError(Token token, String message, String context, String hint) implements ParseError {
        public SyntaxError {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.SYNTAX;
        }

        @Override
        public List<Token> related() {
            return List.of();
        }
    }

    /**
     * Cross-construct mismatch, e.g. a block decorator with nothing to wrap.
     */
    record SemanticError(Token token, String message, String context, String hint) implements ParseError {
        public SemanticError {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.SEMANTIC;
        }

        @Override
        public List<Token> related() {
            return List.of();
        }
    }

    /**
     * Name collision within a uniqueness scope. {@code related} holds the first declaration.
     */
    record DuplicateError(Token token, String message, String context, String hint, List<Token> related)
        implements ParseError {
        public DuplicateError {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(message, "message");
            related = List.copyOf(related);
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.DUPLICATE;
        }
    }

    /**
     * Undefined variable or unknown decorator name.
     */
    record ReferenceError(Token token, String message, String context, String hint) implements ParseError {
        public ReferenceError {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.REFERENCE;
        }

        @Override
        public List<Token> related() {
            return List.of();
        }
    }
}
