package org.pragmatica.devcmd.parser;

import org.pragmatica.devcmd.lexer.Token;
import org.pragmatica.devcmd.lexer.TokenKind;
import org.pragmatica.devcmd.parser.StructureMap.ArgumentSpan;
import org.pragmatica.devcmd.parser.StructureMap.TokenRange;
import org.pragmatica.devcmd.tree.SourceLocation;
import org.pragmatica.devcmd.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Index arithmetic over a token sequence shared by both passes: skipping trivia, matching
 * delimiters, splitting statements and arguments, and measuring decorators.
 *
 * <p>A quoted string is always a single STRING token, so delimiter matching never looks inside
 * quotes.
 */
final class TokenRanges {
    private TokenRanges() {}

    /**
     * Shape of an {@code @name(args){block}} occurrence. Indices are -1 for absent parts.
     *
     * @param end     index of the last token of the decorator
     * @param problem description of an unclosed part, if any
     */
    record DecoratorShape(int atIndex, int nameIndex, String name, int openParen, int closeParen, int openBrace,
                          int closeBrace, int end, Optional<String> problem) {
        boolean hasArgs() {
            return openParen >= 0 && closeParen >= 0;
        }

        boolean hasBlock() {
            return openBrace >= 0 && closeBrace >= 0;
        }

        TokenRange args() {
            return new TokenRange(openParen + 1, closeParen - 1);
        }

        TokenRange block() {
            return new TokenRange(openBrace, closeBrace);
        }

        /**
         * Index of the problem token: the unclosed delimiter, or the name.
         */
        int problemIndex() {
            if (openBrace >= 0 && closeBrace < 0) {
                return openBrace;
            }
            if (openParen >= 0 && closeParen < 0) {
                return openParen;
            }
            return nameIndex;
        }
    }

    static List<Token> withEof(List<Token> tokens) {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).is(TokenKind.EOF)) {
            return tokens;
        }
        var copy = new ArrayList<>(tokens);
        var end = tokens.isEmpty()
                  ? SourceSpan.at(SourceLocation.START)
                  : SourceSpan.at(tokens.get(tokens.size() - 1).span().end());
        copy.add(new Token(TokenKind.EOF, "", "", end));
        return List.copyOf(copy);
    }

    /**
     * First index at or after {@code from} that is not whitespace, a comment or a continuation.
     */
    static int skipTrivia(List<Token> tokens, int from) {
        int i = from;
        while (i < tokens.size() - 1 && tokens.get(i).kind().isTrivia()) {
            i++;
        }
        return i;
    }

    /**
     * Like {@link #skipTrivia} but also crosses newlines.
     */
    static int skipLayout(List<Token> tokens, int from) {
        int i = from;
        while (i < tokens.size() - 1 && (tokens.get(i).kind().isTrivia() || tokens.get(i).is(TokenKind.NEWLINE))) {
            i++;
        }
        return i;
    }

    /**
     * Index of the NEWLINE or EOF ending the line that contains {@code from}.
     */
    static int lineEnd(List<Token> tokens, int from) {
        int i = from;
        while (i < tokens.size() - 1 && !tokens.get(i).is(TokenKind.NEWLINE)) {
            i++;
        }
        return i;
    }

    static int matchingBrace(List<Token> tokens, int open, int limit) {
        int depth = 0;
        for (int i = open; i <= limit && i < tokens.size(); i++) {
            var kind = tokens.get(i).kind();
            if (kind == TokenKind.LBRACE) {
                depth++;
            } else if (kind == TokenKind.RBRACE) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    static int matchingParen(List<Token> tokens, int open, int limit, boolean stopAtNewline) {
        int depth = 0;
        for (int i = open; i <= limit && i < tokens.size(); i++) {
            var kind = tokens.get(i).kind();
            if (kind == TokenKind.LPAREN) {
                depth++;
            } else if (kind == TokenKind.RPAREN) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            } else if (stopAtNewline && kind == TokenKind.NEWLINE) {
                return -1;
            }
        }
        return -1;
    }

    /**
     * Shrink a range so that it starts and ends on a significant token.
     */
    static TokenRange trim(List<Token> tokens, TokenRange range) {
        int start = range.start();
        int end = range.end();
        while (start <= end && isLayout(tokens.get(start))) {
            start++;
        }
        while (end >= start && isLayout(tokens.get(end))) {
            end--;
        }
        return start > end ? TokenRange.empty(range.start()) : new TokenRange(start, end);
    }

    /**
     * Statements of a block body, separated by a newline outside braces or a {@code ;} outside
     * braces and parentheses. Empty statements are dropped.
     */
    static List<TokenRange> splitStatements(List<Token> tokens, TokenRange range) {
        return split(tokens, range, true);
    }

    /**
     * Lines of a block body; {@code ;} does not separate. Used for pattern branches.
     */
    static List<TokenRange> splitLines(List<Token> tokens, TokenRange range) {
        return split(tokens, range, false);
    }

    private static List<TokenRange> split(List<Token> tokens, TokenRange range, boolean semicolons) {
        var result = new ArrayList<TokenRange>();
        int braces = 0;
        int parens = 0;
        int start = range.start();
        for (int i = range.start(); i <= range.end(); i++) {
            var kind = tokens.get(i).kind();
            boolean cut = false;
            switch (kind) {
                case LBRACE -> braces++;
                case RBRACE -> braces = Math.max(0, braces - 1);
                case LPAREN -> parens++;
                case RPAREN -> parens = Math.max(0, parens - 1);
                case NEWLINE -> {
                    if (braces == 0) {
                        parens = 0;
                        cut = true;
                    }
                }
                case SEMICOLON -> cut = semicolons && braces == 0 && parens == 0;
                default -> {}
            }
            if (cut) {
                addTrimmed(tokens, result, start, i - 1);
                start = i + 1;
            }
        }
        addTrimmed(tokens, result, start, range.end());
        return List.copyOf(result);
    }

    private static void addTrimmed(List<Token> tokens, List<TokenRange> result, int start, int end) {
        if (start > end) {
            return;
        }
        var trimmed = trim(tokens, new TokenRange(start, end));
        if (!trimmed.isEmpty()) {
            result.add(trimmed);
        }
    }

    /**
     * Decorator arguments split at top-level commas. {@code name = value} is a keyword argument
     * when the value is one token or a decorator call.
     */
    static List<ArgumentSpan> splitArguments(List<Token> tokens, TokenRange inner) {
        var result = new ArrayList<ArgumentSpan>();
        if (trim(tokens, inner).isEmpty()) {
            return List.of();
        }
        int depth = 0;
        int start = inner.start();
        for (int i = inner.start(); i <= inner.end(); i++) {
            var kind = tokens.get(i).kind();
            if (kind == TokenKind.LPAREN || kind == TokenKind.LBRACE) {
                depth++;
            } else if (kind == TokenKind.RPAREN || kind == TokenKind.RBRACE) {
                depth--;
            } else if (kind == TokenKind.COMMA && depth == 0) {
                argument(tokens, new TokenRange(start, i - 1)).ifPresent(result::add);
                start = i + 1;
            }
        }
        argument(tokens, new TokenRange(start, inner.end())).ifPresent(result::add);
        return List.copyOf(result);
    }

    private static Optional<ArgumentSpan> argument(List<Token> tokens, TokenRange piece) {
        var range = trim(tokens, piece);
        if (range.isEmpty()) {
            return Optional.empty();
        }
        var first = tokens.get(range.start());
        if (first.kind().isNameLike()) {
            int equals = skipTrivia(tokens, range.start() + 1);
            if (equals <= range.end() && tokens.get(equals).is(TokenKind.EQUALS)) {
                var value = trim(tokens, new TokenRange(equals + 1, range.end()));
                if (!value.isEmpty() && (value.size() == 1 || tokens.get(value.start()).is(TokenKind.AT))) {
                    return Optional.of(new ArgumentSpan(Optional.of(first.value()), value));
                }
            }
        }
        return Optional.of(new ArgumentSpan(Optional.empty(), range));
    }

    /**
     * Measure the decorator starting at {@code at}. Empty when the tokens there are not
     * {@code @} immediately followed by a valid name.
     *
     * @param takesBlock decides, by name, whether a following brace block belongs to the decorator
     */
    static Optional<DecoratorShape> shape(List<Token> tokens, int at, int limit, Predicate<String> takesBlock) {
        if (at + 1 > limit || !tokens.get(at).is(TokenKind.AT)) {
            return Optional.empty();
        }
        var nameToken = tokens.get(at + 1);
        if (!nameToken.kind().isNameLike() || !isValidIdentifier(nameToken.value())) {
            return Optional.empty();
        }
        var name = nameToken.value();
        int nameIndex = at + 1;
        int openParen = -1;
        int closeParen = -1;
        int cursor = nameIndex;

        if (nameIndex + 1 <= limit && tokens.get(nameIndex + 1).is(TokenKind.LPAREN)) {
            openParen = nameIndex + 1;
            closeParen = matchingParen(tokens, openParen, limit, true);
            if (closeParen < 0) {
                int end = Math.min(limit, lineEnd(tokens, openParen) - 1);
                return Optional.of(new DecoratorShape(at, nameIndex, name, openParen, -1, -1, -1, end,
                                                      Optional.of("unclosed decorator arguments for '@" + name + "'")));
            }
            cursor = closeParen;
        }
        if (takesBlock.test(name)) {
            int next = skipTrivia(tokens, cursor + 1);
            if (next <= limit && tokens.get(next).is(TokenKind.LBRACE)) {
                int close = matchingBrace(tokens, next, limit);
                if (close < 0) {
                    return Optional.of(new DecoratorShape(at, nameIndex, name, openParen, closeParen, next, -1, limit,
                                                          Optional.of("unclosed decorator block for '@" + name + "'")));
                }
                return Optional.of(new DecoratorShape(at, nameIndex, name, openParen, closeParen, next, close, close,
                                                      Optional.empty()));
            }
        }
        return Optional.of(new DecoratorShape(at, nameIndex, name, openParen, closeParen, -1, -1, cursor,
                                              Optional.empty()));
    }

    /**
     * Names start with a letter or underscore and continue with letters, digits, {@code _} or {@code -}.
     */
    static boolean isValidIdentifier(String name) {
        if (name.isEmpty()) {
            return false;
        }
        char first = name.charAt(0);
        if (!isAsciiLetter(first) && first != '_') {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!isAsciiLetter(c) && !(c >= '0' && c <= '9') && c != '_' && c != '-') {
                return false;
            }
        }
        return true;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isLayout(Token token) {
        return token.kind().isTrivia() || token.is(TokenKind.NEWLINE);
    }
}
