package org.pragmatica.devcmd.lexer;

import org.pragmatica.devcmd.tree.SourceLocation;
import org.pragmatica.devcmd.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Token source for devcmd files.
 *
 * <p>Produces a whitespace-classified stream: spacing, comments, line continuations and newlines
 * are kept as tokens so that later passes can rebuild the author's formatting. Offsets are UTF-8
 * byte offsets; columns count characters.
 */
public final class Lexer {
    private static final int MAX_INPUT_SIZE = 10_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final Pattern DURATION = Pattern.compile("\\d+(\\.\\d+)?(ns|us|ms|s|m|h)");

    private final String input;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;
    private int line;
    private int column;
    private int offset;
    private int tokenStart;
    private boolean statementStart;

    private Lexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
        this.offset = 0;
        this.statementStart = true;
    }

    public static List<Token> tokenize(String input) {
        Objects.requireNonNull(input, "input");
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new Lexer(input).tokenizeAll();
    }

    private List<Token> tokenizeAll() {
        while (!isAtEnd()) {
            emit(nextToken());
        }
        var end = currentLocation();
        tokens.add(new Token(TokenKind.EOF, "", "", SourceSpan.at(end)));
        return List.copyOf(tokens);
    }

    private void emit(Token token) {
        tokens.add(token);
        switch (token.kind()) {
            case NEWLINE, SEMICOLON -> statementStart = true;
            case WHITESPACE, COMMENT, BACKSLASH -> {}
            default -> statementStart = false;
        }
    }

    private Token nextToken() {
        var start = currentLocation();
        tokenStart = pos;
        char c = peek();

        if (c == '\n') {
            advance();
            return token(TokenKind.NEWLINE, start);
        }
        if (c == '\r' && peekAt(1) == '\n') {
            advance();
            advance();
            return token(TokenKind.NEWLINE, start);
        }
        if (isBlank(c)) {
            return scanWhitespace(start);
        }
        if (c == '#' && atTokenBoundary()) {
            return scanComment(start);
        }
        if (c == '\\' && isLineBreakAt(1)) {
            return scanContinuation(start);
        }
        if (c == '"' || c == '\'' || c == '`') {
            return scanString(start, c);
        }
        if (isDelimiter(c)) {
            advance();
            return token(punctuation(c), start);
        }
        if (Character.isISOControl(c)) {
            advance();
            return token(TokenKind.ILLEGAL, start);
        }
        return scanWord(start);
    }

    private Token scanWhitespace(SourceLocation start) {
        while (!isAtEnd() && isBlank(peek()) && !(peek() == '\r' && peekAt(1) == '\n')) {
            advance();
        }
        return token(TokenKind.WHITESPACE, start);
    }

    private Token scanComment(SourceLocation start) {
        while (!isAtEnd() && peek() != '\n' && !(peek() == '\r' && peekAt(1) == '\n')) {
            advance();
        }
        return token(TokenKind.COMMENT, start);
    }

    private Token scanContinuation(SourceLocation start) {
        advance();
        // backslash
        if (peek() == '\r') {
            advance();
        }
        advance();
        // newline
        return new Token(TokenKind.BACKSLASH, "\\", input.substring(tokenStart, pos), SourceSpan.of(start, currentLocation()));
    }

    private Token scanString(SourceLocation start, char quote) {
        advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != quote) {
            char c = peek();
            if (c == '\n') {
                return illegal(start);
            }
            if (c == '\\' && quote == '"' && pos + 1 < input.length()) {
                advance();
                sb.append(scanEscapeSequence());
            } else {
                sb.append(advance());
            }
        }
        if (isAtEnd()) {
            return illegal(start);
        }
        advance();
        // closing quote
        var raw = input.substring(tokenStart, pos);
        return new Token(TokenKind.STRING, sb.toString(), raw, SourceSpan.of(start, currentLocation()));
    }

    private char scanEscapeSequence() {
        char c = advance();
        return switch (c) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            default -> c;
        };
    }

    private Token illegal(SourceLocation start) {
        var raw = input.substring(tokenStart, pos);
        return new Token(TokenKind.ILLEGAL, raw, raw, SourceSpan.of(start, currentLocation()));
    }

    private Token scanWord(SourceLocation start) {
        while (!isAtEnd() && isWordPart()) {
            advance();
        }
        var text = input.substring(tokenStart, pos);
        return new Token(classifyWord(text), text, text, SourceSpan.of(start, currentLocation()));
    }

    private TokenKind classifyWord(String text) {
        if (statementStart) {
            if (text.equals("var")) {
                return TokenKind.VAR;
            }
            if (text.equals("watch")) {
                return TokenKind.WATCH;
            }
            if (text.equals("stop")) {
                return TokenKind.STOP;
            }
        }
        if (IDENTIFIER.matcher(text).matches()) {
            return TokenKind.IDENTIFIER;
        }
        if (NUMBER.matcher(text).matches()) {
            return TokenKind.NUMBER;
        }
        if (DURATION.matcher(text).matches()) {
            return TokenKind.DURATION;
        }
        return TokenKind.SHELL_TEXT;
    }

    private boolean isWordPart() {
        char c = peek();
        if (isBlank(c) || c == '\n' || isDelimiter(c) || c == '"' || c == '\'' || c == '`') {
            return false;
        }
        if (c == '\\') {
            return !isLineBreakAt(1);
        }
        return !Character.isISOControl(c);
    }

    private boolean atTokenBoundary() {
        if (tokens.isEmpty()) {
            return true;
        }
        var last = tokens.get(tokens.size() - 1).kind();
        return last == TokenKind.WHITESPACE || last == TokenKind.NEWLINE || last == TokenKind.BACKSLASH;
    }

    private static TokenKind punctuation(char c) {
        return switch (c) {
            case '@' -> TokenKind.AT;
            case ':' -> TokenKind.COLON;
            case '=' -> TokenKind.EQUALS;
            case ',' -> TokenKind.COMMA;
            case ';' -> TokenKind.SEMICOLON;
            case '*' -> TokenKind.ASTERISK;
            case '(' -> TokenKind.LPAREN;
            case ')' -> TokenKind.RPAREN;
            case '{' -> TokenKind.LBRACE;
            case '}' -> TokenKind.RBRACE;
            default -> TokenKind.ILLEGAL;
        };
    }

    private static boolean isDelimiter(char c) {
        return "@:=,;*(){}".indexOf(c) >= 0;
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f';
    }

    private boolean isLineBreakAt(int distance) {
        char c = peekAt(distance);
        return c == '\n' || (c == '\r' && peekAt(distance + 1) == '\n');
    }

    private Token token(TokenKind kind, SourceLocation start) {
        var text = input.substring(tokenStart, pos);
        return new Token(kind, text, text, SourceSpan.of(start, currentLocation()));
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekAt(int distance) {
        int index = pos + distance;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++);
        offset += utf8Length(c);
        if (c == '\n') {
            line++;
            column = 1;
        } else if (!Character.isLowSurrogate(c)) {
            column++;
        }
        return c;
    }

    private static int utf8Length(char c) {
        if (c < 0x80) {
            return 1;
        }
        if (c < 0x800) {
            return 2;
        }
        return Character.isSurrogate(c) ? 2 : 3;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, offset);
    }
}
