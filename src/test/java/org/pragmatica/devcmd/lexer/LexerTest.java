package org.pragmatica.devcmd.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LexerTest {

    private static List<TokenKind> kinds(String input) {
        return Lexer.tokenize(input).stream().map(Token::kind).toList();
    }

    private static Token tokenWithValue(List<Token> tokens, String value) {
        return tokens.stream().filter(t -> t.value().equals(value)).findFirst().orElseThrow();
    }

    @Test
    void tokenize_simpleCommand_classifiesEveryToken() {
        assertThat(kinds("build: echo hello")).containsExactly(
            TokenKind.IDENTIFIER, TokenKind.COLON, TokenKind.WHITESPACE, TokenKind.IDENTIFIER,
            TokenKind.WHITESPACE, TokenKind.IDENTIFIER, TokenKind.EOF);
    }

    @Test
    void tokenize_keywords_onlyAtStatementStart() {
        var tokens = Lexer.tokenize("watch server: echo watch\nstop server: x");

        assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.WATCH);
        assertThat(tokens.get(2).kind()).isEqualTo(TokenKind.IDENTIFIER);
        assertThat(tokens.stream().filter(t -> t.value().equals("watch")).map(Token::kind))
            .containsExactly(TokenKind.WATCH, TokenKind.IDENTIFIER);
        assertThat(tokenWithValue(tokens, "stop").kind()).isEqualTo(TokenKind.STOP);
    }

    @Test
    void tokenize_literalWords_areClassified() {
        var tokens = Lexer.tokenize("var T = 30s 8080 1.5 ./src");

        assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.VAR);
        assertThat(tokenWithValue(tokens, "30s").kind()).isEqualTo(TokenKind.DURATION);
        assertThat(tokenWithValue(tokens, "8080").kind()).isEqualTo(TokenKind.NUMBER);
        assertThat(tokenWithValue(tokens, "1.5").kind()).isEqualTo(TokenKind.NUMBER);
        assertThat(tokenWithValue(tokens, "./src").kind()).isEqualTo(TokenKind.SHELL_TEXT);
    }

    @Test
    void tokenize_doubleQuotedString_unescapesValueAndKeepsRaw() {
        var token = Lexer.tokenize("\"a\\\"b\\tc\"").get(0);

        assertThat(token.kind()).isEqualTo(TokenKind.STRING);
        assertThat(token.value()).isEqualTo("a\"b\tc");
        assertThat(token.raw()).isEqualTo("\"a\\\"b\\tc\"");
    }

    @Test
    void tokenize_singleQuotedString_keepsBackslashes() {
        var token = Lexer.tokenize("'a\\nb'").get(0);

        assertThat(token.kind()).isEqualTo(TokenKind.STRING);
        assertThat(token.value()).isEqualTo("a\\nb");
    }

    @Test
    void tokenize_unterminatedString_isIllegal() {
        var tokens = Lexer.tokenize("echo \"oops\nnext");

        assertThat(tokens.get(2).kind()).isEqualTo(TokenKind.ILLEGAL);
        assertThat(tokens.get(2).raw()).isEqualTo("\"oops");
        assertThat(tokens.get(3).kind()).isEqualTo(TokenKind.NEWLINE);
    }

    @Test
    void tokenize_delimitersInsideString_stayInString() {
        assertThat(kinds("\"{ ( @x ; }\"")).containsExactly(TokenKind.STRING, TokenKind.EOF);
    }

    @Test
    void tokenize_lineContinuation_isSingleToken() {
        var tokens = Lexer.tokenize("echo a \\\n  b");

        assertThat(tokens).extracting(Token::kind).contains(TokenKind.BACKSLASH).doesNotContain(TokenKind.NEWLINE);
        var b = tokenWithValue(tokens, "b");
        assertThat(b.line()).isEqualTo(2);
        assertThat(b.column()).isEqualTo(3);
    }

    @Test
    void tokenize_comment_onlyAtTokenBoundary() {
        assertThat(kinds("# note\nx")).startsWith(TokenKind.COMMENT, TokenKind.NEWLINE);
        assertThat(kinds("a#b")).containsExactly(TokenKind.SHELL_TEXT, TokenKind.EOF);
    }

    @Test
    void tokenize_whitespaceRun_keepsExactText() {
        var tokens = Lexer.tokenize("a \t  b");

        assertThat(tokens.get(1).kind()).isEqualTo(TokenKind.WHITESPACE);
        assertThat(tokens.get(1).raw()).isEqualTo(" \t  ");
    }

    @Test
    void tokenize_crlf_isOneNewline() {
        var tokens = Lexer.tokenize("a\r\nb");

        assertThat(tokens.get(1).kind()).isEqualTo(TokenKind.NEWLINE);
        assertThat(tokens.get(1).raw()).isEqualTo("\r\n");
        assertThat(tokens.get(2).line()).isEqualTo(2);
    }

    @Test
    void tokenize_offsets_countUtf8Bytes() {
        var tokens = Lexer.tokenize("é x");
        var x = tokenWithValue(tokens, "x");

        assertThat(x.column()).isEqualTo(3);
        assertThat(x.offset()).isEqualTo(3);
    }

    @Test
    void tokenize_decoratorCall_splitsAtDelimiters() {
        assertThat(kinds("@timeout(30s)")).containsExactly(
            TokenKind.AT, TokenKind.IDENTIFIER, TokenKind.LPAREN, TokenKind.DURATION, TokenKind.RPAREN,
            TokenKind.EOF);
    }

    @Test
    void tokenize_endsWithEofAtEndPosition() {
        var tokens = Lexer.tokenize("ab\n");
        var eof = tokens.get(tokens.size() - 1);

        assertThat(eof.kind()).isEqualTo(TokenKind.EOF);
        assertThat(eof.line()).isEqualTo(2);
        assertThat(eof.column()).isEqualTo(1);
    }

    @Test
    void tokenize_oversizedInput_isRejected() {
        var input = "x".repeat(10_000_001);

        assertThatThrownBy(() -> Lexer.tokenize(input)).isInstanceOf(IllegalArgumentException.class);
    }
}
