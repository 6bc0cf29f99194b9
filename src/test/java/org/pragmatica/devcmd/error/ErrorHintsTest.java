package org.pragmatica.devcmd.error;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.devcmd.error.Errors.syntax;
import static org.pragmatica.devcmd.error.Errors.token;

class ErrorHintsTest {

    @Test
    void categorize_knownMessages_mapToCategories() {
        assertThat(ErrorHints.categorize(syntax("a", 1, 1, "expected ':' after command name 'a'")))
            .contains(ErrorHints.Category.MISSING_COLON);
        assertThat(ErrorHints.categorize(syntax("a", 1, 1, "expected '=' after variable name 'a'")))
            .contains(ErrorHints.Category.MISSING_EQUALS);
        assertThat(ErrorHints.categorize(syntax("{", 1, 1, "unclosed block in command 'a'")))
            .contains(ErrorHints.Category.UNCLOSED_BRACE);
        assertThat(ErrorHints.categorize(syntax("(", 1, 1, "unclosed decorator arguments for '@retry'")))
            .contains(ErrorHints.Category.UNCLOSED_PAREN);
        assertThat(ErrorHints.categorize(syntax("x", 1, 1, "something else"))).isEmpty();
    }

    @Test
    void suggestionFor_dependsOnKind() {
        var duplicate = ParseError.duplicate(token("A", 2, 5), "duplicate variable 'A'", "variable declaration",
                                             "", token("A", 1, 5));
        var reference = ParseError.reference(token("X", 1, 10), "undefined variable 'X'", "decorator", "");

        assertThat(ErrorHints.suggestionFor(duplicate)).hasValueSatisfying(
            suggestion -> assertThat(suggestion).startsWith("Each variable can only be declared once"));
        assertThat(ErrorHints.suggestionFor(reference)).hasValueSatisfying(
            suggestion -> assertThat(suggestion).contains("@var()"));
        assertThat(ErrorHints.helpFor(reference)).contains(ErrorHints.Category.UNDEFINED_VARIABLE.help());
    }

    @Test
    void category_examples_areAvailable() {
        assertThat(ErrorHints.Category.MISSING_COLON.examples()).contains("build: echo hello");
        assertThat(ErrorHints.Category.DUPLICATE.examples()).isEmpty();
    }
}
