package org.pragmatica.devcmd.error;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.devcmd.error.Errors.syntax;

class QuickFixTest {

    @Test
    void generate_missingColon_addsColonAfterName() {
        var fixes = QuickFix.generate(List.of(syntax("build", 1, 1, "expected ':' after command name 'build'")),
                                      List.of("build echo hello"));

        assertThat(fixes).singleElement().satisfies(fix -> {
            assertThat(fix.confidence()).isEqualTo(0.9);
            assertThat(fix.applyTo("build echo hello")).isEqualTo("build: echo hello");
        });
    }

    @Test
    void generate_missingColonAfterWatch_targetsName() {
        var fixes = QuickFix.generate(List.of(syntax("server", 1, 7, "expected ':' after command name 'server'")),
                                      List.of("watch server npm start"));

        assertThat(fixes.get(0).applyTo("watch server npm start")).isEqualTo("watch server: npm start");
    }

    @Test
    void generate_missingEquals_insertsEquals() {
        var fixes = QuickFix.generate(List.of(syntax("1", 1, 7, "expected '=' after variable name 'A'")),
                                      List.of("var A 1"));

        assertThat(fixes).singleElement().satisfies(fix -> {
            assertThat(fix.confidence()).isEqualTo(0.8);
            assertThat(fix.applyTo("var A 1")).isEqualTo("var A = 1");
        });
    }

    @Test
    void generate_unclosedArguments_appendsParenthesis() {
        var line = "build: @retry(3";
        var fixes = QuickFix.generate(List.of(syntax("(", 1, 14, "unclosed decorator arguments for '@retry'")),
                                      List.of(line));

        assertThat(fixes).singleElement().satisfies(fix -> assertThat(fix.applyTo(line)).isEqualTo(line + ")"));
    }

    @Test
    void generate_lineOutsideSource_isSkipped() {
        var fixes = QuickFix.generate(List.of(syntax("build", 9, 1, "expected ':' after command name 'build'")),
                                      List.of("build echo hello"));

        assertThat(fixes).isEmpty();
    }

    @Test
    void applyTo_textNotFound_leavesLineUnchanged() {
        var fix = new QuickFix("rename", 1, "missing", "found", 0.5);

        assertThat(fix.applyTo("build: ok")).isEqualTo("build: ok");
    }
}
