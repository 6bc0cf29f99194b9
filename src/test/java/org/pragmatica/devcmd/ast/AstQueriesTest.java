package org.pragmatica.devcmd.ast;

import org.junit.jupiter.api.Test;
import org.pragmatica.devcmd.DevcmdParser;

import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class AstQueriesTest {
    private static final String SOURCE = """
        var DIR = ./src
        var OUT = dist
        build: @cwd(@var(DIR)) { make @var(OUT) }
        deploy: @when(ENV) {
          prod: echo @var(DIR)
          *: echo none
        }
        lint: golangci-lint run
        """;

    private final Program program = DevcmdParser.parse(SOURCE).program();

    @Test
    void findVariableReferences_searchesArgumentsBlocksAndBranches() {
        assertThat(AstQueries.findVariableReferences(program)).extracting(AstQueries::referencedName)
                                                             .extracting(name -> name.orElseThrow())
                                                             .containsExactly("DIR", "OUT", "DIR");
        assertThat(AstQueries.referencesTo(program, "DIR")).hasSize(2);
        assertThat(AstQueries.referencesTo(program, "MISSING")).isEmpty();
    }

    @Test
    void findDecorators_matchesBlockAndPatternDecorators() {
        assertThat(AstQueries.findDecorators(program, "cwd")).hasSize(1);
        assertThat(AstQueries.findDecorators(program, "when")).singleElement()
                                                              .satisfies(when -> assertThat(when.args()).hasSize(1));
        assertThat(AstQueries.findDecorators(program, "timeout")).isEmpty();
    }

    @Test
    void walk_visitsDeclarationsInOrder() {
        var visited = new ArrayList<String>();
        AstQueries.walk(program, new AstQueries.Visitor() {
            @Override
            public void variable(VariableDecl variable) {
                visited.add("var " + variable.name());
            }

            @Override
            public void command(CommandDecl command) {
                visited.add("cmd " + command.name());
            }
        });

        assertThat(visited).containsExactly("var DIR", "var OUT", "cmd build", "cmd deploy", "cmd lint");
    }

    @Test
    void patternBranch_findsLabelledBranch() {
        var deploy = program.command("deploy").orElseThrow().body().content();

        assertThat(AstQueries.patternBranch(deploy, "prod")).isPresent();
        assertThat(AstQueries.patternBranch(deploy, "*")).isPresent();
        assertThat(AstQueries.patternBranch(deploy, "dev")).isEmpty();
    }

    @Test
    void shellText_onlyForShellBodies() {
        assertThat(AstQueries.shellText(program.command("lint").orElseThrow().body())).contains("golangci-lint run");
        assertThat(AstQueries.shellText(program.command("build").orElseThrow().body())).isEmpty();
    }
}
