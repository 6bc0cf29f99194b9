package org.pragmatica.devcmd.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.pragmatica.devcmd.decorator.StandardDecorators;
import org.pragmatica.devcmd.error.ErrorCollector;
import org.pragmatica.devcmd.error.ErrorKind;
import org.pragmatica.devcmd.error.ParseError;
import org.pragmatica.devcmd.lexer.Lexer;
import org.pragmatica.devcmd.lexer.Token;
import org.pragmatica.devcmd.lexer.TokenKind;
import org.pragmatica.devcmd.parser.StructureMap.CommandSpan;
import org.pragmatica.devcmd.parser.StructureMap.DecoratorSpan;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PreprocessorTest {
    private List<Token> tokens;
    private ErrorCollector errors;

    private StructureMap preprocess(String source) {
        return preprocess(source, ParserConfig.DEFAULT);
    }

    private StructureMap preprocess(String source, ParserConfig config) {
        return preprocess(Lexer.tokenize(source), config);
    }

    private StructureMap preprocess(List<Token> input, ParserConfig config) {
        tokens = TokenRanges.withEof(input);
        errors = new ErrorCollector(config.maxErrors());
        return Preprocessor.preprocess(tokens, StandardDecorators.registry(), config, errors);
    }

    private String value(int index) {
        return tokens.get(index).value();
    }

    private List<String> messages() {
        return errors.errors().stream().map(ParseError::message).toList();
    }

    private String commandName(CommandSpan span) {
        return value(span.nameIndex());
    }

    private String decoratorName(DecoratorSpan span) {
        return value(span.nameIndex());
    }

    @Test
    void preprocess_singleVariable_recordsNameAndValue() {
        var map = preprocess("var SRC = ./src");

        assertThat(errors.errors()).isEmpty();
        assertThat(map.variables()).hasSize(1);
        var variable = map.variables().get(0);
        assertThat(value(variable.nameIndex())).isEqualTo("SRC");
        assertThat(variable.value().size()).isEqualTo(1);
        assertThat(value(variable.value().start())).isEqualTo("./src");
        assertThat(variable.grouped()).isFalse();
        assertThat(variable.group()).isEmpty();
    }

    @Test
    void preprocess_variableGroup_marksMembersGrouped() {
        var map = preprocess("var (\n  A = 1\n  B = 2\n)");

        assertThat(errors.errors()).isEmpty();
        assertThat(map.variables()).extracting(span -> value(span.nameIndex())).containsExactly("A", "B");
        assertThat(map.variables()).allMatch(StructureMap.VariableSpan::grouped);
        assertThat(map.variables().get(0).group()).isEqualTo(map.variables().get(1).group());
    }

    @Test
    void preprocess_variableGroupWithSemicolons_splitsMembers() {
        var map = preprocess("var ( A = 1; B = 2 )");

        assertThat(errors.errors()).isEmpty();
        assertThat(map.variables()).hasSize(2);
        var second = map.variables().get(1);
        assertThat(second.value().size()).isEqualTo(1);
        assertThat(value(second.value().start())).isEqualTo("2");
    }

    @Test
    void preprocess_simpleCommand_recordsLineBody() {
        var map = preprocess("build: echo hello");

        assertThat(map.commands()).hasSize(1);
        var command = map.commands().get(0);
        assertThat(commandName(command)).isEqualTo("build");
        assertThat(command.hasType()).isFalse();
        assertThat(command.block()).isFalse();
        assertThat(value(command.body().start())).isEqualTo("echo");
        assertThat(value(command.body().end())).isEqualTo("hello");
    }

    @Test
    void preprocess_explicitBlock_recordsStatements() {
        var map = preprocess("test: { a; b }");

        var command = map.commands().get(0);
        assertThat(command.block()).isTrue();
        assertThat(tokens.get(command.body().start()).kind()).isEqualTo(TokenKind.LBRACE);
        assertThat(map.blocks()).hasSize(1);
        assertThat(map.blocks().get(0).statements()).hasSize(2);
    }

    @Test
    void preprocess_blockDecoratorBody_isImplicitBlock() {
        var map = preprocess("deploy: @timeout(30s) { npm run build }");

        assertThat(errors.errors()).isEmpty();
        var command = map.commands().get(0);
        assertThat(command.block()).isTrue();
        assertThat(command.decorators()).isEmpty();
        assertThat(tokens.get(command.body().start()).kind()).isEqualTo(TokenKind.AT);

        assertThat(map.decorators()).hasSize(1);
        var timeout = map.decorators().get(0);
        assertThat(decoratorName(timeout)).isEqualTo("timeout");
        assertThat(timeout.args()).isPresent();
        assertThat(timeout.block()).isPresent();
        assertThat(timeout.arguments()).hasSize(1);
        assertThat(map.blocks()).hasSize(1);
    }

    @Test
    void preprocess_functionDecoratorBody_staysSimpleWithLeadingDecorator() {
        var map = preprocess("build: @sh(make)");

        var command = map.commands().get(0);
        assertThat(command.block()).isFalse();
        assertThat(command.decorators()).containsExactly(0);
        assertThat(decoratorName(map.decorators().get(0))).isEqualTo("sh");
    }

    @Test
    void preprocess_nestedDecorators_recordedOuterFirst() {
        var map = preprocess("build: @cwd(@var(DIR)) { make }");

        assertThat(map.decorators()).extracting(this::decoratorName).containsExactly("cwd", "var");
        assertThat(map.decorators().get(1).block()).isEmpty();
    }

    @Test
    void preprocess_patternBlock_splitsBranchesByLine() {
        var map = preprocess("deploy: @when(ENV) {\n  prod: a; b\n  dev: c\n}");

        assertThat(errors.errors()).isEmpty();
        assertThat(map.blocks()).hasSize(1);
        assertThat(map.blocks().get(0).statements()).hasSize(2);
    }

    @Test
    void preprocess_watchAndStop_areDistinctCommands() {
        var map = preprocess("watch server: npm start\nstop server: pkill node\nserver: echo ok");

        assertThat(errors.errors()).isEmpty();
        assertThat(map.commands()).hasSize(3);
        assertThat(map.commands()).extracting(span -> span.hasType() ? value(span.typeIndex()) : "")
                                  .containsExactly("watch", "stop", "");
    }

    @Test
    void preprocess_duplicateCommand_reportsAndKeepsFirst() {
        var map = preprocess("build: echo hello\nbuild: echo world");

        assertThat(map.commands()).hasSize(1);
        assertThat(value(map.commands().get(0).body().end())).isEqualTo("hello");
        assertThat(errors.errors()).hasSize(1);
        var error = errors.errors().get(0);
        assertThat(error.kind()).isEqualTo(ErrorKind.DUPLICATE);
        assertThat(error.message()).isEqualTo("duplicate command 'build'");
        assertThat(error.hint()).isEqualTo("previous declaration at line 1:1");
        assertThat(error.line()).isEqualTo(2);
        assertThat(error.related()).singleElement().satisfies(first -> assertThat(first.line()).isEqualTo(1));
    }

    @Test
    void preprocess_duplicateVariable_isReported() {
        var map = preprocess("var A = 1\nvar A = 2");

        assertThat(map.variables()).hasSize(1);
        assertThat(messages()).containsExactly("duplicate variable 'A'");
    }

    @Test
    void preprocess_duplicateWatch_namesCommandType() {
        preprocess("watch s: a\nwatch s: b");

        assertThat(messages()).containsExactly("duplicate watch command 's'");
    }

    @Test
    void preprocess_missingColon_reportsAndRecoversAtNextLine() {
        var map = preprocess("build echo hello\ntest: ok");

        assertThat(messages()).containsExactly("expected ':' after command name 'build'");
        assertThat(map.commands()).extracting(this::commandName).containsExactly("test");
    }

    @Test
    void preprocess_missingEquals_isReported() {
        preprocess("var A 1");

        assertThat(messages()).containsExactly("expected '=' after variable name 'A'");
    }

    @Test
    void preprocess_invalidVariableName_isReported() {
        preprocess("var 1abc = x");

        assertThat(messages()).containsExactly("invalid variable name '1abc'");
    }

    @Test
    void preprocess_missingVariableValue_isReported() {
        var map = preprocess("var A =");

        assertThat(map.variables()).isEmpty();
        assertThat(messages()).containsExactly("missing value for variable 'A'");
    }

    @Test
    void preprocess_unclosedBlock_resumesAtNextDeclaration() {
        var map = preprocess("test: { echo hello\nbuild: echo ok");

        assertThat(messages()).containsExactly("unclosed block in command 'test'");
        assertThat(map.commands()).extracting(this::commandName).containsExactly("build");
    }

    @Test
    void preprocess_unclosedDecoratorArguments_reportedOnce() {
        preprocess("build: @timeout(30s { x }");

        assertThat(messages()).containsExactly("unclosed decorator arguments for '@timeout'");
    }

    @Test
    void preprocess_unclosedString_isReported() {
        preprocess("build: echo \"oops");

        assertThat(messages()).containsExactly("unclosed string literal");
    }

    @Test
    void preprocess_strayClosingBrace_isSkipped() {
        var map = preprocess("}\nbuild: x");

        assertThat(messages()).containsExactly("unexpected '}'");
        assertThat(map.commands()).hasSize(1);
    }

    @Test
    void preprocess_unknownDecoratorInStrictMode_isReferenceError() {
        preprocess("build: echo @foo", new ParserConfig(10, true, true));

        assertThat(errors.errors()).singleElement().satisfies(error -> {
            assertThat(error.kind()).isEqualTo(ErrorKind.REFERENCE);
            assertThat(error.message()).isEqualTo("invalid decorator '@foo'");
        });
    }

    @Test
    void preprocess_unknownDecoratorInLenientMode_isText() {
        var map = preprocess("build: echo @foo");

        assertThat(errors.errors()).isEmpty();
        assertThat(map.decorators()).isEmpty();
    }

    @Test
    void preprocess_atInsideWord_isNotDecorator() {
        preprocess("mail: echo user@example.com", new ParserConfig(10, true, true));

        assertThat(errors.errors()).isEmpty();
    }

    @Test
    void preprocess_errorBudget_capsCollectedErrors() {
        preprocess("}\n}\n}\n}\n}\n", new ParserConfig(2, false, true));

        assertThat(errors.errors()).hasSize(2);
    }

    @Test
    @Timeout(5)
    void preprocess_garbageInput_terminates() {
        preprocess("} } { ( ) : = , * @ @ ;\n".repeat(50), new ParserConfig(1000, false, true));

        assertThat(errors.errors()).isNotEmpty();
    }

    @Test
    void preprocess_handBuiltTokens_withoutWhitespaceOrEof() {
        var input = Tokens.builder().ident("build").colon().skip(1).ident("echo").build();

        var map = preprocess(input, ParserConfig.DEFAULT);

        assertThat(errors.errors()).isEmpty();
        assertThat(map.commands()).hasSize(1);
        assertThat(map.commands().get(0).body().size()).isEqualTo(1);
    }
}
