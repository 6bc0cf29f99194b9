package org.pragmatica.devcmd.error;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps error messages onto known mistake categories and the advice shown for them.
 */
public final class ErrorHints {
    private ErrorHints() {}

    /**
     * Mistake categories recognized from message text.
     */
    public enum Category {
        MISSING_COLON("Commands need a colon: 'build: echo hello'",
                      List.of("build: echo hello", "watch server: npm start", "stop server: pkill node")),
        MISSING_EQUALS("Variables need equals: 'var SRC = ./src'",
                       List.of("var SRC = ./src", "var PORT = 8080", "var ( SRC = ./src; PORT = 8080 )")),
        UNCLOSED_BRACE("Block commands need closing brace: { command1; command2 }",
                       List.of("setup: { npm install; npm run build }", "services: @parallel { server; client }")),
        UNCLOSED_PAREN("Decorators need closing parenthesis: @retry(3)",
                       List.of("@timeout(30s) { long-running-task }", "@retry(3) { flaky-command }")),
        UNDEFINED_VARIABLE("Declare variables before using: 'var NAME = value' then '@var(NAME)'",
                           List.of("build: cd @var(SRC)", "serve: go run @var(MAIN) --port=@var(PORT)")),
        INVALID_DECORATOR("Decorators start with @ and use parentheses: @timeout(30s)",
                          List.of("@timeout(30s) { long-running-task }", "@sh(echo hello && echo world)")),
        DUPLICATE("Each name can only be used once per type (but watch/stop can share names)", List.of());

        private final String help;
        private final List<String> examples;

        Category(String help, List<String> examples) {
            this.help = help;
            this.examples = examples;
        }

        public String help() {
            return help;
        }

        public List<String> examples() {
            return examples;
        }
    }

    public static Optional<Category> categorize(ParseError error) {
        var message = error.message().toLowerCase(Locale.ROOT);
        if (message.contains("expected ':'")) {
            return Optional.of(Category.MISSING_COLON);
        }
        if (message.contains("expected '='")) {
            return Optional.of(Category.MISSING_EQUALS);
        }
        if (message.contains("unclosed") && (message.contains("brace") || message.contains("block"))) {
            return Optional.of(Category.UNCLOSED_BRACE);
        }
        if (message.contains("unclosed") && (message.contains("paren") || message.contains("argument"))) {
            return Optional.of(Category.UNCLOSED_PAREN);
        }
        if (message.contains("undefined variable")) {
            return Optional.of(Category.UNDEFINED_VARIABLE);
        }
        if (message.contains("invalid decorator")) {
            return Optional.of(Category.INVALID_DECORATOR);
        }
        if (message.contains("duplicate")) {
            return Optional.of(Category.DUPLICATE);
        }
        return Optional.empty();
    }

    /**
     * One-line help text for the {@code help:} line of a diagnostic.
     */
    public static Optional<String> helpFor(ParseError error) {
        return categorize(error).map(Category::help);
    }

    /**
     * Broader fix suggestion used in the summary section of a report.
     */
    public static Optional<String> suggestionFor(ParseError error) {
        var message = error.message().toLowerCase(Locale.ROOT);
        return switch (error.kind()) {
            case SYNTAX -> syntaxSuggestion(message);
            case SEMANTIC -> message.contains("undefined variable")
                             ? Optional.of("Declare variables before using them: 'var VARIABLE_NAME = value'")
                             : Optional.empty();
            case DUPLICATE -> duplicateSuggestion(message);
            case REFERENCE -> referenceSuggestion(message);
        };
    }

    private static Optional<String> syntaxSuggestion(String message) {
        if (message.contains("expected ':'")) {
            return Optional.of("Commands must have a colon after the name: 'command-name: command-body'");
        }
        if (message.contains("expected '='")) {
            return Optional.of("Variables must have an equals sign: 'var NAME = value'");
        }
        if (message.contains("unclosed")) {
            if (message.contains("block") || message.contains("brace")) {
                return Optional.of("Every '{' must have a matching '}' - check your block commands");
            }
            if (message.contains("argument") || message.contains("paren") || message.contains("group")) {
                return Optional.of("Every '(' must have a matching ')' - check your decorators and @var() references");
            }
            if (message.contains("string")) {
                return Optional.of("Every quote must be closed - check your string literals");
            }
        }
        if (message.contains("invalid") && (message.contains("command name") || message.contains("variable name"))) {
            return Optional.of("Names must start with a letter and contain only letters, numbers, hyphens, and underscores");
        }
        return Optional.empty();
    }

    private static Optional<String> duplicateSuggestion(String message) {
        if (message.contains("variable")) {
            return Optional.of("Each variable can only be declared once - use different names or remove the duplicate");
        }
        if (message.contains("command")) {
            return Optional.of("Each command can only be declared once - use different names or combine the commands");
        }
        return Optional.empty();
    }

    private static Optional<String> referenceSuggestion(String message) {
        if (message.contains("undefined variable")) {
            return Optional.of("Make sure to declare the variable before using it with @var()");
        }
        if (message.contains("invalid decorator")) {
            return Optional.of("Check the decorator name against the registered block, function and pattern decorators");
        }
        return Optional.empty();
    }
}
