package org.pragmatica.devcmd;

import org.pragmatica.devcmd.analysis.VariableReferenceValidator;
import org.pragmatica.devcmd.decorator.DecoratorRegistry;
import org.pragmatica.devcmd.decorator.StandardDecorators;
import org.pragmatica.devcmd.error.ErrorCollector;
import org.pragmatica.devcmd.lexer.Lexer;
import org.pragmatica.devcmd.lexer.Token;
import org.pragmatica.devcmd.parser.AstBuilder;
import org.pragmatica.devcmd.parser.ParseResult;
import org.pragmatica.devcmd.parser.ParserConfig;
import org.pragmatica.devcmd.parser.Preprocessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for parsing devcmd files.
 *
 * <p>Example usage:
 * <pre>{@code
 * var result = DevcmdParser.parse("""
 *     var PORT = 8080
 *     serve: @timeout(30s) { go run . --port=@var(PORT) }
 *     """);
 *
 * if (result.hasErrors()) {
 *     System.err.println(result.formatReport());
 * }
 * }</pre>
 *
 * <p>A parser holds configuration only; every call parses independently.
 */
public final class DevcmdParser {
    private static final Logger log = LoggerFactory.getLogger(DevcmdParser.class);

    private final ParserConfig config;
    private final DecoratorRegistry registry;

    private DevcmdParser(ParserConfig config, DecoratorRegistry registry) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Parser with default configuration and the standard decorators.
     */
    public static DevcmdParser create() {
        return create(ParserConfig.DEFAULT, StandardDecorators.registry());
    }

    public static DevcmdParser create(ParserConfig config, DecoratorRegistry registry) {
        return new DevcmdParser(config, registry);
    }

    /**
     * Parse source text with the default parser.
     */
    public static ParseResult parse(String source) {
        return create().parseText(source);
    }

    /**
     * Parse a token sequence from any token source with the default parser.
     */
    public static ParseResult parse(List<Token> tokens) {
        return create().parseTokens(tokens);
    }

    public ParseResult parseText(String source) {
        var tokens = Lexer.tokenize(source);
        return run(tokens, Optional.of(source));
    }

    public ParseResult parseTokens(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        return run(List.copyOf(tokens), Optional.empty());
    }

    public ParserConfig config() {
        return config;
    }

    private ParseResult run(List<Token> tokens, Optional<String> source) {
        var errors = new ErrorCollector(config.maxErrors());
        var structure = Preprocessor.preprocess(tokens, registry, config, errors);
        var program = AstBuilder.build(tokens, structure, registry, errors);
        if (!config.allowUndefinedVariables()) {
            VariableReferenceValidator.validate(program, errors);
        }
        log.debug("Parsed {} tokens: {} variables, {} commands, {} errors",
                  tokens.size(), program.allVariables().size(), program.commands().size(), errors.size());
        return new ParseResult(program, errors.errors(), source);
    }

    /**
     * Create a builder for more complex parser configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxErrors = ParserConfig.DEFAULT.maxErrors();
        private boolean strictMode = ParserConfig.DEFAULT.strictMode();
        private boolean allowUndefinedVariables = ParserConfig.DEFAULT.allowUndefinedVariables();
        private DecoratorRegistry registry = StandardDecorators.registry();

        private Builder() {}

        public Builder maxErrors(int maxErrors) {
            this.maxErrors = maxErrors;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strictMode = strict;
            return this;
        }

        public Builder allowUndefinedVariables(boolean allow) {
            this.allowUndefinedVariables = allow;
            return this;
        }

        public Builder registry(DecoratorRegistry registry) {
            this.registry = registry;
            return this;
        }

        public DevcmdParser build() {
            return new DevcmdParser(new ParserConfig(maxErrors, strictMode, allowUndefinedVariables), registry);
        }
    }
}
