package org.pragmatica.devcmd.parser;

import org.pragmatica.devcmd.ast.Argument;
import org.pragmatica.devcmd.ast.CommandBody;
import org.pragmatica.devcmd.ast.CommandContent;
import org.pragmatica.devcmd.ast.CommandContent.BlockContent;
import org.pragmatica.devcmd.ast.CommandContent.DecoratedContent;
import org.pragmatica.devcmd.ast.CommandContent.PatternContent;
import org.pragmatica.devcmd.ast.CommandContent.ShellContent;
import org.pragmatica.devcmd.ast.CommandDecl;
import org.pragmatica.devcmd.ast.CommandType;
import org.pragmatica.devcmd.ast.Decorator;
import org.pragmatica.devcmd.ast.Expression;
import org.pragmatica.devcmd.ast.FunctionDecorator;
import org.pragmatica.devcmd.ast.Pattern;
import org.pragmatica.devcmd.ast.PatternBranch;
import org.pragmatica.devcmd.ast.Program;
import org.pragmatica.devcmd.ast.ShellPart;
import org.pragmatica.devcmd.ast.VarGroup;
import org.pragmatica.devcmd.ast.VariableDecl;
import org.pragmatica.devcmd.decorator.DecoratorRegistry;
import org.pragmatica.devcmd.error.ErrorCollector;
import org.pragmatica.devcmd.error.ParseError;
import org.pragmatica.devcmd.lexer.Token;
import org.pragmatica.devcmd.lexer.TokenKind;
import org.pragmatica.devcmd.parser.StructureMap.BlockRange;
import org.pragmatica.devcmd.parser.StructureMap.CommandSpan;
import org.pragmatica.devcmd.parser.StructureMap.DecoratorSpan;
import org.pragmatica.devcmd.parser.StructureMap.StatementSpan;
import org.pragmatica.devcmd.parser.StructureMap.TokenRange;
import org.pragmatica.devcmd.parser.StructureMap.VariableSpan;
import org.pragmatica.devcmd.tree.SourceSpan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.pragmatica.devcmd.parser.TokenRanges.skipTrivia;
import static org.pragmatica.devcmd.parser.TokenRanges.trim;

/**
 * Second pass: materializes the {@link Program} from the tokens and the {@link StructureMap}.
 * Reads both inputs without modifying them.
 */
public final class AstBuilder {
    private static final String DECORATOR_CONTEXT = "decorator";
    private static final String PATTERN_CONTEXT = "pattern branch";

    private final List<Token> tokens;
    private final StructureMap map;
    private final DecoratorRegistry registry;
    private final ErrorCollector errors;
    private final Map<Integer, DecoratorSpan> decoratorsByAt;
    private final Map<Integer, BlockRange> blocksByOpen;

    private AstBuilder(List<Token> tokens, StructureMap map, DecoratorRegistry registry, ErrorCollector errors) {
        this.tokens = tokens;
        this.map = map;
        this.registry = registry;
        this.errors = errors;
        this.decoratorsByAt = map.decoratorsByAt();
        this.blocksByOpen = map.blocksByOpen();
    }

    public static Program build(List<Token> tokens,
                                StructureMap map,
                                DecoratorRegistry registry,
                                ErrorCollector errors) {
        return new AstBuilder(TokenRanges.withEof(tokens), map, registry, errors).program();
    }

    private Program program() {
        var ungrouped = new ArrayList<VariableDecl>();
        var grouped = new LinkedHashMap<TokenRange, List<VariableDecl>>();
        for (var span : map.variables()) {
            var variable = variable(span);
            if (span.group().isPresent()) {
                grouped.computeIfAbsent(span.group().get(), range -> new ArrayList<>()).add(variable);
            } else {
                ungrouped.add(variable);
            }
        }
        var groups = new ArrayList<VarGroup>();
        grouped.forEach((range, variables) -> groups.add(new VarGroup(variables, span(range))));

        var commands = new ArrayList<CommandDecl>();
        map.commands().forEach(span -> commands.add(command(span)));

        var whole = SourceSpan.of(tokens.get(0).span().start(), tokens.get(tokens.size() - 1).span().end());
        return new Program(ungrouped, groups, commands, whole);
    }

    private VariableDecl variable(VariableSpan span) {
        var name = tokens.get(span.nameIndex());
        var value = expression(span.value());
        return new VariableDecl(name.value(),
                                value,
                                SourceSpan.of(name.span().start(), tokens.get(span.value().end()).span().end()),
                                span.group().map(this::span));
    }

    private CommandDecl command(CommandSpan span) {
        var type = CommandType.COMMAND;
        if (span.hasType()) {
            type = tokens.get(span.typeIndex()).is(TokenKind.WATCH) ? CommandType.WATCH : CommandType.STOP;
        }
        var body = body(span);
        int first = span.hasType() ? span.typeIndex() : span.nameIndex();
        var end = span.body().isEmpty()
                  ? tokens.get(span.colonIndex()).span().end()
                  : tokens.get(span.body().end()).span().end();
        return new CommandDecl(tokens.get(span.nameIndex()).value(), type, body,
                               SourceSpan.of(tokens.get(first).span().start(), end));
    }

    private CommandBody body(CommandSpan span) {
        var range = span.body();
        if (range.isEmpty()) {
            var at = SourceSpan.at(tokens.get(span.colonIndex()).span().end());
            return new CommandBody(false, new ShellContent(List.of(), at), at);
        }
        if (!span.block()) {
            return new CommandBody(false, statementContent(range), span(range));
        }
        var content = tokens.get(range.start()).is(TokenKind.LBRACE)
                      ? blockContent(range.start(), range.end())
                      : statementContent(range);
        return new CommandBody(true, content, span(range));
    }

    // Blocks and statements

    /**
     * Content of {@code { ... }}: nothing yields an empty block, one statement yields that
     * statement's content, several yield a {@link BlockContent}.
     */
    private CommandContent blockContent(int open, int close) {
        var block = blocksByOpen.get(open);
        var statements = block != null
                         ? block.statements().stream().map(StatementSpan::range).toList()
                         : TokenRanges.splitStatements(tokens, new TokenRange(open + 1, close - 1));
        var contents = new ArrayList<CommandContent>();
        statements.forEach(range -> contents.add(statementContent(range)));
        if (contents.size() == 1) {
            return contents.get(0);
        }
        return new BlockContent(contents, span(new TokenRange(open, close)));
    }

    private CommandContent statementContent(TokenRange range) {
        if (range.isEmpty()) {
            return new ShellContent(List.of(), span(range));
        }
        var lead = decoratorsByAt.get(range.start());
        if (lead != null && registry.takesBlock(nameOf(lead))) {
            var decorated = decoratedContent(range);
            if (decorated.isPresent()) {
                return decorated.get();
            }
            return shellContent(range, false);
        }
        return shellContent(range, true);
    }

    /**
     * A statement led by block decorators: the chain wraps the block of its last decorator, or the
     * branches of a pattern decorator. Empty, with an error reported, when no block follows.
     */
    private Optional<CommandContent> decoratedContent(TokenRange range) {
        var chain = new ArrayList<Decorator>();
        var first = decoratorsByAt.get(range.start());
        int k = range.start();
        while (k <= range.end()) {
            var span = decoratorsByAt.get(k);
            if (span == null) {
                break;
            }
            var name = nameOf(span);
            if (registry.isPatternDecorator(name)) {
                if (span.block().isEmpty()) {
                    semantic(span.nameIndex(), "pattern decorator '@" + name + "' requires a block of branches",
                             "add branches: @" + name + "(...) { label: command }");
                    return Optional.empty();
                }
                checkTrailing(span.end(), range);
                var pattern = patternContent(span);
                return Optional.of(chain.isEmpty()
                                   ? pattern
                                   : new DecoratedContent(chain, pattern,
                                                          span(new TokenRange(range.start(), span.end()))));
            }
            if (!registry.isBlockDecorator(name)) {
                break;
            }
            chain.add(decorator(span));
            if (span.block().isPresent()) {
                checkTrailing(span.end(), range);
                var block = span.block().get();
                var inner = blockContent(block.start(), block.end());
                return Optional.of(new DecoratedContent(chain, inner, span(new TokenRange(range.start(), block.end()))));
            }
            k = skipTrivia(tokens, span.end() + 1);
        }
        var name = nameOf(first);
        semantic(first.nameIndex(), "block decorator '@" + name + "' requires a block",
                 "wrap the commands in braces: @" + name + "(...) { ... }");
        return Optional.empty();
    }

    private void checkTrailing(int end, TokenRange range) {
        int next = skipTrivia(tokens, end + 1);
        if (next <= range.end()) {
            errors.add(ParseError.syntax(tokens.get(next), "unexpected content after decorator block",
                                         DECORATOR_CONTEXT, "start a new statement with ';' or a new line"));
        }
    }

    // Patterns

    private PatternContent patternContent(DecoratorSpan span) {
        var block = span.block().orElseThrow();
        var recorded = blocksByOpen.get(block.start());
        var lines = recorded != null
                    ? recorded.statements().stream().map(StatementSpan::range).toList()
                    : TokenRanges.splitLines(tokens, new TokenRange(block.start() + 1, block.end() - 1));
        var branches = new ArrayList<PatternBranch>();
        var seen = new HashMap<String, Token>();
        for (var line : lines) {
            var branch = branch(line);
            if (branch.isEmpty()) {
                continue;
            }
            var label = branch.get().pattern().label();
            var labelToken = tokens.get(line.start());
            var previous = seen.putIfAbsent(label, labelToken);
            if (previous != null) {
                semantic(line.start(), "duplicate pattern '" + label + "' in @" + nameOf(span),
                         "previous branch at line " + previous.line() + ":" + previous.column());
                continue;
            }
            branches.add(branch.get());
        }
        return new PatternContent(decorator(span), branches, span(new TokenRange(span.atIndex(), block.end())));
    }

    private Optional<PatternBranch> branch(TokenRange line) {
        var first = tokens.get(line.start());
        Pattern pattern;
        if (first.is(TokenKind.ASTERISK)) {
            pattern = new Pattern.Wildcard(first.span());
        } else if (first.kind().isNameLike() && TokenRanges.isValidIdentifier(first.value())) {
            pattern = new Pattern.IdentifierPattern(first.value(), first.span());
        } else {
            syntax(line.start(), "invalid pattern '" + first.raw() + "'", "patterns are identifiers or '*'");
            return Optional.empty();
        }
        int colon = skipTrivia(tokens, line.start() + 1);
        if (colon > line.end() || !tokens.get(colon).is(TokenKind.COLON)) {
            syntax(Math.min(colon, line.end()), "expected ':' after pattern '" + pattern.label() + "'",
                   "write '" + pattern.label() + ": command'");
            return Optional.empty();
        }
        var contentRange = trim(tokens, new TokenRange(colon + 1, line.end()));
        if (contentRange.isEmpty()) {
            syntax(colon, "missing content for pattern '" + pattern.label() + "'",
                   "write a command after '" + pattern.label() + ":'");
            return Optional.empty();
        }
        CommandContent content;
        if (tokens.get(contentRange.start()).is(TokenKind.LBRACE)
            && TokenRanges.matchingBrace(tokens, contentRange.start(), contentRange.end()) == contentRange.end()) {
            content = blockContent(contentRange.start(), contentRange.end());
        } else {
            content = statementContent(contentRange);
        }
        return Optional.of(new PatternBranch(pattern, content, span(line)));
    }

    // Shell text

    private ShellContent shellContent(TokenRange range, boolean reportMisplaced) {
        var parts = new ArrayList<ShellPart>();
        var text = new TextAssembler(tokens);
        for (int i = range.start(); i <= range.end(); i++) {
            var token = tokens.get(i);
            if (token.kind().isTrivia() || token.is(TokenKind.NEWLINE)) {
                continue;
            }
            var decorator = decoratorsByAt.get(i);
            if (decorator != null) {
                var name = nameOf(decorator);
                if (registry.isFunctionDecorator(name)) {
                    text.separator(i);
                    text.flush().ifPresent(parts::add);
                    parts.add(functionDecorator(decorator));
                    text.consumed(decorator.end());
                    i = decorator.end();
                    continue;
                }
                if (reportMisplaced) {
                    semantic(decorator.nameIndex(), "decorator '@" + name + "' must start a statement",
                             "move '@" + name + "' to the start of the command or block statement");
                }
            }
            if ((token.is(TokenKind.STRING) || token.is(TokenKind.SHELL_TEXT)) && token.raw().indexOf('@') >= 0) {
                var segments = InlineDecoratorScanner.scan(token, registry);
                if (segments.stream().anyMatch(FunctionDecorator.class::isInstance)) {
                    text.separator(i);
                    for (var segment : segments) {
                        if (segment instanceof ShellPart.TextPart piece) {
                            text.piece(piece.text(), piece.span());
                        } else {
                            text.flush().ifPresent(parts::add);
                            parts.add(segment);
                        }
                    }
                    text.consumed(i);
                    continue;
                }
            }
            text.token(i);
        }
        text.flush().ifPresent(parts::add);
        return new ShellContent(parts, span(range));
    }

    // Decorators and expressions

    private Decorator decorator(DecoratorSpan span) {
        return new Decorator(nameOf(span), arguments(span), tokens.get(span.nameIndex()),
                             span(new TokenRange(span.atIndex(), span.headEnd())));
    }

    private FunctionDecorator functionDecorator(DecoratorSpan span) {
        return new FunctionDecorator(nameOf(span), arguments(span), tokens.get(span.nameIndex()),
                                     span(new TokenRange(span.atIndex(), span.end())));
    }

    private List<Argument> arguments(DecoratorSpan span) {
        var arguments = new ArrayList<Argument>();
        span.arguments().forEach(arg -> arguments.add(new Argument(arg.name(), expression(arg.value()))));
        return arguments;
    }

    /**
     * One token is classified as a literal; a whole-range decorator call becomes a
     * {@link FunctionDecorator}; anything else is kept as text.
     */
    Expression expression(TokenRange raw) {
        var range = trim(tokens, raw);
        if (range.isEmpty()) {
            return new Expression.StringLiteral("", "", span(raw));
        }
        if (range.size() == 1) {
            return literal(tokens.get(range.start()));
        }
        var recorded = decoratorsByAt.get(range.start());
        if (recorded != null && recorded.end() == range.end()) {
            return functionDecorator(recorded);
        }
        var derived = derivedDecorator(range);
        if (derived.isPresent()) {
            return derived.get();
        }
        var text = new TextAssembler(tokens);
        for (int i = range.start(); i <= range.end(); i++) {
            if (!tokens.get(i).kind().isTrivia() && !tokens.get(i).is(TokenKind.NEWLINE)) {
                text.token(i);
            }
        }
        var value = text.flush().map(ShellPart.TextPart::text).orElse("");
        return new Expression.StringLiteral(value, value, span(range));
    }

    private Expression literal(Token token) {
        return switch (token.kind()) {
            case STRING -> new Expression.StringLiteral(token.value(), token.raw(), token.span());
            case NUMBER -> new Expression.NumberLiteral(token.value(), token.span());
            case DURATION -> new Expression.DurationLiteral(token.value(), token.span());
            default -> LiteralClassifier.classify(token.value(), token.span());
        };
    }

    /**
     * Decorator call read straight from the tokens, for ranges the structure map has no entry for.
     */
    private Optional<Expression> derivedDecorator(TokenRange range) {
        var found = TokenRanges.shape(tokens, range.start(), range.end(), name -> false);
        if (found.isEmpty() || found.get().problem().isPresent() || found.get().end() != range.end()
            || !registry.knows(found.get().name())) {
            return Optional.empty();
        }
        var shape = found.get();
        var arguments = new ArrayList<Argument>();
        if (shape.hasArgs()) {
            TokenRanges.splitArguments(tokens, shape.args())
                       .forEach(arg -> arguments.add(new Argument(arg.name(), expression(arg.value()))));
        }
        return Optional.of(new FunctionDecorator(shape.name(), arguments, tokens.get(shape.nameIndex()),
                                                 span(range)));
    }

    // Helpers

    private String nameOf(DecoratorSpan span) {
        return tokens.get(span.nameIndex()).value();
    }

    private SourceSpan span(TokenRange range) {
        if (range.isEmpty()) {
            return SourceSpan.at(tokens.get(Math.min(range.start(), tokens.size() - 1)).span().start());
        }
        return SourceSpan.of(tokens.get(range.start()).span().start(), tokens.get(range.end()).span().end());
    }

    private void syntax(int index, String message, String hint) {
        errors.add(ParseError.syntax(tokens.get(index), message, PATTERN_CONTEXT, hint));
    }

    private void semantic(int index, String message, String hint) {
        errors.add(ParseError.semantic(tokens.get(index), message, DECORATOR_CONTEXT, hint));
    }
}
