package org.pragmatica.devcmd.parser;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.pragmatica.devcmd.parser.TokenRanges.isValidIdentifier;
import static org.pragmatica.devcmd.parser.TokenRanges.lineEnd;
import static org.pragmatica.devcmd.parser.TokenRanges.matchingBrace;
import static org.pragmatica.devcmd.parser.TokenRanges.matchingParen;
import static org.pragmatica.devcmd.parser.TokenRanges.skipLayout;
import static org.pragmatica.devcmd.parser.TokenRanges.skipTrivia;
import static org.pragmatica.devcmd.parser.TokenRanges.trim;

/**
 * Structural pass: one forward scan over the tokens locating variables, commands, decorators and
 * blocks without building any tree.
 *
 * <p>Every malformed construct produces one error and the scan resumes at a recovery point
 * strictly after the current position, so the scan always terminates. After the scan, duplicate
 * variables and commands are reported and dropped from the map.
 */
public final class Preprocessor {
    private static final Logger log = LoggerFactory.getLogger(Preprocessor.class);

    private static final String VARIABLE_CONTEXT = "variable declaration";
    private static final String COMMAND_CONTEXT = "command declaration";
    private static final String DECORATOR_CONTEXT = "decorator";
    private static final String NAME_RULE = "names start with a letter or '_' and contain only letters, digits, '_' or '-'";

    private final List<Token> tokens;
    private final DecoratorRegistry registry;
    private final ErrorCollector errors;
    private final boolean strict;
    private final int eof;

    private final List<VariableSpan> variables = new ArrayList<>();
    private final List<CommandSpan> commands = new ArrayList<>();
    private final List<DecoratorSpan> decorators = new ArrayList<>();
    private final List<BlockRange> blocks = new ArrayList<>();
    private final Map<Integer, Integer> decoratorIndexByAt = new HashMap<>();
    private final Set<Integer> blockOpens = new HashSet<>();
    private final Set<Integer> reported = new HashSet<>();

    private Preprocessor(List<Token> tokens, DecoratorRegistry registry, ErrorCollector errors, boolean strict) {
        this.tokens = tokens;
        this.registry = registry;
        this.errors = errors;
        this.strict = strict;
        this.eof = tokens.size() - 1;
    }

    public static StructureMap preprocess(List<Token> tokens,
                                          DecoratorRegistry registry,
                                          ParserConfig config,
                                          ErrorCollector errors) {
        return new Preprocessor(TokenRanges.withEof(tokens), registry, errors, config.strictMode()).run();
    }

    private StructureMap run() {
        int i = 0;
        while (i < eof && !errors.isFull()) {
            i = Math.max(i + 1, topLevel(i));
        }
        validateDuplicates();
        blocks.sort(Comparator.comparingInt(BlockRange::openIndex));
        log.debug("Structure: {} variables, {} commands, {} decorators, {} blocks",
                  variables.size(), commands.size(), decorators.size(), blocks.size());
        return new StructureMap(variables, commands, decorators, blocks);
    }

    private int topLevel(int i) {
        var token = tokens.get(i);
        return switch (token.kind()) {
            case NEWLINE, WHITESPACE, COMMENT, BACKSLASH, SEMICOLON -> i + 1;
            case VAR -> variable(i);
            case WATCH, STOP -> typedCommand(i);
            case IDENTIFIER -> namedCommand(i);
            case NUMBER, DURATION, SHELL_TEXT, STRING -> strayWord(i);
            case ILLEGAL -> {
                reportIllegal(i);
                yield i + 1;
            }
            default -> unexpected(i);
        };
    }

    // Variables

    private int variable(int varIndex) {
        int next = skipTrivia(tokens, varIndex + 1);
        if (tokens.get(next).is(TokenKind.LPAREN)) {
            return group(next);
        }
        return single(next, eof, Optional.empty());
    }

    private int group(int open) {
        int close = matchingParen(tokens, open, eof, false);
        if (close < 0) {
            syntax(open, "unclosed variable group", VARIABLE_CONTEXT, "close the group with ')'");
            return synchronize(open);
        }
        var groupRange = Optional.of(new TokenRange(open, close));
        int k = open + 1;
        while (k < close && !errors.isFull()) {
            var token = tokens.get(k);
            if (isLayout(token) || token.is(TokenKind.SEMICOLON)) {
                k++;
                continue;
            }
            k = Math.max(k + 1, single(k, close, groupRange));
        }
        return close + 1;
    }

    /**
     * {@code NAME = VALUE} starting at {@code nameIndex}; returns the index of the terminator.
     */
    private int single(int nameIndex, int limit, Optional<TokenRange> group) {
        var nameToken = tokens.get(nameIndex);
        if (nameIndex >= limit || !isWord(nameToken)) {
            syntax(nameIndex, "expected variable name after 'var'", VARIABLE_CONTEXT, "write 'var NAME = value'");
            return recoverVariable(nameIndex, limit, group);
        }
        var name = nameToken.value();
        if (!isValidIdentifier(name)) {
            syntax(nameIndex, "invalid variable name '" + nameToken.raw() + "'", VARIABLE_CONTEXT, NAME_RULE);
            return recoverVariable(nameIndex, limit, group);
        }
        int equals = skipTrivia(tokens, nameIndex + 1);
        if (equals >= limit || !tokens.get(equals).is(TokenKind.EQUALS)) {
            syntax(equals, "expected '=' after variable name '" + name + "'", VARIABLE_CONTEXT,
                   "write 'var " + name + " = value'");
            return recoverVariable(equals, limit, group);
        }
        int end = valueEnd(equals + 1, limit);
        var value = trim(tokens, new TokenRange(equals + 1, end - 1));
        if (value.isEmpty()) {
            syntax(skipTrivia(tokens, equals + 1), "missing value for variable '" + name + "'", VARIABLE_CONTEXT,
                   "write 'var " + name + " = value'");
            return end;
        }
        variables.add(new VariableSpan(nameIndex, value, group.isPresent(), group));
        scanContent(value);
        return end;
    }

    private int valueEnd(int start, int limit) {
        int depth = 0;
        for (int i = start; i < limit; i++) {
            var kind = tokens.get(i).kind();
            if (kind == TokenKind.NEWLINE) {
                return i;
            }
            if (kind == TokenKind.LPAREN) {
                depth++;
            } else if (kind == TokenKind.RPAREN) {
                depth--;
            } else if (kind == TokenKind.SEMICOLON && depth <= 0) {
                return i;
            }
        }
        return limit;
    }

    private int recoverVariable(int from, int limit, Optional<TokenRange> group) {
        if (group.isEmpty()) {
            return synchronize(from);
        }
        int k = from;
        while (k < limit && !tokens.get(k).is(TokenKind.NEWLINE) && !tokens.get(k).is(TokenKind.SEMICOLON)) {
            k++;
        }
        return k;
    }

    // Commands

    private int typedCommand(int keywordIndex) {
        var keyword = tokens.get(keywordIndex);
        int next = skipTrivia(tokens, keywordIndex + 1);
        var nameToken = tokens.get(next);
        if (nameToken.is(TokenKind.COLON)) {
            return command(-1, keywordIndex, next);
        }
        if (isWord(nameToken)) {
            int colon = skipTrivia(tokens, next + 1);
            if (!tokens.get(colon).is(TokenKind.COLON)) {
                syntax(next, "expected ':' after command name '" + nameToken.raw() + "'", COMMAND_CONTEXT,
                       "add ':' after '" + nameToken.raw() + "'");
                return synchronize(next);
            }
            if (!isValidIdentifier(nameToken.value())) {
                syntax(next, "invalid command name '" + nameToken.raw() + "'", COMMAND_CONTEXT, NAME_RULE);
                return skipBody(colon);
            }
            return command(keywordIndex, next, colon);
        }
        syntax(next, "expected command name after '" + keyword.value() + "'", COMMAND_CONTEXT,
               "write '" + keyword.value() + " NAME: command'");
        return synchronize(keywordIndex);
    }

    private int namedCommand(int nameIndex) {
        var nameToken = tokens.get(nameIndex);
        int colon = skipTrivia(tokens, nameIndex + 1);
        if (!tokens.get(colon).is(TokenKind.COLON)) {
            syntax(nameIndex, "expected ':' after command name '" + nameToken.value() + "'", COMMAND_CONTEXT,
                   "add ':' after '" + nameToken.value() + "'");
            return synchronize(nameIndex);
        }
        return command(-1, nameIndex, colon);
    }

    private int strayWord(int index) {
        var token = tokens.get(index);
        int colon = skipTrivia(tokens, index + 1);
        if (tokens.get(colon).is(TokenKind.COLON)) {
            syntax(index, "invalid command name '" + token.raw() + "'", COMMAND_CONTEXT, NAME_RULE);
            return skipBody(colon);
        }
        syntax(index, "unexpected '" + token.raw() + "'", COMMAND_CONTEXT,
               "declarations start with 'var', 'watch', 'stop' or a command name followed by ':'");
        return synchronize(index);
    }

    private int unexpected(int index) {
        var token = tokens.get(index);
        switch (token.kind()) {
            case AT -> syntax(index, "unexpected decorator outside of a command", COMMAND_CONTEXT,
                              "decorators belong in a command body: 'name: @decorator(...) { ... }'");
            case LBRACE -> {
                syntax(index, "unexpected '{' outside of a command", COMMAND_CONTEXT,
                       "blocks belong to a command: 'name: { ... }'");
                int close = matchingBrace(tokens, index, eof);
                return close < 0 ? synchronize(index) : close + 1;
            }
            case RBRACE -> syntax(index, "unexpected '}'", COMMAND_CONTEXT, "no block is open here");
            default -> syntax(index, "unexpected '" + token.raw() + "'", COMMAND_CONTEXT, "");
        }
        return synchronize(index);
    }

    private int command(int typeIndex, int nameIndex, int colonIndex) {
        int start = skipTrivia(tokens, colonIndex + 1);
        var first = tokens.get(start);
        if (first.is(TokenKind.NEWLINE) || first.is(TokenKind.EOF)) {
            int ahead = skipLayout(tokens, start);
            if (!tokens.get(ahead).is(TokenKind.LBRACE)) {
                commands.add(new CommandSpan(typeIndex, nameIndex, colonIndex, TokenRange.empty(colonIndex + 1),
                                             false, List.of()));
                return start;
            }
            start = ahead;
            first = tokens.get(start);
        }
        if (first.is(TokenKind.LBRACE)) {
            return explicitBlock(typeIndex, nameIndex, colonIndex, start);
        }
        if (first.is(TokenKind.AT)) {
            var implicitEnd = implicitBlock(typeIndex, nameIndex, colonIndex, start);
            if (implicitEnd.isPresent()) {
                return implicitEnd.get();
            }
        }
        return simpleBody(typeIndex, nameIndex, colonIndex, start);
    }

    private int explicitBlock(int typeIndex, int nameIndex, int colonIndex, int open) {
        int close = matchingBrace(tokens, open, eof);
        if (close < 0) {
            syntax(open, "unclosed block in command '" + tokens.get(nameIndex).value() + "'", COMMAND_CONTEXT,
                   "add a closing '}'");
            return recoverTopLevel(open);
        }
        recordBlock(open, close, false);
        commands.add(new CommandSpan(typeIndex, nameIndex, colonIndex, new TokenRange(open, close), true, List.of()));
        return afterBlock(close);
    }

    /**
     * {@code name: @a(x) @b(y) { ... }} is sugar for {@code name: { @a(x) @b(y) { ... } }}: a chain
     * of block decorators ending in a block becomes the whole body and no decorators are attached
     * to the command itself. Empty when the body does not have that shape.
     */
    private Optional<Integer> implicitBlock(int typeIndex, int nameIndex, int colonIndex, int start) {
        int k = start;
        while (true) {
            var name = tokens.get(Math.min(k + 1, eof)).value();
            if (!registry.knows(name)) {
                return Optional.empty();
            }
            var found = TokenRanges.shape(tokens, k, eof, registry::takesBlock);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            var shape = found.get();
            if (shape.problem().isPresent()) {
                if (shape.openBrace() < 0) {
                    return Optional.empty();
                }
                reportOnce(shape.problemIndex(), shape.problem().get(), "add a closing '}'");
                return Optional.of(recoverTopLevel(shape.openBrace()));
            }
            if (shape.hasBlock()) {
                var body = new TokenRange(start, shape.closeBrace());
                scanContent(body);
                commands.add(new CommandSpan(typeIndex, nameIndex, colonIndex, body, true, List.of()));
                return Optional.of(afterBlock(shape.closeBrace()));
            }
            if (!registry.isBlockDecorator(shape.name())) {
                return Optional.empty();
            }
            int next = skipTrivia(tokens, shape.end() + 1);
            if (!tokens.get(next).is(TokenKind.AT)) {
                return Optional.empty();
            }
            k = next;
        }
    }

    private int simpleBody(int typeIndex, int nameIndex, int colonIndex, int start) {
        int end = lineEnd(tokens, start);
        var body = trim(tokens, new TokenRange(start, end - 1));
        scanContent(body);
        var leading = new ArrayList<Integer>();
        int k = body.start();
        while (!body.isEmpty() && k <= body.end() && decoratorIndexByAt.containsKey(k)) {
            int index = decoratorIndexByAt.get(k);
            leading.add(index);
            k = skipTrivia(tokens, decorators.get(index).end() + 1);
        }
        commands.add(new CommandSpan(typeIndex, nameIndex, colonIndex, body, false, leading));
        return end;
    }

    private int afterBlock(int close) {
        int next = skipTrivia(tokens, close + 1);
        var token = tokens.get(next);
        if (token.is(TokenKind.NEWLINE) || token.is(TokenKind.EOF) || token.is(TokenKind.SEMICOLON)) {
            return next;
        }
        syntax(next, "unexpected content after block", COMMAND_CONTEXT, "start the next command on a new line");
        return synchronize(next);
    }

    private int skipBody(int colon) {
        int start = skipTrivia(tokens, colon + 1);
        if (tokens.get(start).is(TokenKind.LBRACE)) {
            int close = matchingBrace(tokens, start, eof);
            if (close >= 0) {
                return close + 1;
            }
        }
        return synchronize(colon);
    }

    // Decorators and blocks

    /**
     * Record every registered decorator in the range, reporting lexical problems on the way.
     */
    private void scanContent(TokenRange range) {
        for (int i = range.start(); i <= range.end(); i++) {
            var token = tokens.get(i);
            if (token.is(TokenKind.ILLEGAL)) {
                reportIllegal(i);
            } else if (token.is(TokenKind.AT)) {
                i = Math.max(i, decorator(i, range.end()));
            }
        }
    }

    /**
     * Record the decorator at {@code at}, once; returns the index of its last token, or
     * {@code at} when nothing was recorded.
     */
    private int decorator(int at, int limit) {
        var known = decoratorIndexByAt.get(at);
        if (known != null) {
            return decorators.get(known).end();
        }
        if (at + 1 > limit || !tokens.get(at + 1).kind().isNameLike()) {
            return at;
        }
        var name = tokens.get(at + 1).value();
        if (!registry.knows(name)) {
            if (strict && inDecoratorPosition(at)) {
                report(ParseError.reference(tokens.get(at), "invalid decorator '@" + name + "'", DECORATOR_CONTEXT,
                                            "'" + name + "' is not a registered decorator"));
            }
            return at;
        }
        var found = TokenRanges.shape(tokens, at, limit, registry::takesBlock);
        if (found.isEmpty()) {
            return at;
        }
        var shape = found.get();
        if (shape.problem().isPresent()) {
            reportOnce(shape.problemIndex(), shape.problem().get(),
                       shape.openBrace() >= 0 ? "add a closing '}'" : "add a closing ')' on the same line");
            return shape.end();
        }
        Optional<TokenRange> args = shape.hasArgs() ? Optional.of(shape.args()) : Optional.empty();
        Optional<TokenRange> block = shape.hasBlock() ? Optional.of(shape.block()) : Optional.empty();
        var arguments = args.map(range -> TokenRanges.splitArguments(tokens, range)).orElse(List.of());

        decoratorIndexByAt.put(at, decorators.size());
        decorators.add(new DecoratorSpan(at, shape.nameIndex(), args, block, arguments));

        args.ifPresent(this::scanContent);
        block.ifPresent(range -> recordBlock(range.start(), range.end(), registry.isPatternDecorator(name)));
        return shape.end();
    }

    private void recordBlock(int open, int close, boolean patternBranches) {
        if (!blockOpens.add(open)) {
            return;
        }
        var inner = new TokenRange(open + 1, close - 1);
        scanContent(inner);
        var ranges = patternBranches
                     ? TokenRanges.splitLines(tokens, inner)
                     : TokenRanges.splitStatements(tokens, inner);
        var statements = new ArrayList<StatementSpan>();
        for (var range : ranges) {
            statements.add(new StatementSpan(range, decoratorIndexByAt.getOrDefault(range.start(), -1)));
        }
        blocks.add(new BlockRange(open, close, inner, statements));
    }

    private boolean inDecoratorPosition(int at) {
        if (at == 0) {
            return true;
        }
        return switch (tokens.get(at - 1).kind()) {
            case WHITESPACE, NEWLINE, BACKSLASH, COLON, LBRACE, LPAREN, COMMA, EQUALS, SEMICOLON -> true;
            default -> false;
        };
    }

    // Recovery

    /**
     * Index after the next newline, or of the next keyword, whichever comes first. Always greater
     * than {@code from}.
     */
    int synchronize(int from) {
        for (int k = from + 1; k < eof; k++) {
            if (tokens.get(k - 1).is(TokenKind.NEWLINE) || tokens.get(k).kind().isKeyword()) {
                return k;
            }
        }
        return eof;
    }

    /**
     * After an unclosed brace: resume at the next line that starts in column 1 with a declaration.
     */
    private int recoverTopLevel(int from) {
        for (int k = from + 1; k < eof; k++) {
            if (tokens.get(k - 1).is(TokenKind.NEWLINE) && tokens.get(k).column() == 1 && startsDeclaration(k)) {
                return k;
            }
        }
        return eof;
    }

    private boolean startsDeclaration(int index) {
        var token = tokens.get(index);
        if (token.kind().isKeyword()) {
            return true;
        }
        return token.is(TokenKind.IDENTIFIER) && tokens.get(skipTrivia(tokens, index + 1)).is(TokenKind.COLON);
    }

    // Duplicates

    private void validateDuplicates() {
        var seenVariables = new HashMap<String, Token>();
        var keptVariables = new ArrayList<VariableSpan>();
        for (var span : variables) {
            var name = tokens.get(span.nameIndex());
            var previous = seenVariables.putIfAbsent(name.value(), name);
            if (previous == null) {
                keptVariables.add(span);
            } else {
                duplicate(name, previous, "duplicate variable '" + name.value() + "'", VARIABLE_CONTEXT);
            }
        }
        variables.clear();
        variables.addAll(keptVariables);

        var seenCommands = new HashMap<String, Token>();
        var keptCommands = new ArrayList<CommandSpan>();
        for (var span : commands) {
            var name = tokens.get(span.nameIndex());
            var type = span.hasType() ? tokens.get(span.typeIndex()).value() + " " : "";
            var previous = seenCommands.putIfAbsent(type + name.value(), name);
            if (previous == null) {
                keptCommands.add(span);
            } else {
                duplicate(name, previous, "duplicate " + type + "command '" + name.value() + "'", COMMAND_CONTEXT);
            }
        }
        commands.clear();
        commands.addAll(keptCommands);
    }

    private void duplicate(Token token, Token previous, String message, String context) {
        report(ParseError.duplicate(token, message, context,
                                    "previous declaration at line " + previous.line() + ":" + previous.column(),
                                    previous));
    }

    // Errors

    private void reportIllegal(int index) {
        if (!reported.add(index)) {
            return;
        }
        var raw = tokens.get(index).raw();
        if (!raw.isEmpty() && (raw.charAt(0) == '"' || raw.charAt(0) == '\'' || raw.charAt(0) == '`')) {
            report(ParseError.syntax(tokens.get(index), "unclosed string literal", "string literal",
                                     "close the string with " + raw.charAt(0)));
        } else {
            report(ParseError.syntax(tokens.get(index), "unexpected character '" + raw + "'", "input", ""));
        }
    }

    private void reportOnce(int index, String message, String hint) {
        if (reported.add(index)) {
            syntax(index, message, DECORATOR_CONTEXT, hint);
        }
    }

    private void syntax(int index, String message, String context, String hint) {
        report(ParseError.syntax(tokens.get(index), message, context, hint));
    }

    private void report(ParseError error) {
        if (errors.add(error)) {
            log.trace("Structural error at {}: {}", error.token().span().start(), error.message());
        }
    }

    private static boolean isWord(Token token) {
        return switch (token.kind()) {
            case IDENTIFIER, VAR, WATCH, STOP, NUMBER, DURATION, SHELL_TEXT, STRING -> true;
            default -> false;
        };
    }

    private static boolean isLayout(Token token) {
        return token.kind().isTrivia() || token.is(TokenKind.NEWLINE);
    }
}
