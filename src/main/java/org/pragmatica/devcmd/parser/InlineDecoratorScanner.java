package org.pragmatica.devcmd.parser;

import org.pragmatica.devcmd.ast.Argument;
import org.pragmatica.devcmd.ast.Expression;
import org.pragmatica.devcmd.ast.FunctionDecorator;
import org.pragmatica.devcmd.ast.ShellPart;
import org.pragmatica.devcmd.decorator.DecoratorRegistry;
import org.pragmatica.devcmd.lexer.Token;
import org.pragmatica.devcmd.lexer.TokenKind;
import org.pragmatica.devcmd.tree.SourceLocation;
import org.pragmatica.devcmd.tree.SourceSpan;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds function decorators written inside a single opaque token, e.g. the {@code @var(NAME)} in
 * {@code "hello @var(NAME)"}. Produces the same parts the token-level path would: text around the
 * decorator and a {@link FunctionDecorator} with classified arguments.
 *
 * <p>Positions inside the token are derived from the token start, counting characters for columns
 * and UTF-8 bytes for offsets.
 */
final class InlineDecoratorScanner {
    private static final Pattern NAMED_ARGUMENT = Pattern.compile("([A-Za-z_][A-Za-z0-9_-]*)\\s*=\\s*(\\S+)");

    private final String text;
    private final SourceLocation base;
    private final DecoratorRegistry registry;

    private InlineDecoratorScanner(String text, SourceLocation base, DecoratorRegistry registry) {
        this.text = text;
        this.base = base;
        this.registry = registry;
    }

    /**
     * Split the raw text of {@code token} into text parts and function decorators. A token with no
     * decorator yields a single text part.
     */
    static List<ShellPart> scan(Token token, DecoratorRegistry registry) {
        return new InlineDecoratorScanner(token.raw(), token.span().start(), registry).parts();
    }

    private record Match(FunctionDecorator decorator, int end) {}

    private List<ShellPart> parts() {
        var parts = new ArrayList<ShellPart>();
        int textStart = 0;
        int pos = 0;
        while (true) {
            int at = text.indexOf('@', pos);
            if (at < 0) {
                break;
            }
            var match = decoratorAt(at, text.length());
            if (match.isPresent()) {
                if (at > textStart) {
                    parts.add(new ShellPart.TextPart(text.substring(textStart, at), span(textStart, at)));
                }
                parts.add(match.get().decorator());
                textStart = match.get().end() + 1;
                pos = textStart;
            } else {
                pos = at + 1;
            }
        }
        if (textStart < text.length()) {
            parts.add(new ShellPart.TextPart(text.substring(textStart), span(textStart, text.length())));
        }
        return List.copyOf(parts);
    }

    /**
     * {@code @name(...)} at {@code at} with a registered function decorator name and balanced
     * parentheses before {@code limit}.
     */
    private Optional<Match> decoratorAt(int at, int limit) {
        int nameEnd = at + 1;
        while (nameEnd < limit && isNameChar(text.charAt(nameEnd))) {
            nameEnd++;
        }
        var name = text.substring(at + 1, nameEnd);
        if (!TokenRanges.isValidIdentifier(name) || !registry.isFunctionDecorator(name)
            || nameEnd >= limit || text.charAt(nameEnd) != '(') {
            return Optional.empty();
        }
        int close = closingParen(nameEnd, limit);
        if (close < 0) {
            return Optional.empty();
        }
        var nameToken = new Token(TokenKind.IDENTIFIER, name, name, span(at + 1, nameEnd));
        var decorator = new FunctionDecorator(name, arguments(nameEnd + 1, close), nameToken, span(at, close + 1));
        return Optional.of(new Match(decorator, close));
    }

    private List<Argument> arguments(int from, int to) {
        var arguments = new ArrayList<Argument>();
        int depth = 0;
        char quote = 0;
        int start = from;
        for (int i = from; i < to; i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\' && quote == '"') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (isQuote(c)) {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                argument(start, i).ifPresent(arguments::add);
                start = i + 1;
            }
        }
        argument(start, to).ifPresent(arguments::add);
        return List.copyOf(arguments);
    }

    private Optional<Argument> argument(int from, int to) {
        while (from < to && Character.isWhitespace(text.charAt(from))) {
            from++;
        }
        while (to > from && Character.isWhitespace(text.charAt(to - 1))) {
            to--;
        }
        if (from >= to) {
            return Optional.empty();
        }
        var value = text.substring(from, to);
        var named = NAMED_ARGUMENT.matcher(value);
        if (named.matches()) {
            int valueStart = from + named.start(2);
            return Optional.of(Argument.named(named.group(1), expression(valueStart, to)));
        }
        return Optional.of(Argument.positional(expression(from, to)));
    }

    private Expression expression(int from, int to) {
        var value = text.substring(from, to);
        var valueSpan = span(from, to);
        if (value.length() >= 2 && isQuote(value.charAt(0)) && value.charAt(value.length() - 1) == value.charAt(0)) {
            return new Expression.StringLiteral(value.substring(1, value.length() - 1), value, valueSpan);
        }
        if (value.charAt(0) == '@') {
            var nested = decoratorAt(from, to);
            if (nested.isPresent() && nested.get().end() == to - 1) {
                return nested.get().decorator();
            }
        }
        if (value.chars().anyMatch(Character::isWhitespace)) {
            return new Expression.StringLiteral(value, value, valueSpan);
        }
        return LiteralClassifier.classify(value, valueSpan);
    }

    private int closingParen(int open, int limit) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < limit; i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\' && quote == '"') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (isQuote(c)) {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private SourceSpan span(int from, int to) {
        return SourceSpan.of(at(from), at(to));
    }

    private SourceLocation at(int index) {
        var prefix = text.substring(0, index);
        return base.shift(prefix.codePointCount(0, index), prefix.getBytes(StandardCharsets.UTF_8).length);
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'' || c == '`';
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }
}
