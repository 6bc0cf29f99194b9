package org.pragmatica.devcmd.parser;

import org.pragmatica.devcmd.ast.Expression;
import org.pragmatica.devcmd.tree.SourceSpan;

import java.util.regex.Pattern;

/**
 * Sniffs the literal kind of a bare word: {@code 8080} is a number, {@code 30s} or {@code 2.5m}
 * a duration, anything else ({@code ./src}, {@code true}) an identifier.
 */
final class LiteralClassifier {
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DURATION = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)(ns|us|ms|s|m|h)");

    private LiteralClassifier() {}

    static Expression classify(String text, SourceSpan span) {
        if (INTEGER.matcher(text).matches()) {
            return new Expression.NumberLiteral(text, span);
        }
        if (DURATION.matcher(text).matches()) {
            return new Expression.DurationLiteral(text, span);
        }
        return new Expression.Identifier(text, span);
    }
}
