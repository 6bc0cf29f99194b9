package org.pragmatica.devcmd.ast;

import org.pragmatica.devcmd.tree.SourceSpan;

import java.math.BigDecimal;
import java.util.OptionalLong;

/**
 * Value expressions: literals, identifiers and function decorators used as values.
 */
public sealed interface Expression
    permits Expression.StringLiteral, Expression.NumberLiteral, Expression.DurationLiteral,
            Expression.Identifier, FunctionDecorator {

    SourceSpan span();

    /**
     * Text of the expression as it would be passed on to a shell.
     */
    String text();

    /**
     * @param value unquoted, unescaped content
     * @param raw   content as written, including quotes when present
     */
    record StringLiteral(String value, String raw, SourceSpan span) implements Expression {
        @Override
        public String text() {
            return value;
        }
    }

    record NumberLiteral(String value, SourceSpan span) implements Expression {
        @Override
        public String text() {
            return value;
        }

        /**
         * Exact numeric value. Covers decimals and integers of any magnitude.
         */
        public BigDecimal asDecimal() {
            return new BigDecimal(value);
        }

        /**
         * Value as a {@code long}, empty when it has a fractional part or does not fit.
         */
        public OptionalLong asLong() {
            try {
                return OptionalLong.of(asDecimal().longValueExact());
            } catch (ArithmeticException e) {
                return OptionalLong.empty();
            }
        }
    }

    /**
     * Duration such as {@code 30s}, {@code 2.5m} or {@code 100ms}.
     */
    record DurationLiteral(String value, SourceSpan span) implements Expression {
        @Override
        public String text() {
            return value;
        }
    }

    record Identifier(String name, SourceSpan span) implements Expression {
        @Override
        public String text() {
            return name;
        }
    }
}
