package org.pragmatica.devcmd.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.devcmd.ast.Expression;
import org.pragmatica.devcmd.tree.SourceLocation;
import org.pragmatica.devcmd.tree.SourceSpan;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class LiteralClassifierTest {
    private static final SourceSpan SPAN = SourceSpan.at(SourceLocation.START);

    @Test
    void classify_integers_areNumbers() {
        assertInstanceOf(Expression.NumberLiteral.class, LiteralClassifier.classify("8080", SPAN));
        assertInstanceOf(Expression.NumberLiteral.class, LiteralClassifier.classify("+5", SPAN));
        assertEquals(OptionalLong.of(-12L), ((Expression.NumberLiteral) LiteralClassifier.classify("-12", SPAN)).asLong());
    }

    @Test
    void classify_unitSuffixes_areDurations() {
        for (var text : new String[]{"30s", "100ms", "1.5h", ".5s", "2m", "10us", "3ns"}) {
            assertInstanceOf(Expression.DurationLiteral.class, LiteralClassifier.classify(text, SPAN), text);
        }
    }

    @Test
    void classify_otherWords_areIdentifiers() {
        for (var text : new String[]{"true", "./src", "30x", "s30", "production"}) {
            var expression = LiteralClassifier.classify(text, SPAN);
            assertInstanceOf(Expression.Identifier.class, expression, text);
            assertEquals(text, expression.text());
        }
    }
}
