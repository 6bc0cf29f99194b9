package org.pragmatica.devcmd.error;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.devcmd.error.Errors.syntax;

class ErrorCollectorTest {

    @Test
    void add_beyondBudget_dropsError() {
        var collector = new ErrorCollector(2);

        assertThat(collector.add(syntax("a", 1, 1, "one"))).isTrue();
        assertThat(collector.add(syntax("b", 2, 1, "two"))).isTrue();
        assertThat(collector.isFull()).isTrue();
        assertThat(collector.add(syntax("c", 3, 1, "three"))).isFalse();

        assertThat(collector.size()).isEqualTo(2);
        assertThat(collector.errors()).extracting(ParseError::message).containsExactly("one", "two");
    }

    @Test
    void errors_returnsSnapshot() {
        var collector = new ErrorCollector(5);
        var before = collector.errors();

        collector.add(syntax("a", 1, 1, "one"));

        assertThat(before).isEmpty();
        assertThat(collector.errors()).hasSize(1);
    }

    @Test
    void constructor_nonPositiveBudget_isRejected() {
        assertThatThrownBy(() -> new ErrorCollector(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
