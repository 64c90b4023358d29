package io.exprkit.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ArityTest {

    @Nested
    @DisplayName("matches")
    class Matches {

        @Test
        void exactAritiesMatchOnEqualCount() {
            assertThat(Arity.exactly(2).matches(Arity.exactly(2))).isTrue();
            assertThat(Arity.exactly(2).matches(Arity.exactly(3))).isFalse();
        }

        @Test
        void exactCountSatisfiesMinimumInBothDirections() {
            assertThat(Arity.exactly(3).matches(Arity.atLeast(2))).isTrue();
            assertThat(Arity.atLeast(2).matches(Arity.exactly(3))).isTrue();
            assertThat(Arity.atLeast(2).matches(Arity.exactly(1))).isFalse();
            assertThat(Arity.exactly(1).matches(Arity.atLeast(2))).isFalse();
        }

        @Test
        void minimumsMatchOnEqualCount() {
            assertThat(Arity.atLeast(2).matches(Arity.atLeast(2))).isTrue();
            assertThat(Arity.atLeast(2).matches(Arity.atLeast(1))).isFalse();
        }

        @Test
        void anyAcceptsEveryExactCount() {
            assertThat(Arity.ANY.matches(Arity.exactly(0))).isTrue();
            assertThat(Arity.ANY.matches(Arity.exactly(7))).isTrue();
        }
    }

    @Test
    void recordEqualityIsStructural() {
        assertThat(Arity.exactly(3)).isNotEqualTo(Arity.atLeast(2));
        assertThat(Arity.atLeast(2)).isEqualTo(Arity.atLeast(2));
    }

    @Test
    void descriptions() {
        assertThat(Arity.exactly(0).description()).isEqualTo("0 arguments");
        assertThat(Arity.exactly(1).description()).isEqualTo("1 argument");
        assertThat(Arity.exactly(2).description()).isEqualTo("2 arguments");
        assertThat(Arity.atLeast(1).description()).isEqualTo("at least 1 argument");
        assertThat(Arity.atLeast(2).description()).isEqualTo("at least 2 arguments");
    }

    @Test
    void negativeCountsRejected() {
        assertThatThrownBy(() -> Arity.exactly(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Arity.atLeast(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
