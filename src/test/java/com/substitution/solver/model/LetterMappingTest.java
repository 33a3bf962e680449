package com.substitution.solver.model;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the immutable, injective cipher-to-plain mapping.
 */
class LetterMappingTest {

    @Test
    void testEmptyMapping() {
        LetterMapping empty = LetterMapping.empty();
        assertThat(empty.isEmpty()).isTrue();
        assertThat(empty.size()).isZero();
        assertThat(empty.isMapped('a')).isFalse();
        assertThat(empty.plainFor('a')).isEqualTo(LetterMapping.UNMAPPED);
        assertThat(empty.toString()).isEqualTo("{}");
    }

    @Test
    void testExtendReturnsNewInstanceAndLeavesOriginalUntouched() {
        LetterMapping base = LetterMapping.empty().with('x', 'd');
        LetterMapping extended = base.extend("xdg", "dog");

        assertThat(extended).isNotSameAs(base);
        assertThat(base.size()).isEqualTo(1);
        assertThat(base.isMapped('d')).isFalse();
        assertThat(extended.asMap()).containsExactly(Map.entry('d', 'o'), Map.entry('g', 'g'), Map.entry('x', 'd'));
        assertThat(extended.isClaimed('o')).isTrue();
        assertThat(extended.isClaimed('x')).isFalse();
    }

    @Test
    void testExtendWithNothingNewReturnsSameInstance() {
        LetterMapping mapping = LetterMapping.empty().extend("xdg", "dog");
        assertThat(mapping.extend("gx", "gd")).isSameAs(mapping);
    }

    @Test
    void testWithRejectsSecondCipherLetterForClaimedPlainLetter() {
        LetterMapping mapping = LetterMapping.empty().with('a', 'o');
        assertThatThrownBy(() -> mapping.with('b', 'o'))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already claimed");
    }

    @Test
    void testWithRejectsRemapping() {
        LetterMapping mapping = LetterMapping.empty().with('a', 'o');
        assertThat(mapping.with('a', 'o')).isSameAs(mapping);
        assertThatThrownBy(() -> mapping.with('a', 'p'))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testExtendRejectsInconsistentReading() {
        LetterMapping mapping = LetterMapping.empty().with('a', 'o');
        assertThatThrownBy(() -> mapping.extend("bc", "on")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> mapping.extend("abc", "on")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testNonLetterRejected() {
        assertThatThrownBy(() -> LetterMapping.empty().with('A', 'b')).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LetterMapping.empty().isMapped('1')).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testOfAndEquality() {
        Map<Character, Character> pairs = new LinkedHashMap<>();
        pairs.put('x', 'd');
        pairs.put('d', 'o');
        pairs.put('g', 'g');

        assertThat(LetterMapping.of(pairs)).isEqualTo(LetterMapping.empty().extend("xdg", "dog"));
        assertThat(LetterMapping.of(pairs).hashCode()).isEqualTo(LetterMapping.empty().extend("xdg", "dog").hashCode());
        assertThat(LetterMapping.of(pairs).toString()).isEqualTo("{d:o, g:g, x:d}");
    }
}
