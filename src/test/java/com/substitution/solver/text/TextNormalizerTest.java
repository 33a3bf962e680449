package com.substitution.solver.text;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for text normalization and tokenization.
 */
class TextNormalizerTest {

    @ParameterizedTest
    @CsvSource({
            "'Test!!', test",
            "'I''m', im",
            "'Don''t use multiple words...', dontusemultiplewords",
            "'R2-D2', rd",
            "'ÉCOLE', cole"
    })
    void testNormalize(String input, String expected) {
        assertThat(TextNormalizer.normalize(input)).isEqualTo(expected);
    }

    @Test
    void testNormalizeEmptyAndNull() {
        assertThat(TextNormalizer.normalize("")).isEmpty();
        assertThat(TextNormalizer.normalize(null)).isEmpty();
        assertThat(TextNormalizer.normalize("123 !? \t")).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = { "Hello, World!", "already", "MiXeD 42 cAsE", "", "  \n" })
    void testNormalizeIsIdempotent(String input) {
        String once = TextNormalizer.normalize(input);
        assertThat(TextNormalizer.normalize(once)).isEqualTo(once);
    }

    @Test
    void testTokenizeSplitsOnWhitespaceAndDropsEmptyTokens() {
        assertThat(TextNormalizer.tokenize("  Itssg,\tVgksr!  -- 42\nabc "))
                .containsExactly("itssg", "vgksr", "abc");
    }

    @Test
    void testTokenizeBlank() {
        assertThat(TextNormalizer.tokenize("   ")).isEmpty();
        assertThat(TextNormalizer.tokenize(null)).isEmpty();
    }

    @Test
    void testToLowerLetter() {
        assertThat(TextNormalizer.toLowerLetter('Q')).isEqualTo('q');
        assertThat(TextNormalizer.toLowerLetter('q')).isEqualTo('q');
        assertThat(TextNormalizer.toLowerLetter('!')).isEqualTo((char) 0);
        assertThat(TextNormalizer.toLowerLetter('é')).isEqualTo((char) 0);
    }
}
