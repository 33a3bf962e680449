package com.substitution.solver.render;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.substitution.solver.model.LetterMapping;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for rendering a key onto original text.
 */
class SubstitutionRendererTest {

    private static final LetterMapping DOG = LetterMapping.of(Map.of('x', 'd', 'd', 'o', 'g', 'g'));

    @Test
    void testPreservesCaseAndPunctuation() {
        assertThat(SubstitutionRenderer.render("Xdg!", DOG)).isEqualTo("Dog!");
        assertThat(SubstitutionRenderer.render("XDG, xdg? 42", DOG)).isEqualTo("DOG, dog? 42");
    }

    @Test
    void testUnmappedLettersPassThrough() {
        assertThat(SubstitutionRenderer.render("Xyz", DOG)).isEqualTo("Dyz");
    }

    @Test
    void testOutputKeepsInputShape() {
        String input = "  Xdg\t(xdg)\nÉtude ";
        String output = SubstitutionRenderer.render(input, DOG);

        assertThat(output).hasSameSizeAs(input);
        assertThat(output).isEqualTo("  Dog\t(dog)\nÉtuoe ");
    }

    @Test
    void testPlaceholderSubstitution() {
        char[] substitutions = new char[LetterMapping.ALPHABET_SIZE];
        substitutions['d' - 'a'] = '_';

        assertThat(SubstitutionRenderer.render("Dd", substitutions)).isEqualTo("__");
    }

    @Test
    void testRejectsShortSubstitutionArray() {
        assertThatThrownBy(() -> SubstitutionRenderer.render("x", new char[3]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
