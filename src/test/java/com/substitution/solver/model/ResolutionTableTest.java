package com.substitution.solver.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ResolutionTableTest {

    private static ResolutionTable tableWith(char cipher, Resolution resolution) {
        List<Resolution> all = new ArrayList<>(Collections.nCopies(26, Resolution.unknown()));
        all.set(cipher - 'a', resolution);
        return new ResolutionTable(all);
    }

    @Test
    void testRequiresFullAlphabet() {
        assertThatThrownBy(() -> new ResolutionTable(List.of(Resolution.unknown())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testSubstitutions() {
        List<Resolution> all = new ArrayList<>(Collections.nCopies(26, Resolution.unknown()));
        all.set(0, Resolution.certain('z'));
        all.set(1, Resolution.ambiguous());
        char[] substitutions = new ResolutionTable(all).toSubstitutions('_');

        assertThat(substitutions[0]).isEqualTo('z');
        assertThat(substitutions[1]).isEqualTo('_');
        assertThat(substitutions[2]).isEqualTo(LetterMapping.UNMAPPED);
    }

    @Test
    void testRestrictAndCount() {
        ResolutionTable table = tableWith('q', Resolution.certain('e'));

        assertThat(table.restrictTo("qqa")).containsOnlyKeys('a', 'q');
        assertThat(table.count(Resolution.Kind.CERTAIN, "qa")).isEqualTo(1);
        assertThat(table.count(Resolution.Kind.UNKNOWN, "qa")).isEqualTo(1);
        assertThat(table.count(Resolution.Kind.AMBIGUOUS, "qa")).isZero();
    }

    @Test
    void testResolutionToString() {
        assertThat(Resolution.certain('e').toString()).isEqualTo("Certain(e)");
        assertThat(Resolution.ambiguous().toString()).isEqualTo("Ambiguous");
        assertThat(Resolution.unknown().toString()).isEqualTo("Unknown");
    }
}
