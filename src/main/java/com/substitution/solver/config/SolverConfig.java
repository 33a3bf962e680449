package com.substitution.solver.config;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for a solver run.
 */
@Data
@Builder
public class SolverConfig {

    public static final Path DEFAULT_DICTIONARY = Path.of("/usr/share/dict/words");
    public static final char DEFAULT_PLACEHOLDER = '_';

    @Builder.Default
    private Path dictionaryPath = DEFAULT_DICTIONARY;

    /**
     * Printed in place of letters with more than one candidate reading.
     */
    @Builder.Default
    private char placeholder = DEFAULT_PLACEHOLDER;

    @Builder.Default
    private ChainOrdering ordering = ChainOrdering.FEWEST_CANDIDATES_FIRST;

    /**
     * Cap on mappings produced by all stages together; 0 means exhaustive.
     */
    private long maxMappings;

    private boolean report;

    public boolean isBudgeted() {
        return maxMappings > 0;
    }
}
