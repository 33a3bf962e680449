package com.substitution.solver.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the solver. Keeps SolveCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedSolveOptions {
    String ciphertext;
    Path normalizedDictionaryPath;
    char placeholder;
    int cipherWordCount;
}
