package com.substitution.solver;

import com.substitution.solver.cli.SubstitutionCommand;
import picocli.CommandLine;

/**
 * Main entry point for the substitution cipher solver.
 * Recovers plaintext from a monoalphabetic substitution cipher by propagating
 * dictionary word candidates through a chain of per-word stages.
 */
public class SolverApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SubstitutionCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
