package com.substitution.solver.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Root command; all work happens in the subcommands.
 */
@Command(
        name = "subsolve",
        mixinStandardHelpOptions = true,
        version = "substitution-solver 1.0.0",
        description = "Solves (or creates) monoalphabetic substitution ciphers using a word list.",
        subcommands = { SolveCommand.class, EncryptCommand.class }
)
public class SubstitutionCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing subcommand: use 'solve' or 'encrypt'");
    }
}
