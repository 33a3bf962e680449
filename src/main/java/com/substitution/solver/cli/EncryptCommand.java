package com.substitution.solver.cli;

import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.substitution.solver.encrypt.SubstitutionKey;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * CLI command that enciphers text with a random key. Useful for making test cases.
 */
@Command(
        name = "encrypt",
        mixinStandardHelpOptions = true,
        description = "Encrypts text with a randomly generated substitution key, keeping case and punctuation."
)
public class EncryptCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(EncryptCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "PLAINTEXT", description = "Text to encrypt; several arguments are joined with spaces")
    private List<String> plaintext;

    @Option(names = { "--seed", "-s" }, description = "Random seed, for a reproducible key")
    private Long seed;

    @Option(names = { "--show-key", "-k" }, description = "Log the generated key (image of a-z)")
    private boolean showKey;

    @Override
    public Integer call() {
        Random random = seed != null ? new Random(seed) : new Random();
        SubstitutionKey key = SubstitutionKey.random(random);

        if (showKey) {
            log.info("Key: abcdefghijklmnopqrstuvwxyz -> {}", key);
        }

        spec.commandLine().getOut().println(key.encipher(String.join(" ", plaintext)));
        spec.commandLine().getOut().flush();
        return 0;
    }
}
