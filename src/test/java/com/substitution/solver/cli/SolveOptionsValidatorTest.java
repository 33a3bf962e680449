package com.substitution.solver.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.substitution.solver.cli.exception.OptionsValidationException;
import com.substitution.solver.cli.model.SolveOptions;
import com.substitution.solver.cli.model.ValidatedSolveOptions;
import com.substitution.solver.cli.validation.SolveOptionsValidator;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

class SolveOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final SolveOptionsValidator validator = new SolveOptionsValidator();

    private static SolveOptions parse(String... args) {
        SolveOptions options = new SolveOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }

    @Test
    void testValidOptions() throws IOException {
        Path dict = Files.writeString(tempDir.resolve("words"), "dog\n");

        ValidatedSolveOptions validated = validator.validate(parse("-d", dict.toString(), "Xdg!", "abc"));

        assertThat(validated.getCiphertext()).isEqualTo("Xdg! abc");
        assertThat(validated.getCipherWordCount()).isEqualTo(2);
        assertThat(validated.getPlaceholder()).isEqualTo('_');
        assertThat(validated.getNormalizedDictionaryPath()).isAbsolute();
    }

    @Test
    void testAllProblemsReportedTogether() {
        SolveOptions options = parse("-d", tempDir.resolve("none").toString(), "--placeholder", "ab",
                "--max-mappings", "-3", "42");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(4)
                        .anyMatch(m -> m.startsWith("Ciphertext contains no letters"))
                        .anyMatch(m -> m.startsWith("Dictionary file does not exist"))
                        .anyMatch(m -> m.startsWith("Max mappings must be >= 0"))
                        .anyMatch(m -> m.startsWith("Placeholder must be a single character")))
                .hasMessageStartingWith("4 invalid option(s):");
    }

    @Test
    void testDirectoryIsNotADictionary() {
        SolveOptions options = parse("-d", tempDir.toString(), "xdg");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("not a regular file");
    }
}
