package com.substitution.solver.cli;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.substitution.solver.cli.exception.OptionsValidationException;
import com.substitution.solver.cli.model.SolveOptions;
import com.substitution.solver.cli.model.ValidatedSolveOptions;
import com.substitution.solver.cli.output.SolveResultsPrinter;
import com.substitution.solver.cli.validation.SolveOptionsValidator;
import com.substitution.solver.config.SolverConfig;
import com.substitution.solver.report.KeyReportWriter;
import com.substitution.solver.solver.SolveResult;
import com.substitution.solver.solver.SolverService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command that decrypts a substitution ciphertext against a word list.
 */
@Command(
        name = "solve",
        mixinStandardHelpOptions = true,
        description = "Recovers the plaintext behind a monoalphabetic substitution cipher. "
                + "Letters with several possible readings are shown as the placeholder, unresolved ones unchanged."
)
public class SolveCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SolveCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private SolveOptions options = new SolveOptions();

    private final SolveOptionsValidator validator = new SolveOptionsValidator();
    private final SolveResultsPrinter printer = new SolveResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedSolveOptions validated = validator.validate(options);

            SolverConfig config = SolverConfig.builder()
                    .dictionaryPath(validated.getNormalizedDictionaryPath())
                    .placeholder(validated.getPlaceholder())
                    .ordering(options.getOrdering())
                    .maxMappings(options.getMaxMappings())
                    .report(options.isReport())
                    .build();

            printer.printBanner(options, validated);

            SolveResult result = new SolverService(config).solve(validated.getCiphertext());
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }

            PrintWriter out = spec.commandLine().getOut();
            printer.printSuccess(out, result);
            if (config.isReport()) {
                out.println();
                out.print(new KeyReportWriter().render(result, config.getPlaceholder()));
                out.flush();
            }
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 1;
        } catch (Exception e) {
            log.error("Solve failed with exception", e);
            return 1;
        }
    }
}
