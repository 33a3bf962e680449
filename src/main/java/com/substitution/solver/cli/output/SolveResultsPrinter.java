package com.substitution.solver.cli.output;

import java.io.PrintWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.substitution.solver.cli.model.SolveOptions;
import com.substitution.solver.cli.model.ValidatedSolveOptions;
import com.substitution.solver.solver.SolveResult;

/**
 * Responsible only for printing CLI output for the "solve" command.
 * The decrypted text goes to the command's output stream; everything else is
 * logged, so standard output can be piped.
 */
public class SolveResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(SolveResultsPrinter.class);

    public void printBanner(SolveOptions o, ValidatedSolveOptions v) {
        log.info("=================================================");
        log.info("Substitution Cipher Solver");
        log.info("=================================================");
        log.info("Cipher Words: {}", v.getCipherWordCount());
        log.info("Dictionary: {}", v.getNormalizedDictionaryPath());
        log.info("Ordering: {}", o.getOrdering());
        log.info("Max Mappings: {}", o.getMaxMappings() > 0 ? o.getMaxMappings() : "unlimited");
        log.info("Ambiguous Placeholder: '{}'", v.getPlaceholder());
        log.info("=================================================");
    }

    public void printSuccess(PrintWriter out, SolveResult result) {
        out.println(result.getPlaintext());
        out.flush();

        log.info("");
        log.info("=================================================");
        log.info("SOLVE COMPLETE");
        log.info("=================================================");
        log.info("Stages: {} ({} cipher words)", result.getStageCount(), result.getCipherWordCount());
        log.info("Mappings Produced: {}", result.getMappingsProduced());
        log.info("Mappings Reaching Aggregator: {}", result.getMappingsObserved());
        log.info("Letters Certain: {}", result.getCertainCount());
        log.info("Letters Ambiguous: {}", result.getAmbiguousCount());
        log.info("Letters Unknown: {}", result.getUnknownCount());

        if (!result.getUnmatchedWords().isEmpty()) {
            log.info("Words Without Dictionary Match: {}", String.join(", ", result.getUnmatchedWords()));
        }
        if (result.isTruncated()) {
            log.warn("Search was cut short by --max-mappings; raise it for an exhaustive result.");
        }
        log.info("=================================================");
    }

    public void printFailure(SolveResult result) {
        log.error("Solve failed: {}", result.getErrorMessage());
    }
}
