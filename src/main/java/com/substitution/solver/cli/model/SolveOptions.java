package com.substitution.solver.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.substitution.solver.config.ChainOrdering;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "solve" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class SolveOptions {

	@Parameters(arity = "1..*", paramLabel = "CIPHERTEXT", description = "Text to decrypt; several arguments are joined with spaces")
	private List<String> ciphertext;

	@Option(names = { "--dictfile", "-d" }, defaultValue = "/usr/share/dict/words", description = "Word list, one word per line (default: ${DEFAULT-VALUE})")
	private Path dictionaryFile;

	@Option(names = {
			"--ordering" }, defaultValue = "FEWEST_CANDIDATES_FIRST", description = "Stage evaluation order: FEWEST_CANDIDATES_FIRST or INPUT_ORDER")
	private ChainOrdering ordering;

	@Option(names = {
			"--max-mappings" }, defaultValue = "0", description = "Stop after this many partial mappings (0 = exhaustive search)")
	private long maxMappings;

	@Option(names = { "--placeholder" }, defaultValue = "_", description = "Character printed for ambiguous letters")
	private String placeholder;

	@Option(names = { "--report", "-r" }, description = "Print a key report with per-letter resolutions and search statistics")
	private boolean report;

	// ---- Getters (no setters needed; picocli sets fields reflectively) ----

}
