package com.substitution.solver.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.substitution.solver.cli.exception.OptionsValidationException;
import com.substitution.solver.cli.model.SolveOptions;
import com.substitution.solver.cli.model.ValidatedSolveOptions;
import com.substitution.solver.text.TextNormalizer;

public class SolveOptionsValidator {

	public ValidatedSolveOptions validate(SolveOptions o) {
		List<String> errors = new ArrayList<>();

		String ciphertext = o.getCiphertext() == null ? "" : String.join(" ", o.getCiphertext());
		int wordCount = TextNormalizer.tokenize(ciphertext).size();
		if (wordCount == 0) {
			errors.add("Ciphertext contains no letters to solve.");
		}

		Path dictionary = o.getDictionaryFile();
		Path normalizedDictionary = null;
		if (dictionary == null) {
			errors.add("Dictionary file is required (--dictfile / -d).");
		} else {
			normalizedDictionary = dictionary.toAbsolutePath().normalize();
			if (!Files.isRegularFile(normalizedDictionary)) {
				errors.add("Dictionary file does not exist or is not a regular file: " + normalizedDictionary);
			} else if (!Files.isReadable(normalizedDictionary)) {
				errors.add("Dictionary file is not readable: " + normalizedDictionary);
			}
		}

		if (o.getMaxMappings() < 0) {
			errors.add("Max mappings must be >= 0. Got: " + o.getMaxMappings());
		}

		char placeholder = parsePlaceholder(o.getPlaceholder(), errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedSolveOptions(ciphertext, normalizedDictionary, placeholder, wordCount);
	}

	private static char parsePlaceholder(String raw, List<String> errors) {
		if (raw == null || raw.length() != 1) {
			errors.add("Placeholder must be a single character. Got: '" + raw + "'");
			return 0;
		}
		char ch = raw.charAt(0);
		// A letter would be indistinguishable from a solved one in the output
		if (TextNormalizer.toLowerLetter(ch) != 0) {
			errors.add("Placeholder must not be a letter. Got: '" + raw + "'");
		}
		return ch;
	}
}
