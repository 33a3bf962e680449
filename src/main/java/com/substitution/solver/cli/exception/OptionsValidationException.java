package com.substitution.solver.cli.exception;

import java.util.List;

/**
 * Carries every problem found in the command-line options, so they can be
 * reported together instead of one per run.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super(errors.size() + " invalid option(s):" + System.lineSeparator()
				+ String.join(System.lineSeparator(), errors));
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}
}
