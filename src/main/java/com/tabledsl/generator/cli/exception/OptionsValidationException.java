package com.tabledsl.generator.cli.exception;

import java.util.List;

/**
 * Rejected command line. Carries every problem found, in the order the options were checked.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super(errors.size() == 1
				? "Invalid generator options: " + errors.get(0)
				: "Invalid generator options (" + errors.size() + " problems): " + String.join(" ", errors));
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}
}
