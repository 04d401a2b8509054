package com.scaffold.generator.cli.exception;

import java.util.List;

/**
 * Every problem found in the generate options, reported in one go.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super(buildMessage(errors));
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}

	private static String buildMessage(List<String> errors) {
		if (errors.size() == 1) {
			return errors.get(0);
		}
		return errors.size() + " invalid options:" + System.lineSeparator()
				+ String.join(System.lineSeparator(), errors);
	}
}
