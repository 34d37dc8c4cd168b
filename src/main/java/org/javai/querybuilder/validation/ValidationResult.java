package org.javai.querybuilder.validation;

import java.util.List;

/**
 * Verdict of {@link QueryValidator}.
 *
 * @param valid true when the text was parsable and its parentheses balance
 * @param formatted best-effort reformatted text; empty only if tokenizing failed
 * @param errors fatal findings, each of which makes the text invalid
 * @param warnings non-fatal findings; never affect {@code valid}
 */
public record ValidationResult(boolean valid, String formatted, List<String> errors, List<String> warnings) {

	public ValidationResult {
		formatted = formatted != null ? formatted : "";
		errors = errors != null ? List.copyOf(errors) : List.of();
		warnings = warnings != null ? List.copyOf(warnings) : List.of();
	}

	public boolean hasWarnings() {
		return !warnings.isEmpty();
	}
}
