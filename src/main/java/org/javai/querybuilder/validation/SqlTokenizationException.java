package org.javai.querybuilder.validation;

/**
 * Thrown by a {@link SqlTokenizer} when text cannot be tokenized at all, as
 * opposed to text that tokenizes but is semantically odd.
 */
public class SqlTokenizationException extends RuntimeException {

	public SqlTokenizationException(String message) {
		super(message);
	}

	public SqlTokenizationException(String message, Throwable cause) {
		super(message, cause);
	}
}
