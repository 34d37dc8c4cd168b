package org.javai.querybuilder.template;

/**
 * Thrown when a template cannot be read from or written to its store.
 */
public class TemplateStoreException extends RuntimeException {

	public TemplateStoreException(String message) {
		super(message);
	}

	public TemplateStoreException(String message, Throwable cause) {
		super(message, cause);
	}
}
