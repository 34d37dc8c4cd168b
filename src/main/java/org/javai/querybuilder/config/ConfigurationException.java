package org.javai.querybuilder.config;

/**
 * Thrown when a configuration document or settings file cannot be read into the
 * query model.
 */
public class ConfigurationException extends RuntimeException {

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
