package org.javai.sqlassist.config;

/**
 * Raised when assistant settings cannot be read or contain invalid values.
 */
public class AssistantConfigurationException extends RuntimeException {

	public AssistantConfigurationException(String message) {
		super(message);
	}

	public AssistantConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
