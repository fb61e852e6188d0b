package org.javai.sqlassist.config;

/**
 * Options for the remote completion call.
 *
 * @param model model identifier passed to the chat client
 * @param temperature sampling temperature, kept low so generation leans deterministic
 * @param maxTokens upper bound on the length of the generated response
 */
public record GenerationSettings(String model, double temperature, int maxTokens) {

	public static final String DEFAULT_MODEL = "gpt-3.5-turbo";
	public static final double DEFAULT_TEMPERATURE = 0.1;
	public static final int DEFAULT_MAX_TOKENS = 500;

	public GenerationSettings {
		if (model == null || model.isBlank()) {
			throw new IllegalArgumentException("model must not be blank");
		}
		if (temperature < 0.0 || temperature > 2.0) {
			throw new IllegalArgumentException("temperature must be between 0.0 and 2.0");
		}
		if (maxTokens < 1) {
			throw new IllegalArgumentException("maxTokens must be >= 1");
		}
	}

	public static GenerationSettings defaults() {
		return new GenerationSettings(DEFAULT_MODEL, DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS);
	}
}
