package org.javai.sqlassist.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/**
 * Settings for the assistant, read from YAML.
 *
 * <pre>
 * generation:
 *   model: gpt-3.5-turbo
 *   temperature: 0.1
 *   max-tokens: 500
 * introspection:
 *   sample-rows: 5
 * </pre>
 *
 * <p>Every key is optional; missing keys take the defaults shown above.</p>
 */
public record AssistantSettings(GenerationSettings generation, IntrospectionSettings introspection) {

	public static final String DEFAULT_RESOURCE = "sql-assist.yml";

	public AssistantSettings {
		generation = generation != null ? generation : GenerationSettings.defaults();
		introspection = introspection != null ? introspection : IntrospectionSettings.defaults();
	}

	public static AssistantSettings defaults() {
		return new AssistantSettings(GenerationSettings.defaults(), IntrospectionSettings.defaults());
	}

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults when it is absent.
	 */
	public static AssistantSettings load() {
		ClassLoader loader = Thread.currentThread().getContextClassLoader();
		if (loader == null) {
			loader = AssistantSettings.class.getClassLoader();
		}
		try (InputStream in = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
			return in != null ? load(in) : defaults();
		}
		catch (IOException e) {
			throw new AssistantConfigurationException("Failed to read " + DEFAULT_RESOURCE, e);
		}
	}

	public static AssistantSettings load(InputStream inputStream) {
		try {
			Object data = new Yaml().load(inputStream);
			return fromMap(data);
		}
		catch (AssistantConfigurationException e) {
			throw e;
		}
		catch (RuntimeException e) {
			throw new AssistantConfigurationException("Failed to parse assistant settings", e);
		}
	}

	public static AssistantSettings fromYaml(String yamlContent) {
		if (yamlContent == null || yamlContent.isBlank()) {
			return defaults();
		}
		try {
			return fromMap(new Yaml().load(yamlContent));
		}
		catch (AssistantConfigurationException e) {
			throw e;
		}
		catch (RuntimeException e) {
			throw new AssistantConfigurationException("Failed to parse assistant settings", e);
		}
	}

	private static AssistantSettings fromMap(Object data) {
		if (data == null) {
			return defaults();
		}
		Map<String, Object> root = asMap(data, "root");
		return new AssistantSettings(
				buildGeneration(asMap(root.get("generation"), "generation")),
				buildIntrospection(asMap(root.get("introspection"), "introspection")));
	}

	private static GenerationSettings buildGeneration(Map<String, Object> section) {
		String model = stringValue(section.get("model"), GenerationSettings.DEFAULT_MODEL);
		double temperature = numberValue(section.get("temperature"), "generation.temperature",
				GenerationSettings.DEFAULT_TEMPERATURE).doubleValue();
		int maxTokens = numberValue(section.get("max-tokens"), "generation.max-tokens",
				GenerationSettings.DEFAULT_MAX_TOKENS).intValue();
		try {
			return new GenerationSettings(model, temperature, maxTokens);
		}
		catch (IllegalArgumentException e) {
			throw new AssistantConfigurationException("Invalid generation settings: " + e.getMessage(), e);
		}
	}

	private static IntrospectionSettings buildIntrospection(Map<String, Object> section) {
		int sampleRows = numberValue(section.get("sample-rows"), "introspection.sample-rows",
				IntrospectionSettings.defaults().sampleRows()).intValue();
		try {
			return new IntrospectionSettings(sampleRows);
		}
		catch (IllegalArgumentException e) {
			throw new AssistantConfigurationException("Invalid introspection settings: " + e.getMessage(), e);
		}
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> asMap(Object value, String path) {
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map)) {
			throw new AssistantConfigurationException("Expected a mapping at '" + path + "'");
		}
		return (Map<String, Object>) value;
	}

	private static String stringValue(Object value, String fallback) {
		if (value == null) {
			return fallback;
		}
		String text = value.toString().trim();
		return text.isEmpty() ? fallback : text;
	}

	private static Number numberValue(Object value, String path, Number fallback) {
		if (value == null) {
			return fallback;
		}
		if (value instanceof Number number) {
			return number;
		}
		try {
			return Double.parseDouble(value.toString().trim());
		}
		catch (NumberFormatException e) {
			throw new AssistantConfigurationException("Expected a number at '" + path + "' but got: " + value, e);
		}
	}
}
