package org.javai.sqlassist.generate;

/**
 * A candidate SQL statement and the strategy that produced it.
 *
 * @param query the SQL text
 * @param method the producing strategy
 */
public record GeneratedQuery(String query, GenerationMethod method) {

	public GeneratedQuery {
		if (query == null) {
			throw new IllegalArgumentException("query must not be null");
		}
		if (method == null) {
			throw new IllegalArgumentException("method must not be null");
		}
	}

	public static GeneratedQuery ai(String query) {
		return new GeneratedQuery(query, GenerationMethod.AI);
	}

	public static GeneratedQuery pattern(String query) {
		return new GeneratedQuery(query, GenerationMethod.PATTERN);
	}
}
