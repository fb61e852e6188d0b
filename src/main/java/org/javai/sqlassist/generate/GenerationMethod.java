package org.javai.sqlassist.generate;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which strategy produced a generated query.
 */
public enum GenerationMethod {
	/** Produced by the remote language model. */
	AI("ai"),
	/** Produced by the deterministic keyword generator. */
	PATTERN("pattern");

	private final String wireName;

	GenerationMethod(String wireName) {
		this.wireName = wireName;
	}

	@JsonValue
	public String wireName() {
		return wireName;
	}
}
