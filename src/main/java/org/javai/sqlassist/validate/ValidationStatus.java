package org.javai.sqlassist.validate;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse verdict derived from the confidence score.
 */
public enum ValidationStatus {
	GOOD("good", "Query looks good and matches your question"),
	WARNING("warning", "Query may partially match your question"),
	ERROR("error", "Query might not fully answer your question");

	static final int GOOD_THRESHOLD = 80;
	static final int WARNING_THRESHOLD = 60;

	private final String wireName;
	private final String message;

	ValidationStatus(String wireName, String message) {
		this.wireName = wireName;
		this.message = message;
	}

	@JsonValue
	public String wireName() {
		return wireName;
	}

	public String message() {
		return message;
	}

	public static ValidationStatus forConfidence(int confidence) {
		if (confidence >= GOOD_THRESHOLD) {
			return GOOD;
		}
		if (confidence >= WARNING_THRESHOLD) {
			return WARNING;
		}
		return ERROR;
	}
}
