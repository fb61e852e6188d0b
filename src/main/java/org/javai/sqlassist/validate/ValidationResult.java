package org.javai.sqlassist.validate;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Assessment of how well a query answers a question.
 *
 * @param status verdict derived from {@code confidence}
 * @param confidence score between {@value QueryValidator#MIN_CONFIDENCE} and {@value QueryValidator#MAX_CONFIDENCE}
 * @param message fixed message for the status
 * @param issues problems found, in rule order
 * @param suggestions fixes proposed, in rule order
 */
@JsonPropertyOrder({ "status", "confidence", "message", "issues", "suggestions" })
public record ValidationResult(
		ValidationStatus status,
		int confidence,
		String message,
		List<String> issues,
		List<String> suggestions
) {
	public ValidationResult {
		if (status == null) {
			throw new IllegalArgumentException("status must not be null");
		}
		if (confidence < QueryValidator.MIN_CONFIDENCE || confidence > QueryValidator.MAX_CONFIDENCE) {
			throw new IllegalArgumentException("confidence out of range: " + confidence);
		}
		message = message != null ? message : status.message();
		issues = issues != null ? List.copyOf(issues) : List.of();
		suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
	}

	public static ValidationResult of(int confidence, List<String> issues, List<String> suggestions) {
		ValidationStatus status = ValidationStatus.forConfidence(confidence);
		return new ValidationResult(status, confidence, status.message(), issues, suggestions);
	}

	public boolean hasIssues() {
		return !issues.isEmpty();
	}
}
