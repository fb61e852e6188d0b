package org.javai.sqlassist.validate;

/**
 * A single finding reported by a {@link ValidationRule}.
 *
 * @param deduction points subtracted from the confidence score (positive)
 * @param issue what is wrong with the query
 * @param suggestion how to fix it
 */
public record RuleViolation(int deduction, String issue, String suggestion) {

	public RuleViolation {
		if (deduction < 0) {
			throw new IllegalArgumentException("deduction must be >= 0");
		}
		if (issue == null || issue.isBlank()) {
			throw new IllegalArgumentException("issue must not be blank");
		}
		suggestion = suggestion != null ? suggestion : "";
	}
}
