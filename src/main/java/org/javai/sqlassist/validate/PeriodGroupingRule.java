package org.javai.sqlassist.validate;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Questions about trends or per-period figures ("monthly revenue", "orders per week") need a
 * GROUP BY, and the grouping should be on a date column or date function.
 */
public final class PeriodGroupingRule implements ValidationRule {

	static final Pattern PERIODICITY = Pattern.compile(
			"\\b(daily|weekly|monthly|yearly|quarterly"
					+ "|per\\s+(day|week|month|year)"
					+ "|by\\s+(day|week|month|year|date)"
					+ "|over\\s+time|trend\\w*|history|historical)\\b");

	private static final RuleViolation MISSING_GROUP_BY = new RuleViolation(25,
			"Question asks for figures over time but query lacks GROUP BY",
			"Group by a date expression, e.g. GROUP BY DATE(created_at)");

	private static final RuleViolation MISSING_DATE_GROUPING = new RuleViolation(15,
			"Query groups rows but not by a date column or date function",
			"Group by the relevant period, e.g. strftime('%Y-%m', created_at)");

	@Override
	public List<RuleViolation> evaluate(ValidationInput input) {
		if (!PERIODICITY.matcher(input.questionLower()).find()) {
			return List.of();
		}
		if (!input.sqlHasToken("GROUP BY")) {
			return List.of(MISSING_GROUP_BY);
		}
		if (!SqlTokens.referencesDate(input)) {
			return List.of(MISSING_DATE_GROUPING);
		}
		return List.of();
	}
}
