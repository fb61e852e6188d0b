package org.javai.sqlassist.validate;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks that a question referring to a point or span in time gets a WHERE clause, and that the
 * WHERE clause looks at a date column or date function.
 *
 * <p>Two flavours share the checks. {@link #specificDate()} reacts to dates such as "today",
 * "March" or "2024"; {@link #dateRange()} reacts to spans such as "last 7 days", "since" or
 * "recent". Both patterns know "this/last/next week|month|year|quarter"; such a phrase is left to
 * the range flavour, so one missing filter is charged once. Any other date in the question still
 * triggers the specific flavour.</p>
 */
public final class TimeFilterRule implements ValidationRule {

	static final Pattern SPECIFIC_DATE = Pattern.compile(
			"\\b(today|yesterday|tomorrow"
					+ "|monday|tuesday|wednesday|thursday|friday|saturday|sunday"
					+ "|january|february|march|april|may|june|july|august|september|october|november|december"
					+ "|(this|last|next)\\s+(week|month|year|quarter)"
					+ "|202[0-6])\\b");

	static final Pattern DATE_RANGE = Pattern.compile(
			"\\b((last|past)\\s+\\d+\\s+(days?|weeks?|months?|years?)"
					+ "|since|before|after|between|from|until"
					+ "|\\d+\\s+(days?|weeks?|months?|years?)\\s+ago"
					+ "|recent\\w*|latest|oldest|newest"
					+ "|(this|last|next)\\s+(week|month|year|quarter))\\b");

	static final Pattern SHARED_PERIOD = Pattern.compile("\\b(this|last|next)\\s+(week|month|year|quarter)\\b");

	private final String name;
	private final boolean rangeFlavour;
	private final RuleViolation missingWhere;
	private final RuleViolation missingDateFilter;

	private TimeFilterRule(String name, boolean rangeFlavour, RuleViolation missingWhere,
			RuleViolation missingDateFilter) {
		this.name = name;
		this.rangeFlavour = rangeFlavour;
		this.missingWhere = missingWhere;
		this.missingDateFilter = missingDateFilter;
	}

	public static TimeFilterRule specificDate() {
		return new TimeFilterRule("SpecificDateRule", false,
				new RuleViolation(25,
						"Question mentions a specific date but query has no WHERE clause",
						"Add a WHERE clause that filters on the relevant date column"),
				new RuleViolation(20,
						"Query filters rows but not on a date column or date function",
						"Compare a date column with the requested date, e.g. WHERE DATE(created_at) = ..."));
	}

	public static TimeFilterRule dateRange() {
		return new TimeFilterRule("DateRangeRule", true,
				new RuleViolation(30,
						"Question mentions a time period but query has no WHERE clause for filtering",
						"Add a WHERE clause restricting the date range"),
				new RuleViolation(20,
						"Query has a WHERE clause but it does not appear to filter by date",
						"Restrict a date column to the requested period, e.g. WHERE created_at >= ..."));
	}

	static boolean mentionsDateRange(String questionLower) {
		return DATE_RANGE.matcher(questionLower).find();
	}

	static boolean mentionsSpecificDate(String questionLower) {
		return SPECIFIC_DATE.matcher(questionLower).find();
	}

	@Override
	public List<RuleViolation> evaluate(ValidationInput input) {
		if (!triggered(input.questionLower())) {
			return List.of();
		}
		if (!input.sqlHasToken("WHERE")) {
			return List.of(missingWhere);
		}
		if (!SqlTokens.referencesDate(input)) {
			return List.of(missingDateFilter);
		}
		return List.of();
	}

	private boolean triggered(String questionLower) {
		if (rangeFlavour) {
			return mentionsDateRange(questionLower);
		}
		return mentionsSpecificDate(SHARED_PERIOD.matcher(questionLower).replaceAll(" "));
	}

	@Override
	public String name() {
		return name;
	}
}
