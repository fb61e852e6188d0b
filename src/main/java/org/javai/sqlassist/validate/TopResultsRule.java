package org.javai.sqlassist.validate;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "Top", "first" and "best" questions want a bounded result: the SQL needs a LIMIT.
 */
public final class TopResultsRule implements ValidationRule {

	private static final List<String> TRIGGERS = List.of("top ", "first ", "best ");
	private static final Pattern TOP_N = Pattern.compile("\\b(?:top|first|best)\\s+(\\d+)\\b");

	static final int DEDUCTION = 10;

	@Override
	public List<RuleViolation> evaluate(ValidationInput input) {
		if (!input.questionContainsAny(TRIGGERS) || input.sqlHasToken("LIMIT")) {
			return List.of();
		}
		Matcher matcher = TOP_N.matcher(input.questionLower());
		if (matcher.find()) {
			String n = matcher.group(1);
			return List.of(new RuleViolation(DEDUCTION,
					"Question asks for the top " + n + " but query has no LIMIT",
					"Add LIMIT " + n + " to the query"));
		}
		return List.of(new RuleViolation(DEDUCTION,
				"Question asks for top results but query has no LIMIT",
				"Add a LIMIT clause to return only the leading rows"));
	}
}
