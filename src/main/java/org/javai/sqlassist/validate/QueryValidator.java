package org.javai.sqlassist.validate;

import java.util.ArrayList;
import java.util.List;
import org.javai.sqlassist.schema.SchemaCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores a generated query against the question it is meant to answer.
 *
 * <p>The score starts at {@value #MAX_CONFIDENCE}. Each rule runs independently, in order, and
 * every violation it reports subtracts its deduction and appends its issue and suggestion.
 * The final score never drops below {@value #MIN_CONFIDENCE}.</p>
 *
 * <p>Thread-safe: the rule list is immutable and rules are stateless.</p>
 */
public final class QueryValidator {

	private static final Logger logger = LoggerFactory.getLogger(QueryValidator.class);

	public static final int MAX_CONFIDENCE = 100;
	public static final int MIN_CONFIDENCE = 20;

	private final List<ValidationRule> rules;

	public QueryValidator() {
		this(defaultRules());
	}

	public QueryValidator(List<ValidationRule> rules) {
		this.rules = rules != null ? List.copyOf(rules) : List.of();
	}

	public List<ValidationRule> rules() {
		return rules;
	}

	public ValidationResult validate(String question, String sql, SchemaCatalog schema) {
		ValidationInput input = ValidationInput.of(question, sql, schema);
		int deductions = 0;
		List<String> issues = new ArrayList<>();
		List<String> suggestions = new ArrayList<>();
		for (ValidationRule rule : rules) {
			for (RuleViolation violation : rule.evaluate(input)) {
				logger.debug("{} deducts {}: {}", rule.name(), violation.deduction(), violation.issue());
				deductions += violation.deduction();
				issues.add(violation.issue());
				if (!violation.suggestion().isBlank()) {
					suggestions.add(violation.suggestion());
				}
			}
		}
		int confidence = Math.max(MIN_CONFIDENCE, MAX_CONFIDENCE - deductions);
		return ValidationResult.of(confidence, issues, suggestions);
	}

	/**
	 * The standard battery, in evaluation order.
	 */
	public static List<ValidationRule> defaultRules() {
		return List.of(
				KeywordRule.triggeredBy("how many", "count", "number of", "total number")
						.requires("COUNT")
						.named("CountRule")
						.deducts(30, "Question asks for a count but query does not use COUNT()",
								"Consider using COUNT() to count matching rows"),
				KeywordRule.triggeredBy("total", "sum of", "combined")
						.unless("total number")
						.requires("SUM", "COUNT")
						.named("SumRule")
						.deducts(25, "Question asks for a total but query uses neither SUM() nor COUNT()",
								"Consider using SUM() on the relevant numeric column"),
				KeywordRule.triggeredBy("average", "avg", "mean")
						.requires("AVG")
						.named("AverageRule")
						.deducts(30, "Question asks for an average but query does not use AVG()",
								"Consider using AVG() on the relevant numeric column"),
				KeywordRule.triggeredBy("highest", "maximum", "max", "most", "largest", "biggest")
						.requires("MAX", "ORDER BY")
						.named("MaximumRule")
						.deducts(20, "Question asks for the highest value but query uses neither MAX() nor ORDER BY",
								"Use MAX() or ORDER BY ... DESC"),
				KeywordRule.triggeredBy("lowest", "minimum", "min", "least", "smallest")
						.requires("MIN", "ORDER BY")
						.named("MinimumRule")
						.deducts(20, "Question asks for the lowest value but query uses neither MIN() nor ORDER BY",
								"Use MIN() or ORDER BY ... ASC"),
				KeywordRule.triggeredBy(" by ", " per ", " each ", " for each ")
						.requires("GROUP BY")
						.named("GroupingRule")
						.deducts(20, "Question implies grouping but query lacks GROUP BY",
								"Consider adding a GROUP BY clause"),
				TimeFilterRule.specificDate(),
				TimeFilterRule.dateRange(),
				new PeriodGroupingRule(),
				new TableReferenceRule(),
				new TopResultsRule());
	}
}
