package org.javai.sqlassist.validate;

import java.util.List;

/**
 * Fires when the question contains one of the trigger phrases (and none of the exclusions) while
 * the SQL contains none of the required tokens.
 *
 * <pre>{@code
 * KeywordRule.triggeredBy("average", "avg", "mean")
 *     .requires("AVG")
 *     .deducts(30, "Question asks for an average but query does not use AVG()",
 *             "Consider using AVG() on the relevant numeric column");
 * }</pre>
 */
public final class KeywordRule implements ValidationRule {

	private final String name;
	private final List<String> triggers;
	private final List<String> exclusions;
	private final List<String> requiredTokens;
	private final RuleViolation violation;

	private KeywordRule(String name, List<String> triggers, List<String> exclusions, List<String> requiredTokens,
			RuleViolation violation) {
		this.name = name;
		this.triggers = triggers;
		this.exclusions = exclusions;
		this.requiredTokens = requiredTokens;
		this.violation = violation;
	}

	public static Builder triggeredBy(String... phrases) {
		return new Builder(List.of(phrases));
	}

	@Override
	public List<RuleViolation> evaluate(ValidationInput input) {
		if (!input.questionContainsAny(triggers) || input.questionContainsAny(exclusions)) {
			return List.of();
		}
		if (input.sqlHasAnyToken(requiredTokens)) {
			return List.of();
		}
		return List.of(violation);
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public String toString() {
		return name + triggers + "->" + requiredTokens;
	}

	public static final class Builder {
		private final List<String> triggers;
		private List<String> exclusions = List.of();
		private List<String> requiredTokens = List.of();
		private String name;

		private Builder(List<String> triggers) {
			this.triggers = triggers;
		}

		public Builder unless(String... phrases) {
			this.exclusions = List.of(phrases);
			return this;
		}

		/**
		 * The SQL satisfies the rule when it contains any one of these tokens.
		 */
		public Builder requires(String... tokens) {
			this.requiredTokens = List.of(tokens);
			return this;
		}

		public Builder named(String name) {
			this.name = name;
			return this;
		}

		public KeywordRule deducts(int deduction, String issue, String suggestion) {
			if (requiredTokens.isEmpty()) {
				throw new IllegalStateException("requires(...) must name at least one SQL token");
			}
			String effectiveName = name != null ? name : "KeywordRule" + requiredTokens;
			return new KeywordRule(effectiveName, triggers, exclusions, requiredTokens,
					new RuleViolation(deduction, issue, suggestion));
		}
	}
}
