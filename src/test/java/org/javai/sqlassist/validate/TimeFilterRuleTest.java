package org.javai.sqlassist.validate;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import org.javai.sqlassist.schema.SchemaCatalog;
import org.junit.jupiter.api.Test;

class TimeFilterRuleTest {

	private final TimeFilterRule specificDate = TimeFilterRule.specificDate();
	private final TimeFilterRule dateRange = TimeFilterRule.dateRange();

	private static ValidationInput input(String question, String sql) {
		return ValidationInput.of(question, sql, SchemaCatalog.empty());
	}

	private static List<Integer> deductions(List<RuleViolation> violations) {
		return violations.stream().map(RuleViolation::deduction).toList();
	}

	@Test
	void specificDateWithoutWhereCosts25() {
		List<RuleViolation> violations = specificDate.evaluate(input("Orders placed yesterday", "SELECT * FROM orders"));

		assertThat(deductions(violations)).containsExactly(25);
		assertThat(violations.get(0).issue()).isEqualTo("Question mentions a specific date but query has no WHERE clause");
	}

	@Test
	void specificDateFilterOnNonDateColumnCosts20() {
		List<RuleViolation> violations = specificDate.evaluate(
				input("Orders in 2024", "SELECT * FROM orders WHERE status = 'open'"));

		assertThat(deductions(violations)).containsExactly(20);
	}

	@Test
	void specificDateFilterOnDateColumnPasses() {
		assertThat(specificDate.evaluate(
				input("Orders placed on Friday", "SELECT * FROM orders WHERE placed_on = '2024-03-01'"))).isEmpty();
		assertThat(specificDate.evaluate(
				input("Signups in March", "SELECT * FROM users WHERE MONTH(joined) = 3"))).isEmpty();
	}

	@Test
	void rangePhraseWithoutWhereCosts30() {
		List<RuleViolation> violations = dateRange.evaluate(input("Orders from the last 7 days", "SELECT * FROM orders"));

		assertThat(deductions(violations)).containsExactly(30);
		assertThat(violations.get(0).suggestion()).isEqualTo("Add a WHERE clause restricting the date range");
	}

	@Test
	void rangeFilterOnNonDateColumnCosts20() {
		List<RuleViolation> violations = dateRange.evaluate(
				input("Recent orders", "SELECT * FROM orders WHERE total > 10"));

		assertThat(deductions(violations)).containsExactly(20);
	}

	@Test
	void rangeFilterOnDateColumnPasses() {
		assertThat(dateRange.evaluate(input("Users who joined since 2022",
				"SELECT * FROM users WHERE created_at >= '2022-01-01'"))).isEmpty();
	}

	@Test
	void specificDateStaysSilentWhenRangePhraseIsPresent() {
		ValidationInput lastMonth = input("Total sales last month", "SELECT SUM(amount) FROM sales");

		assertThat(specificDate.evaluate(lastMonth)).isEmpty();
		assertThat(deductions(dateRange.evaluate(lastMonth))).containsExactly(30);
	}

	@Test
	void otherRangePhrasesLeaveSpecificDateActive() {
		ValidationInput fromYesterday = input("Orders from yesterday", "SELECT * FROM orders");

		assertThat(deductions(specificDate.evaluate(fromYesterday))).containsExactly(25);
		assertThat(deductions(dateRange.evaluate(fromYesterday))).containsExactly(30);
	}

	@Test
	void unrelatedQuestionsAreIgnored() {
		ValidationInput plain = input("List every customer", "SELECT * FROM customers");

		assertThat(specificDate.evaluate(plain)).isEmpty();
		assertThat(dateRange.evaluate(plain)).isEmpty();
	}

	@Test
	void patternsRecogniseTheirPhrases() {
		assertThat(TimeFilterRule.mentionsSpecificDate("sales on tuesday")).isTrue();
		assertThat(TimeFilterRule.mentionsSpecificDate("sales next quarter")).isTrue();
		assertThat(TimeFilterRule.mentionsSpecificDate("sales in 2019")).isFalse();
		assertThat(TimeFilterRule.mentionsDateRange("orders 3 weeks ago")).isTrue();
		assertThat(TimeFilterRule.mentionsDateRange("the past 12 months")).isTrue();
		assertThat(TimeFilterRule.mentionsDateRange("newest accounts")).isTrue();
		assertThat(TimeFilterRule.mentionsDateRange("orders by region")).isFalse();
	}

	@Test
	void rulesCarryDistinctNames() {
		assertThat(specificDate.name()).isEqualTo("SpecificDateRule");
		assertThat(dateRange.name()).isEqualTo("DateRangeRule");
	}
}
