package org.javai.sqlassist.validate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.javai.sqlassist.schema.SchemaCatalog;
import org.junit.jupiter.api.Test;

class KeywordRuleTest {

	private final KeywordRule sumRule = KeywordRule.triggeredBy("total", "sum of")
			.unless("total number")
			.requires("SUM", "COUNT")
			.named("SumRule")
			.deducts(25, "needs SUM", "use SUM");

	private static ValidationInput input(String question, String sql) {
		return ValidationInput.of(question, sql, SchemaCatalog.empty());
	}

	@Test
	void firesWhenTriggeredAndNoRequiredTokenPresent() {
		assertThat(sumRule.evaluate(input("Total revenue", "SELECT revenue FROM t")))
				.containsExactly(new RuleViolation(25, "needs SUM", "use SUM"));
	}

	@Test
	void anyRequiredTokenSatisfiesTheRule() {
		assertThat(sumRule.evaluate(input("Total revenue", "SELECT sum(revenue) FROM t"))).isEmpty();
		assertThat(sumRule.evaluate(input("Total revenue", "SELECT count(*) FROM t"))).isEmpty();
	}

	@Test
	void exclusionSilencesTheRule() {
		assertThat(sumRule.evaluate(input("The total number of rows", "SELECT * FROM t"))).isEmpty();
	}

	@Test
	void tokensMatchInsideIdentifiers() {
		assertThat(sumRule.evaluate(input("Total revenue", "SELECT summary FROM t"))).isEmpty();
		assertThat(sumRule.evaluate(input("Total revenue", "SELECT account_id FROM t"))).isEmpty();
		assertThat(sumRule.evaluate(input("Total revenue", "SELECT revenue FROM ledger"))).hasSize(1);
	}

	@Test
	void builderRequiresAToken() {
		assertThatThrownBy(() -> KeywordRule.triggeredBy("x").deducts(1, "issue", "fix"))
				.isInstanceOf(IllegalStateException.class);
	}

	@Test
	void nameDefaultsToRequiredTokens() {
		assertThat(sumRule.name()).isEqualTo("SumRule");
		assertThat(KeywordRule.triggeredBy("x").requires("AVG").deducts(1, "i", "s").name())
				.isEqualTo("KeywordRule[AVG]");
	}
}
