package org.javai.sqlassist.generate;

import static org.assertj.core.api.Assertions.assertThat;
import org.javai.sqlassist.schema.ColumnInfo;
import org.javai.sqlassist.schema.Documentation;
import org.javai.sqlassist.schema.InMemorySchemaCatalog;
import org.javai.sqlassist.schema.SchemaCatalog;
import org.junit.jupiter.api.Test;

class PatternQueryGeneratorTest {

	private final PatternQueryGenerator generator = new PatternQueryGenerator();

	private String generate(String question, SchemaCatalog schema) {
		GeneratedQuery query = generator.generate(question, schema, Documentation.empty());
		assertThat(query.method()).isEqualTo(GenerationMethod.PATTERN);
		return query.query();
	}

	@Test
	void countQuestionCountsRowsOfNamedTable() {
		SchemaCatalog schema = new InMemorySchemaCatalog().addColumns("users", "id", "name");

		assertThat(generate("How many users are there?", schema)).isEqualTo("SELECT COUNT(*) FROM \"users\"");
	}

	@Test
	void listQuestionSelectsAllWithLargeLimit() {
		SchemaCatalog schema = new InMemorySchemaCatalog()
				.addColumns("users", "id")
				.addColumns("orders", "id");

		assertThat(generate("Show me all orders", schema)).isEqualTo("SELECT * FROM \"orders\" LIMIT 100");
	}

	@Test
	void averageUsesFirstNumericColumn() {
		SchemaCatalog schema = new InMemorySchemaCatalog()
				.addColumn("products", new ColumnInfo("name", "TEXT"))
				.addColumn("products", new ColumnInfo("price", "REAL"))
				.addColumn("products", new ColumnInfo("stock", "INTEGER"));

		assertThat(generate("What is the average price of products?", schema))
				.isEqualTo("SELECT AVG(\"price\") FROM \"products\"");
	}

	@Test
	void averageWithoutNumericColumnFallsThroughToDefault() {
		SchemaCatalog schema = new InMemorySchemaCatalog().addColumns("notes", "body");

		assertThat(generate("average notes", schema)).isEqualTo("SELECT * FROM \"notes\" LIMIT 10");
	}

	@Test
	void totalIsTreatedAsCount() {
		SchemaCatalog schema = new InMemorySchemaCatalog().addColumns("sales", "amount");

		assertThat(generate("What were total sales last month?", schema)).isEqualTo("SELECT COUNT(*) FROM \"sales\"");
	}

	@Test
	void countKeywordWinsOverListKeyword() {
		SchemaCatalog schema = new InMemorySchemaCatalog().addColumns("users", "id");

		assertThat(generate("count all users", schema)).isEqualTo("SELECT COUNT(*) FROM \"users\"");
	}

	@Test
	void keywordsMatchAsSubstrings() {
		SchemaCatalog schema = new InMemorySchemaCatalog().addColumns("events", "id");

		// "target" contains "get"
		assertThat(generate("which events hit the target", schema)).isEqualTo("SELECT * FROM \"events\" LIMIT 100");
	}

	@Test
	void unmatchedQuestionUsesFirstTableAndSmallLimit() {
		SchemaCatalog schema = new InMemorySchemaCatalog()
				.addColumns("customers", "id")
				.addColumns("invoices", "id");

		assertThat(generate("Which region does better?", schema)).isEqualTo("SELECT * FROM \"customers\" LIMIT 10");
	}

	@Test
	void firstTableInSchemaOrderWinsWhenSeveralAreNamed() {
		SchemaCatalog schema = new InMemorySchemaCatalog()
				.addColumns("orders", "id")
				.addColumns("users", "id");

		assertThat(generate("how many users placed orders", schema)).isEqualTo("SELECT COUNT(*) FROM \"orders\"");
	}

	@Test
	void underscoredTableNameMatchesSpacedWords() {
		SchemaCatalog schema = new InMemorySchemaCatalog()
				.addColumns("customers", "id")
				.addColumns("order_items", "id");

		assertThat(generate("How many order items are there?", schema))
				.isEqualTo("SELECT COUNT(*) FROM \"order_items\"");
	}

	@Test
	void emptySchemaEmitsNullTableName() {
		assertThat(generate("Which region does better?", SchemaCatalog.empty()))
				.isEqualTo("SELECT * FROM \"null\" LIMIT 10");
		assertThat(generate("how many?", null)).isEqualTo("SELECT COUNT(*) FROM \"null\"");
	}

	@Test
	void generationIsDeterministic() {
		SchemaCatalog schema = new InMemorySchemaCatalog()
				.addColumn("products", new ColumnInfo("price", "DECIMAL(10,2)"));

		String first = generate("avg products", schema);
		String second = generate("avg products", schema);

		assertThat(first).isEqualTo(second).isEqualTo("SELECT AVG(\"price\") FROM \"products\"");
	}
}
