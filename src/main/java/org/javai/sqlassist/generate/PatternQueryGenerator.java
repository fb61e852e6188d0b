package org.javai.sqlassist.generate;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.javai.sqlassist.schema.ColumnInfo;
import org.javai.sqlassist.schema.Documentation;
import org.javai.sqlassist.schema.SchemaCatalog;
import org.javai.sqlassist.schema.TableInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic keyword-driven translator. Always produces a query.
 *
 * <p>The target table is the first table (in schema order) whose name appears in the question,
 * otherwise the first table of the schema. The intent is picked by the first matching keyword
 * group:</p>
 * <ol>
 *   <li>count, how many, total: {@code SELECT COUNT(*) FROM "t"}</li>
 *   <li>all, show, list, get: {@code SELECT * FROM "t" LIMIT 100}</li>
 *   <li>average, avg: {@code SELECT AVG("c") FROM "t"} over the first numeric column, when there is one</li>
 *   <li>anything else: {@code SELECT * FROM "t" LIMIT 10}</li>
 * </ol>
 *
 * <p>Keywords match as plain substrings of the lower-cased question. An empty schema has no
 * target table and the literal {@code "null"} is emitted in its place.</p>
 */
public final class PatternQueryGenerator implements QueryGenerator {

	private static final Logger logger = LoggerFactory.getLogger(PatternQueryGenerator.class);

	private static final List<String> COUNT_KEYWORDS = List.of("count", "how many", "total");
	private static final List<String> LIST_KEYWORDS = List.of("all", "show", "list", "get");
	private static final List<String> AVERAGE_KEYWORDS = List.of("average", "avg");
	private static final List<String> NUMERIC_TYPE_MARKERS = List.of("INT", "FLOAT", "DECIMAL", "NUMERIC", "REAL", "DOUBLE");

	static final int LIST_LIMIT = 100;
	static final int DEFAULT_LIMIT = 10;

	@Override
	public GeneratedQuery generate(String question, SchemaCatalog schema, Documentation documentation) {
		String questionLower = question != null ? question.toLowerCase(Locale.ROOT) : "";
		SchemaCatalog effectiveSchema = schema != null ? schema : SchemaCatalog.empty();
		String table = resolveTable(questionLower, effectiveSchema);
		String sql = buildQuery(questionLower, table, effectiveSchema);
		logger.debug("Pattern generator chose table {} -> {}", table, sql);
		return GeneratedQuery.pattern(sql);
	}

	/**
	 * @return the target table, or null when the schema is empty
	 */
	static String resolveTable(String questionLower, SchemaCatalog schema) {
		List<String> tables = schema.tableNames();
		for (String table : tables) {
			String nameLower = table.toLowerCase(Locale.ROOT);
			if (questionLower.contains(nameLower) || questionLower.contains(nameLower.replace('_', ' '))) {
				return table;
			}
		}
		return tables.isEmpty() ? null : tables.get(0);
	}

	private static String buildQuery(String questionLower, String table, SchemaCatalog schema) {
		if (containsAny(questionLower, COUNT_KEYWORDS)) {
			return "SELECT COUNT(*) FROM " + quote(table);
		}
		if (containsAny(questionLower, LIST_KEYWORDS)) {
			return "SELECT * FROM " + quote(table) + " LIMIT " + LIST_LIMIT;
		}
		if (containsAny(questionLower, AVERAGE_KEYWORDS)) {
			Optional<ColumnInfo> numeric = schema.table(table).flatMap(PatternQueryGenerator::firstNumericColumn);
			if (numeric.isPresent()) {
				return "SELECT AVG(" + quote(numeric.get().name()) + ") FROM " + quote(table);
			}
		}
		return "SELECT * FROM " + quote(table) + " LIMIT " + DEFAULT_LIMIT;
	}

	static Optional<ColumnInfo> firstNumericColumn(TableInfo table) {
		return table.columns().stream()
				.filter(column -> {
					String type = column.type().toUpperCase(Locale.ROOT);
					return NUMERIC_TYPE_MARKERS.stream().anyMatch(type::contains);
				})
				.findFirst();
	}

	private static boolean containsAny(String text, List<String> keywords) {
		return keywords.stream().anyMatch(text::contains);
	}

	private static String quote(String identifier) {
		return "\"" + identifier + "\"";
	}
}
