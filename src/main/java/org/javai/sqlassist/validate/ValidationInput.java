package org.javai.sqlassist.validate;

import java.util.Locale;
import java.util.regex.Pattern;
import org.javai.sqlassist.schema.SchemaCatalog;

/**
 * The normalised inputs every rule sees.
 *
 * @param question the question as asked
 * @param questionLower the question, lower-cased
 * @param sql the SQL as generated
 * @param sqlUpper the SQL, upper-cased with whitespace runs collapsed to one space
 * @param schema the schema the SQL was generated against
 */
public record ValidationInput(
		String question,
		String questionLower,
		String sql,
		String sqlUpper,
		SchemaCatalog schema
) {
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	public static ValidationInput of(String question, String sql, SchemaCatalog schema) {
		String safeQuestion = question != null ? question : "";
		String safeSql = sql != null ? sql : "";
		return new ValidationInput(
				safeQuestion,
				safeQuestion.toLowerCase(Locale.ROOT),
				safeSql,
				WHITESPACE.matcher(safeSql.toUpperCase(Locale.ROOT)).replaceAll(" ").trim(),
				schema != null ? schema : SchemaCatalog.empty());
	}

	public String sqlLower() {
		return sqlUpper.toLowerCase(Locale.ROOT);
	}

	public boolean questionContainsAny(Iterable<String> phrases) {
		for (String phrase : phrases) {
			if (questionLower.contains(phrase)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Keyword test against the upper-cased SQL. Matches anywhere, identifiers included.
	 * Multi-word tokens such as {@code GROUP BY} are matched with single spaces.
	 */
	public boolean sqlHasToken(String token) {
		return SqlTokens.containsToken(sqlUpper, token);
	}

	public boolean sqlHasAnyToken(Iterable<String> tokens) {
		for (String token : tokens) {
			if (sqlHasToken(token)) {
				return true;
			}
		}
		return false;
	}
}
