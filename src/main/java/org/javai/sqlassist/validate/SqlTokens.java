package org.javai.sqlassist.validate;

import java.util.List;

/**
 * Token and date-pattern tests over normalised SQL text.
 */
final class SqlTokens {

	static final List<String> DATE_COLUMN_FRAGMENTS = List.of(
			"date", "time", "created", "updated", "timestamp", "_at", "_on");

	static final List<String> DATE_FUNCTIONS = List.of(
			"DATE", "DATETIME", "TIMESTAMP", "STRFTIME", "DATE_TRUNC", "EXTRACT", "YEAR", "MONTH", "DAY");

	private SqlTokens() {
	}

	/**
	 * Plain substring test, so {@code COUNT} is found in {@code ORDER_COUNT} as well.
	 */
	static boolean containsToken(String sqlUpper, String token) {
		return sqlUpper.contains(token);
	}

	/**
	 * True when the SQL mentions a date-like column name or calls a date function.
	 */
	static boolean referencesDate(ValidationInput input) {
		String sqlLower = input.sqlLower();
		for (String fragment : DATE_COLUMN_FRAGMENTS) {
			if (sqlLower.contains(fragment)) {
				return true;
			}
		}
		return input.sqlHasAnyToken(DATE_FUNCTIONS);
	}
}
