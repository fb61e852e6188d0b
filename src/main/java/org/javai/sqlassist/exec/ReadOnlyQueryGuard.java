package org.javai.sqlassist.exec;

import java.util.Locale;

/**
 * The check any executor must apply before running generated SQL: the statement text, once
 * trimmed, has to begin with {@code SELECT} (case-insensitive).
 *
 * <p>The check is textual. It does not parse the statement, so a CTE starting with
 * {@code WITH} is refused as well.</p>
 */
public final class ReadOnlyQueryGuard {

	private ReadOnlyQueryGuard() {
	}

	public static boolean isSelect(String sql) {
		return sql != null && sql.trim().toUpperCase(Locale.ROOT).startsWith("SELECT");
	}

	/**
	 * @return the trimmed statement
	 * @throws QueryRejectedException if the statement is blank or not a SELECT
	 */
	public static String requireSelect(String sql) {
		if (sql == null || sql.isBlank()) {
			throw new QueryRejectedException("Query is required");
		}
		if (!isSelect(sql)) {
			throw new QueryRejectedException("Only SELECT queries are allowed");
		}
		return sql.trim();
	}
}
