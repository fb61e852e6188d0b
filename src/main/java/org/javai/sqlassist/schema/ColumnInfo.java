package org.javai.sqlassist.schema;

/**
 * A column discovered by schema introspection.
 *
 * @param name column name, unique within its table
 * @param type declared type exactly as reported by the database (never parsed further)
 * @param nullable whether the column accepts nulls
 * @param defaultValue default value literal, or null when the column has none
 * @param primaryKey whether the column belongs to the table's primary key
 */
public record ColumnInfo(
		String name,
		String type,
		boolean nullable,
		String defaultValue,
		boolean primaryKey
) {
	public ColumnInfo {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("name must not be blank");
		}
		type = type != null ? type : "";
	}

	/**
	 * Convenience constructor for a nullable, non-key column without a default.
	 */
	public ColumnInfo(String name, String type) {
		this(name, type, true, null, false);
	}

	/**
	 * Returns a copy of this column with the primary key flag set.
	 */
	public ColumnInfo asPrimaryKey() {
		return primaryKey ? this : new ColumnInfo(name, type, nullable, defaultValue, true);
	}
}
