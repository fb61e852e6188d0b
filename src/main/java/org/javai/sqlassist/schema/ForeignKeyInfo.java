package org.javai.sqlassist.schema;

import java.util.List;

/**
 * Describes a foreign key constraint. Purely structural: the referenced table is not checked
 * against the schema.
 *
 * @param constrainedColumns columns of the owning table, in key order
 * @param referredTable the referenced table
 * @param referredColumns referenced columns, in key order
 */
public record ForeignKeyInfo(
		List<String> constrainedColumns,
		String referredTable,
		List<String> referredColumns
) {
	public ForeignKeyInfo {
		constrainedColumns = constrainedColumns != null ? List.copyOf(constrainedColumns) : List.of();
		referredColumns = referredColumns != null ? List.copyOf(referredColumns) : List.of();
	}

	/**
	 * Single-column foreign key.
	 */
	public static ForeignKeyInfo of(String column, String referredTable, String referredColumn) {
		return new ForeignKeyInfo(List.of(column), referredTable, List.of(referredColumn));
	}
}
