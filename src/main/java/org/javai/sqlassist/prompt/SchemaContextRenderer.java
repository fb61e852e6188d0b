package org.javai.sqlassist.prompt;

import java.util.ArrayList;
import java.util.List;
import org.javai.sqlassist.schema.ColumnInfo;
import org.javai.sqlassist.schema.Documentation;
import org.javai.sqlassist.schema.ForeignKeyInfo;
import org.javai.sqlassist.schema.SchemaCatalog;
import org.javai.sqlassist.schema.TableInfo;

/**
 * Renders a schema and its documentation overlay as the text block handed to the language model.
 *
 * <p>Output is deterministic: tables in schema order, columns in stored order. Example:</p>
 *
 * <pre>
 * TABLE: orders
 *   Description: Orders placed by customers
 *   COLUMNS:
 *     - id: INTEGER (PRIMARY KEY)
 *     - user_id: INTEGER -- Buyer
 *   FOREIGN KEYS:
 *     - user_id -> users(id)
 * </pre>
 *
 * <p>Every table block ends with an empty line. A null or empty schema renders as an empty string.</p>
 */
public final class SchemaContextRenderer {

	private SchemaContextRenderer() {
	}

	public static String render(SchemaCatalog schema, Documentation documentation) {
		if (schema == null || schema.isEmpty()) {
			return "";
		}
		Documentation docs = documentation != null ? documentation : Documentation.empty();
		List<String> lines = new ArrayList<>();
		schema.tables().forEach((tableName, table) -> renderTable(lines, tableName, table, docs));
		return String.join("\n", lines);
	}

	private static void renderTable(List<String> lines, String tableName, TableInfo table, Documentation docs) {
		lines.add("TABLE: " + tableName);
		docs.tableDescription(tableName).ifPresent(description -> lines.add("  Description: " + description));
		lines.add("  COLUMNS:");
		for (ColumnInfo column : table.columns()) {
			StringBuilder line = new StringBuilder("    - ")
					.append(column.name())
					.append(": ")
					.append(column.type());
			if (column.primaryKey()) {
				line.append(" (PRIMARY KEY)");
			}
			docs.columnDescription(tableName, column.name())
					.ifPresent(description -> line.append(" -- ").append(description));
			lines.add(line.toString());
		}
		if (table.hasForeignKeys()) {
			lines.add("  FOREIGN KEYS:");
			for (ForeignKeyInfo foreignKey : table.foreignKeys()) {
				lines.add("    - " + String.join(", ", foreignKey.constrainedColumns())
						+ " -> " + foreignKey.referredTable()
						+ "(" + String.join(", ", foreignKey.referredColumns()) + ")");
			}
		}
		lines.add("");
	}
}
