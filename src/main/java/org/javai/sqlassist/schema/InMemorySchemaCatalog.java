package org.javai.sqlassist.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory {@link SchemaCatalog}, filled by the introspector or by tests.
 *
 * <pre>{@code
 * SchemaCatalog schema = new InMemorySchemaCatalog()
 *     .addTable("users")
 *     .addColumn("users", new ColumnInfo("id", "INTEGER", false, null, true))
 *     .addColumn("users", new ColumnInfo("name", "TEXT"))
 *     .addTable("orders")
 *     .addColumn("orders", new ColumnInfo("user_id", "INTEGER"))
 *     .addForeignKey("orders", ForeignKeyInfo.of("user_id", "users", "id"));
 * }</pre>
 *
 * <p>Tables keep insertion order. Once handed to a {@code ConnectionSnapshot} the catalog is
 * treated as read-only; {@link #tables()} always returns an immutable copy.</p>
 */
public final class InMemorySchemaCatalog implements SchemaCatalog {

	private final Map<String, TableBuilder> tables = new LinkedHashMap<>();

	public InMemorySchemaCatalog addTable(String tableName) {
		if (tableName == null || tableName.isBlank()) {
			return this;
		}
		tables.putIfAbsent(tableName, new TableBuilder());
		return this;
	}

	/**
	 * Adds a fully built table, replacing any previous definition but keeping its position.
	 */
	public InMemorySchemaCatalog putTable(String tableName, TableInfo table) {
		if (tableName == null || tableName.isBlank() || table == null) {
			return this;
		}
		TableBuilder builder = tables.computeIfAbsent(tableName, t -> new TableBuilder());
		builder.columns.clear();
		builder.columns.putAll(indexColumns(table.columns()));
		builder.foreignKeys.clear();
		builder.foreignKeys.addAll(table.foreignKeys());
		builder.sampleRows = table.sampleRows();
		builder.rowCount = table.rowCount();
		return this;
	}

	public InMemorySchemaCatalog addColumn(String tableName, ColumnInfo column) {
		if (tableName == null || tableName.isBlank() || column == null) {
			return this;
		}
		tables.computeIfAbsent(tableName, t -> new TableBuilder()).columns.put(column.name(), column);
		return this;
	}

	public InMemorySchemaCatalog addColumns(String tableName, String... columnNames) {
		if (columnNames != null) {
			for (String columnName : columnNames) {
				if (columnName != null && !columnName.isBlank()) {
					addColumn(tableName, new ColumnInfo(columnName, "TEXT"));
				}
			}
		}
		return this;
	}

	/**
	 * Flags the named columns as primary key members. Unknown names are ignored.
	 */
	public InMemorySchemaCatalog markPrimaryKey(String tableName, String... columnNames) {
		TableBuilder table = tables.get(tableName);
		if (table == null || columnNames == null) {
			return this;
		}
		for (String columnName : columnNames) {
			ColumnInfo column = table.columns.get(columnName);
			if (column != null) {
				table.columns.put(columnName, column.asPrimaryKey());
			}
		}
		return this;
	}

	public InMemorySchemaCatalog addForeignKey(String tableName, ForeignKeyInfo foreignKey) {
		if (tableName == null || tableName.isBlank() || foreignKey == null) {
			return this;
		}
		tables.computeIfAbsent(tableName, t -> new TableBuilder()).foreignKeys.add(foreignKey);
		return this;
	}

	public InMemorySchemaCatalog withSamples(String tableName, List<Map<String, String>> rows, long rowCount) {
		TableBuilder table = tables.get(tableName);
		if (table != null) {
			table.sampleRows = rows != null ? rows : List.of();
			table.rowCount = Math.max(0, rowCount);
		}
		return this;
	}

	@Override
	public Map<String, TableInfo> tables() {
		Map<String, TableInfo> copy = new LinkedHashMap<>();
		tables.forEach((name, builder) -> copy.put(name, builder.build()));
		return Collections.unmodifiableMap(copy);
	}

	@Override
	public String toString() {
		return "InMemorySchemaCatalog" + tables.keySet();
	}

	private static Map<String, ColumnInfo> indexColumns(List<ColumnInfo> columns) {
		Map<String, ColumnInfo> indexed = new LinkedHashMap<>();
		for (ColumnInfo column : columns) {
			indexed.put(column.name(), column);
		}
		return indexed;
	}

	private static final class TableBuilder {
		private final Map<String, ColumnInfo> columns = new LinkedHashMap<>();
		private final List<ForeignKeyInfo> foreignKeys = new ArrayList<>();
		private List<Map<String, String>> sampleRows = List.of();
		private long rowCount;

		TableInfo build() {
			return new TableInfo(List.copyOf(columns.values()), foreignKeys, sampleRows, rowCount);
		}
	}
}
