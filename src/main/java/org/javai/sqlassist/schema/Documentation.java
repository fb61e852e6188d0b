package org.javai.sqlassist.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * User-supplied descriptions keyed by table and column name.
 *
 * <p>The overlay is independent of the introspected schema: keys naming tables or columns the
 * schema does not contain are kept but never rendered. It survives schema reloads.</p>
 *
 * @param tables table name to its documentation
 */
public record Documentation(Map<String, TableDocumentation> tables) {

	private static final Documentation EMPTY = new Documentation(Map.of());

	public Documentation {
		tables = tables != null ? Collections.unmodifiableMap(new LinkedHashMap<>(tables)) : Map.of();
	}

	public static Documentation empty() {
		return EMPTY;
	}

	public boolean isEmpty() {
		return tables.isEmpty();
	}

	public Optional<String> tableDescription(String tableName) {
		return Optional.ofNullable(tableName)
				.map(tables::get)
				.map(TableDocumentation::description)
				.filter(d -> !d.isBlank());
	}

	public Optional<String> columnDescription(String tableName, String columnName) {
		if (tableName == null || columnName == null) {
			return Optional.empty();
		}
		TableDocumentation table = tables.get(tableName);
		if (table == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(table.columns().get(columnName))
				.filter(d -> !d.isBlank());
	}

	/**
	 * Returns a copy with the given table documentation added or replaced.
	 */
	public Documentation with(String tableName, TableDocumentation table) {
		Map<String, TableDocumentation> copy = new LinkedHashMap<>(tables);
		copy.put(tableName, table);
		return new Documentation(copy);
	}

	/**
	 * @param description free-text table description (empty when absent)
	 * @param columns column name to free-text description
	 */
	public record TableDocumentation(String description, Map<String, String> columns) {

		public TableDocumentation {
			description = description != null ? description : "";
			columns = columns != null ? Collections.unmodifiableMap(new LinkedHashMap<>(columns)) : Map.of();
		}

		public TableDocumentation(String description) {
			this(description, Map.of());
		}
	}
}
