package org.javai.sqlassist.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything known about one table.
 *
 * <p>Column order is discovery order and is preserved: it decides which numeric column the
 * pattern generator picks and the order in which columns are rendered.</p>
 *
 * @param columns columns in discovery order
 * @param foreignKeys foreign keys declared on this table
 * @param sampleRows up to {@link #MAX_SAMPLE_ROWS} rows of sample data (column name to value, values may be null)
 * @param rowCount best-effort row count, 0 when counting failed
 */
public record TableInfo(
		List<ColumnInfo> columns,
		List<ForeignKeyInfo> foreignKeys,
		List<Map<String, String>> sampleRows,
		long rowCount
) {
	public static final int MAX_SAMPLE_ROWS = 5;

	public TableInfo {
		columns = columns != null ? List.copyOf(columns) : List.of();
		foreignKeys = foreignKeys != null ? List.copyOf(foreignKeys) : List.of();
		sampleRows = copySamples(sampleRows);
		if (rowCount < 0) {
			throw new IllegalArgumentException("rowCount must be >= 0");
		}
	}

	public TableInfo(List<ColumnInfo> columns) {
		this(columns, List.of(), List.of(), 0);
	}

	public Optional<ColumnInfo> findColumn(String name) {
		if (name == null) {
			return Optional.empty();
		}
		return columns.stream()
				.filter(c -> c.name().equals(name))
				.findFirst();
	}

	public boolean hasForeignKeys() {
		return !foreignKeys.isEmpty();
	}

	// Map.copyOf rejects null values, samples keep them.
	private static List<Map<String, String>> copySamples(List<Map<String, String>> rows) {
		if (rows == null || rows.isEmpty()) {
			return List.of();
		}
		List<Map<String, String>> copy = new ArrayList<>();
		for (Map<String, String> row : rows) {
			if (copy.size() == MAX_SAMPLE_ROWS) {
				break;
			}
			copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row != null ? row : Map.of())));
		}
		return Collections.unmodifiableList(copy);
	}
}
