package org.javai.sqlassist.schema;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Contract for an introspected relational schema: table name to table metadata.
 *
 * <p>Iteration order of {@link #tables()} is significant. The pattern generator falls back to the
 * first table and the context renderer emits tables in this order.</p>
 */
public interface SchemaCatalog {

	/**
	 * @return map of table name to table metadata (non-null, possibly empty, in discovery order)
	 */
	Map<String, TableInfo> tables();

	default boolean isEmpty() {
		return tables().isEmpty();
	}

	default List<String> tableNames() {
		return List.copyOf(tables().keySet());
	}

	default Optional<TableInfo> table(String tableName) {
		if (tableName == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(tables().get(tableName));
	}

	/**
	 * The empty schema, used before introspection has run.
	 */
	static SchemaCatalog empty() {
		return () -> Map.of();
	}

	/**
	 * Returns an unmodifiable copy that keeps the table order. Later changes to {@code schema},
	 * such as further {@code addColumn} calls on an {@link InMemorySchemaCatalog}, are not seen
	 * by the copy.
	 *
	 * @return the copy, or null when {@code schema} is null
	 */
	static SchemaCatalog copyOf(SchemaCatalog schema) {
		if (schema == null || schema instanceof FrozenSchemaCatalog) {
			return schema;
		}
		return new FrozenSchemaCatalog(schema.tables());
	}
}
