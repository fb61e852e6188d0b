package org.javai.sqlassist.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unmodifiable point-in-time copy of a schema, see {@link SchemaCatalog#copyOf(SchemaCatalog)}.
 *
 * @param tables table name to table metadata, in the source's order
 */
record FrozenSchemaCatalog(Map<String, TableInfo> tables) implements SchemaCatalog {

	FrozenSchemaCatalog {
		tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables != null ? tables : Map.of()));
	}

	@Override
	public String toString() {
		return "SchemaCatalog" + tables.keySet();
	}
}
