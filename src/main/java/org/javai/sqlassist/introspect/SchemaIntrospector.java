package org.javai.sqlassist.introspect;

import javax.sql.DataSource;
import org.javai.sqlassist.schema.SchemaCatalog;

/**
 * Reads the structure of a connected database.
 */
public interface SchemaIntrospector {

	/**
	 * Builds a fresh schema. Per-table sample and count failures degrade that table's fields
	 * instead of failing the call.
	 *
	 * @throws SchemaIntrospectionException if the table structure cannot be read at all
	 */
	SchemaCatalog introspect(DataSource dataSource);
}
