package org.javai.sqlassist.session;

import java.util.Optional;
import javax.sql.DataSource;
import org.javai.sqlassist.schema.Documentation;
import org.javai.sqlassist.schema.SchemaCatalog;

/**
 * Immutable view of the active connection: the data source, the schema introspected from it and
 * the documentation overlay. A request reads one snapshot and uses it throughout, so it never
 * sees a schema paired with documentation from another connection.
 *
 * @param dataSource the connected data source, null when disconnected
 * @param schema the introspected schema, copied on construction; null until introspection has run
 * @param documentation the documentation overlay, never null
 * @param generation increases on every reconnect; identifies which connection produced the schema
 */
public record ConnectionSnapshot(
		DataSource dataSource,
		SchemaCatalog schema,
		Documentation documentation,
		long generation
) {
	private static final ConnectionSnapshot DISCONNECTED = new ConnectionSnapshot(null, null, Documentation.empty(), 0);

	public ConnectionSnapshot {
		schema = SchemaCatalog.copyOf(schema);
		documentation = documentation != null ? documentation : Documentation.empty();
	}

	public static ConnectionSnapshot disconnected() {
		return DISCONNECTED;
	}

	public boolean isConnected() {
		return dataSource != null;
	}

	public boolean hasSchema() {
		return schema != null;
	}

	/**
	 * The schema, or the empty schema before introspection.
	 */
	public SchemaCatalog schemaOrEmpty() {
		return schema != null ? schema : SchemaCatalog.empty();
	}

	public Optional<DataSource> connection() {
		return Optional.ofNullable(dataSource);
	}

	ConnectionSnapshot withSchema(SchemaCatalog newSchema) {
		return new ConnectionSnapshot(dataSource, newSchema, documentation, generation);
	}

	ConnectionSnapshot withDocumentation(Documentation newDocumentation) {
		return new ConnectionSnapshot(dataSource, schema, newDocumentation, generation);
	}
}
