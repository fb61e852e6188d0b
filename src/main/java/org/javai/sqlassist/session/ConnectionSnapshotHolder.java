package org.javai.sqlassist.session;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import javax.sql.DataSource;
import org.javai.sqlassist.introspect.SchemaIntrospector;
import org.javai.sqlassist.schema.Documentation;
import org.javai.sqlassist.schema.SchemaCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the process-wide active {@link ConnectionSnapshot}.
 *
 * <p>Snapshots are never mutated. Every change builds a new snapshot and swaps it in atomically,
 * so readers calling {@link #current()} always get a consistent schema/documentation pair.</p>
 */
public final class ConnectionSnapshotHolder {

	private static final Logger logger = LoggerFactory.getLogger(ConnectionSnapshotHolder.class);

	private final AtomicReference<ConnectionSnapshot> current =
			new AtomicReference<>(ConnectionSnapshot.disconnected());

	public ConnectionSnapshot current() {
		return current.get();
	}

	public ConnectionStatus status() {
		return ConnectionStatus.of(current());
	}

	/**
	 * Attaches a new data source. Schema and documentation of the previous connection are dropped.
	 */
	public ConnectionSnapshot connect(DataSource dataSource) {
		Objects.requireNonNull(dataSource, "dataSource must not be null");
		ConnectionSnapshot snapshot = current.updateAndGet(previous ->
				new ConnectionSnapshot(dataSource, null, Documentation.empty(), previous.generation() + 1));
		logger.info("Connected data source (generation {})", snapshot.generation());
		return snapshot;
	}

	public ConnectionSnapshot disconnect() {
		ConnectionSnapshot snapshot = current.updateAndGet(previous ->
				new ConnectionSnapshot(null, null, Documentation.empty(), previous.generation() + 1));
		logger.info("Disconnected (generation {})", snapshot.generation());
		return snapshot;
	}

	/**
	 * Replaces the schema, keeping the documentation and data source.
	 */
	public ConnectionSnapshot reloadSchema(SchemaCatalog schema) {
		Objects.requireNonNull(schema, "schema must not be null");
		ConnectionSnapshot snapshot = current.updateAndGet(previous -> previous.withSchema(schema));
		logger.info("Schema reloaded with {} tables", schema.tables().size());
		return snapshot;
	}

	/**
	 * Replaces the documentation overlay, keeping the schema and data source.
	 */
	public ConnectionSnapshot updateDocumentation(Documentation documentation) {
		Documentation effective = documentation != null ? documentation : Documentation.empty();
		return current.updateAndGet(previous -> previous.withDocumentation(effective));
	}

	/**
	 * Introspects the current data source and publishes the result.
	 *
	 * @throws IllegalStateException if not connected, or if a reconnect happened while introspecting
	 */
	public ConnectionSnapshot refreshSchema(SchemaIntrospector introspector) {
		Objects.requireNonNull(introspector, "introspector must not be null");
		ConnectionSnapshot base = current();
		if (!base.isConnected()) {
			throw new IllegalStateException("Not connected to a database");
		}
		SchemaCatalog schema = introspector.introspect(base.dataSource());
		ConnectionSnapshot snapshot = current.updateAndGet(latest -> {
			if (latest.generation() != base.generation()) {
				throw new IllegalStateException("Connection changed while the schema was being read");
			}
			return latest.withSchema(schema);
		});
		logger.info("Schema refreshed with {} tables", schema.tables().size());
		return snapshot;
	}
}
