package org.javai.sqlassist.introspect;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.sql.DataSource;
import org.javai.sqlassist.config.IntrospectionSettings;
import org.javai.sqlassist.schema.ColumnInfo;
import org.javai.sqlassist.schema.ForeignKeyInfo;
import org.javai.sqlassist.schema.InMemorySchemaCatalog;
import org.javai.sqlassist.schema.SchemaCatalog;
import org.javai.sqlassist.schema.TableInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SchemaIntrospector} over {@link DatabaseMetaData}.
 *
 * <p>Tables come back in the driver's metadata order, columns in ordinal order. Primary keys are
 * merged into the columns by name; imported keys are grouped into (possibly multi-column)
 * foreign keys. Sample rows and row counts are best effort: a table the user may not read still
 * appears, with no samples and a count of 0.</p>
 */
public final class JdbcSchemaIntrospector implements SchemaIntrospector {

	private static final Logger logger = LoggerFactory.getLogger(JdbcSchemaIntrospector.class);

	private final IntrospectionSettings settings;

	public JdbcSchemaIntrospector(IntrospectionSettings settings) {
		this.settings = settings != null ? settings : IntrospectionSettings.defaults();
	}

	public JdbcSchemaIntrospector() {
		this(IntrospectionSettings.defaults());
	}

	@Override
	public SchemaCatalog introspect(DataSource dataSource) {
		if (dataSource == null) {
			throw new IllegalArgumentException("dataSource must not be null");
		}
		try (Connection connection = dataSource.getConnection()) {
			DatabaseMetaData metaData = connection.getMetaData();
			String quote = identifierQuote(metaData);
			InMemorySchemaCatalog schema = new InMemorySchemaCatalog();
			for (String table : readTableNames(metaData)) {
				List<ColumnInfo> columns = readColumns(metaData, table);
				List<ForeignKeyInfo> foreignKeys = readForeignKeys(metaData, table);
				String quotedTable = quote + table + quote;
				List<Map<String, String>> samples = readSamples(connection, table, quotedTable);
				long rowCount = countRows(connection, table, quotedTable);
				schema.putTable(table, new TableInfo(columns, foreignKeys, samples, rowCount));
			}
			logger.debug("Introspected {} tables", schema.tables().size());
			return schema;
		}
		catch (SQLException e) {
			throw new SchemaIntrospectionException("Failed to read database schema: " + e.getMessage(), e);
		}
	}

	private static String identifierQuote(DatabaseMetaData metaData) throws SQLException {
		String quote = metaData.getIdentifierQuoteString();
		return quote == null || quote.isBlank() ? "" : quote.trim();
	}

	private static List<String> readTableNames(DatabaseMetaData metaData) throws SQLException {
		List<String> tables = new ArrayList<>();
		try (ResultSet rs = metaData.getTables(null, null, "%", new String[] { "TABLE" })) {
			while (rs.next()) {
				String name = rs.getString("TABLE_NAME");
				if (name != null && !name.startsWith("sqlite_")) {
					tables.add(name);
				}
			}
		}
		return tables;
	}

	private static List<ColumnInfo> readColumns(DatabaseMetaData metaData, String table) throws SQLException {
		Set<String> primaryKey = new HashSet<>();
		try (ResultSet rs = metaData.getPrimaryKeys(null, null, table)) {
			while (rs.next()) {
				primaryKey.add(rs.getString("COLUMN_NAME"));
			}
		}
		List<ColumnInfo> columns = new ArrayList<>();
		try (ResultSet rs = metaData.getColumns(null, null, table, "%")) {
			while (rs.next()) {
				String name = rs.getString("COLUMN_NAME");
				columns.add(new ColumnInfo(
						name,
						rs.getString("TYPE_NAME"),
						!"NO".equalsIgnoreCase(rs.getString("IS_NULLABLE")),
						rs.getString("COLUMN_DEF"),
						primaryKey.contains(name)));
			}
		}
		return columns;
	}

	/**
	 * Groups imported key rows into constraints: by FK_NAME when the driver reports one, otherwise
	 * a new constraint starts at every KEY_SEQ of 1.
	 */
	private static List<ForeignKeyInfo> readForeignKeys(DatabaseMetaData metaData, String table) throws SQLException {
		Map<String, KeyColumns> keys = new LinkedHashMap<>();
		int anonymous = 0;
		String currentKey = null;
		try (ResultSet rs = metaData.getImportedKeys(null, null, table)) {
			while (rs.next()) {
				String fkName = rs.getString("FK_NAME");
				String referredTable = rs.getString("PKTABLE_NAME");
				int keySeq = rs.getInt("KEY_SEQ");
				String key;
				if (fkName != null && !fkName.isBlank()) {
					key = fkName;
				}
				else if (keySeq <= 1 || currentKey == null) {
					key = referredTable + "#" + (anonymous++);
				}
				else {
					key = currentKey;
				}
				currentKey = key;
				keys.computeIfAbsent(key, k -> new KeyColumns(referredTable))
						.add(rs.getString("FKCOLUMN_NAME"), rs.getString("PKCOLUMN_NAME"));
			}
		}
		return keys.values().stream().map(KeyColumns::build).toList();
	}

	private List<Map<String, String>> readSamples(Connection connection, String table, String quotedTable) {
		if (settings.sampleRows() == 0) {
			return List.of();
		}
		List<Map<String, String>> rows = new ArrayList<>();
		try (Statement statement = connection.createStatement();
				ResultSet rs = statement.executeQuery("SELECT * FROM " + quotedTable + " LIMIT " + settings.sampleRows())) {
			ResultSetMetaData columns = rs.getMetaData();
			while (rs.next() && rows.size() < settings.sampleRows()) {
				Map<String, String> row = new LinkedHashMap<>();
				for (int i = 1; i <= columns.getColumnCount(); i++) {
					Object value = rs.getObject(i);
					row.put(columns.getColumnLabel(i), value != null ? value.toString() : null);
				}
				rows.add(row);
			}
			return rows;
		}
		catch (SQLException e) {
			logger.debug("Skipping sample rows for {}: {}", table, e.getMessage());
			return List.of();
		}
	}

	private static long countRows(Connection connection, String table, String quotedTable) {
		try (Statement statement = connection.createStatement();
				ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM " + quotedTable)) {
			return rs.next() ? rs.getLong(1) : 0;
		}
		catch (SQLException e) {
			logger.debug("Skipping row count for {}: {}", table, e.getMessage());
			return 0;
		}
	}

	private static final class KeyColumns {
		private final String referredTable;
		private final List<String> constrained = new ArrayList<>();
		private final List<String> referred = new ArrayList<>();

		KeyColumns(String referredTable) {
			this.referredTable = referredTable;
		}

		void add(String constrainedColumn, String referredColumn) {
			constrained.add(constrainedColumn);
			referred.add(referredColumn);
		}

		ForeignKeyInfo build() {
			return new ForeignKeyInfo(constrained, referredTable, referred);
		}
	}
}
