package org.javai.sqlassist.introspect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import javax.sql.DataSource;
import org.javai.sqlassist.config.IntrospectionSettings;
import org.javai.sqlassist.schema.ColumnInfo;
import org.javai.sqlassist.schema.ForeignKeyInfo;
import org.javai.sqlassist.schema.SchemaCatalog;
import org.javai.sqlassist.schema.TableInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

class JdbcSchemaIntrospectorTest {

	@TempDir
	Path tempDir;

	private DataSource dataSource;

	@BeforeEach
	void createDatabase() throws SQLException {
		SQLiteDataSource sqlite = new SQLiteDataSource();
		sqlite.setUrl("jdbc:sqlite:" + tempDir.resolve("shop.db"));
		dataSource = sqlite;

		try (Connection connection = dataSource.getConnection(); Statement statement = connection.createStatement()) {
			statement.execute("CREATE TABLE users (id INTEGER PRIMARY KEY, email TEXT NOT NULL, nickname TEXT)");
			statement.execute("CREATE TABLE orders (id INTEGER PRIMARY KEY, user_id INTEGER REFERENCES users(id), "
					+ "amount REAL, status TEXT DEFAULT 'open')");
			for (int i = 1; i <= 7; i++) {
				statement.execute("INSERT INTO users (id, email, nickname) VALUES (" + i + ", 'u" + i + "@example.com', "
						+ (i == 1 ? "NULL" : "'nick" + i + "'") + ")");
			}
			statement.execute("INSERT INTO orders (id, user_id, amount) VALUES (1, 1, 9.5)");
		}
	}

	@Test
	void readsTablesColumnsAndKeys() {
		SchemaCatalog schema = new JdbcSchemaIntrospector().introspect(dataSource);

		assertThat(schema.tableNames()).containsExactlyInAnyOrder("users", "orders");

		TableInfo users = schema.table("users").orElseThrow();
		assertThat(users.columns()).extracting(ColumnInfo::name).containsExactly("id", "email", "nickname");
		assertThat(users.findColumn("id")).hasValueSatisfying(c -> assertThat(c.primaryKey()).isTrue());
		assertThat(users.findColumn("email")).hasValueSatisfying(c -> {
			assertThat(c.type()).isEqualToIgnoringCase("TEXT");
			assertThat(c.nullable()).isFalse();
			assertThat(c.primaryKey()).isFalse();
		});

		TableInfo orders = schema.table("orders").orElseThrow();
		assertThat(orders.findColumn("amount")).hasValueSatisfying(c -> assertThat(c.type()).isEqualToIgnoringCase("REAL"));
		assertThat(orders.findColumn("status")).hasValueSatisfying(c -> assertThat(c.defaultValue()).contains("open"));
		assertThat(orders.foreignKeys()).containsExactly(ForeignKeyInfo.of("user_id", "users", "id"));
	}

	@Test
	void samplesAreCappedAndCountsAreExact() {
		SchemaCatalog schema = new JdbcSchemaIntrospector().introspect(dataSource);

		TableInfo users = schema.table("users").orElseThrow();
		assertThat(users.rowCount()).isEqualTo(7);
		assertThat(users.sampleRows()).hasSize(TableInfo.MAX_SAMPLE_ROWS);
		assertThat(users.sampleRows().get(0))
				.containsEntry("email", "u1@example.com")
				.containsEntry("nickname", null);
		assertThat(schema.table("orders").orElseThrow().rowCount()).isEqualTo(1);
	}

	@Test
	void sampleSizeFollowsSettings() {
		SchemaCatalog none = new JdbcSchemaIntrospector(new IntrospectionSettings(0)).introspect(dataSource);
		SchemaCatalog two = new JdbcSchemaIntrospector(new IntrospectionSettings(2)).introspect(dataSource);

		assertThat(none.table("users").orElseThrow().sampleRows()).isEmpty();
		assertThat(none.table("users").orElseThrow().rowCount()).isEqualTo(7);
		assertThat(two.table("users").orElseThrow().sampleRows()).hasSize(2);
	}

	@Test
	void unreachableDatabaseRaisesIntrospectionException() throws SQLException {
		DataSource broken = mock(DataSource.class);
		when(broken.getConnection()).thenThrow(new SQLException("connection refused"));

		assertThatThrownBy(() -> new JdbcSchemaIntrospector().introspect(broken))
				.isInstanceOf(SchemaIntrospectionException.class)
				.hasMessageContaining("connection refused")
				.hasCauseInstanceOf(SQLException.class);
	}

	@Test
	void dataSourceIsRequired() {
		assertThatThrownBy(() -> new JdbcSchemaIntrospector().introspect(null))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
