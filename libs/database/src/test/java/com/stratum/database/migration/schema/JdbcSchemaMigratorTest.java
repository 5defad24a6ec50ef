package com.stratum.database.migration.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("JdbcSchemaMigrator")
class JdbcSchemaMigratorTest {

    private final JdbcSchemaMigrator migrator = new JdbcSchemaMigrator("app");

    @Nested
    @DisplayName("statement rendering")
    class Rendering {

        @Test
        @DisplayName("qualifies tables and indexes with the schema")
        void qualifies() {
            assertThat(sql(migrator.addColumn("users", "email", "VARCHAR(320) "))).isEqualTo(
                    "ALTER TABLE app.users ADD COLUMN email VARCHAR(320)");
            assertThat(sql(migrator.dropColumn("users", "email")))
                    .isEqualTo("ALTER TABLE app.users DROP COLUMN email");
            assertThat(sql(migrator.renameColumn("users", "name", "full_name")))
                    .isEqualTo("ALTER TABLE app.users RENAME COLUMN name TO full_name");
            assertThat(sql(migrator.renameTable("users", "accounts")))
                    .isEqualTo("ALTER TABLE app.users RENAME TO accounts");
            assertThat(sql(migrator.addIndex("users", "users_email_idx", true, "email", "tenant_id")))
                    .isEqualTo("CREATE UNIQUE INDEX users_email_idx ON app.users (email, tenant_id)");
            assertThat(sql(migrator.dropIndex("users_email_idx"))).isEqualTo("DROP INDEX app.users_email_idx");
            assertThat(sql(migrator.addNotNull("users", "email")))
                    .isEqualTo("ALTER TABLE app.users ALTER COLUMN email SET NOT NULL");
            assertThat(sql(migrator.dropNotNull("users", "email")))
                    .isEqualTo("ALTER TABLE app.users ALTER COLUMN email DROP NOT NULL");
        }

        @Test
        @DisplayName("leaves names unqualified without a schema")
        void unqualified() {
            assertThat(sql(new JdbcSchemaMigrator(" ").addIndex("t", "t_idx", false, "c")))
                    .isEqualTo("CREATE INDEX t_idx ON t (c)");
        }

        @Test
        @DisplayName("rejects identifiers that are not plain names")
        void rejectsInjection() {
            assertThatThrownBy(() -> migrator.dropColumn("users; DROP TABLE x", "a"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> migrator.addIndex("users", "idx", false))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new JdbcSchemaMigrator("my schema"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("raw statements keep their parameters, nulls included")
        void rawSql() {
            SqlStatementOperation op = (SqlStatementOperation) migrator.sql("UPDATE t SET a = ?, b = ?", 1, null);

            assertThat(op.parameters()).containsExactly(1, null);
            assertThat(op.description()).isEqualTo("UPDATE t SET a = ?, b = ?");
        }
    }

    @Nested
    @DisplayName("against a database")
    class Applying {

        private Connection connection;

        @BeforeEach
        void open() throws SQLException {
            connection = DriverManager.getConnection("jdbc:h2:mem:" + UUID.randomUUID());
            try (Statement statement = connection.createStatement()) {
                statement.execute("CREATE SCHEMA app");
                statement.execute("CREATE TABLE app.users (id BIGINT PRIMARY KEY, name VARCHAR(64))");
            }
        }

        @AfterEach
        void close() throws SQLException {
            connection.close();
        }

        @Test
        @DisplayName("migrate applies the operations in order")
        void appliesInOrder() throws SQLException {
            migrator.migrate(connection, List.of(
                    migrator.addColumn("users", "email", "VARCHAR(320)"),
                    migrator.sql("INSERT INTO app.users (id, name, email) VALUES (?, ?, ?)", 1L, "ann", "a@x"),
                    migrator.addNotNull("users", "email"),
                    migrator.addIndex("users", "users_email_idx", true, "email"),
                    migrator.renameColumn("users", "name", "full_name")));

            try (Statement statement = connection.createStatement();
                    ResultSet rs = statement.executeQuery("SELECT full_name, email FROM app.users")) {
                assertThat(rs.next()).isTrue();
                assertThat(rs.getString(1)).isEqualTo("ann");
                assertThat(rs.getString(2)).isEqualTo("a@x");
            }
        }

        @Test
        @DisplayName("migrate stops at the first failing operation")
        void stopsAtFailure() {
            List<SchemaOperation> operations = List.of(
                    migrator.dropColumn("users", "missing_column"),
                    migrator.addColumn("users", "never_added", "INT"));

            assertThatThrownBy(() -> migrator.migrate(connection, operations))
                    .isInstanceOf(SQLException.class);
        }
    }

    private static String sql(SchemaOperation operation) {
        return ((SqlStatementOperation) operation).sql();
    }
}
