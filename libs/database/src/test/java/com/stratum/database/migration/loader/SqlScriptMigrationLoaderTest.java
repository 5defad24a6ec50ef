package com.stratum.database.migration.loader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.stratum.database.migration.Migration;
import com.stratum.database.migration.schema.JdbcSchemaMigrator;
import com.stratum.database.migration.schema.SchemaOperation;
import com.stratum.database.migration.schema.SqlStatementOperation;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("SqlScriptMigrationLoader")
class SqlScriptMigrationLoaderTest {

    @TempDir Path dir;

    private final SqlScriptMigrationLoader loader = new SqlScriptMigrationLoader();

    @Test
    @DisplayName("supports .sql files regardless of case")
    void supports() {
        assertThat(loader.supports("version_1.sql")).isTrue();
        assertThat(loader.supports("version_1.SQL")).isTrue();
        assertThat(loader.supports("version_1.py")).isFalse();
    }

    @Test
    @DisplayName("turns each statement into a SQL operation")
    void producesOperations() throws IOException {
        Path script = Files.writeString(dir.resolve("version_1.sql"),
                "ALTER TABLE users ADD COLUMN age INT;\nUPDATE users SET age = 0;\n");

        List<SchemaOperation> operations = loader.load(script).upgrade(new JdbcSchemaMigrator(null));

        assertThat(operations).containsExactly(
                new SqlStatementOperation("ALTER TABLE users ADD COLUMN age INT"),
                new SqlStatementOperation("UPDATE users SET age = 0"));
    }

    @Test
    @DisplayName("reads the script only when the migration runs")
    void readsLazily() throws IOException {
        Path script = dir.resolve("version_2.sql");

        Migration migration = loader.load(script);
        Files.writeString(script, "SELECT 1;");

        assertThat(migration.upgrade(new JdbcSchemaMigrator(null))).hasSize(1);
    }

    @Test
    @DisplayName("a script that vanished fails when applied")
    void missingScript() {
        Migration migration = loader.load(dir.resolve("version_3.sql"));

        assertThatThrownBy(() -> migration.upgrade(new JdbcSchemaMigrator(null)))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("version_3.sql");
    }
}
