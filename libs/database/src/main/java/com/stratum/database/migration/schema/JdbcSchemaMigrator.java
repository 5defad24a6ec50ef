package com.stratum.database.migration.schema;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * {@link SchemaMigrator} that renders each change as an ANSI/PostgreSQL {@code ALTER TABLE} or
 * {@code CREATE INDEX} statement, qualified with the configured schema.
 *
 * <p>Identifiers are restricted to plain unquoted names; anything else is rejected with {@link
 * IllegalArgumentException} before a statement is built.
 */
public final class JdbcSchemaMigrator implements SchemaMigrator {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");

    private final String schema;

    /**
     * @param schema schema used to qualify table and index names; null or blank for none
     */
    public JdbcSchemaMigrator(String schema) {
        if (schema != null && !schema.isBlank()) {
            this.schema = identifier(schema);
        } else {
            this.schema = null;
        }
    }

    @Override
    public SchemaOperation sql(String sql, Object... parameters) {
        return new SqlStatementOperation(sql, parameters == null ? List.of() : Arrays.asList(parameters));
    }

    @Override
    public SchemaOperation addColumn(String table, String column, String definition) {
        if (definition == null || definition.isBlank()) {
            throw new IllegalArgumentException("definition must not be null or blank");
        }
        return statement("ALTER TABLE %s ADD COLUMN %s %s"
                .formatted(qualified(table), identifier(column), definition.strip()));
    }

    @Override
    public SchemaOperation dropColumn(String table, String column) {
        return statement("ALTER TABLE %s DROP COLUMN %s"
                .formatted(qualified(table), identifier(column)));
    }

    @Override
    public SchemaOperation renameColumn(String table, String oldName, String newName) {
        return statement("ALTER TABLE %s RENAME COLUMN %s TO %s"
                .formatted(qualified(table), identifier(oldName), identifier(newName)));
    }

    @Override
    public SchemaOperation renameTable(String oldName, String newName) {
        return statement("ALTER TABLE %s RENAME TO %s"
                .formatted(qualified(oldName), identifier(newName)));
    }

    @Override
    public SchemaOperation addIndex(String table, String indexName, boolean unique, String... columns) {
        if (columns == null || columns.length == 0) {
            throw new IllegalArgumentException("an index needs at least one column");
        }
        String columnList = String.join(", ", Arrays.stream(columns).map(JdbcSchemaMigrator::identifier).toList());
        return statement("CREATE %sINDEX %s ON %s (%s)"
                .formatted(unique ? "UNIQUE " : "", identifier(indexName), qualified(table), columnList));
    }

    @Override
    public SchemaOperation dropIndex(String indexName) {
        return statement("DROP INDEX %s".formatted(qualified(indexName)));
    }

    @Override
    public SchemaOperation addNotNull(String table, String column) {
        return statement("ALTER TABLE %s ALTER COLUMN %s SET NOT NULL"
                .formatted(qualified(table), identifier(column)));
    }

    @Override
    public SchemaOperation dropNotNull(String table, String column) {
        return statement("ALTER TABLE %s ALTER COLUMN %s DROP NOT NULL"
                .formatted(qualified(table), identifier(column)));
    }

    /** The schema names are qualified with, or null. */
    public String schema() {
        return schema;
    }

    private SchemaOperation statement(String sql) {
        return new SqlStatementOperation(sql);
    }

    private String qualified(String name) {
        String checked = identifier(name);
        return schema == null ? checked : schema + "." + checked;
    }

    static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("'%s' is not a valid SQL identifier".formatted(name));
        }
        return name;
    }
}
