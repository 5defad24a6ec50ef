package com.stratum.database.migration.schema;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Schema-mutation handle given to every migration.
 *
 * <p>Migrations call the factory methods to describe what they want changed and return the
 * resulting operations; the engine then hands the list back to {@link #migrate(Connection, List)}.
 * The factory methods never touch the database.
 *
 * <pre>{@code
 * Migration addEmail = migrator -> List.of(
 *         migrator.addColumn("users", "email", "VARCHAR(320)"),
 *         migrator.addIndex("users", "users_email_idx", true, "email"));
 * }</pre>
 */
public interface SchemaMigrator {

    /** Arbitrary statement, with optional positional {@code ?} parameters. */
    SchemaOperation sql(String sql, Object... parameters);

    SchemaOperation addColumn(String table, String column, String definition);

    SchemaOperation dropColumn(String table, String column);

    SchemaOperation renameColumn(String table, String oldName, String newName);

    SchemaOperation renameTable(String oldName, String newName);

    SchemaOperation addIndex(String table, String indexName, boolean unique, String... columns);

    SchemaOperation dropIndex(String indexName);

    SchemaOperation addNotNull(String table, String column);

    SchemaOperation dropNotNull(String table, String column);

    /**
     * Applies the operations in order on the given connection. Stops at the first failure.
     *
     * @param connection connection with an open transaction
     * @param operations operations produced by one migration
     * @throws SQLException if any operation fails
     */
    default void migrate(Connection connection, List<SchemaOperation> operations)
            throws SQLException {
        for (SchemaOperation operation : operations) {
            operation.apply(connection);
        }
    }
}
