package com.stratum.database.migration.schema;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A single schema or data change produced by a migration.
 *
 * <p>Operations are inert values until {@link #apply(Connection)} is called by a
 * {@link SchemaMigrator}, always inside the transaction of the batch they belong to.
 */
@FunctionalInterface
public interface SchemaOperation {

    /**
     * Executes the change on the given connection.
     *
     * @param connection connection whose transaction the change joins
     * @throws SQLException if the database rejects the change
     */
    void apply(Connection connection) throws SQLException;

    /** Human-readable form used in log output. */
    default String description() {
        return toString();
    }
}
