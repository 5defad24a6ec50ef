package com.stratum.database.migration;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the single-row version table.
 *
 * <p>The table holds one {@code ref} column with the stringified version of the last batch that
 * was fully applied. Before {@link #ensureInitialized} it has no row (or does not exist); after it,
 * exactly one row. {@link #writeVersion} replaces the row with a delete followed by an insert and
 * must run inside the caller's transaction, so a reader never observes zero or two rows.
 *
 * <p>The store never opens connections; callers pass one in and keep ownership of it.
 */
public final class VersionStore {

    private static final Logger log = LoggerFactory.getLogger(VersionStore.class);

    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern NON_NEGATIVE_INTEGER = Pattern.compile("\\d+");

    private final String schema;
    private final String table;

    /**
     * @param schema schema holding the table; null or blank for the connection's default
     * @param table version table name
     */
    public VersionStore(String schema, String table) {
        if (table == null || !NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("invalid version table name: " + table);
        }
        if (schema != null && !schema.isBlank() && !NAME.matcher(schema).matches()) {
            throw new IllegalArgumentException("invalid schema name: " + schema);
        }
        this.schema = schema == null || schema.isBlank() ? null : schema;
        this.table = table;
    }

    /**
     * Creates the table if absent and seeds it with version 0 if it has no row.
     *
     * @return {@link InitOutcome#CREATED} if the row was inserted, otherwise {@link
     *     InitOutcome#ALREADY_INITIALIZED}
     */
    public InitOutcome ensureInitialized(Connection connection) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            try (Statement statement = connection.createStatement()) {
                statement.execute("CREATE TABLE IF NOT EXISTS %s (ref VARCHAR(255) PRIMARY KEY)"
                        .formatted(qualifiedTable()));
            }
            InitOutcome outcome;
            if (readRawValue(connection).isPresent()) {
                outcome = InitOutcome.ALREADY_INITIALIZED;
            } else {
                insert(connection, 0);
                outcome = InitOutcome.CREATED;
            }
            connection.commit();
            return outcome;
        } catch (SQLException | RuntimeException e) {
            connection.rollback();
            throw e;
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    /**
     * Reads the stored version.
     *
     * @return the version, or empty when the table is missing, unreadable or has no row
     * @throws VersionParseException if the stored value is not a non-negative integer
     */
    public OptionalLong readCurrentVersion(Connection connection) {
        VersionState state = inspect(connection);
        return switch (state.status()) {
            case INITIALIZED -> OptionalLong.of(state.version());
            case UNPARSABLE -> throw new VersionParseException(state.rawValue());
            case NOT_INITIALIZED -> OptionalLong.empty();
        };
    }

    /**
     * Reads the stored version without throwing for a missing table or a bad value.
     *
     * <p>An unreadable table is reported as not initialized. Callers must not use this inside a
     * transaction they intend to keep: on some databases a failed read aborts the transaction.
     */
    public VersionState inspect(Connection connection) {
        Optional<String> raw;
        try {
            if (!tableExists(connection)) {
                return VersionState.notInitialized();
            }
            raw = readRawValue(connection);
        } catch (SQLException e) {
            log.warn("Unable to read version table {}: {}", qualifiedTable(), e.getMessage());
            return VersionState.notInitialized();
        }
        if (raw.isEmpty()) {
            return VersionState.notInitialized();
        }
        String value = raw.get().strip();
        if (!NON_NEGATIVE_INTEGER.matcher(value).matches()) {
            return VersionState.unparsable(raw.get());
        }
        try {
            return VersionState.initialized(Long.parseLong(value));
        } catch (NumberFormatException e) {
            return VersionState.unparsable(raw.get());
        }
    }

    /**
     * Replaces the stored version with {@code version}.
     *
     * @throws IllegalStateException if the connection is in auto-commit mode
     */
    public void writeVersion(Connection connection, long version) throws SQLException {
        if (version < 0) {
            throw new IllegalArgumentException("version must not be negative: " + version);
        }
        if (connection.getAutoCommit()) {
            throw new IllegalStateException("writeVersion must run inside a transaction");
        }
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM " + qualifiedTable());
        }
        insert(connection, version);
        log.info("Set version to {}", version);
    }

    /** The table name as written in SQL, schema-qualified when a schema is configured. */
    public String qualifiedTable() {
        return schema == null ? table : schema + "." + table;
    }

    private void insert(Connection connection, long version) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO %s (ref) VALUES (?)".formatted(qualifiedTable()))) {
            statement.setString(1, Long.toString(version));
            statement.executeUpdate();
        }
    }

    private Optional<String> readRawValue(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.setMaxRows(1);
            try (ResultSet rs = statement.executeQuery("SELECT ref FROM " + qualifiedTable())) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        }
    }

    private boolean tableExists(Connection connection) throws SQLException {
        DatabaseMetaData metaData = connection.getMetaData();
        String schemaPattern = schema == null ? null : pattern(metaData, schema);
        try (ResultSet rs = metaData.getTables(
                connection.getCatalog(), schemaPattern, pattern(metaData, table), null)) {
            return rs.next();
        }
    }

    /**
     * Metadata search pattern for an unquoted identifier: folded to the case the database stores
     * it in, with {@code _} escaped so it is not a wildcard.
     */
    private static String pattern(DatabaseMetaData metaData, String name) throws SQLException {
        String folded = name;
        if (metaData.storesUpperCaseIdentifiers()) {
            folded = name.toUpperCase(Locale.ROOT);
        } else if (metaData.storesLowerCaseIdentifiers()) {
            folded = name.toLowerCase(Locale.ROOT);
        }
        String escape = metaData.getSearchStringEscape();
        if (escape == null || escape.isEmpty()) {
            return folded;
        }
        return folded.replace("_", escape + "_");
    }
}
