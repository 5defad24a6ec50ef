package com.stratum.database.migration;

import com.stratum.database.migration.schema.SchemaMigrator;
import com.stratum.database.migration.schema.SchemaOperation;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies pending migrations and answers questions about the version marker.
 *
 * <p>Every public method acquires its own connection from the {@link DataSource} and closes it
 * before returning. {@link #upgrade(UpgradeTarget)} runs the whole batch and the version write in
 * one transaction: either every pending migration in range is applied and the marker advances
 * once, or the transaction is rolled back and nothing changes.
 *
 * <p>Single-writer: two concurrent upgrades against the same database are not detected.
 */
public final class MigrationExecutor {

    private static final Logger log = LoggerFactory.getLogger(MigrationExecutor.class);

    private final DataSource dataSource;
    private final VersionStore versionStore;
    private final MigrationRegistry registry;
    private final SchemaMigrator schemaMigrator;
    private final Path migrationsDirectory;

    public MigrationExecutor(
            DataSource dataSource,
            VersionStore versionStore,
            MigrationRegistry registry,
            SchemaMigrator schemaMigrator,
            Path migrationsDirectory) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.versionStore = Objects.requireNonNull(versionStore, "versionStore");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.schemaMigrator = Objects.requireNonNull(schemaMigrator, "schemaMigrator");
        this.migrationsDirectory = Objects.requireNonNull(migrationsDirectory, "migrationsDirectory");
    }

    /** Creates and seeds the version table if needed. */
    public InitOutcome init() {
        try (Connection connection = dataSource.getConnection()) {
            InitOutcome outcome = versionStore.ensureInitialized(connection);
            if (outcome == InitOutcome.CREATED) {
                log.info("Database initialized: {} created at version 0", versionStore.qualifiedTable());
            } else {
                log.info("Database was already initialized");
            }
            return outcome;
        } catch (SQLException e) {
            throw new MigrationException(
                    "Unable to initialize version table %s".formatted(versionStore.qualifiedTable()), e);
        }
    }

    /** Reads the version marker without modifying anything. */
    public VersionState inspect() {
        VersionState state;
        try (Connection connection = dataSource.getConnection()) {
            state = versionStore.inspect(connection);
        } catch (SQLException e) {
            throw new MigrationException("Unable to connect to the database", e);
        }
        switch (state.status()) {
            case INITIALIZED -> log.info("Your database is at version {}", state.version());
            case UNPARSABLE -> log.error("Unable to parse current version '{}' as an integer", state.rawValue());
            case NOT_INITIALIZED -> log.info("Run 'init' to create a version table first");
        }
        return state;
    }

    /** Highest version in the migrations directory, 0 if it holds none. */
    public long latest() {
        return registry.latestVersion(migrationsDirectory);
    }

    /**
     * Compares the stored version with the migrations on disk.
     *
     * @throws NotInitializedException if no version is stored
     */
    public MigrationStatus status() {
        long current;
        try (Connection connection = dataSource.getConnection()) {
            current = currentVersion(connection);
        } catch (SQLException e) {
            throw new MigrationException("Unable to connect to the database", e);
        }
        List<MigrationDescriptor> migrations = registry.discover(migrationsDirectory);
        long latest = MigrationRegistry.latestVersion(migrations);
        return new MigrationStatus(current, latest, pending(migrations, current, latest));
    }

    /**
     * Applies every migration above the stored version up to {@code target}.
     *
     * @return the versions before and after, with the migrations applied; a no-op result when
     *     nothing is pending
     * @throws NotInitializedException if no version is stored
     * @throws VersionParseException if the stored version is not an integer
     * @throws MigrationDirectoryNotFoundException if the migrations directory is missing
     * @throws VersionAheadOfMigrationsException if the stored version exceeds every migration
     * @throws MigrationApplicationException if a migration fails; nothing is committed
     */
    public UpgradeResult upgrade(UpgradeTarget target) {
        Objects.requireNonNull(target, "target");
        try (Connection connection = dataSource.getConnection()) {
            long current = currentVersion(connection);
            List<MigrationDescriptor> migrations = registry.discover(migrationsDirectory);
            long latest = MigrationRegistry.latestVersion(migrations);
            if (current > latest) {
                log.error("Upgrade halted: database is at version {} but the latest migration is {}",
                        current, latest);
                throw new VersionAheadOfMigrationsException(current, latest);
            }

            long resolved = target.resolve(latest);
            List<MigrationDescriptor> batch = current == resolved
                    ? List.of()
                    : pending(migrations, current, resolved);
            if (batch.isEmpty()) {
                log.info("You are already up to date at version {}", current);
                return UpgradeResult.upToDate(current);
            }

            log.info("Migrating from version {} to \"{}\" ({} migrations)", current, target, batch.size());
            long newVersion = apply(connection, batch);
            log.info("Database is now at version {}", newVersion);
            return new UpgradeResult(current, newVersion, batch);
        } catch (SQLException e) {
            throw new MigrationException("Database error during upgrade: " + e.getMessage(), e);
        }
    }

    /** Runs the batch and the version write in one transaction. */
    private long apply(Connection connection, List<MigrationDescriptor> batch) throws SQLException {
        long newVersion = batch.get(batch.size() - 1).version();
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            for (MigrationDescriptor migration : batch) {
                runMigration(connection, migration);
            }
            try {
                versionStore.writeVersion(connection, newVersion);
                connection.commit();
            } catch (SQLException e) {
                rollback(connection, e);
                throw new MigrationException("Unable to record version %d, no migrations were applied"
                        .formatted(newVersion), e);
            }
            return newVersion;
        } catch (Throwable failure) {
            // restoring auto-commit below would commit whatever the batch left open
            rollback(connection, failure);
            throw failure;
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    private void runMigration(Connection connection, MigrationDescriptor migration) throws SQLException {
        log.info("Upgrading to version {} ({})", migration.version(), migration.identifier());
        try {
            List<SchemaOperation> operations = migration.migration().upgrade(schemaMigrator);
            if (operations == null) {
                operations = List.of();
            }
            for (SchemaOperation operation : operations) {
                log.debug("  {}", operation.description());
            }
            schemaMigrator.migrate(connection, operations);
        } catch (SQLException | RuntimeException e) {
            log.error("Migration {} failed, rolling back the batch", migration.identifier(), e);
            rollback(connection, e);
            throw new MigrationApplicationException(migration, e);
        }
    }

    private static void rollback(Connection connection, Throwable failure) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    private long currentVersion(Connection connection) {
        OptionalLong current = versionStore.readCurrentVersion(connection);
        if (current.isEmpty()) {
            log.error("Halted: you must run 'init' before using this database");
            throw new NotInitializedException();
        }
        return current.getAsLong();
    }

    /** Migrations with {@code current < version <= target}, keeping their order. */
    static List<MigrationDescriptor> pending(List<MigrationDescriptor> migrations, long current, long target) {
        return migrations.stream()
                .filter(m -> m.version() > current && m.version() <= target)
                .toList();
    }
}
