package com.stratum.database.migration;

/**
 * Thrown when the database reports a version newer than the highest migration on disk.
 *
 * <p>Usually means the migrations directory is stale or points at the wrong project.
 */
public class VersionAheadOfMigrationsException extends MigrationException {

    private final long currentVersion;
    private final long latestVersion;

    public VersionAheadOfMigrationsException(long currentVersion, long latestVersion) {
        super("Database is at version %d but the latest migration found is %d"
                .formatted(currentVersion, latestVersion));
        this.currentVersion = currentVersion;
        this.latestVersion = latestVersion;
    }

    public long currentVersion() {
        return currentVersion;
    }

    public long latestVersion() {
        return latestVersion;
    }
}
