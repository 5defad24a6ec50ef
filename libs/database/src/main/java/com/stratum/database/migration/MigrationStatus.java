package com.stratum.database.migration;

import java.util.List;

/**
 * Where the database stands relative to the migrations on disk.
 *
 * @param currentVersion version stored in the database
 * @param latestVersion highest version discovered, 0 if none
 * @param pending migrations above the current version, ascending
 */
public record MigrationStatus(long currentVersion, long latestVersion, List<MigrationDescriptor> pending) {

    public MigrationStatus {
        pending = List.copyOf(pending);
    }

    public boolean upToDate() {
        return pending.isEmpty();
    }
}
