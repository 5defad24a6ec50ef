package com.stratum.database.migration;

/**
 * Thrown when a migration inside a batch fails. The surrounding transaction has been rolled back
 * and the version marker is untouched when this reaches the caller.
 */
public class MigrationApplicationException extends MigrationException {

    private final String identifier;
    private final long version;

    public MigrationApplicationException(MigrationDescriptor migration, Throwable cause) {
        super("Migration '%s' (version %d) failed, no migrations were applied: %s"
                        .formatted(migration.identifier(), migration.version(), cause.getMessage()),
                cause);
        this.identifier = migration.identifier();
        this.version = migration.version();
    }

    public String identifier() {
        return identifier;
    }

    public long version() {
        return version;
    }
}
