package com.stratum.database.migration;

/** Thrown when an operation needs the version table but {@code init} has never been run. */
public class NotInitializedException extends MigrationException {

    public NotInitializedException() {
        super("Database is not initialized: run 'init' to create the version table first");
    }
}
