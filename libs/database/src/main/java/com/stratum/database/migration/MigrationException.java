package com.stratum.database.migration;

/**
 * Base type for every condition the migration engine reports to its caller.
 *
 * <p>Unchecked: each top-level operation either completes or aborts with one of the subclasses.
 * {@link MigrationService} converts them into unsuccessful {@link CommandResult}s so that a host
 * process never crashes on a reported condition.
 */
public class MigrationException extends RuntimeException {

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
