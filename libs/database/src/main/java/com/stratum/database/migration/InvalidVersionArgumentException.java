package com.stratum.database.migration;

/** Thrown when an upgrade target is neither a non-negative integer nor {@code latest}. */
public class InvalidVersionArgumentException extends MigrationException {

    private final String argument;

    public InvalidVersionArgumentException(String argument) {
        super("Invalid target version '%s': expected a non-negative integer or '%s'"
                .formatted(argument, UpgradeTarget.LATEST));
        this.argument = argument;
    }

    public String argument() {
        return argument;
    }
}
