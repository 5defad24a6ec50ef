package com.stratum.database.migration;

/** Thrown when the stored version marker is not a non-negative base-10 integer. */
public class VersionParseException extends MigrationException {

    private final String rawValue;

    public VersionParseException(String rawValue) {
        super("Unable to parse current version '%s' as an integer".formatted(rawValue));
        this.rawValue = rawValue;
    }

    public String rawValue() {
        return rawValue;
    }
}
