package com.stratum.database.migration;

/**
 * Snapshot of the version marker as reported by {@code inspect}.
 *
 * @param status which of the three outcomes was observed
 * @param version the parsed version; only meaningful when {@code status} is {@link
 *     Status#INITIALIZED}
 * @param rawValue the stored text, or null when nothing is stored
 */
public record VersionState(Status status, long version, String rawValue) {

    public enum Status {
        /** No version table, or a table without a row. */
        NOT_INITIALIZED,
        INITIALIZED,
        /** A row exists but its value is not a non-negative integer. */
        UNPARSABLE
    }

    public static VersionState notInitialized() {
        return new VersionState(Status.NOT_INITIALIZED, 0, null);
    }

    public static VersionState initialized(long version) {
        return new VersionState(Status.INITIALIZED, version, Long.toString(version));
    }

    public static VersionState unparsable(String rawValue) {
        return new VersionState(Status.UNPARSABLE, 0, rawValue);
    }

    public boolean isInitialized() {
        return status == Status.INITIALIZED;
    }
}
