package com.stratum.database.migration;

import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Where an upgrade should stop: a fixed version, or the latest migration on disk.
 *
 * @param version the target version; empty for {@link #latest()}
 */
public record UpgradeTarget(OptionalLong version) {

    /** Argument value selecting the latest migration. */
    public static final String LATEST = "latest";

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private static final UpgradeTarget LATEST_TARGET = new UpgradeTarget(OptionalLong.empty());

    public UpgradeTarget {
        if (version == null) {
            version = OptionalLong.empty();
        }
        if (version.isPresent() && version.getAsLong() < 0) {
            throw new IllegalArgumentException("target version must not be negative");
        }
    }

    public static UpgradeTarget latest() {
        return LATEST_TARGET;
    }

    public static UpgradeTarget of(long version) {
        return new UpgradeTarget(OptionalLong.of(version));
    }

    /**
     * Normalizes a caller-supplied target.
     *
     * @param argument null or blank for latest, a non-negative integer, or {@value #LATEST}
     * @throws InvalidVersionArgumentException for anything else
     */
    public static UpgradeTarget parse(String argument) {
        if (argument == null || argument.isBlank() || LATEST.equals(argument)) {
            return latest();
        }
        if (!DIGITS.matcher(argument).matches()) {
            throw new InvalidVersionArgumentException(argument);
        }
        try {
            return of(Long.parseLong(argument));
        } catch (NumberFormatException e) {
            throw new InvalidVersionArgumentException(argument);
        }
    }

    public boolean isLatest() {
        return version.isEmpty();
    }

    /** The concrete version to stop at, given the highest version discovered. */
    long resolve(long latestDiscovered) {
        return version.orElse(latestDiscovered);
    }

    @Override
    public String toString() {
        return isLatest() ? LATEST : Long.toString(version.getAsLong());
    }
}
