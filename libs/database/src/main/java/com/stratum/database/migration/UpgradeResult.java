package com.stratum.database.migration;

import java.util.List;

/**
 * Outcome of one {@code upgrade} call.
 *
 * @param previousVersion version stored before the call
 * @param currentVersion version stored after the call
 * @param applied migrations applied in this call, in order; empty for a no-op
 */
public record UpgradeResult(long previousVersion, long currentVersion, List<MigrationDescriptor> applied) {

    public UpgradeResult {
        applied = List.copyOf(applied);
    }

    static UpgradeResult upToDate(long version) {
        return new UpgradeResult(version, version, List.of());
    }

    /** True when nothing was pending and no transaction was opened. */
    public boolean upToDate() {
        return applied.isEmpty();
    }
}
