package com.stratum.database.migration;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A discovered migration: its identity, version and the loaded operation producer.
 *
 * @param identifier file name without extension, e.g. {@code version_3_add_users}
 * @param version version parsed from the identifier
 * @param location file the migration was discovered at
 * @param migration operation producer, invoked only when the migration is applied
 */
public record MigrationDescriptor(String identifier, long version, Path location, Migration migration) {

    public MigrationDescriptor {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(migration, "migration");
        if (version < 0) {
            throw new IllegalArgumentException("version must not be negative: " + version);
        }
    }

    @Override
    public String toString() {
        return identifier + "@" + version;
    }
}
