package com.stratum.database.migration;

import java.nio.file.Path;

/**
 * Turns a discovered migration file into an invokable {@link Migration}.
 *
 * <p>{@link MigrationRegistry} asks each registered loader in turn; the first one that supports a
 * file name wins. Loading must be free of side effects on the database and should defer reading
 * the file until {@link Migration#upgrade} is called.
 */
public interface MigrationLoader {

    /**
     * @param fileName file name including extension, e.g. {@code version_3_add_users.sql}
     * @return true if this loader can produce a migration from the file
     */
    boolean supports(String fileName);

    /**
     * @param file path to a file this loader {@link #supports(String) supports}
     * @return the migration; never null
     */
    Migration load(Path file);
}
