/**
 * Versioned schema migrations applied in order, exactly once, inside one transaction per upgrade.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.stratum.database.migration.VersionStore}: the single-row version marker table
 *   <li>{@link com.stratum.database.migration.MigrationRegistry}: discovery and ordering of
 *       {@code version_<N>} files through pluggable {@link
 *       com.stratum.database.migration.MigrationLoader}s
 *   <li>{@link com.stratum.database.migration.MigrationExecutor}: transactional application of
 *       the pending batch
 *   <li>{@link com.stratum.database.migration.MigrationService}: {@code init}, {@code inspect},
 *       {@code latest}, {@code upgrade} and {@code status} as {@link
 *       com.stratum.database.migration.CommandResult}s
 * </ul>
 */
package com.stratum.database.migration;
