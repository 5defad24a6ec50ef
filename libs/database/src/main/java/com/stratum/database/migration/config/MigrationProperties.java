package com.stratum.database.migration.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized configuration for the migration engine, bound from {@code stratum.migration.*}.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * stratum:
 *   migration:
 *     database:
 *       url: jdbc:postgresql://localhost:5432/app
 *       username: app
 *       password: secret
 *     schema: public
 *     table: stratum_version
 *     location: migrations
 * }</pre>
 *
 * @param database connection settings
 * @param schema schema holding the version table and qualifying schema changes (default {@code
 *     public})
 * @param table version table name (default {@value #DEFAULT_TABLE})
 * @param location migrations directory, relative to the working directory unless absolute
 *     (default {@code migrations})
 */
@Validated
@ConfigurationProperties(prefix = "stratum.migration")
public record MigrationProperties(
        @NotNull @Valid DatabaseConfig database,
        String schema,
        @NotBlank String table,
        @NotBlank String location) {

    public static final String DEFAULT_SCHEMA = "public";
    public static final String DEFAULT_TABLE = "stratum_version";
    public static final String DEFAULT_LOCATION = "migrations";

    /** Applies defaults for optional fields; runs before Bean Validation. */
    public MigrationProperties {
        if (schema == null) {
            schema = DEFAULT_SCHEMA;
        }
        if (table == null || table.isBlank()) {
            table = DEFAULT_TABLE;
        }
        if (location == null || location.isBlank()) {
            location = DEFAULT_LOCATION;
        }
    }

    /**
     * Connection settings for the database being migrated.
     *
     * @param url JDBC connection URL (e.g., {@code jdbc:postgresql://localhost:5432/app})
     * @param username database username
     * @param password database password
     */
    public record DatabaseConfig(@NotBlank String url, String username, String password) {}
}
