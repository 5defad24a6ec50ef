/**
 * Database tooling for Stratum.
 *
 * <p>The {@link com.stratum.database.migration} package holds the migration engine; its {@code
 * schema} subpackage provides the schema-mutation handle migrations are written against, and
 * {@code config} the Spring Boot wiring bound from {@code stratum.migration.*}.
 */
package com.stratum.database;
