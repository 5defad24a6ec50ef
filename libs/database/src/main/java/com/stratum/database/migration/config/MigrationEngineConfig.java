package com.stratum.database.migration.config;

import com.stratum.database.migration.MigrationExecutor;
import com.stratum.database.migration.MigrationLoader;
import com.stratum.database.migration.MigrationRegistry;
import com.stratum.database.migration.MigrationService;
import com.stratum.database.migration.VersionStore;
import com.stratum.database.migration.loader.SqlScriptMigrationLoader;
import com.stratum.database.migration.schema.JdbcSchemaMigrator;
import com.stratum.database.migration.schema.SchemaMigrator;
import java.nio.file.Path;
import java.util.List;
import javax.sql.DataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the migration engine from {@link MigrationProperties}.
 *
 * <p>Every bean is conditional on a missing bean of the same type, so a host can supply its own
 * {@link DataSource} or {@link SchemaMigrator}. Every {@link MigrationLoader} bean is handed to the
 * {@link MigrationRegistry}, so a host adds a migration format by declaring a loader next to the
 * built-in SQL script one.
 */
@Configuration
@EnableConfigurationProperties(MigrationProperties.class)
public class MigrationEngineConfig {

    /** Bean name of the data source the engine migrates. */
    public static final String MIGRATION_DATA_SOURCE_BEAN = "migrationDataSource";

    @Bean(name = MIGRATION_DATA_SOURCE_BEAN)
    @ConditionalOnMissingBean(DataSource.class)
    public DataSource migrationDataSource(MigrationProperties properties) {
        MigrationProperties.DatabaseConfig config = properties.database();
        return DataSourceBuilder.create()
                .url(config.url())
                .username(config.username())
                .password(config.password())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public SqlScriptMigrationLoader sqlScriptMigrationLoader() {
        return new SqlScriptMigrationLoader();
    }

    @Bean
    @ConditionalOnMissingBean
    public MigrationRegistry migrationRegistry(List<MigrationLoader> loaders) {
        return new MigrationRegistry(loaders);
    }

    @Bean
    @ConditionalOnMissingBean
    public VersionStore versionStore(MigrationProperties properties) {
        return new VersionStore(properties.schema(), properties.table());
    }

    @Bean
    @ConditionalOnMissingBean
    public SchemaMigrator schemaMigrator(MigrationProperties properties) {
        return new JdbcSchemaMigrator(properties.schema());
    }

    @Bean
    @ConditionalOnMissingBean
    public MigrationExecutor migrationExecutor(
            DataSource dataSource,
            VersionStore versionStore,
            MigrationRegistry registry,
            SchemaMigrator schemaMigrator,
            MigrationProperties properties) {
        return new MigrationExecutor(
                dataSource, versionStore, registry, schemaMigrator, Path.of(properties.location()));
    }

    @Bean
    @ConditionalOnMissingBean
    public MigrationService migrationService(MigrationExecutor executor) {
        return new MigrationService(executor);
    }
}
