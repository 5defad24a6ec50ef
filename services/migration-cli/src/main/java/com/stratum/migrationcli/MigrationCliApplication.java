package com.stratum.migrationcli;

import com.stratum.database.migration.config.MigrationEngineConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.context.annotation.Import;

/**
 * Command-line host for the Stratum migration engine.
 *
 * <pre>
 * java -jar migration-cli.jar init
 * java -jar migration-cli.jar upgrade [target]
 * java -jar migration-cli.jar inspect --stratum.migration.location=db/migrations
 * </pre>
 *
 * <p>Connection settings, schema and migrations directory come from {@code application.yml},
 * environment variables or {@code --stratum.migration.*} arguments. The process exit status is
 * the command's {@link com.stratum.database.migration.CommandResult#exitCode()}.
 *
 * <p>Spring Boot's own DataSource auto-configuration is excluded: the engine builds its data source
 * from {@code stratum.migration.database}.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@Import(MigrationEngineConfig.class)
public class MigrationCliApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(MigrationCliApplication.class, args)));
    }
}
