package com.stratum.database.migration.loader;

import com.stratum.database.migration.Migration;
import com.stratum.database.migration.MigrationLoader;
import java.nio.file.Path;
import java.util.Locale;

/** Loads plain SQL scripts ({@code version_<N>*.sql}) as migrations. */
public final class SqlScriptMigrationLoader implements MigrationLoader {

    public static final String EXTENSION = ".sql";

    @Override
    public boolean supports(String fileName) {
        return fileName.toLowerCase(Locale.ROOT).endsWith(EXTENSION);
    }

    @Override
    public Migration load(Path file) {
        return new SqlScriptMigration(file);
    }
}
