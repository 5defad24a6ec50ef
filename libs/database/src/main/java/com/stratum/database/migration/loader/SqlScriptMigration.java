package com.stratum.database.migration.loader;

import com.stratum.database.migration.Migration;
import com.stratum.database.migration.schema.SchemaMigrator;
import com.stratum.database.migration.schema.SchemaOperation;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.springframework.core.io.PathResource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.jdbc.datasource.init.ScriptUtils;

/**
 * A migration whose operations are the statements of a SQL script. The script is read when the
 * migration is applied, not when it is discovered.
 *
 * <p>Statements are split with Spring's {@link ScriptUtils}: {@code ;} separates statements
 * outside quoted text, line and block comments are dropped, and a backslash escapes the next
 * character.
 */
final class SqlScriptMigration implements Migration {

    private final Path script;

    SqlScriptMigration(Path script) {
        this.script = script;
    }

    @Override
    public List<SchemaOperation> upgrade(SchemaMigrator migrator) {
        String content;
        try {
            content = Files.readString(script, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read migration script " + script, e);
        }
        EncodedResource resource = new EncodedResource(new PathResource(script), StandardCharsets.UTF_8);
        return statements(resource, content).stream().map(migrator::sql).toList();
    }

    /**
     * @param resource the script's origin, only used in error messages; may be null
     * @throws org.springframework.jdbc.datasource.init.ScriptException for an unterminated block
     *     comment
     */
    static List<String> statements(EncodedResource resource, String content) {
        List<String> statements = new ArrayList<>();
        ScriptUtils.splitSqlScript(resource, content,
                ScriptUtils.DEFAULT_STATEMENT_SEPARATOR,
                ScriptUtils.DEFAULT_COMMENT_PREFIXES,
                ScriptUtils.DEFAULT_BLOCK_COMMENT_START_DELIMITER,
                ScriptUtils.DEFAULT_BLOCK_COMMENT_END_DELIMITER,
                statements);
        return statements.stream().map(String::strip).filter(statement -> !statement.isEmpty()).toList();
    }

    @Override
    public String toString() {
        return "SqlScriptMigration[" + script + "]";
    }
}
