package com.stratum.database.migration;

import com.stratum.database.migration.schema.SchemaMigrator;
import com.stratum.database.migration.schema.SchemaOperation;
import java.util.List;

/**
 * One migration unit: given the schema-mutation handle, produces the ordered operations that
 * bring the database from the previous version to this one.
 *
 * <p>Implementations must not touch the database themselves; the engine applies the returned
 * operations inside the batch transaction. {@link #upgrade(SchemaMigrator)} is only invoked when
 * the migration is actually applied, never during discovery.
 */
@FunctionalInterface
public interface Migration {

    List<SchemaOperation> upgrade(SchemaMigrator migrator);
}
