package io.hookcron.core.database.migrate;

import io.hookcron.core.database.DatabaseConfig;
import org.jdbi.v3.core.Handle;

public class MigrationContext
{
    private final boolean postgres;

    public MigrationContext(String databaseType)
    {
        this.postgres = DatabaseConfig.isPostgres(databaseType);
    }

    public boolean isPostgres()
    {
        return postgres;
    }

    public CreateTableBuilder newCreateTableBuilder(String tableName)
    {
        return new CreateTableBuilder(postgres, tableName);
    }

    // index name is <table>_on_<column>_and_<column>...
    public void createIndex(Handle handle, String tableName, String... columns)
    {
        String indexName = tableName + "_on_" + String.join("_and_", columns);
        handle.execute("create index " + indexName + " on " + tableName + " (" + String.join(", ", columns) + ")");
    }
}
