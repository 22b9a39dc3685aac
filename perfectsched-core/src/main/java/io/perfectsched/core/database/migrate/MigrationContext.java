package io.perfectsched.core.database.migrate;

public class MigrationContext
{
    private final String databaseType;
    private final String tableName;

    public MigrationContext(String databaseType, String tableName)
    {
        this.databaseType = databaseType;
        this.tableName = tableName;
    }

    public boolean isPostgres()
    {
        return databaseType.equals("postgresql");
    }

    /**
     * Name of the schedule table.
     */
    public String getTableName()
    {
        return tableName;
    }

    public String getSchemaMigrationsTableName()
    {
        return tableName + "_schema_migrations";
    }

    public CreateTableBuilder newCreateTableBuilder(String tableName)
    {
        return new CreateTableBuilder(isPostgres(), tableName);
    }
}
