package io.perfectsched.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20240311093000_CreateSchedules
        implements Migration
{
    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        String table = context.getTableName();
        handle.execute(
                context.newCreateTableBuilder(table)
                        .ifNotExists()
                        .addString("id", "primary key")
                        .addLong("timeout", "not null")
                        .addLong("next_time", "not null")
                        .addString("cron", "")
                        .addInt("delay", "default 0 not null")
                        .addLongText("data", "")
                        .addString("timezone", "")
                        .build());

        handle.execute("create index if not exists " + table + "_on_timeout on " + table + " (timeout)");
    }
}
