package io.hookcron.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20250301120500_CreateScheduleExecutions
        implements Migration
{
    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        handle.execute(
                context.newCreateTableBuilder("schedule_executions")
                .addLongId("id")
                .addString("schedule_id", "not null")
                .addLong("occurrence_at", "not null")
                .addLong("executed_at", "not null")
                .addString("outcome", "not null")
                .addInt("status_code", "")
                .addLongText("message", "")
                .build());
        context.createIndex(handle, "schedule_executions", "schedule_id", "id");
    }
}
