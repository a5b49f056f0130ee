package io.hookcron.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20250301120000_CreateSchedules
        implements Migration
{
    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        // instants except created_at and updated_at are epoch seconds
        handle.execute(
                context.newCreateTableBuilder("schedules")
                .addUuidStringId("id")
                .addString("owner_id", "not null")
                .addString("name", "not null")
                .addLongText("payload", "")
                .addLongText("message_data", "")
                .addLongText("target_url", "not null")
                .addLong("scheduled_at", "not null")
                .addBoolean("is_recurring", "not null")
                .addString("recurrence_pattern", "not null")
                .addLongText("recurrence_config", "")
                .addInt("max_executions", "")
                .addInt("execution_count", "not null default 0")
                .addLong("next_execution_at", "")
                .addLong("last_executed_at", "")
                .addBoolean("is_active", "not null")
                .addString("claim_id", "")
                .addLong("claim_expire_time", "")
                .addTimestamp("created_at", "not null")
                .addTimestamp("updated_at", "not null")
                .build());
        context.createIndex(handle, "schedules", "is_active", "next_execution_at");
        context.createIndex(handle, "schedules", "owner_id", "id");
    }
}
