package io.hookcron.core.schedule;

import java.time.Instant;
import com.google.common.base.Optional;
import io.hookcron.client.config.Config;

/**
 * Columns of a schedule that come from the user. {@link ScheduleDefinition} is what gets
 * written, {@link StoredSchedule} is what is read back with the execution state.
 */
public abstract class Schedule
{
    public abstract String getName();

    public abstract String getTargetUrl();

    // MessageSnapshot JSON
    public abstract Optional<String> getPayload();

    // pre-built wire JSON of rows created before snapshots were stored
    public abstract Optional<String> getMessageData();

    public abstract Instant getScheduledAt();

    public abstract boolean getRecurring();

    public abstract String getRecurrencePattern();

    public abstract Config getRecurrenceConfig();

    public abstract Optional<Integer> getMaxExecutions();
}
