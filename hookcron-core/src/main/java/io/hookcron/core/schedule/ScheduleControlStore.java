package io.hookcron.core.schedule;

import java.time.Instant;
import io.hookcron.core.repository.ResourceNotFoundException;

/**
 * Updates on a schedule row locked by {@link ScheduleStore#lockScheduleById}.
 * Every update clears the claim of the row.
 */
public interface ScheduleControlStore
{
    StoredSchedule getScheduleById(String scheduleId)
        throws ResourceNotFoundException;

    void updateSchedule(String scheduleId, ScheduleDefinition definition, Instant nextExecutionAt, boolean active)
        throws ResourceNotFoundException;

    void setActive(String scheduleId, boolean active)
        throws ResourceNotFoundException;

    void resetNextExecution(String scheduleId, Instant nextExecutionAt)
        throws ResourceNotFoundException;

    void deleteSchedule(String scheduleId)
        throws ResourceNotFoundException;
}
