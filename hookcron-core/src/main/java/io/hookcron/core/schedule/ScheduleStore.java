package io.hookcron.core.schedule;

import java.time.Instant;
import java.util.List;
import com.google.common.base.Optional;
import io.hookcron.core.repository.ResourceConflictException;
import io.hookcron.core.repository.ResourceLimitExceededException;
import io.hookcron.core.repository.ResourceNotFoundException;

public interface ScheduleStore
{
    List<StoredSchedule> getSchedules(int pageSize, Optional<String> lastId);

    List<StoredSchedule> getSchedulesByOwner(String ownerId, int pageSize, Optional<String> lastId);

    int countSchedulesByOwner(String ownerId);

    StoredSchedule getScheduleById(String scheduleId)
        throws ResourceNotFoundException;

    StoredSchedule putSchedule(String ownerId, ScheduleDefinition definition, Instant nextExecutionAt);

    List<StoredScheduleExecution> getExecutions(String scheduleId, int limit);

    interface ScheduleLockAction <T>
    {
        T call(ScheduleControlStore store, StoredSchedule storedSchedule)
            throws ResourceNotFoundException, ResourceConflictException, ResourceLimitExceededException;
    }

    <T> T lockScheduleById(String scheduleId, ScheduleLockAction<T> func)
        throws ResourceNotFoundException, ResourceConflictException, ResourceLimitExceededException;
}
