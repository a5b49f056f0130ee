package io.hookcron.core.schedule;

import java.time.Instant;
import io.hookcron.core.repository.ResourceNotFoundException;

public class ScheduleControl
{
    private final ScheduleControlStore store;
    private StoredSchedule schedule;

    public ScheduleControl(ScheduleControlStore store, StoredSchedule schedule)
    {
        this.store = store;
        this.schedule = schedule;
    }

    public StoredSchedule get()
    {
        return schedule;
    }

    public StoredSchedule update(ScheduleDefinition definition, Instant nextExecutionAt, boolean active)
        throws ResourceNotFoundException
    {
        store.updateSchedule(schedule.getId(), definition, nextExecutionAt, active);
        return reload();
    }

    public StoredSchedule enableSchedule()
        throws ResourceNotFoundException
    {
        store.setActive(schedule.getId(), true);
        return reload();
    }

    public StoredSchedule disableSchedule()
        throws ResourceNotFoundException
    {
        store.setActive(schedule.getId(), false);
        return reload();
    }

    public StoredSchedule resetNextExecution(Instant nextExecutionAt)
        throws ResourceNotFoundException
    {
        store.resetNextExecution(schedule.getId(), nextExecutionAt);
        return reload();
    }

    public void delete()
        throws ResourceNotFoundException
    {
        store.deleteSchedule(schedule.getId());
    }

    private StoredSchedule reload()
        throws ResourceNotFoundException
    {
        schedule = store.getScheduleById(schedule.getId());
        return schedule;
    }
}
