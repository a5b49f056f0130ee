package io.hookcron.core.schedule;

import io.hookcron.core.repository.ResourceLimitExceededException;

public class ScheduleQuotaExceededException
        extends ResourceLimitExceededException
{
    private final String ownerId;

    public ScheduleQuotaExceededException(String ownerId, int count, int limit)
    {
        super(String.format("Owner %s already has %d schedules. The limit is %d", ownerId, count, limit), limit);
        this.ownerId = ownerId;
    }

    public String getOwnerId()
    {
        return ownerId;
    }
}
