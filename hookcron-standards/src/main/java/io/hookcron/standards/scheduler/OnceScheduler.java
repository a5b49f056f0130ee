package io.hookcron.standards.scheduler;

import java.time.Instant;
import java.time.ZoneId;
import io.hookcron.spi.NextFireTime;
import io.hookcron.spi.Scheduler;

// fires only at the scheduled time stored with the schedule
public class OnceScheduler
        implements Scheduler
{
    private final ZoneId timeZone;

    OnceScheduler(ZoneId timeZone)
    {
        this.timeZone = timeZone;
    }

    @Override
    public ZoneId getTimeZone()
    {
        return timeZone;
    }

    @Override
    public NextFireTime nextFireTime(Instant lastFireTime)
    {
        return NextFireTime.terminal();
    }
}
