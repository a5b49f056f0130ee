package io.hookcron.spi;

import java.time.Instant;
import java.time.ZoneId;

public interface Scheduler
{
    ZoneId getTimeZone();

    // getTime of the returned NextFireTime is strictly after the given time
    NextFireTime nextFireTime(Instant lastFireTime);
}
